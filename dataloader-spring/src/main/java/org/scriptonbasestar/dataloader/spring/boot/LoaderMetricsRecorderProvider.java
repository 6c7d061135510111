package org.scriptonbasestar.dataloader.spring.boot;

import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetrics;
import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetricsRecorder;

/**
 * 소스 이름별 메트릭 recorder를 만듭니다. {@link SBDataloaderFactory}가 소스마다 한 번 호출합니다.
 *
 * @author archmagece
 * @since 2025-02
 */
@FunctionalInterface
public interface LoaderMetricsRecorderProvider {

	LoaderMetricsRecorderProvider IN_MEMORY = sourceName -> new LoaderMetrics();

	LoaderMetricsRecorder recorderFor(String sourceName);
}
