package org.scriptonbasestar.dataloader.engine.source;

import org.scriptonbasestar.dataloader.core.strategy.MissingKeyPolicy;
import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetricsRecorder;

import java.time.Duration;
import java.util.Objects;

/**
 * 소스별 설정 (불변)
 *
 * <ul>
 *   <li>missingKeyPolicy: 배치 결과에 없는 키 처리 (기본값 RESOLVE_NULL)</li>
 *   <li>fetchTimeout: 그룹별 fetch 제한 시간, ZERO면 비활성화 (기본값)</li>
 *   <li>metrics: 메트릭 콜백 (기본값 NOOP)</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-02
 */
public final class SourceOptions {

	private static final SourceOptions DEFAULTS =
		new SourceOptions(MissingKeyPolicy.RESOLVE_NULL, Duration.ZERO, LoaderMetricsRecorder.NOOP);

	private final MissingKeyPolicy missingKeyPolicy;
	private final Duration fetchTimeout;
	private final LoaderMetricsRecorder metrics;

	private SourceOptions(MissingKeyPolicy missingKeyPolicy, Duration fetchTimeout, LoaderMetricsRecorder metrics) {
		this.missingKeyPolicy = missingKeyPolicy;
		this.fetchTimeout = fetchTimeout;
		this.metrics = metrics;
	}

	public static SourceOptions defaults() {
		return DEFAULTS;
	}

	public SourceOptions withMissingKeyPolicy(MissingKeyPolicy missingKeyPolicy) {
		if (missingKeyPolicy == null) {
			throw new IllegalArgumentException("missingKeyPolicy must not be null");
		}
		return new SourceOptions(missingKeyPolicy, fetchTimeout, metrics);
	}

	public SourceOptions withFetchTimeout(Duration fetchTimeout) {
		if (fetchTimeout == null || fetchTimeout.isNegative()) {
			throw new IllegalArgumentException("fetchTimeout must not be null or negative : " + fetchTimeout);
		}
		return new SourceOptions(missingKeyPolicy, fetchTimeout, metrics);
	}

	public SourceOptions withMetrics(LoaderMetricsRecorder metrics) {
		return new SourceOptions(missingKeyPolicy, fetchTimeout, metrics != null ? metrics : LoaderMetricsRecorder.NOOP);
	}

	public MissingKeyPolicy getMissingKeyPolicy() {
		return missingKeyPolicy;
	}

	public Duration getFetchTimeout() {
		return fetchTimeout;
	}

	public boolean hasFetchTimeout() {
		return !fetchTimeout.isZero();
	}

	public LoaderMetricsRecorder getMetrics() {
		return metrics;
	}

	// metrics는 동일 인스턴스일 때만 같음
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourceOptions)) {
			return false;
		}
		SourceOptions that = (SourceOptions) o;
		return missingKeyPolicy == that.missingKeyPolicy
			&& fetchTimeout.equals(that.fetchTimeout)
			&& metrics == that.metrics;
	}

	@Override
	public int hashCode() {
		return Objects.hash(missingKeyPolicy, fetchTimeout);
	}

	@Override
	public String toString() {
		return "SourceOptions{missingKeyPolicy=" + missingKeyPolicy + ", fetchTimeout=" + fetchTimeout + "}";
	}
}
