package org.scriptonbasestar.dataloader.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import org.scriptonbasestar.dataloader.engine.executor.DataloaderExecutors;
import org.scriptonbasestar.dataloader.engine.loader.SBDataloader;
import org.scriptonbasestar.dataloader.metrics.micrometer.MicrometerLoaderMetrics;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * Spring Boot Auto-Configuration for SB Dataloader.
 * <p>
 * Registers:
 * <ul>
 *   <li>{@code sbDataloaderExecutor} - shared fetch pool, shut down with the context</li>
 *   <li>{@link LoaderMetricsRecorderProvider} - Micrometer-backed when Micrometer and a MeterRegistry
 *   bean are present, in-memory {@code LoaderMetrics} otherwise</li>
 *   <li>{@link SBDataloaderFactory} - creates loaders and configured sources</li>
 * </ul>
 * </p>
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * sb-dataloader:
 *   fetch-threads: 16
 *   fetch-timeout-ms: 3000
 *   enable-metrics: true
 *   sources:
 *     users:
 *       fetch-timeout-ms: 500
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@Configuration
@ConditionalOnClass(SBDataloader.class)
@EnableConfigurationProperties(SBDataloaderProperties.class)
public class SBDataloaderAutoConfiguration {

	public static final String EXECUTOR_BEAN_NAME = "sbDataloaderExecutor";

	private final SBDataloaderProperties properties;

	@Autowired
	public SBDataloaderAutoConfiguration(SBDataloaderProperties properties) {
		this.properties = properties;
	}

	/**
	 * 공유 fetch 풀. 종료는 {@link FetchExecutorShutdownHook}이 graceful하게 처리합니다.
	 */
	@Bean(name = EXECUTOR_BEAN_NAME, destroyMethod = "")
	@ConditionalOnMissingBean(name = EXECUTOR_BEAN_NAME)
	public ExecutorService sbDataloaderExecutor() {
		return DataloaderExecutors.newFetchPool(properties.getFetchThreads());
	}

	@Bean
	@ConditionalOnMissingBean(name = "sbDataloaderExecutorShutdownHook")
	public FetchExecutorShutdownHook sbDataloaderExecutorShutdownHook(
		@Qualifier(EXECUTOR_BEAN_NAME) ExecutorService executor) {
		return new FetchExecutorShutdownHook(executor);
	}

	@Bean
	@ConditionalOnMissingBean(LoaderMetricsRecorderProvider.class)
	public LoaderMetricsRecorderProvider loaderMetricsRecorderProvider() {
		return LoaderMetricsRecorderProvider.IN_MEMORY;
	}

	@Bean
	@ConditionalOnMissingBean(SBDataloaderFactory.class)
	public SBDataloaderFactory sbDataloaderFactory(@Qualifier(EXECUTOR_BEAN_NAME) ExecutorService executor,
												   LoaderMetricsRecorderProvider recorderProvider) {
		return new SBDataloaderFactory(executor, properties, recorderProvider);
	}

	/**
	 * Micrometer가 classpath에 있을 때만 활성화됩니다.
	 * MeterRegistry 빈이 없으면 in-memory 메트릭으로 동작합니다.
	 */
	@Configuration
	@ConditionalOnClass(name = {
		"io.micrometer.core.instrument.MeterRegistry",
		"org.scriptonbasestar.dataloader.metrics.micrometer.MicrometerLoaderMetrics"
	})
	static class MicrometerRecorderConfiguration {

		@Bean
		@ConditionalOnMissingBean(LoaderMetricsRecorderProvider.class)
		public LoaderMetricsRecorderProvider micrometerLoaderMetricsRecorderProvider(
			ObjectProvider<MeterRegistry> meterRegistry) {
			return sourceName -> {
				MeterRegistry registry = meterRegistry.getIfAvailable();
				return registry == null
					? LoaderMetricsRecorderProvider.IN_MEMORY.recorderFor(sourceName)
					: new MicrometerLoaderMetrics(registry, sourceName);
			};
		}
	}

	/**
	 * Shutdown hook for the fetch executor.
	 */
	static class FetchExecutorShutdownHook implements DisposableBean {
		private final ExecutorService executor;

		FetchExecutorShutdownHook(ExecutorService executor) {
			this.executor = executor;
		}

		@Override
		public void destroy() {
			if (!executor.isShutdown()) {
				DataloaderExecutors.shutdown(executor);
			}
		}
	}
}
