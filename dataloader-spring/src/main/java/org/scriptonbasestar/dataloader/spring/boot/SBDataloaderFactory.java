package org.scriptonbasestar.dataloader.spring.boot;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.dataloader.core.loader.SBBatchLoader;
import org.scriptonbasestar.dataloader.engine.loader.SBDataloader;
import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetricsRecorder;
import org.scriptonbasestar.dataloader.engine.source.KVSource;
import org.scriptonbasestar.dataloader.engine.source.SourceOptions;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 설정을 적용한 로더와 소스를 만드는 팩토리. 요청(워크플로우)마다 {@link #newLoader()}로 새 로더를 만듭니다.
 *
 * <pre>{@code
 * @Autowired
 * private SBDataloaderFactory dataloaders;
 *
 * public List<User> findUsers(List<Long> ids) {
 *     SBDataloader loader = dataloaders.newLoader()
 *         .addSource("users", dataloaders.kvSource("users", userBatchLoader))
 *         .loadMany("users", "user", ids)
 *         .run();
 *     return loader.getMany("users", "user", ids);
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
public class SBDataloaderFactory {

	private final Executor executor;
	private final SBDataloaderProperties properties;
	private final LoaderMetricsRecorderProvider recorderProvider;
	private final Map<String, LoaderMetricsRecorder> recorders = new ConcurrentHashMap<>();

	public SBDataloaderFactory(Executor executor, SBDataloaderProperties properties,
							   LoaderMetricsRecorderProvider recorderProvider) {
		if (executor == null) {
			throw new IllegalArgumentException("executor must not be null");
		}
		if (properties == null) {
			throw new IllegalArgumentException("properties must not be null");
		}
		if (recorderProvider == null) {
			throw new IllegalArgumentException("recorderProvider must not be null");
		}
		this.executor = executor;
		this.properties = properties;
		this.recorderProvider = recorderProvider;
	}

	/**
	 * 공유 fetch executor를 쓰는 빈 로더.
	 */
	public SBDataloader newLoader() {
		return SBDataloader.create(executor);
	}

	/**
	 * {@code sb-dataloader.*} 기본값에 {@code sb-dataloader.sources.<name>.*}를 덮어쓴 소스 설정.
	 * 메트릭 recorder는 소스 이름마다 하나를 재사용합니다.
	 */
	public SourceOptions sourceOptions(String sourceName) {
		if (sourceName == null || sourceName.trim().isEmpty()) {
			throw new IllegalArgumentException("source name must not be null or empty");
		}
		SBDataloaderProperties.SourceConfig config = properties.resolve(sourceName);
		SourceOptions options = SourceOptions.defaults()
			.withMissingKeyPolicy(config.getMissingKeyPolicy())
			.withFetchTimeout(Duration.ofMillis(config.getFetchTimeoutMs()));
		if (Boolean.TRUE.equals(config.getEnableMetrics())) {
			options = options.withMetrics(recorders.computeIfAbsent(sourceName, this::createRecorder));
		}
		return options;
	}

	public <G, K, V> KVSource<G, K, V> kvSource(String sourceName, SBBatchLoader<G, K, V> batchLoader) {
		return KVSource.<G, K, V>builder()
			.batchLoader(batchLoader)
			.options(sourceOptions(sourceName))
			.build();
	}

	/**
	 * @return 메트릭이 켜진 소스의 recorder, 아직 만들어지지 않았거나 꺼져 있으면 null
	 */
	public LoaderMetricsRecorder getRecorder(String sourceName) {
		return recorders.get(sourceName);
	}

	public Executor getExecutor() {
		return executor;
	}

	private LoaderMetricsRecorder createRecorder(String sourceName) {
		LoaderMetricsRecorder recorder = recorderProvider.recorderFor(sourceName);
		log.debug("Metrics recorder created - source : {}, recorder : {}", sourceName, recorder.getClass().getSimpleName());
		return recorder;
	}
}
