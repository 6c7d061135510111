package org.scriptonbasestar.dataloader.engine.source;

import org.scriptonbasestar.dataloader.core.loader.SBBatchLoader;
import org.scriptonbasestar.dataloader.core.strategy.MissingKeyPolicy;
import org.scriptonbasestar.dataloader.engine.cache.SourceCache;
import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetricsRecorder;
import org.scriptonbasestar.dataloader.engine.pending.PendingMap;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Key/Value 소스. grouping key는 대상 타입(태그), item key는 식별자입니다.
 *
 * <pre>{@code
 * KVSource<String, Long, User> users = KVSource.<String, Long, User>builder()
 *     .batchLoader((type, ids) -> userRepository.findAllByIdAsMap(ids))
 *     .missingKeyPolicy(MissingKeyPolicy.RESOLVE_NULL)
 *     .fetchTimeout(Duration.ofSeconds(3))
 *     .build();
 *
 * SBDataloader loader = SBDataloader.create()
 *     .addSource("users", users)
 *     .loadMany("users", "user", Arrays.asList(1L, 2L, 3L))
 *     .run();
 *
 * User user = loader.get("users", "user", 1L);
 * }</pre>
 *
 * @param <G> grouping key 타입
 * @param <K> item key 타입
 * @param <V> 값 타입
 * @author archmagece
 * @since 2025-02
 */
public final class KVSource<G, K, V> extends AbstractSBSource<G, K, V> {

	private final SBBatchLoader<G, K, V> batchLoader;

	private KVSource(SBBatchLoader<G, K, V> batchLoader, SourceOptions options,
					 SourceCache<G, K, V> cache, PendingMap<G, K> pending) {
		super(options, cache, pending);
		this.batchLoader = batchLoader;
	}

	/**
	 * 기본 설정으로 소스를 생성합니다.
	 */
	public static <G, K, V> KVSource<G, K, V> of(SBBatchLoader<G, K, V> batchLoader) {
		return KVSource.<G, K, V>builder().batchLoader(batchLoader).build();
	}

	public static <G, K, V> Builder<G, K, V> builder() {
		return new Builder<>();
	}

	@Override
	protected Map<K, V> loadBatch(G groupingKey, Set<K> itemKeys) {
		return batchLoader.loadBatch(groupingKey, itemKeys);
	}

	@Override
	protected KVSource<G, K, V> copy(SourceCache<G, K, V> cache, PendingMap<G, K> pending) {
		return new KVSource<>(batchLoader, getOptions(), cache, pending);
	}

	@Override
	protected Object definition() {
		return batchLoader;
	}

	/**
	 * KVSource Builder 클래스
	 */
	public static class Builder<G, K, V> {
		private SBBatchLoader<G, K, V> batchLoader;
		private SourceOptions options = SourceOptions.defaults();

		public Builder<G, K, V> batchLoader(SBBatchLoader<G, K, V> batchLoader) {
			this.batchLoader = batchLoader;
			return this;
		}

		/**
		 * 설정을 통째로 지정합니다. 이후의 개별 설정 메서드는 이 값 위에 적용됩니다.
		 */
		public Builder<G, K, V> options(SourceOptions options) {
			if (options == null) {
				throw new IllegalArgumentException("options must not be null");
			}
			this.options = options;
			return this;
		}

		public Builder<G, K, V> missingKeyPolicy(MissingKeyPolicy missingKeyPolicy) {
			this.options = options.withMissingKeyPolicy(missingKeyPolicy);
			return this;
		}

		/**
		 * 그룹별 fetch 제한 시간. 초과하면 해당 그룹의 키들이 실패로 캐시됩니다.
		 * 실행 중인 fetch 자체를 중단하지는 않습니다.
		 *
		 * @param fetchTimeout 제한 시간, ZERO면 비활성화
		 */
		public Builder<G, K, V> fetchTimeout(Duration fetchTimeout) {
			this.options = options.withFetchTimeout(fetchTimeout);
			return this;
		}

		public Builder<G, K, V> metrics(LoaderMetricsRecorder metrics) {
			this.options = options.withMetrics(metrics);
			return this;
		}

		public KVSource<G, K, V> build() {
			if (batchLoader == null) {
				throw new IllegalStateException("batchLoader must be set");
			}
			return new KVSource<>(batchLoader, options, SourceCache.empty(), PendingMap.empty());
		}
	}
}
