package org.scriptonbasestar.dataloader.engine.source;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException;
import org.scriptonbasestar.dataloader.core.exception.SBNotLoadedException;
import org.scriptonbasestar.dataloader.core.result.FetchResult;
import org.scriptonbasestar.dataloader.core.strategy.MissingKeyPolicy;
import org.scriptonbasestar.dataloader.engine.cache.SourceCache;
import org.scriptonbasestar.dataloader.engine.pending.PendingMap;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link SBSource} 기본 구현.
 *
 * <p>하위 클래스는 배치 함수({@link #loadBatch})와 새 상태로 자신을 복제하는 {@link #copy}만
 * 구현하면 됩니다. 이미 로드된 값을 들고 있는 키를 대기열 없이 바로 캐시에 넣으려면
 * {@link #preResolve}를 오버라이드합니다.</p>
 *
 * @param <G> grouping key 타입
 * @param <K> item key 타입
 * @param <V> 값 타입
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
public abstract class AbstractSBSource<G, K, V> implements SBSource<G, K, V> {

	private final SourceCache<G, K, V> cache;
	private final PendingMap<G, K> pending;
	private final SourceOptions options;

	protected AbstractSBSource(SourceOptions options, SourceCache<G, K, V> cache, PendingMap<G, K> pending) {
		if (options == null) {
			throw new IllegalArgumentException("options must not be null");
		}
		this.options = options;
		this.cache = cache != null ? cache : SourceCache.empty();
		this.pending = pending != null ? pending : PendingMap.empty();
	}

	/**
	 * 한 그룹을 로드합니다. fetch 스레드에서 호출됩니다.
	 */
	protected abstract Map<K, V> loadBatch(G groupingKey, Set<K> itemKeys);

	/**
	 * 같은 정의(배치 함수, 설정)에 새 캐시/대기열 상태를 가진 소스를 만듭니다.
	 */
	protected abstract AbstractSBSource<G, K, V> copy(SourceCache<G, K, V> cache, PendingMap<G, K> pending);

	/**
	 * equals 비교에 쓰이는 소스 정의. 같은 인스턴스일 때만 같은 소스로 봅니다.
	 */
	protected abstract Object definition();

	/**
	 * 대기열에 넣기 전에 호출됩니다. 키가 이미 로드된 값을 명시적으로 들고 있으면 그 결과를 반환하고,
	 * 아니면 empty를 반환해 일반 대기열로 보냅니다.
	 */
	protected Optional<FetchResult<V>> preResolve(G groupingKey, K itemKey) {
		return Optional.empty();
	}

	@Override
	public SBSource<G, K, V> load(G groupingKey, K itemKey) {
		return loadMany(groupingKey, Collections.singletonList(itemKey));
	}

	@Override
	public SBSource<G, K, V> loadMany(G groupingKey, Collection<? extends K> itemKeys) {
		checkGroupingKey(groupingKey);
		if (itemKeys == null) {
			throw new IllegalArgumentException("itemKeys must not be null");
		}

		SourceCache<G, K, V> nextCache = cache;
		PendingMap<G, K> nextPending = pending;
		for (K itemKey : itemKeys) {
			checkItemKey(itemKey);
			if (nextCache.contains(groupingKey, itemKey)) {
				options.getMetrics().recordHit();
				continue;
			}
			if (nextPending.contains(groupingKey, itemKey)) {
				continue;
			}
			Optional<FetchResult<V>> resolved = preResolve(groupingKey, itemKey);
			if (resolved.isPresent()) {
				log.trace("load pre-resolved - groupingKey : {}, itemKey : {}", groupingKey, itemKey);
				nextCache = nextCache.put(groupingKey, itemKey, resolved.get());
				continue;
			}
			log.trace("load queued - groupingKey : {}, itemKey : {}", groupingKey, itemKey);
			nextPending = nextPending.add(groupingKey, itemKey);
			options.getMetrics().recordQueued();
		}

		if (nextCache == cache && nextPending == pending) {
			return this;
		}
		return copy(nextCache, nextPending);
	}

	@Override
	public SBSource<G, K, V> put(G groupingKey, K itemKey, V value) {
		checkGroupingKey(groupingKey);
		checkItemKey(itemKey);
		log.trace("put - groupingKey : {}, itemKey : {}", groupingKey, itemKey);
		SourceCache<G, K, V> nextCache = cache.put(groupingKey, itemKey, FetchResult.success(value));
		// put 된 키는 run에서 다시 덮어쓰지 않도록 대기열에서 뺀다
		PendingMap<G, K> nextPending = pending.remove(groupingKey, itemKey);
		if (nextCache == cache && nextPending == pending) {
			return this;
		}
		return copy(nextCache, nextPending);
	}

	@Override
	public V get(G groupingKey, K itemKey) {
		return fetchResult(groupingKey, itemKey).getValue();
	}

	@Override
	public FetchResult<V> fetchResult(G groupingKey, K itemKey) {
		return cache.get(groupingKey, itemKey)
			.orElseThrow(() -> new SBNotLoadedException(groupingKey, itemKey));
	}

	@Override
	public boolean hasPending() {
		return !pending.isEmpty();
	}

	@Override
	public CompletableFuture<SBSource<G, K, V>> runAsync(Executor executor) {
		if (executor == null) {
			throw new IllegalArgumentException("executor must not be null");
		}
		if (pending.isEmpty()) {
			return CompletableFuture.completedFuture(this);
		}

		Map<G, Set<K>> batches = pending.drain();
		log.debug("run - dispatching {} batch(es) : {}", batches.size(), batches.keySet());

		Map<G, CompletableFuture<Map<K, FetchResult<V>>>> futures = new LinkedHashMap<>();
		for (Map.Entry<G, Set<K>> batch : batches.entrySet()) {
			futures.put(batch.getKey(), fetchGroup(batch.getKey(), batch.getValue(), executor));
		}

		return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
			.thenApply(ignored -> {
				Map<G, Map<K, FetchResult<V>>> outcomes = new LinkedHashMap<>();
				for (Map.Entry<G, CompletableFuture<Map<K, FetchResult<V>>>> entry : futures.entrySet()) {
					outcomes.put(entry.getKey(), entry.getValue().join());
				}
				return copy(cache.mergeAll(outcomes), PendingMap.empty());
			});
	}

	/**
	 * 그룹 하나를 executor에 올립니다. fetch timeout은 대기열에서 기다린 시간을 빼고
	 * 워커가 그룹을 실제로 시작한 시점부터 잽니다.
	 */
	private CompletableFuture<Map<K, FetchResult<V>>> fetchGroup(G groupingKey, Set<K> itemKeys, Executor executor) {
		CompletableFuture<Map<K, FetchResult<V>>> fetch = new CompletableFuture<>();
		try {
			executor.execute(() -> invokeBatch(groupingKey, itemKeys, fetch));
		} catch (RejectedExecutionException e) {
			fetch.completeExceptionally(e);
		}
		return fetch.handle((results, error) -> error == null ? results : failAll(groupingKey, itemKeys, error));
	}

	private void invokeBatch(G groupingKey, Set<K> itemKeys, CompletableFuture<Map<K, FetchResult<V>>> fetch) {
		if (fetch.isDone()) {
			log.debug("batch skipped, already completed - groupingKey : {}", groupingKey);
			return;
		}
		if (options.hasFetchTimeout()) {
			fetch.orTimeout(options.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
		}

		long start = System.nanoTime();
		Map<K, V> values;
		try {
			values = loadBatch(groupingKey, itemKeys);
		} catch (RuntimeException | Error e) {
			fetch.completeExceptionally(e);
			return;
		}
		long elapsed = System.nanoTime() - start;
		if (values == null) {
			fetch.completeExceptionally(
				new SBBatchLoadFailException(groupingKey, "Batch loader returned null for " + groupingKey, null));
			return;
		}

		Map<K, FetchResult<V>> results = new LinkedHashMap<>();
		int missing = 0;
		for (K itemKey : itemKeys) {
			if (values.containsKey(itemKey)) {
				results.put(itemKey, FetchResult.success(values.get(itemKey)));
			} else {
				missing++;
				results.put(itemKey, missingResult(groupingKey, itemKey));
			}
		}
		if (!fetch.complete(results)) {
			// timeout으로 이미 실패 처리된 그룹
			log.debug("batch result discarded - groupingKey : {}, {}ms",
				groupingKey, TimeUnit.NANOSECONDS.toMillis(elapsed));
			return;
		}
		options.getMetrics().recordBatchSuccess(itemKeys.size(), elapsed);
		if (missing > 0) {
			options.getMetrics().recordMissingKeys(missing);
		}
		log.debug("batch loaded - groupingKey : {}, keys : {}, missing : {}, {}ms",
			groupingKey, itemKeys.size(), missing, TimeUnit.NANOSECONDS.toMillis(elapsed));
	}

	private FetchResult<V> missingResult(G groupingKey, K itemKey) {
		if (options.getMissingKeyPolicy() == MissingKeyPolicy.FAIL) {
			return FetchResult.failure(new SBBatchLoadFailException(groupingKey,
				"No result for key : " + itemKey + " in " + groupingKey, null));
		}
		return FetchResult.success(null);
	}

	private Map<K, FetchResult<V>> failAll(G groupingKey, Set<K> itemKeys, Throwable error) {
		Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
		SBBatchLoadFailException failure;
		if (cause instanceof SBBatchLoadFailException) {
			failure = (SBBatchLoadFailException) cause;
		} else if (cause instanceof TimeoutException) {
			failure = new SBBatchLoadFailException(groupingKey,
				"Batch load timed out after " + options.getFetchTimeout().toMillis() + "ms for " + groupingKey, cause);
		} else {
			failure = new SBBatchLoadFailException(groupingKey, "Batch load failed for " + groupingKey, cause);
		}
		log.warn("batch failed - groupingKey : {}, keys : {}, cause : {}", groupingKey, itemKeys.size(), cause.toString());

		options.getMetrics().recordBatchFailure(itemKeys.size());
		FetchResult<V> result = FetchResult.failure(failure);
		Map<K, FetchResult<V>> results = new LinkedHashMap<>();
		for (K itemKey : itemKeys) {
			results.put(itemKey, result);
		}
		return results;
	}

	private static void checkGroupingKey(Object groupingKey) {
		if (groupingKey == null) {
			throw new IllegalArgumentException("groupingKey must not be null");
		}
	}

	private static void checkItemKey(Object itemKey) {
		if (itemKey == null) {
			throw new IllegalArgumentException("itemKey must not be null");
		}
	}

	protected SourceOptions getOptions() {
		return options;
	}

	protected SourceCache<G, K, V> getCache() {
		return cache;
	}

	protected PendingMap<G, K> getPending() {
		return pending;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		AbstractSBSource<?, ?, ?> that = (AbstractSBSource<?, ?, ?>) o;
		return definition() == that.definition()
			&& options.equals(that.options)
			&& cache.equals(that.cache)
			&& pending.equals(that.pending);
	}

	@Override
	public int hashCode() {
		return 31 * cache.hashCode() + pending.hashCode();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{cache=" + cache + ", pending=" + pending + "}";
	}
}
