package org.scriptonbasestar.dataloader.engine.loader;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.dataloader.core.exception.SBUnknownSourceException;
import org.scriptonbasestar.dataloader.core.result.FetchResult;
import org.scriptonbasestar.dataloader.engine.executor.DataloaderExecutors;
import org.scriptonbasestar.dataloader.engine.source.SBSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 이름 붙은 소스들을 묶어 한 워크플로우 동안 사용하는 데이터로더.
 *
 * <p>불변 값입니다. load/put 등은 새 로더를 반환하고, 아무것도 바뀌지 않으면 같은 인스턴스를
 * 반환합니다. 워크플로우가 끝나면 버립니다 (캐시는 워크플로우 간에 공유되지 않음).</p>
 *
 * <pre>{@code
 * SBDataloader loader = SBDataloader.builder()
 *     .executor(fetchPool)
 *     .source("db", KVSource.of(userBatchLoader))
 *     .build();
 *
 * loader = loader.loadMany("db", "user", userIds).run();
 * List<User> users = loader.getMany("db", "user", userIds);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
public final class SBDataloader {

	private final Map<String, SBSource<?, ?, ?>> sources;
	private final Executor executor;

	private SBDataloader(Map<String, SBSource<?, ?, ?>> sources, Executor executor) {
		this.sources = sources;
		this.executor = executor;
	}

	/**
	 * 소스 없이 기본 executor로 생성합니다.
	 */
	public static SBDataloader create() {
		return builder().build();
	}

	public static SBDataloader create(Executor executor) {
		return builder().executor(executor).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * 소스를 등록합니다. 같은 이름이 있으면 교체합니다.
	 */
	public SBDataloader addSource(String name, SBSource<?, ?, ?> source) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("source name must not be null or empty");
		}
		if (source == null) {
			throw new IllegalArgumentException("source must not be null");
		}
		if (sources.get(name) == source) {
			return this;
		}
		if (sources.containsKey(name)) {
			log.debug("Replacing source : {}", name);
		}
		Map<String, SBSource<?, ?, ?>> next = new LinkedHashMap<>(sources);
		next.put(name, source);
		return new SBDataloader(Collections.unmodifiableMap(next), executor);
	}

	public <G, K, V> SBDataloader load(String sourceName, G groupingKey, K itemKey) {
		SBSource<G, K, V> source = source(sourceName);
		return replace(sourceName, source, source.load(groupingKey, itemKey));
	}

	public <G, K, V> SBDataloader loadMany(String sourceName, G groupingKey, Collection<? extends K> itemKeys) {
		SBSource<G, K, V> source = source(sourceName);
		return replace(sourceName, source, source.loadMany(groupingKey, itemKeys));
	}

	public <G, K, V> SBDataloader put(String sourceName, G groupingKey, K itemKey, V value) {
		SBSource<G, K, V> source = source(sourceName);
		return replace(sourceName, source, source.put(groupingKey, itemKey, value));
	}

	public <G, K, V> V get(String sourceName, G groupingKey, K itemKey) {
		SBSource<G, K, V> source = source(sourceName);
		return source.get(groupingKey, itemKey);
	}

	/**
	 * 요청한 키 순서대로 값을 반환합니다. 로드되지 않았거나 실패한 키가 있으면 첫 번째 키에서 예외가 납니다.
	 */
	public <G, K, V> List<V> getMany(String sourceName, G groupingKey, Collection<? extends K> itemKeys) {
		if (itemKeys == null) {
			throw new IllegalArgumentException("itemKeys must not be null");
		}
		SBSource<G, K, V> source = source(sourceName);
		List<V> values = new ArrayList<>(itemKeys.size());
		for (K itemKey : itemKeys) {
			values.add(source.get(groupingKey, itemKey));
		}
		return values;
	}

	public <G, K, V> FetchResult<V> fetchResult(String sourceName, G groupingKey, K itemKey) {
		SBSource<G, K, V> source = source(sourceName);
		return source.fetchResult(groupingKey, itemKey);
	}

	/**
	 * 대기 중인 모든 소스의 모든 그룹을 executor에서 동시에 로드하고 완료까지 대기합니다.
	 *
	 * <p>배치 실패는 해당 키에 캐시될 뿐 다른 그룹/소스의 로드를 막지 않습니다.</p>
	 *
	 * @return 대기 중인 작업이 없으면 this
	 */
	public SBDataloader run() {
		Map<String, CompletableFuture<? extends SBSource<?, ?, ?>>> runs = new LinkedHashMap<>();
		for (Map.Entry<String, SBSource<?, ?, ?>> entry : sources.entrySet()) {
			if (entry.getValue().hasPending()) {
				runs.put(entry.getKey(), entry.getValue().runAsync(executor));
			}
		}
		if (runs.isEmpty()) {
			log.trace("run - nothing pending");
			return this;
		}

		log.debug("run - sources : {}", runs.keySet());
		DataloaderExecutors.await(CompletableFuture.allOf(runs.values().toArray(new CompletableFuture<?>[0])));

		Map<String, SBSource<?, ?, ?>> next = new LinkedHashMap<>(sources);
		for (Map.Entry<String, CompletableFuture<? extends SBSource<?, ?, ?>>> entry : runs.entrySet()) {
			next.put(entry.getKey(), entry.getValue().join());
		}
		return new SBDataloader(Collections.unmodifiableMap(next), executor);
	}

	public boolean hasPending() {
		for (SBSource<?, ?, ?> source : sources.values()) {
			if (source.hasPending()) {
				return true;
			}
		}
		return false;
	}

	public Set<String> sourceNames() {
		return sources.keySet();
	}

	/**
	 * @throws SBUnknownSourceException 등록되지 않은 이름
	 */
	public <G, K, V> SBSource<G, K, V> getSource(String name) {
		return source(name);
	}

	public Executor getExecutor() {
		return executor;
	}

	@SuppressWarnings("unchecked")
	private <G, K, V> SBSource<G, K, V> source(String name) {
		SBSource<?, ?, ?> source = sources.get(name);
		if (source == null) {
			throw new SBUnknownSourceException(name);
		}
		return (SBSource<G, K, V>) source;
	}

	private <G, K, V> SBDataloader replace(String name, SBSource<G, K, V> before, SBSource<G, K, V> after) {
		if (before == after) {
			return this;
		}
		Map<String, SBSource<?, ?, ?>> next = new LinkedHashMap<>(sources);
		next.put(name, after);
		return new SBDataloader(Collections.unmodifiableMap(next), executor);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SBDataloader)) {
			return false;
		}
		SBDataloader that = (SBDataloader) o;
		return executor == that.executor && sources.equals(that.sources);
	}

	@Override
	public int hashCode() {
		return sources.hashCode();
	}

	@Override
	public String toString() {
		return "SBDataloader{sources=" + sources + "}";
	}

	/**
	 * SBDataloader Builder 클래스
	 */
	public static class Builder {
		private Executor executor = DataloaderExecutors.defaultExecutor(); // 기본값: common pool
		private final Map<String, SBSource<?, ?, ?>> sources = new LinkedHashMap<>();

		/**
		 * 배치 fetch를 실행할 executor. 로더는 executor를 종료하지 않습니다.
		 */
		public Builder executor(Executor executor) {
			if (executor == null) {
				throw new IllegalArgumentException("executor must not be null");
			}
			this.executor = executor;
			return this;
		}

		public Builder source(String name, SBSource<?, ?, ?> source) {
			if (name == null || name.trim().isEmpty()) {
				throw new IllegalArgumentException("source name must not be null or empty");
			}
			if (source == null) {
				throw new IllegalArgumentException("source must not be null");
			}
			sources.put(name, source);
			return this;
		}

		public SBDataloader build() {
			return new SBDataloader(Collections.unmodifiableMap(new LinkedHashMap<>(sources)), executor);
		}
	}
}
