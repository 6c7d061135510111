package org.scriptonbasestar.dataloader.engine.cache;

import org.scriptonbasestar.dataloader.core.result.FetchResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 소스 캐시. {@code (grouping key, item key) → FetchResult} 불변 맵입니다.
 *
 * <p>모든 변경 연산은 새 인스턴스를 반환하며, 변경이 없으면 {@code this}를 그대로 반환합니다.
 * 변경 시 바깥 맵과 해당 그룹의 안쪽 맵만 복사하고 나머지 그룹은 공유합니다.</p>
 *
 * <p>항목은 자동으로 만료되거나 제거되지 않습니다. put 또는 새 run 결과로만 덮어씁니다.</p>
 *
 * @param <G> grouping key 타입
 * @param <K> item key 타입
 * @param <V> 값 타입
 * @author archmagece
 * @since 2025-02
 */
public final class SourceCache<G, K, V> {

	private static final SourceCache<?, ?, ?> EMPTY = new SourceCache<>(Collections.emptyMap());

	private final Map<G, Map<K, FetchResult<V>>> groups;

	private SourceCache(Map<G, Map<K, FetchResult<V>>> groups) {
		this.groups = groups;
	}

	@SuppressWarnings("unchecked")
	public static <G, K, V> SourceCache<G, K, V> empty() {
		return (SourceCache<G, K, V>) EMPTY;
	}

	public Optional<FetchResult<V>> get(G groupingKey, K itemKey) {
		Map<K, FetchResult<V>> group = groups.get(groupingKey);
		if (group == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(group.get(itemKey));
	}

	public boolean contains(G groupingKey, K itemKey) {
		Map<K, FetchResult<V>> group = groups.get(groupingKey);
		return group != null && group.containsKey(itemKey);
	}

	/**
	 * 무조건 덮어씁니다 (캐시 워밍용).
	 *
	 * @return 같은 결과가 이미 있으면 this
	 */
	public SourceCache<G, K, V> put(G groupingKey, K itemKey, FetchResult<V> result) {
		Map<K, FetchResult<V>> group = groups.get(groupingKey);
		if (group != null && group.containsKey(itemKey) && Objects.equals(group.get(itemKey), result)) {
			return this;
		}
		Map<K, FetchResult<V>> nextGroup = group == null ? new LinkedHashMap<>() : new LinkedHashMap<>(group);
		nextGroup.put(itemKey, result);
		return withGroup(groupingKey, nextGroup);
	}

	/**
	 * 한 그룹의 fetch 결과를 일괄 저장합니다.
	 */
	public SourceCache<G, K, V> merge(G groupingKey, Map<K, FetchResult<V>> results) {
		if (results.isEmpty()) {
			return this;
		}
		Map<K, FetchResult<V>> group = groups.get(groupingKey);
		Map<K, FetchResult<V>> nextGroup = group == null ? new LinkedHashMap<>() : new LinkedHashMap<>(group);
		nextGroup.putAll(results);
		return withGroup(groupingKey, nextGroup);
	}

	/**
	 * run 한 번의 모든 그룹 결과를 한 번에 병합합니다.
	 */
	public SourceCache<G, K, V> mergeAll(Map<G, Map<K, FetchResult<V>>> outcomes) {
		SourceCache<G, K, V> next = this;
		for (Map.Entry<G, Map<K, FetchResult<V>>> entry : outcomes.entrySet()) {
			next = next.merge(entry.getKey(), entry.getValue());
		}
		return next;
	}

	public int size() {
		int size = 0;
		for (Map<K, FetchResult<V>> group : groups.values()) {
			size += group.size();
		}
		return size;
	}

	public boolean isEmpty() {
		return groups.isEmpty();
	}

	private SourceCache<G, K, V> withGroup(G groupingKey, Map<K, FetchResult<V>> group) {
		Map<G, Map<K, FetchResult<V>>> nextGroups = new LinkedHashMap<>(groups);
		nextGroups.put(groupingKey, Collections.unmodifiableMap(group));
		return new SourceCache<>(Collections.unmodifiableMap(nextGroups));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourceCache)) {
			return false;
		}
		return groups.equals(((SourceCache<?, ?, ?>) o).groups);
	}

	@Override
	public int hashCode() {
		return groups.hashCode();
	}

	@Override
	public String toString() {
		return "SourceCache{groups=" + groups.size() + ", entries=" + size() + "}";
	}
}
