package org.scriptonbasestar.dataloader.engine.pending;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 다음 run까지 대기 중인 키 집합. grouping key별로 중복 없이 모읍니다.
 *
 * <p>불변 구조이며 이미 있는 키를 add 하면 같은 인스턴스를 반환합니다.</p>
 *
 * @param <G> grouping key 타입
 * @param <K> item key 타입
 * @author archmagece
 * @since 2025-02
 */
public final class PendingMap<G, K> {

	private static final PendingMap<?, ?> EMPTY = new PendingMap<>(Collections.emptyMap());

	private final Map<G, Set<K>> groups;

	private PendingMap(Map<G, Set<K>> groups) {
		this.groups = groups;
	}

	@SuppressWarnings("unchecked")
	public static <G, K> PendingMap<G, K> empty() {
		return (PendingMap<G, K>) EMPTY;
	}

	public PendingMap<G, K> add(G groupingKey, K itemKey) {
		Set<K> group = groups.get(groupingKey);
		if (group != null && group.contains(itemKey)) {
			return this;
		}
		Set<K> nextGroup = group == null ? new LinkedHashSet<>() : new LinkedHashSet<>(group);
		nextGroup.add(itemKey);
		Map<G, Set<K>> nextGroups = new LinkedHashMap<>(groups);
		nextGroups.put(groupingKey, Collections.unmodifiableSet(nextGroup));
		return new PendingMap<>(Collections.unmodifiableMap(nextGroups));
	}

	public PendingMap<G, K> remove(G groupingKey, K itemKey) {
		Set<K> group = groups.get(groupingKey);
		if (group == null || !group.contains(itemKey)) {
			return this;
		}
		Map<G, Set<K>> nextGroups = new LinkedHashMap<>(groups);
		if (group.size() == 1) {
			nextGroups.remove(groupingKey);
		} else {
			Set<K> nextGroup = new LinkedHashSet<>(group);
			nextGroup.remove(itemKey);
			nextGroups.put(groupingKey, Collections.unmodifiableSet(nextGroup));
		}
		if (nextGroups.isEmpty()) {
			return empty();
		}
		return new PendingMap<>(Collections.unmodifiableMap(nextGroups));
	}

	public boolean contains(G groupingKey, K itemKey) {
		Set<K> group = groups.get(groupingKey);
		return group != null && group.contains(itemKey);
	}

	/**
	 * 현재 대기 중인 그룹의 스냅샷. 비어있는 그룹은 포함하지 않습니다.
	 * 스냅샷을 꺼낸 뒤의 상태는 {@link #empty()} 입니다.
	 *
	 * @return grouping key → 수정 불가능한 item key 집합
	 */
	public Map<G, Set<K>> drain() {
		return groups;
	}

	public boolean isEmpty() {
		return groups.isEmpty();
	}

	public int groupCount() {
		return groups.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PendingMap)) {
			return false;
		}
		return groups.equals(((PendingMap<?, ?>) o).groups);
	}

	@Override
	public int hashCode() {
		return groups.hashCode();
	}

	@Override
	public String toString() {
		return "PendingMap" + groups;
	}
}
