package org.scriptonbasestar.dataloader.core.loader;

import org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException;

import java.util.Map;
import java.util.Set;

/**
 * 배치 로드 함수.
 *
 * <p>하나의 grouping key와 마지막 flush 이후 요청된 중복 없는 item key 집합을 받아
 * item key별 결과 맵을 반환합니다. 키의 순서는 보장되지 않습니다.</p>
 *
 * <pre>{@code
 * SBBatchLoader<String, Long, User> loader = (type, ids) -> {
 *     Map<Long, User> map = new HashMap<>();
 *     for (User user : repository.findAllById(ids)) {
 *         map.put(user.getId(), user);
 *     }
 *     return map;
 * };
 * }</pre>
 *
 * <p>서로 다른 grouping key에 대해 동시에 호출될 수 있으므로 thread-safe 해야 합니다.</p>
 *
 * @param <G> grouping key 타입
 * @param <K> item key 타입
 * @param <V> 값 타입
 * @author archmagece
 * @since 2025-02
 */
@FunctionalInterface
public interface SBBatchLoader<G, K, V> {

	/**
	 * 요청된 키들을 한 번에 로드합니다.
	 *
	 * @param groupingKey 그룹 키
	 * @param itemKeys 요청된 키 (비어있지 않음, 수정 불가)
	 * @return item key별 값. 맵에 없는 키는 소스의 MissingKeyPolicy에 따라 처리됩니다.
	 * @throws SBBatchLoadFailException 그룹 전체 로드 실패 시
	 */
	Map<K, V> loadBatch(G groupingKey, Set<K> itemKeys) throws SBBatchLoadFailException;
}
