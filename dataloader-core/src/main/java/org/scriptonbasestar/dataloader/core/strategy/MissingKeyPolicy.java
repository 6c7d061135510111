package org.scriptonbasestar.dataloader.core.strategy;

/**
 * 배치 함수가 반환한 맵에 요청한 키가 없을 때의 처리 방식
 *
 * <ul>
 *   <li>RESOLVE_NULL: "찾지 못함"으로 보고 null 값으로 성공 처리 (기본값)</li>
 *   <li>FAIL: 해당 키를 실패로 캐시</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-02
 */
public enum MissingKeyPolicy {
	/**
	 * 누락된 키를 null 값의 성공 결과로 캐시합니다.
	 * <p>관계형 연관(belongs-to)에서 대상 행이 없는 경우와 같은 동작입니다.</p>
	 */
	RESOLVE_NULL,

	/**
	 * 누락된 키를 {@link org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException}
	 * 실패로 캐시합니다. get 호출 시 예외가 던져집니다.
	 */
	FAIL
}
