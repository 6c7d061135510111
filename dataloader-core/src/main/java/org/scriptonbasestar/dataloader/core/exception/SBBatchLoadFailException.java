package org.scriptonbasestar.dataloader.core.exception;

/**
 * 배치 로드 실패.
 *
 * <p>배치 함수가 그룹 전체에 대해 실패하면 요청된 모든 키에 이 예외가 캐시되고,
 * 이후 해당 키를 {@code get} 할 때마다 다시 던져집니다.</p>
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBBatchLoadFailException extends SBDataloaderException {

	private final transient Object groupingKey;

	public SBBatchLoadFailException(String message) {
		this(null, message, null);
	}

	public SBBatchLoadFailException(String message, Throwable cause) {
		this(null, message, cause);
	}

	public SBBatchLoadFailException(Object groupingKey, String message, Throwable cause) {
		super(message, cause);
		this.groupingKey = groupingKey;
	}

	/**
	 * @return 실패한 그룹의 grouping key, 알 수 없으면 null
	 */
	public Object getGroupingKey() {
		return groupingKey;
	}
}
