package org.scriptonbasestar.dataloader.core.result;

import org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException;

import java.util.Objects;

/**
 * 캐시에 저장되는 로드 결과. 성공(값) 또는 실패(예외) 둘 중 하나입니다.
 *
 * <p>성공 값으로 null을 허용합니다 (MissingKeyPolicy.RESOLVE_NULL로 "찾지 못함"을 표현).
 * 실패는 {@link #getValue()} 호출 시 저장된 예외를 다시 던지므로 정상적인 값과 구분됩니다.</p>
 *
 * @param <V> 값 타입
 * @author archmagece
 * @since 2025-02
 */
public abstract class FetchResult<V> {

	private FetchResult() {
	}

	public static <V> FetchResult<V> success(V value) {
		return new Success<>(value);
	}

	public static <V> FetchResult<V> failure(SBBatchLoadFailException error) {
		if (error == null) {
			throw new IllegalArgumentException("error must not be null");
		}
		return new Failure<>(error);
	}

	public abstract boolean isSuccess();

	public boolean isFailure() {
		return !isSuccess();
	}

	/**
	 * @return 성공 값
	 * @throws SBBatchLoadFailException 실패 결과인 경우 저장된 예외
	 */
	public abstract V getValue() throws SBBatchLoadFailException;

	/**
	 * @return 실패 예외, 성공이면 null
	 */
	public abstract SBBatchLoadFailException getError();

	private static final class Success<V> extends FetchResult<V> {
		private final V value;

		Success(V value) {
			this.value = value;
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public V getValue() {
			return value;
		}

		@Override
		public SBBatchLoadFailException getError() {
			return null;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof Success)) {
				return false;
			}
			return Objects.equals(value, ((Success<?>) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(value);
		}

		@Override
		public String toString() {
			return "Success{" + value + "}";
		}
	}

	private static final class Failure<V> extends FetchResult<V> {
		private final SBBatchLoadFailException error;

		Failure(SBBatchLoadFailException error) {
			this.error = error;
		}

		@Override
		public boolean isSuccess() {
			return false;
		}

		@Override
		public V getValue() {
			throw error;
		}

		@Override
		public SBBatchLoadFailException getError() {
			return error;
		}

		// 같은 예외 인스턴스일 때만 동일
		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof Failure)) {
				return false;
			}
			return error == ((Failure<?>) o).error;
		}

		@Override
		public int hashCode() {
			return System.identityHashCode(error);
		}

		@Override
		public String toString() {
			return "Failure{" + error.getMessage() + "}";
		}
	}
}
