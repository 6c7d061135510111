package org.scriptonbasestar.dataloader.engine.metrics;

/**
 * 소스가 load/run 중에 호출하는 메트릭 콜백.
 *
 * <p>run 도중 여러 fetch 스레드에서 동시에 호출되므로 구현체는 thread-safe 해야 합니다.</p>
 *
 * @author archmagece
 * @since 2025-02
 */
public interface LoaderMetricsRecorder {

	LoaderMetricsRecorder NOOP = new LoaderMetricsRecorder() {
		@Override
		public String toString() {
			return "LoaderMetricsRecorder.NOOP";
		}
	};

	/**
	 * 이미 캐시된 키를 load 했습니다.
	 */
	default void recordHit() {
	}

	/**
	 * 키가 대기열에 추가되었습니다.
	 */
	default void recordQueued() {
	}

	/**
	 * @param keyCount 요청된 키 수
	 * @param loadTimeNanos 배치 함수 실행 시간 (나노초)
	 */
	default void recordBatchSuccess(int keyCount, long loadTimeNanos) {
	}

	/**
	 * @param keyCount 실패로 캐시된 키 수
	 */
	default void recordBatchFailure(int keyCount) {
	}

	/**
	 * @param count 배치 결과에 없던 키 수
	 */
	default void recordMissingKeys(int count) {
	}
}
