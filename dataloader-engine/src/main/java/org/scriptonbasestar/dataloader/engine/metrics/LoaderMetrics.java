package org.scriptonbasestar.dataloader.engine.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 로더 통계 및 메트릭 정보를 제공합니다.
 *
 * 스레드 안전하며 오버헤드가 거의 없도록 AtomicLong을 사용합니다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class LoaderMetrics implements LoaderMetricsRecorder {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong queuedCount = new AtomicLong(0);
	private final AtomicLong batchSuccessCount = new AtomicLong(0);
	private final AtomicLong batchFailureCount = new AtomicLong(0);
	private final AtomicLong loadedKeyCount = new AtomicLong(0);
	private final AtomicLong failedKeyCount = new AtomicLong(0);
	private final AtomicLong missingKeyCount = new AtomicLong(0);
	private final AtomicLong totalBatchTime = new AtomicLong(0);  // 나노초

	@Override
	public void recordHit() {
		hitCount.incrementAndGet();
	}

	@Override
	public void recordQueued() {
		queuedCount.incrementAndGet();
	}

	@Override
	public void recordBatchSuccess(int keyCount, long loadTimeNanos) {
		batchSuccessCount.incrementAndGet();
		loadedKeyCount.addAndGet(keyCount);
		totalBatchTime.addAndGet(loadTimeNanos);
	}

	@Override
	public void recordBatchFailure(int keyCount) {
		batchFailureCount.incrementAndGet();
		failedKeyCount.addAndGet(keyCount);
	}

	@Override
	public void recordMissingKeys(int count) {
		missingKeyCount.addAndGet(count);
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long queuedCount() {
		return queuedCount.get();
	}

	/**
	 * 총 load 요청 수 (히트 + 대기열 추가).
	 * 이미 대기 중인 키를 다시 load 한 경우는 세지 않습니다.
	 */
	public long requestCount() {
		return hitCount.get() + queuedCount.get();
	}

	/**
	 * @return 히트율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double hitRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) hitCount.get() / requests;
	}

	public long batchCount() {
		return batchSuccessCount.get() + batchFailureCount.get();
	}

	public long batchSuccessCount() {
		return batchSuccessCount.get();
	}

	public long batchFailureCount() {
		return batchFailureCount.get();
	}

	public long loadedKeyCount() {
		return loadedKeyCount.get();
	}

	public long failedKeyCount() {
		return failedKeyCount.get();
	}

	public long missingKeyCount() {
		return missingKeyCount.get();
	}

	/**
	 * @return 성공한 배치의 평균 실행 시간 (나노초), 배치가 없으면 0.0
	 */
	public double averageBatchTime() {
		long batches = batchSuccessCount.get();
		return batches == 0 ? 0.0 : (double) totalBatchTime.get() / batches;
	}

	public void reset() {
		hitCount.set(0);
		queuedCount.set(0);
		batchSuccessCount.set(0);
		batchFailureCount.set(0);
		loadedKeyCount.set(0);
		failedKeyCount.set(0);
		missingKeyCount.set(0);
		totalBatchTime.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"LoaderMetrics{requests=%d, hits=%d, queued=%d, hitRate=%.2f%%, " +
			"batches=%d, batchFailures=%d, loadedKeys=%d, failedKeys=%d, missingKeys=%d, avgBatchTime=%.2fμs}",
			requestCount(),
			hitCount(),
			queuedCount(),
			hitRate() * 100,
			batchCount(),
			batchFailureCount(),
			loadedKeyCount(),
			failedKeyCount(),
			missingKeyCount(),
			averageBatchTime() / 1000  // 나노초 → 마이크로초
		);
	}
}
