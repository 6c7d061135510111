package org.scriptonbasestar.dataloader.engine.metrics;

import org.junit.Assert;
import org.junit.Test;

/**
 * @author archmagece
 * @since 2025-02
 */
public class LoaderMetricsTest {

	@Test
	public void testEmptyMetrics() {
		LoaderMetrics metrics = new LoaderMetrics();

		Assert.assertEquals(0, metrics.requestCount());
		Assert.assertEquals(0.0, metrics.hitRate(), 0.0001);
		Assert.assertEquals(0.0, metrics.averageBatchTime(), 0.0001);
	}

	@Test
	public void testHitRate() {
		LoaderMetrics metrics = new LoaderMetrics();
		metrics.recordHit();
		metrics.recordHit();
		metrics.recordHit();
		metrics.recordQueued();

		Assert.assertEquals(4, metrics.requestCount());
		Assert.assertEquals(0.75, metrics.hitRate(), 0.0001);
	}

	@Test
	public void testBatchCounters() {
		LoaderMetrics metrics = new LoaderMetrics();
		metrics.recordBatchSuccess(3, 1_000_000L);
		metrics.recordBatchSuccess(5, 3_000_000L);
		metrics.recordBatchFailure(2);
		metrics.recordMissingKeys(1);

		Assert.assertEquals(3, metrics.batchCount());
		Assert.assertEquals(2, metrics.batchSuccessCount());
		Assert.assertEquals(1, metrics.batchFailureCount());
		Assert.assertEquals(8, metrics.loadedKeyCount());
		Assert.assertEquals(2, metrics.failedKeyCount());
		Assert.assertEquals(1, metrics.missingKeyCount());
		Assert.assertEquals(2_000_000.0, metrics.averageBatchTime(), 0.0001);
	}

	@Test
	public void testReset() {
		LoaderMetrics metrics = new LoaderMetrics();
		metrics.recordHit();
		metrics.recordBatchSuccess(1, 10L);
		metrics.reset();

		Assert.assertEquals(0, metrics.hitCount());
		Assert.assertEquals(0, metrics.batchCount());
		Assert.assertEquals(0, metrics.loadedKeyCount());
	}

	@Test
	public void testNoopRecorderIgnoresEverything() {
		LoaderMetricsRecorder.NOOP.recordHit();
		LoaderMetricsRecorder.NOOP.recordBatchSuccess(1, 1L);
		LoaderMetricsRecorder.NOOP.recordBatchFailure(1);
	}

	@Test
	public void testToString() {
		LoaderMetrics metrics = new LoaderMetrics();
		metrics.recordHit();

		Assert.assertTrue(metrics.toString().startsWith("LoaderMetrics{requests=1"));
	}
}
