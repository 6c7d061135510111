package org.scriptonbasestar.dataloader.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.dataloader.engine.executor.DataloaderExecutors;
import org.scriptonbasestar.dataloader.engine.loader.SBDataloader;
import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetrics;
import org.scriptonbasestar.dataloader.engine.source.KVSource;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.junit.Assert.*;

/**
 * MicrometerLoaderMetrics 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class MicrometerLoaderMetricsTest {

	private LoaderMetrics loaderMetrics;
	private MeterRegistry meterRegistry;
	private MicrometerLoaderMetrics metrics;

	@Before
	public void setUp() {
		loaderMetrics = new LoaderMetrics();
		meterRegistry = new SimpleMeterRegistry();
		metrics = new MicrometerLoaderMetrics(loaderMetrics, meterRegistry, "users");
	}

	@Test
	public void testRecordHitAndQueued() {
		metrics.recordHit();
		metrics.recordQueued();
		metrics.recordQueued();

		assertEquals(1, loaderMetrics.hitCount());
		assertEquals(2, loaderMetrics.queuedCount());
		assertEquals(1.0, meterRegistry.counter("dataloader.load.hits", "source", "users").count(), 0.001);
		assertEquals(2.0, meterRegistry.counter("dataloader.load.queued", "source", "users").count(), 0.001);
		assertEquals(1.0 / 3, meterRegistry.get("dataloader.hit.rate").tag("source", "users").gauge().value(), 0.001);
	}

	@Test
	public void testRecordBatchSuccess() {
		metrics.recordBatchSuccess(3, 1000000L);  // 1ms
		metrics.recordBatchSuccess(5, 2000000L);  // 2ms

		assertEquals(2, loaderMetrics.batchSuccessCount());
		assertEquals(2.0,
			meterRegistry.counter("dataloader.batches", "source", "users", "result", "success").count(),
			0.001
		);
		assertEquals(2, meterRegistry.timer("dataloader.batch.duration", "source", "users").count());
		assertEquals(8.0, meterRegistry.summary("dataloader.batch.keys", "source", "users").totalAmount(), 0.001);
	}

	@Test
	public void testRecordBatchFailureAndMissingKeys() {
		metrics.recordBatchFailure(4);
		metrics.recordMissingKeys(2);

		assertEquals(1, loaderMetrics.batchFailureCount());
		assertEquals(4, loaderMetrics.failedKeyCount());
		assertEquals(1.0,
			meterRegistry.counter("dataloader.batches", "source", "users", "result", "failure").count(),
			0.001
		);
		assertEquals(2.0, meterRegistry.counter("dataloader.missing.keys", "source", "users").count(), 0.001);
	}

	@Test
	public void testRecordedBySource() {
		Map<Long, String> names = new HashMap<>();
		names.put(1L, "Ben Wilson");
		ExecutorService executor = DataloaderExecutors.newFetchPool(1);
		try {
			SBDataloader loader = SBDataloader.create(executor)
				.addSource("users", KVSource.<String, Long, String>builder()
					.batchLoader((type, ids) -> names)
					.metrics(metrics)
					.build())
				.loadMany("users", "user", Arrays.asList(1L, 2L))
				.run();
			loader.load("users", "user", 1L);
		} finally {
			DataloaderExecutors.shutdown(executor);
		}

		assertEquals(1.0, meterRegistry.counter("dataloader.load.hits", "source", "users").count(), 0.001);
		assertEquals(2.0, meterRegistry.counter("dataloader.load.queued", "source", "users").count(), 0.001);
		assertEquals(1.0,
			meterRegistry.counter("dataloader.batches", "source", "users", "result", "success").count(),
			0.001
		);
		assertEquals(1.0, meterRegistry.counter("dataloader.missing.keys", "source", "users").count(), 0.001);
	}

	@Test
	public void testSeparateSourcesHaveSeparateMeters() {
		MicrometerLoaderMetrics posts = new MicrometerLoaderMetrics(meterRegistry, "posts");
		posts.recordHit();

		assertEquals(0.0, meterRegistry.counter("dataloader.load.hits", "source", "users").count(), 0.001);
		assertEquals(1.0, meterRegistry.counter("dataloader.load.hits", "source", "posts").count(), 0.001);
		assertEquals("posts", posts.getSourceName());
		assertEquals(1, posts.getLoaderMetrics().hitCount());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullLoaderMetrics() {
		new MicrometerLoaderMetrics(null, meterRegistry, "users");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullMeterRegistry() {
		new MicrometerLoaderMetrics(loaderMetrics, null, "users");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptySourceName() {
		new MicrometerLoaderMetrics(loaderMetrics, meterRegistry, "  ");
	}
}
