package org.scriptonbasestar.dataloader.metrics.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetrics;
import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetricsRecorder;

import java.util.concurrent.TimeUnit;

/**
 * LoaderMetrics와 Micrometer MeterRegistry에 동시에 기록하는 recorder
 *
 * 소스 이름은 모든 meter에 {@code source} 태그로 붙습니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * MicrometerLoaderMetrics metrics = new MicrometerLoaderMetrics(new LoaderMetrics(), registry, "users");
 *
 * KVSource<String, Long, User> users = KVSource.<String, Long, User>builder()
 *     .batchLoader(userBatchLoader)
 *     .metrics(metrics)
 *     .build();
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class MicrometerLoaderMetrics implements LoaderMetricsRecorder {

	private final LoaderMetrics loaderMetrics;
	private final String sourceName;

	// Micrometer meters
	private final Counter hitCounter;
	private final Counter queuedCounter;
	private final Counter batchSuccessCounter;
	private final Counter batchFailureCounter;
	private final Counter missingKeyCounter;
	private final Timer batchTimer;
	private final DistributionSummary batchKeysSummary;

	/**
	 * @param loaderMetrics 함께 기록할 in-memory 메트릭
	 * @param meterRegistry Micrometer 레지스트리
	 * @param sourceName    소스 이름 (태그로 사용)
	 */
	public MicrometerLoaderMetrics(LoaderMetrics loaderMetrics, MeterRegistry meterRegistry, String sourceName) {
		if (loaderMetrics == null) {
			throw new IllegalArgumentException("LoaderMetrics must not be null");
		}
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		if (sourceName == null || sourceName.trim().isEmpty()) {
			throw new IllegalArgumentException("Source name must not be null or empty");
		}

		this.loaderMetrics = loaderMetrics;
		this.sourceName = sourceName;

		this.hitCounter = Counter.builder("dataloader.load.hits")
			.tag("source", sourceName)
			.description("Loads answered from the loader cache")
			.register(meterRegistry);

		this.queuedCounter = Counter.builder("dataloader.load.queued")
			.tag("source", sourceName)
			.description("Keys queued for the next run")
			.register(meterRegistry);

		this.batchSuccessCounter = Counter.builder("dataloader.batches")
			.tag("source", sourceName)
			.tag("result", "success")
			.description("Batch fetch success count")
			.register(meterRegistry);

		this.batchFailureCounter = Counter.builder("dataloader.batches")
			.tag("source", sourceName)
			.tag("result", "failure")
			.description("Batch fetch failure count")
			.register(meterRegistry);

		this.missingKeyCounter = Counter.builder("dataloader.missing.keys")
			.tag("source", sourceName)
			.description("Requested keys absent from batch results")
			.register(meterRegistry);

		this.batchTimer = Timer.builder("dataloader.batch.duration")
			.tag("source", sourceName)
			.description("Batch fetch duration")
			.register(meterRegistry);

		this.batchKeysSummary = DistributionSummary.builder("dataloader.batch.keys")
			.tag("source", sourceName)
			.description("Keys per batch fetch")
			.register(meterRegistry);

		Gauge.builder("dataloader.hit.rate", loaderMetrics, LoaderMetrics::hitRate)
			.tag("source", sourceName)
			.description("Load cache hit rate")
			.register(meterRegistry);
	}

	/**
	 * 새 LoaderMetrics로 생성합니다.
	 */
	public MicrometerLoaderMetrics(MeterRegistry meterRegistry, String sourceName) {
		this(new LoaderMetrics(), meterRegistry, sourceName);
	}

	@Override
	public void recordHit() {
		loaderMetrics.recordHit();
		hitCounter.increment();
	}

	@Override
	public void recordQueued() {
		loaderMetrics.recordQueued();
		queuedCounter.increment();
	}

	@Override
	public void recordBatchSuccess(int keyCount, long loadTimeNanos) {
		loaderMetrics.recordBatchSuccess(keyCount, loadTimeNanos);
		batchSuccessCounter.increment();
		batchTimer.record(loadTimeNanos, TimeUnit.NANOSECONDS);
		batchKeysSummary.record(keyCount);
	}

	@Override
	public void recordBatchFailure(int keyCount) {
		loaderMetrics.recordBatchFailure(keyCount);
		batchFailureCounter.increment();
		batchKeysSummary.record(keyCount);
	}

	@Override
	public void recordMissingKeys(int count) {
		loaderMetrics.recordMissingKeys(count);
		missingKeyCounter.increment(count);
	}

	public String getSourceName() {
		return sourceName;
	}

	public LoaderMetrics getLoaderMetrics() {
		return loaderMetrics;
	}
}
