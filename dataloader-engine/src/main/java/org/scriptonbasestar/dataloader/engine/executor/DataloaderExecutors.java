package org.scriptonbasestar.dataloader.engine.executor;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.dataloader.core.exception.SBDataloaderException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * fetch용 executor 생성/종료 유틸
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
@UtilityClass
public class DataloaderExecutors {

	/**
	 * 배치 fetch 전용 고정 크기 스레드 풀 (daemon, 이름: SBDataloader-Fetch-N).
	 * 생성한 쪽에서 {@link #shutdown(ExecutorService)}로 종료해야 합니다.
	 *
	 * @param threads 스레드 수
	 * @return executor
	 */
	public static ExecutorService newFetchPool(int threads) {
		if (threads <= 0) {
			throw new IllegalArgumentException("threads must be positive : " + threads);
		}
		AtomicInteger sequence = new AtomicInteger(0);
		ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
			Thread t = new Thread(r, "SBDataloader-Fetch-" + sequence.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
		log.debug("Fetch pool created with {} threads", threads);
		return executor;
	}

	/**
	 * executor를 지정하지 않았을 때 사용하는 기본 executor (common pool).
	 */
	public static Executor defaultExecutor() {
		return ForkJoinPool.commonPool();
	}

	/**
	 * ExecutorService를 graceful하게 종료합니다.
	 */
	public static void shutdown(ExecutorService executor) {
		log.debug("Shutting down dataloader fetch executor");
		executor.shutdown();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				log.warn("Executor did not terminate in time, forcing shutdown");
				executor.shutdownNow();
				if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
					log.error("Executor did not terminate after forced shutdown");
				}
			}
		} catch (InterruptedException e) {
			log.warn("Interrupted while waiting for executor termination", e);
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	/**
	 * run 완료까지 대기합니다.
	 *
	 * @throws SBDataloaderException 대기 중 인터럽트 되었거나 run 자체가 비정상 종료된 경우
	 */
	public static <T> T await(CompletableFuture<T> future) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new SBDataloaderException("Interrupted while waiting for batch loads", e);
		} catch (ExecutionException e) {
			throw new SBDataloaderException("Batch run failed", e.getCause());
		}
	}
}
