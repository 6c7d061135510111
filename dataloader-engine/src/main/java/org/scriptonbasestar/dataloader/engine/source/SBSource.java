package org.scriptonbasestar.dataloader.engine.source;

import org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException;
import org.scriptonbasestar.dataloader.core.exception.SBNotLoadedException;
import org.scriptonbasestar.dataloader.core.result.FetchResult;
import org.scriptonbasestar.dataloader.engine.executor.DataloaderExecutors;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 캐시 + 대기열 + 배치 함수를 묶은 데이터 소스.
 *
 * <p>소스는 불변 값입니다. 변경 연산은 새 소스를 반환하고, 아무것도 바뀌지 않았으면
 * 같은 인스턴스({@code this})를 반환합니다. 로더는 이 성질로 no-op을 감지합니다.</p>
 *
 * <p>키 상태: {@code UNQUEUED → PENDING (load) → LOADED | FAILED (run)},
 * {@code UNQUEUED → LOADED (put)}.</p>
 *
 * @param <G> grouping key 타입
 * @param <K> item key 타입
 * @param <V> 값 타입
 * @author archmagece
 * @since 2025-02
 */
public interface SBSource<G, K, V> {

	/**
	 * 키를 다음 run 대기열에 추가합니다. 이미 캐시된 키는 무시합니다.
	 *
	 * @return 변경이 없으면 this
	 */
	SBSource<G, K, V> load(G groupingKey, K itemKey);

	/**
	 * @return 모든 키가 이미 캐시(또는 대기) 중이면 this
	 */
	SBSource<G, K, V> loadMany(G groupingKey, Collection<? extends K> itemKeys);

	/**
	 * fetch 없이 캐시에 값을 직접 넣습니다 (캐시 워밍).
	 */
	SBSource<G, K, V> put(G groupingKey, K itemKey, V value);

	/**
	 * @return 캐시된 값
	 * @throws SBNotLoadedException 로드되지 않은 키
	 * @throws SBBatchLoadFailException 배치 로드가 실패한 키
	 */
	V get(G groupingKey, K itemKey);

	/**
	 * 실패를 예외로 던지지 않고 결과 자체를 반환합니다.
	 *
	 * @throws SBNotLoadedException 로드되지 않은 키
	 */
	FetchResult<V> fetchResult(G groupingKey, K itemKey);

	boolean hasPending();

	/**
	 * 대기 중인 그룹마다 배치 함수를 executor에서 한 번씩 실행하고,
	 * 모두 끝나면 결과가 병합된 새 소스로 완료되는 future를 반환합니다.
	 * 배치 실패는 future를 실패시키지 않고 해당 키의 실패 결과로 캐시됩니다.
	 */
	CompletableFuture<SBSource<G, K, V>> runAsync(Executor executor);

	/**
	 * {@link #runAsync(Executor)} 후 완료까지 대기합니다.
	 */
	default SBSource<G, K, V> run(Executor executor) {
		return DataloaderExecutors.await(runAsync(executor));
	}

	default SBSource<G, K, V> run() {
		return run(DataloaderExecutors.defaultExecutor());
	}
}
