/**
 * Micrometer 기반 로더 메트릭 통합
 *
 * <p>Micrometer MeterRegistry와 SB Dataloader의 메트릭을 연동합니다.</p>
 *
 * <h3>지원 메트릭 (모두 source 태그)</h3>
 * <ul>
 *   <li>dataloader.load.hits - 캐시에서 바로 응답한 load 횟수 (Counter)</li>
 *   <li>dataloader.load.queued - 대기열에 추가된 키 수 (Counter)</li>
 *   <li>dataloader.batches{result=success|failure} - 배치 fetch 횟수 (Counter)</li>
 *   <li>dataloader.missing.keys - 결과에 없던 키 수 (Counter)</li>
 *   <li>dataloader.batch.duration - 배치 fetch 시간 (Timer)</li>
 *   <li>dataloader.batch.keys - 배치당 키 수 (DistributionSummary)</li>
 *   <li>dataloader.hit.rate - 히트율 (Gauge)</li>
 * </ul>
 *
 * @since 2025-02
 * @author archmagece
 */
package org.scriptonbasestar.dataloader.metrics.micrometer;
