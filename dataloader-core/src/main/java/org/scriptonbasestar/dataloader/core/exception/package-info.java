/**
 * 데이터로더 예외
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.dataloader.core.exception.SBNotLoadedException} - load/run 전에 get 호출</li>
 *   <li>{@link org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException} - 배치 함수 실패 (키별로 캐시됨)</li>
 *   <li>{@link org.scriptonbasestar.dataloader.core.exception.SBUnknownSourceException} - 등록되지 않은 소스 이름</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.dataloader.core.exception;
