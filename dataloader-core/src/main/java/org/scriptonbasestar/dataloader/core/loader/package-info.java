/**
 * 배치 로더 인터페이스
 *
 * <p>{@link org.scriptonbasestar.dataloader.core.loader.SBBatchLoader}는 소스가 run 시점에
 * grouping key별로 한 번씩 호출하는 배치 함수입니다.</p>
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.dataloader.core.loader;
