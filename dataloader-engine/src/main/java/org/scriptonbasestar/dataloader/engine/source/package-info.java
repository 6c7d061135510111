/**
 * 데이터 소스
 *
 * <p>소스는 캐시, 대기열, 배치 함수를 하나로 묶은 불변 값입니다.</p>
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.dataloader.engine.source.SBSource} - 소스 인터페이스</li>
 *   <li>{@link org.scriptonbasestar.dataloader.engine.source.AbstractSBSource} - load/put/get/run 기본 구현</li>
 *   <li>{@link org.scriptonbasestar.dataloader.engine.source.KVSource} - 임의의 배치 함수를 쓰는 Key/Value 소스</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.dataloader.engine.source;
