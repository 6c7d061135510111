/**
 * JDBC 기반 소스
 *
 * <p>Spring JDBC의 {@code NamedParameterJdbcTemplate}으로 배치 조회를 수행하는 소스를 제공합니다.</p>
 *
 * <h2>주요 클래스</h2>
 * <ul>
 *     <li>{@link org.scriptonbasestar.dataloader.source.jdbc.JdbcBatchLoader} - id IN (...) 조회로 동작하는 key/value 배치 로더</li>
 *     <li>{@link org.scriptonbasestar.dataloader.source.jdbc.AssociationSource} - belongs-to / has-many 연관 로딩 소스</li>
 *     <li>{@link org.scriptonbasestar.dataloader.source.jdbc.Relationship} - 연관 메타데이터</li>
 *     <li>{@link org.scriptonbasestar.dataloader.source.jdbc.QueryCustomizer} - 연관 쿼리 조건 추가</li>
 * </ul>
 *
 * <h2>주의사항</h2>
 * <ul>
 *     <li>JDBC 드라이버는 사용자가 직접 의존성에 추가해야 합니다</li>
 *     <li>IN 조건의 키 개수는 DB의 파라미터 제한을 넘지 않도록 해야 합니다</li>
 *     <li>테이블/컬럼 이름은 SQL에 그대로 들어가므로 식별자 형식만 허용합니다</li>
 * </ul>
 *
 * @since 2025-02
 * @author archmagece
 */
package org.scriptonbasestar.dataloader.source.jdbc;
