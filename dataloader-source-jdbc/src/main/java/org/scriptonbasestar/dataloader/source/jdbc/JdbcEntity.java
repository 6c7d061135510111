package org.scriptonbasestar.dataloader.source.jdbc;

import org.springframework.jdbc.core.RowMapper;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link JdbcBatchLoader}가 읽는 테이블 정의. KVSource의 grouping key로 사용됩니다.
 *
 * <pre>{@code
 * JdbcEntity<User> users = JdbcEntity.of("users", "id",
 *     (rs, rowNum) -> new User(rs.getLong("id"), rs.getString("username")),
 *     User::getId);
 * }</pre>
 *
 * <p>테이블 이름과 id 컬럼(대소문자 무시)이 같고, 같은 RowMapper와 id 추출 함수 인스턴스를 쓸 때만
 * 같은 그룹으로 취급합니다. 같은 테이블을 다른 매퍼로 읽는 엔티티는 캐시를 공유하지 않으므로,
 * 엔티티는 상수로 한 번 만들어 재사용합니다.</p>
 *
 * @param <V> 행을 매핑한 값 타입
 * @author archmagece
 * @since 2025-02
 */
public final class JdbcEntity<V> {

	private final String table;
	private final String idColumn;
	private final RowMapper<V> rowMapper;
	private final Function<? super V, ?> idExtractor;

	private JdbcEntity(String table, String idColumn, RowMapper<V> rowMapper, Function<? super V, ?> idExtractor) {
		this.table = SqlIdentifiers.identifier(table, "table");
		this.idColumn = SqlIdentifiers.identifier(idColumn, "idColumn");
		if (rowMapper == null) {
			throw new IllegalArgumentException("rowMapper cannot be null");
		}
		if (idExtractor == null) {
			throw new IllegalArgumentException("idExtractor cannot be null");
		}
		this.rowMapper = rowMapper;
		this.idExtractor = idExtractor;
	}

	/**
	 * @param table       테이블 이름
	 * @param idColumn    IN 조건에 사용할 id 컬럼
	 * @param rowMapper   행 매퍼
	 * @param idExtractor 매핑된 값에서 item key(id)를 꺼내는 함수
	 */
	public static <V> JdbcEntity<V> of(String table, String idColumn, RowMapper<V> rowMapper,
									   Function<? super V, ?> idExtractor) {
		return new JdbcEntity<>(table, idColumn, rowMapper, idExtractor);
	}

	String selectByIdsSql(String parameterName) {
		return "SELECT * FROM " + table + " WHERE " + idColumn + " IN (:" + parameterName + ")";
	}

	Object extractId(V value) {
		return idExtractor.apply(value);
	}

	public String getTable() {
		return table;
	}

	public String getIdColumn() {
		return idColumn;
	}

	public RowMapper<V> getRowMapper() {
		return rowMapper;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof JdbcEntity)) {
			return false;
		}
		JdbcEntity<?> that = (JdbcEntity<?>) o;
		return table.equalsIgnoreCase(that.table)
			&& idColumn.equalsIgnoreCase(that.idColumn)
			&& rowMapper == that.rowMapper
			&& idExtractor == that.idExtractor;
	}

	@Override
	public int hashCode() {
		return Objects.hash(table.toLowerCase(Locale.ROOT), idColumn.toLowerCase(Locale.ROOT),
			System.identityHashCode(rowMapper), System.identityHashCode(idExtractor));
	}

	@Override
	public String toString() {
		return table + "." + idColumn;
	}
}
