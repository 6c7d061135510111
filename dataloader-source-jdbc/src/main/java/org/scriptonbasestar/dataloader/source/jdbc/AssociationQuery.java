package org.scriptonbasestar.dataloader.source.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 연관 조회 쿼리. 불변이며 {@link #and}, {@link #param}, {@link #orderBy}는 새 쿼리를 반환합니다.
 *
 * <pre>{@code
 * SELECT * FROM <table> WHERE <column> IN (:keys) [AND <condition>...] [ORDER BY <orderBy>]
 * }</pre>
 *
 * <p>{@code keys} 파라미터 이름은 예약되어 있습니다.</p>
 *
 * @author archmagece
 * @since 2025-02
 */
public final class AssociationQuery {

	static final String KEYS = "keys";

	private final String table;
	private final String column;
	private final List<String> conditions;
	private final Map<String, Object> parameters;
	private final String orderBy;

	private AssociationQuery(String table, String column, List<String> conditions,
							 Map<String, Object> parameters, String orderBy) {
		this.table = table;
		this.column = column;
		this.conditions = conditions;
		this.parameters = parameters;
		this.orderBy = orderBy;
	}

	public static AssociationQuery of(String table, String column) {
		return new AssociationQuery(
			SqlIdentifiers.identifier(table, "table"),
			SqlIdentifiers.identifier(column, "column"),
			Collections.emptyList(),
			Collections.emptyMap(),
			null);
	}

	/**
	 * AND 조건을 추가합니다. 값은 {@code :name} 형태의 named parameter로 참조하고 {@link #param}으로 바인딩합니다.
	 */
	public AssociationQuery and(String condition) {
		if (condition == null || condition.trim().isEmpty()) {
			throw new IllegalArgumentException("condition cannot be null or empty");
		}
		List<String> next = new ArrayList<>(conditions);
		next.add(condition.trim());
		return new AssociationQuery(table, column, Collections.unmodifiableList(next), parameters, orderBy);
	}

	public AssociationQuery param(String name, Object value) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("parameter name cannot be null or empty");
		}
		if (KEYS.equals(name)) {
			throw new IllegalArgumentException("parameter name is reserved : " + name);
		}
		Map<String, Object> next = new LinkedHashMap<>(parameters);
		next.put(name, value);
		return new AssociationQuery(table, column, conditions, Collections.unmodifiableMap(next), orderBy);
	}

	/**
	 * @param orderBy 정렬 구문 (예: {@code "id DESC"}), null이면 정렬 없음
	 */
	public AssociationQuery orderBy(String orderBy) {
		return new AssociationQuery(table, column, conditions, parameters, SqlIdentifiers.orderBy(orderBy));
	}

	public String toSql() {
		StringBuilder sql = new StringBuilder("SELECT * FROM ")
			.append(table)
			.append(" WHERE ")
			.append(column)
			.append(" IN (:").append(KEYS).append(')');
		for (String condition : conditions) {
			sql.append(" AND (").append(condition).append(')');
		}
		if (orderBy != null) {
			sql.append(" ORDER BY ").append(orderBy);
		}
		return sql.toString();
	}

	public String getTable() {
		return table;
	}

	public String getColumn() {
		return column;
	}

	public List<String> getConditions() {
		return conditions;
	}

	public Map<String, Object> getParameters() {
		return parameters;
	}

	public String getOrderBy() {
		return orderBy;
	}

	@Override
	public String toString() {
		return toSql();
	}
}
