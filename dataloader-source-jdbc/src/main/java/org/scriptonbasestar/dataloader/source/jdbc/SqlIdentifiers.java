package org.scriptonbasestar.dataloader.source.jdbc;

import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * SQL 문자열에 그대로 들어가는 테이블/컬럼/정렬 구문 검증.
 *
 * @author archmagece
 * @since 2025-02
 */
@UtilityClass
class SqlIdentifiers {

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
	private static final Pattern ORDER_BY = Pattern.compile("[A-Za-z0-9_.,\\s]+");

	static String identifier(String value, String name) {
		if (value == null || !IDENTIFIER.matcher(value).matches()) {
			throw new IllegalArgumentException(name + " is not a valid SQL identifier : " + value);
		}
		return value;
	}

	static String orderBy(String value) {
		if (value == null) {
			return null;
		}
		if (value.trim().isEmpty() || !ORDER_BY.matcher(value).matches()) {
			throw new IllegalArgumentException("orderBy is not a valid ORDER BY clause : " + value);
		}
		return value.trim();
	}
}
