package org.scriptonbasestar.dataloader.source.jdbc;

import java.util.Map;

/**
 * 연관 그룹마다 한 번, 쿼리 실행 직전에 호출됩니다.
 *
 * <pre>{@code
 * QueryCustomizer publishedOnly = (query, params) ->
 *     Boolean.TRUE.equals(params.get("published"))
 *         ? query.and("published = :published").param("published", true)
 *         : query;
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@FunctionalInterface
public interface QueryCustomizer {

	QueryCustomizer IDENTITY = (query, params) -> query;

	/**
	 * @param query  기본 연관 쿼리
	 * @param params {@link Association#getParams()}
	 * @return 실행할 쿼리
	 */
	AssociationQuery customize(AssociationQuery query, Map<String, Object> params);
}
