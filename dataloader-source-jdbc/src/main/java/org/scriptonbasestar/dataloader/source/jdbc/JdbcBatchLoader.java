package org.scriptonbasestar.dataloader.source.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException;
import org.scriptonbasestar.dataloader.core.loader.SBBatchLoader;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JDBC 기반 key/value 배치 로더.
 * <p>
 * grouping key는 {@link JdbcEntity}, item key는 id 값입니다. 그룹마다 한 번
 * {@code SELECT * FROM <table> WHERE <id> IN (:ids)}를 실행하고 결과 행을 id 별로 돌려줍니다.
 * 요청한 id에 해당하는 행이 없으면 결과에서 빠지며, 소스의 MissingKeyPolicy가 처리합니다.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * JdbcBatchLoader jdbcLoader = new JdbcBatchLoader(dataSource);
 * SBDataloader loader = SBDataloader.create(fetchPool)
 *     .addSource("db", KVSource.of(jdbcLoader));
 *
 * loader = loader.load("db", USERS, 1L).run();
 * User user = loader.get("db", USERS, 1L);
 * }</pre>
 *
 * <h3>Thread Safety:</h3>
 * <p>
 * NamedParameterJdbcTemplate만 공유하므로 여러 그룹을 동시에 로드해도 안전합니다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
public class JdbcBatchLoader implements SBBatchLoader<JdbcEntity<?>, Object, Object> {

	private static final String IDS = "ids";

	private final NamedParameterJdbcTemplate jdbcTemplate;

	public JdbcBatchLoader(NamedParameterJdbcTemplate jdbcTemplate) {
		if (jdbcTemplate == null) {
			throw new IllegalArgumentException("jdbcTemplate cannot be null");
		}
		this.jdbcTemplate = jdbcTemplate;
	}

	public JdbcBatchLoader(DataSource dataSource) {
		this(new NamedParameterJdbcTemplate(dataSource));
	}

	@Override
	public Map<Object, Object> loadBatch(JdbcEntity<?> entity, Set<Object> ids) throws SBBatchLoadFailException {
		return load(entity, ids);
	}

	private <V> Map<Object, Object> load(JdbcEntity<V> entity, Set<Object> ids) {
		String sql = entity.selectByIdsSql(IDS);
		log.debug("loadBatch - sql : {}, ids : {}", sql, ids.size());
		try {
			List<V> rows = jdbcTemplate.query(sql, new MapSqlParameterSource(IDS, ids), entity.getRowMapper());
			Map<Object, Object> result = new HashMap<>();
			for (V row : rows) {
				result.put(entity.extractId(row), row);
			}
			return result;
		} catch (DataAccessException e) {
			throw new SBBatchLoadFailException(entity, "Failed to load " + entity + " for ids : " + ids, e);
		}
	}
}
