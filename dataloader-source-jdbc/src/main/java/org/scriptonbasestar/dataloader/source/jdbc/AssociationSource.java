package org.scriptonbasestar.dataloader.source.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException;
import org.scriptonbasestar.dataloader.core.result.FetchResult;
import org.scriptonbasestar.dataloader.core.strategy.MissingKeyPolicy;
import org.scriptonbasestar.dataloader.engine.cache.SourceCache;
import org.scriptonbasestar.dataloader.engine.metrics.LoaderMetricsRecorder;
import org.scriptonbasestar.dataloader.engine.pending.PendingMap;
import org.scriptonbasestar.dataloader.engine.source.AbstractSBSource;
import org.scriptonbasestar.dataloader.engine.source.SBSource;
import org.scriptonbasestar.dataloader.engine.source.SourceOptions;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 관계형 연관 소스. grouping key는 {@link Association}, item key는 소유 엔티티, 값은 연관 엔티티
 * (belongs-to) 또는 연관 엔티티 리스트(has-many)입니다.
 *
 * <pre>{@code
 * AssociationSource db = AssociationSource.builder()
 *     .dataSource(dataSource)
 *     .relationship(POST_AUTHOR)
 *     .relationship(USER_POSTS)
 *     .queryCustomizer(publishedOnly)
 *     .build();
 *
 * SBDataloader loader = SBDataloader.create(fetchPool)
 *     .addSource("db", db)
 *     .load("db", Association.of(Post.class, "user"), post)
 *     .run();
 *
 * User author = loader.get("db", Association.of(Post.class, "user"), post);
 * }</pre>
 *
 * <p>소유자의 연관 필드가 {@link Preloaded#of}로 이미 로드되어 있으면 조회 없이 그 값을 캐시합니다.
 * {@link Preloaded#notLoaded()}는 캐시를 채우지 않습니다.</p>
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
public final class AssociationSource extends AbstractSBSource<Association, Object, Object> {

	private final Definition definition;

	private AssociationSource(Definition definition, SourceOptions options,
							  SourceCache<Association, Object, Object> cache, PendingMap<Association, Object> pending) {
		super(options, cache, pending);
		this.definition = definition;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public SBSource<Association, Object, Object> loadMany(Association association, Collection<? extends Object> owners) {
		if (association == null) {
			throw new IllegalArgumentException("groupingKey must not be null");
		}
		if (owners == null) {
			throw new IllegalArgumentException("itemKeys must not be null");
		}
		Relationship<Object, Object> relationship = definition.relationship(association);
		for (Object owner : owners) {
			checkOwner(relationship, owner);
		}
		return super.loadMany(association, owners);
	}

	/**
	 * 연관 값을 직접 캐시합니다. {@link Preloaded} 값은 로드된 경우에만 풀어서 저장하고,
	 * 로드되지 않았으면 아무것도 하지 않습니다.
	 */
	@Override
	public SBSource<Association, Object, Object> put(Association association, Object owner, Object value) {
		if (association == null) {
			throw new IllegalArgumentException("groupingKey must not be null");
		}
		checkOwner(definition.relationship(association), owner);
		if (value instanceof Preloaded) {
			Preloaded<?> preloaded = (Preloaded<?>) value;
			if (!preloaded.isLoaded()) {
				log.trace("put ignored, not loaded - association : {}, owner : {}", association, owner);
				return this;
			}
			return super.put(association, owner, preloaded.get());
		}
		return super.put(association, owner, value);
	}

	@Override
	protected Optional<FetchResult<Object>> preResolve(Association association, Object owner) {
		Preloaded<?> preloaded = definition.relationship(association).preloadedOf(owner);
		if (preloaded == null || !preloaded.isLoaded()) {
			return Optional.empty();
		}
		Object value = preloaded.get();
		return Optional.of(FetchResult.<Object>success(value));
	}

	@Override
	protected Map<Object, Object> loadBatch(Association association, Set<Object> owners) {
		Relationship<Object, Object> relationship = definition.relationship(association);

		Set<Object> keys = new LinkedHashSet<>();
		for (Object owner : owners) {
			Object key = relationship.ownerKeyOf(owner);
			if (key != null) {
				keys.add(key);
			}
		}

		Map<Object, List<Object>> rowsByKey = keys.isEmpty()
			? Collections.emptyMap()
			: query(association, relationship, keys);

		Map<Object, Object> result = new HashMap<>();
		for (Object owner : owners) {
			Object key = relationship.ownerKeyOf(owner);
			List<Object> rows = key == null ? null : rowsByKey.get(key);
			if (relationship.getCardinality() == Relationship.Cardinality.MANY) {
				result.put(owner, rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows));
			} else if (rows != null && !rows.isEmpty()) {
				result.put(owner, rows.get(0));
			} else if (key == null) {
				// 외래 키가 비어 있으면 연관 값이 없는 것으로 확정
				result.put(owner, null);
			}
		}
		return result;
	}

	private Map<Object, List<Object>> query(Association association, Relationship<Object, Object> relationship, Set<Object> keys) {
		AssociationQuery query = definition.customizer.customize(relationship.baseQuery(), association.getParams());
		if (query == null) {
			throw new SBBatchLoadFailException(association, "QueryCustomizer returned null for " + association, null);
		}
		MapSqlParameterSource parameters = new MapSqlParameterSource(query.getParameters())
			.addValue(AssociationQuery.KEYS, keys);
		log.debug("loadBatch - association : {}, sql : {}, keys : {}", association, query.toSql(), keys.size());

		try {
			List<Object> rows = definition.jdbcTemplate.query(query.toSql(), parameters, relationship.getRowMapper());
			Map<Object, List<Object>> rowsByKey = new LinkedHashMap<>();
			for (Object row : rows) {
				rowsByKey.computeIfAbsent(relationship.targetKeyOf(row), k -> new ArrayList<>()).add(row);
			}
			return rowsByKey;
		} catch (DataAccessException e) {
			throw new SBBatchLoadFailException(association, "Failed to load " + association, e);
		}
	}

	private static void checkOwner(Relationship<Object, Object> relationship, Object owner) {
		if (owner != null && !relationship.isOwner(owner)) {
			throw new IllegalArgumentException("Owner " + owner.getClass().getName()
				+ " does not match relationship " + relationship);
		}
	}

	@Override
	protected AssociationSource copy(SourceCache<Association, Object, Object> cache, PendingMap<Association, Object> pending) {
		return new AssociationSource(definition, getOptions(), cache, pending);
	}

	@Override
	protected Object definition() {
		return definition;
	}

	/**
	 * 복사본들이 공유하는 불변 설정.
	 */
	private static final class Definition {
		private final NamedParameterJdbcTemplate jdbcTemplate;
		private final Map<String, Relationship<?, ?>> relationships;
		private final QueryCustomizer customizer;

		private Definition(NamedParameterJdbcTemplate jdbcTemplate, Map<String, Relationship<?, ?>> relationships,
						   QueryCustomizer customizer) {
			this.jdbcTemplate = jdbcTemplate;
			this.relationships = relationships;
			this.customizer = customizer;
		}

		@SuppressWarnings("unchecked")
		private Relationship<Object, Object> relationship(Association association) {
			Relationship<?, ?> relationship = relationships.get(relationKey(association.getOwnerType(), association.getName()));
			if (relationship == null) {
				throw new IllegalArgumentException("Unknown relationship : " + association.getOwnerType().getName()
					+ "." + association.getName());
			}
			return (Relationship<Object, Object>) relationship;
		}
	}

	private static String relationKey(Class<?> ownerType, String name) {
		return ownerType.getName() + "#" + name;
	}

	/**
	 * AssociationSource Builder 클래스
	 */
	public static class Builder {
		private NamedParameterJdbcTemplate jdbcTemplate;
		private final Map<String, Relationship<?, ?>> relationships = new LinkedHashMap<>();
		private QueryCustomizer customizer = QueryCustomizer.IDENTITY;
		private SourceOptions options = SourceOptions.defaults();

		public Builder jdbcTemplate(NamedParameterJdbcTemplate jdbcTemplate) {
			this.jdbcTemplate = jdbcTemplate;
			return this;
		}

		public Builder dataSource(DataSource dataSource) {
			if (dataSource == null) {
				throw new IllegalArgumentException("dataSource cannot be null");
			}
			this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
			return this;
		}

		public Builder relationship(Relationship<?, ?> relationship) {
			if (relationship == null) {
				throw new IllegalArgumentException("relationship cannot be null");
			}
			String key = relationKey(relationship.getOwnerType(), relationship.getName());
			if (relationships.containsKey(key)) {
				throw new IllegalArgumentException("Duplicate relationship : " + relationship);
			}
			relationships.put(key, relationship);
			return this;
		}

		public Builder queryCustomizer(QueryCustomizer customizer) {
			if (customizer == null) {
				throw new IllegalArgumentException("customizer cannot be null");
			}
			this.customizer = customizer;
			return this;
		}

		public Builder options(SourceOptions options) {
			if (options == null) {
				throw new IllegalArgumentException("options must not be null");
			}
			this.options = options;
			return this;
		}

		public Builder missingKeyPolicy(MissingKeyPolicy missingKeyPolicy) {
			this.options = options.withMissingKeyPolicy(missingKeyPolicy);
			return this;
		}

		public Builder fetchTimeout(Duration fetchTimeout) {
			this.options = options.withFetchTimeout(fetchTimeout);
			return this;
		}

		public Builder metrics(LoaderMetricsRecorder metrics) {
			this.options = options.withMetrics(metrics);
			return this;
		}

		public AssociationSource build() {
			if (jdbcTemplate == null) {
				throw new IllegalStateException("jdbcTemplate or dataSource must be set");
			}
			Definition definition = new Definition(jdbcTemplate,
				Collections.unmodifiableMap(new LinkedHashMap<>(relationships)), customizer);
			return new AssociationSource(definition, options, SourceCache.empty(), PendingMap.empty());
		}
	}
}
