package org.scriptonbasestar.dataloader.source.jdbc;

import org.springframework.jdbc.core.RowMapper;

import java.util.function.Function;

/**
 * {@link AssociationSource}에 등록하는 관계 메타데이터.
 *
 * <p>소유자에서 꺼낸 키({@code ownerKey})와 대상 행에서 꺼낸 키({@code targetKey})가 같으면
 * 그 행이 소유자의 연관 값입니다.</p>
 *
 * <pre>{@code
 * // posts.user_id -> users.id
 * Relationship<Post, User> author = Relationship.belongsTo(Post.class, "user", User.class)
 *     .ownerKey(Post::getUserId)
 *     .target("users", "id")
 *     .rowMapper(USER_MAPPER)
 *     .targetKey(User::getId)
 *     .preloaded(Post::getUser)
 *     .build();
 *
 * // users.id -> posts.user_id
 * Relationship<User, Post> posts = Relationship.hasMany(User.class, "posts", Post.class)
 *     .ownerKey(User::getId)
 *     .target("posts", "user_id")
 *     .rowMapper(POST_MAPPER)
 *     .targetKey(Post::getUserId)
 *     .orderBy("id")
 *     .build();
 * }</pre>
 *
 * @param <O> 소유 엔티티 타입
 * @param <R> 대상 엔티티 타입
 * @author archmagece
 * @since 2025-02
 */
public final class Relationship<O, R> {

	public enum Cardinality {
		/** belongs-to / has-one: 값은 대상 하나 (없으면 MissingKeyPolicy) */
		ONE,
		/** has-many: 값은 대상 리스트 (없으면 빈 리스트) */
		MANY
	}

	private final Class<O> ownerType;
	private final String name;
	private final Cardinality cardinality;
	private final Function<? super O, ?> ownerKey;
	private final String table;
	private final String column;
	private final RowMapper<R> rowMapper;
	private final Function<? super R, ?> targetKey;
	private final String orderBy;
	private final Function<? super O, ? extends Preloaded<?>> preloaded;

	private Relationship(Builder<O, R> builder) {
		this.ownerType = builder.ownerType;
		this.name = builder.name;
		this.cardinality = builder.cardinality;
		this.ownerKey = builder.ownerKey;
		this.table = builder.table;
		this.column = builder.column;
		this.rowMapper = builder.rowMapper;
		this.targetKey = builder.targetKey;
		this.orderBy = builder.orderBy;
		this.preloaded = builder.preloaded;
	}

	public static <O, R> Builder<O, R> belongsTo(Class<O> ownerType, String name, Class<R> targetType) {
		return new Builder<>(ownerType, name, Cardinality.ONE);
	}

	public static <O, R> Builder<O, R> hasMany(Class<O> ownerType, String name, Class<R> targetType) {
		return new Builder<>(ownerType, name, Cardinality.MANY);
	}

	public Class<O> getOwnerType() {
		return ownerType;
	}

	public String getName() {
		return name;
	}

	public Cardinality getCardinality() {
		return cardinality;
	}

	public RowMapper<R> getRowMapper() {
		return rowMapper;
	}

	Object ownerKeyOf(O owner) {
		return ownerKey.apply(owner);
	}

	Object targetKeyOf(R row) {
		return targetKey.apply(row);
	}

	/**
	 * @return 소유자에 이미 로드된 연관 값 마커, accessor가 없으면 null
	 */
	Preloaded<?> preloadedOf(O owner) {
		return preloaded == null ? null : preloaded.apply(owner);
	}

	AssociationQuery baseQuery() {
		AssociationQuery query = AssociationQuery.of(table, column);
		return orderBy == null ? query : query.orderBy(orderBy);
	}

	boolean isOwner(Object candidate) {
		return ownerType.isInstance(candidate);
	}

	@Override
	public String toString() {
		return ownerType.getSimpleName() + "." + name + "(" + cardinality + " -> " + table + "." + column + ")";
	}

	/**
	 * Relationship Builder 클래스
	 */
	public static class Builder<O, R> {
		private final Class<O> ownerType;
		private final String name;
		private final Cardinality cardinality;
		private Function<? super O, ?> ownerKey;
		private String table;
		private String column;
		private RowMapper<R> rowMapper;
		private Function<? super R, ?> targetKey;
		private String orderBy;
		private Function<? super O, ? extends Preloaded<?>> preloaded;

		private Builder(Class<O> ownerType, String name, Cardinality cardinality) {
			if (ownerType == null) {
				throw new IllegalArgumentException("ownerType cannot be null");
			}
			if (name == null || name.trim().isEmpty()) {
				throw new IllegalArgumentException("name cannot be null or empty");
			}
			this.ownerType = ownerType;
			this.name = name;
			this.cardinality = cardinality;
		}

		public Builder<O, R> ownerKey(Function<? super O, ?> ownerKey) {
			this.ownerKey = ownerKey;
			return this;
		}

		/**
		 * @param table  대상 테이블
		 * @param column 소유자 키와 비교할 대상 테이블의 컬럼
		 */
		public Builder<O, R> target(String table, String column) {
			this.table = SqlIdentifiers.identifier(table, "table");
			this.column = SqlIdentifiers.identifier(column, "column");
			return this;
		}

		public Builder<O, R> rowMapper(RowMapper<R> rowMapper) {
			this.rowMapper = rowMapper;
			return this;
		}

		public Builder<O, R> targetKey(Function<? super R, ?> targetKey) {
			this.targetKey = targetKey;
			return this;
		}

		public Builder<O, R> orderBy(String orderBy) {
			this.orderBy = SqlIdentifiers.orderBy(orderBy);
			return this;
		}

		/**
		 * 소유자에 이미 들어있는 연관 값을 꺼내는 accessor. {@link Preloaded#of}를 반환하면 조회 없이 캐시됩니다.
		 */
		public Builder<O, R> preloaded(Function<? super O, ? extends Preloaded<?>> preloaded) {
			this.preloaded = preloaded;
			return this;
		}

		public Relationship<O, R> build() {
			if (ownerKey == null) {
				throw new IllegalStateException("ownerKey must be set : " + name);
			}
			if (table == null || column == null) {
				throw new IllegalStateException("target must be set : " + name);
			}
			if (rowMapper == null) {
				throw new IllegalStateException("rowMapper must be set : " + name);
			}
			if (targetKey == null) {
				throw new IllegalStateException("targetKey must be set : " + name);
			}
			return new Relationship<>(this);
		}
	}
}
