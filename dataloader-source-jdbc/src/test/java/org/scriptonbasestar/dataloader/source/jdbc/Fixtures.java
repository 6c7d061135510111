package org.scriptonbasestar.dataloader.source.jdbc;

import org.springframework.jdbc.core.RowMapper;

import java.util.function.Function;

/**
 * users / posts 테이블 매핑과 관계 정의.
 */
final class Fixtures {

	static final RowMapper<User> USER_MAPPER = (rs, rowNum) ->
		new User(rs.getLong("id"), rs.getString("username"));

	static final RowMapper<Post> POST_MAPPER = (rs, rowNum) ->
		new Post(rs.getLong("id"), rs.getObject("user_id", Long.class), rs.getString("title"));

	static final Function<User, Object> USER_ID = User::getId;

	static final JdbcEntity<User> USERS = JdbcEntity.of("users", "id", USER_MAPPER, USER_ID);
	static final JdbcEntity<Post> POSTS = JdbcEntity.of("posts", "id", POST_MAPPER, Post::getId);

	static final Association POST_USER = Association.of(Post.class, "user");
	static final Association USER_POSTS = Association.of(User.class, "posts");

	static final Relationship<Post, User> POST_AUTHOR = Relationship.belongsTo(Post.class, "user", User.class)
		.ownerKey(Post::getUserId)
		.target("users", "id")
		.rowMapper(USER_MAPPER)
		.targetKey(User::getId)
		.preloaded(Post::getUser)
		.build();

	static final Relationship<User, Post> USER_POST_LIST = Relationship.hasMany(User.class, "posts", Post.class)
		.ownerKey(User::getId)
		.target("posts", "user_id")
		.rowMapper(POST_MAPPER)
		.targetKey(Post::getUserId)
		.orderBy("id")
		.preloaded(User::getPosts)
		.build();

	private Fixtures() {
	}
}
