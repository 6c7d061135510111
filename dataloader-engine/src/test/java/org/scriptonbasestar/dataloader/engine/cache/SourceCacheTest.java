package org.scriptonbasestar.dataloader.engine.cache;

import org.junit.Assert;
import org.junit.Test;
import org.scriptonbasestar.dataloader.core.result.FetchResult;

import java.util.HashMap;
import java.util.Map;

/**
 * @author archmagece
 * @since 2025-02
 */
public class SourceCacheTest {

	@Test
	public void testEmptyCache() {
		SourceCache<String, Long, String> cache = SourceCache.empty();

		Assert.assertTrue(cache.isEmpty());
		Assert.assertEquals(0, cache.size());
		Assert.assertFalse(cache.get("user", 1L).isPresent());
		Assert.assertFalse(cache.contains("user", 1L));
	}

	@Test
	public void testPutReturnsNewInstanceAndLeavesOriginalUntouched() {
		SourceCache<String, Long, String> empty = SourceCache.empty();
		SourceCache<String, Long, String> cache = empty.put("user", 1L, FetchResult.success("Ben"));

		Assert.assertNotSame(empty, cache);
		Assert.assertTrue(empty.isEmpty());
		Assert.assertEquals(FetchResult.success("Ben"), cache.get("user", 1L).get());
	}

	@Test
	public void testPutSameResultIsNoop() {
		SourceCache<String, Long, String> cache = SourceCache.<String, Long, String>empty()
			.put("user", 1L, FetchResult.success("Ben"));

		Assert.assertSame(cache, cache.put("user", 1L, FetchResult.success("Ben")));
		Assert.assertNotSame(cache, cache.put("user", 1L, FetchResult.success("Andy")));
	}

	@Test
	public void testNullValueIsCached() {
		SourceCache<String, Long, String> cache = SourceCache.<String, Long, String>empty()
			.put("user", 9L, FetchResult.success(null));

		Assert.assertTrue(cache.contains("user", 9L));
		Assert.assertNull(cache.get("user", 9L).get().getValue());
	}

	@Test
	public void testMergeKeepsOtherGroups() {
		SourceCache<String, Long, String> cache = SourceCache.<String, Long, String>empty()
			.put("user", 1L, FetchResult.success("Ben"));

		Map<Long, FetchResult<String>> posts = new HashMap<>();
		posts.put(10L, FetchResult.success("post10"));
		posts.put(11L, FetchResult.success("post11"));
		SourceCache<String, Long, String> merged = cache.merge("post", posts);

		Assert.assertEquals(3, merged.size());
		Assert.assertTrue(merged.contains("user", 1L));
		Assert.assertTrue(merged.contains("post", 11L));
		Assert.assertSame(merged, merged.merge("post", new HashMap<>()));
	}

	@Test
	public void testValueEquality() {
		SourceCache<String, Long, String> a = SourceCache.<String, Long, String>empty()
			.put("user", 1L, FetchResult.success("Ben"));
		SourceCache<String, Long, String> b = SourceCache.<String, Long, String>empty()
			.put("user", 1L, FetchResult.success("Ben"));

		Assert.assertEquals(a, b);
		Assert.assertEquals(a.hashCode(), b.hashCode());
	}
}
