package org.scriptonbasestar.dataloader.engine.loader;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException;
import org.scriptonbasestar.dataloader.core.exception.SBUnknownSourceException;
import org.scriptonbasestar.dataloader.engine.executor.DataloaderExecutors;
import org.scriptonbasestar.dataloader.engine.source.CountingBatchLoader;
import org.scriptonbasestar.dataloader.engine.source.KVSource;
import org.scriptonbasestar.dataloader.engine.source.SBSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * @author archmagece
 * @since 2025-02
 */
public class SBDataloaderTest {

	private ExecutorService executor;
	private CountingBatchLoader<String> users;
	private CountingBatchLoader<String> posts;

	@Before
	public void setUp() {
		executor = DataloaderExecutors.newFetchPool(2);
		users = new CountingBatchLoader<String>()
			.with(1L, "Ben Wilson")
			.with(2L, "Andy McVitty");
		posts = new CountingBatchLoader<String>()
			.with(10L, "first post");
	}

	@After
	public void tearDown() {
		DataloaderExecutors.shutdown(executor);
	}

	private SBDataloader newLoader() {
		return SBDataloader.builder()
			.executor(executor)
			.source("users", KVSource.of(users))
			.source("posts", KVSource.of(posts))
			.build();
	}

	@Test
	public void testLoadRunGet() {
		SBDataloader loader = newLoader().load("users", "user", 1L).run();

		String name = loader.get("users", "user", 1L);
		Assert.assertEquals("user:Ben Wilson", name);
		Assert.assertEquals(1, users.callCount());
		Assert.assertEquals(0, posts.callCount());
	}

	@Test
	public void testSuccessiveLoadsOfSameKeyDoNotRefetch() {
		SBDataloader round1 = newLoader().load("users", "user", 1L).run();
		SBDataloader round2 = round1.load("users", "user", 1L);

		Assert.assertSame(round1, round2);
		Assert.assertSame(round2, round2.run());
		Assert.assertEquals(1, users.callCount());
	}

	@Test
	public void testRunWithoutPendingReturnsSameLoader() {
		SBDataloader loader = newLoader();

		Assert.assertFalse(loader.hasPending());
		Assert.assertSame(loader, loader.run());
	}

	@Test
	public void testLoadReturnsNewLoaderAndKeepsOriginal() {
		SBDataloader loader = newLoader();
		SBDataloader loaded = loader.load("users", "user", 1L);

		Assert.assertNotSame(loader, loaded);
		Assert.assertTrue(loaded.hasPending());
		Assert.assertFalse(loader.hasPending());
		Assert.assertEquals(loaded, loader.load("users", "user", 1L));
	}

	@Test
	public void testPutWarmsCache() {
		SBDataloader loader = newLoader()
			.put("users", "user", 5L, "warmed")
			.load("users", "user", 5L)
			.run();

		String value = loader.get("users", "user", 5L);
		Assert.assertEquals("warmed", value);
		Assert.assertEquals(0, users.callCount());
	}

	@Test
	public void testAllSourcesRunInOneRun() {
		SBDataloader loader = newLoader()
			.loadMany("users", "user", Arrays.asList(1L, 2L))
			.load("posts", "post", 10L)
			.run();

		List<String> names = loader.getMany("users", "user", Arrays.asList(2L, 1L));
		String post = loader.get("posts", "post", 10L);
		Assert.assertEquals(Arrays.asList("user:Andy McVitty", "user:Ben Wilson"), names);
		Assert.assertEquals("post:first post", post);
		Assert.assertEquals(1, users.callCount());
		Assert.assertEquals(1, posts.callCount());
	}

	@Test
	public void testFailureInOneSourceDoesNotAffectOthers() {
		posts.failOn("post");

		SBDataloader loader = newLoader()
			.load("users", "user", 1L)
			.load("posts", "post", 10L)
			.run();

		String name = loader.get("users", "user", 1L);
		Assert.assertEquals("user:Ben Wilson", name);
		Assert.assertTrue(loader.fetchResult("posts", "post", 10L).isFailure());
		try {
			loader.get("posts", "post", 10L);
			Assert.fail("failed batch must rethrow on get");
		} catch (SBBatchLoadFailException e) {
			Assert.assertEquals("post", e.getGroupingKey());
		}
	}

	@Test
	public void testGroupsOfDifferentSourcesAreDispatchedConcurrently() {
		CountDownLatch bothStarted = new CountDownLatch(2);
		Map<String, String> threads = new ConcurrentHashMap<>();
		SBSource<String, Long, String> blocking = KVSource.of((group, keys) -> {
			threads.put(group, Thread.currentThread().getName());
			bothStarted.countDown();
			try {
				if (!bothStarted.await(5, TimeUnit.SECONDS)) {
					throw new IllegalStateException("batches were not dispatched concurrently");
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			return Collections.singletonMap(1L, group);
		});

		SBDataloader loader = SBDataloader.create(executor)
			.addSource("left", blocking)
			.addSource("right", blocking)
			.load("left", "l", 1L)
			.load("right", "r", 1L)
			.run();

		String left = loader.get("left", "l", 1L);
		String right = loader.get("right", "r", 1L);
		Assert.assertEquals("l", left);
		Assert.assertEquals("r", right);
		Assert.assertNotEquals(threads.get("l"), threads.get("r"));
	}

	@Test(expected = SBUnknownSourceException.class)
	public void testLoadUnknownSource() {
		newLoader().load("comments", "comment", 1L);
	}

	@Test
	public void testGetUnknownSource() {
		try {
			newLoader().get("comments", "comment", 1L);
			Assert.fail();
		} catch (SBUnknownSourceException e) {
			Assert.assertEquals("comments", e.getSourceName());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testGetManyWithNullKeys() {
		newLoader().getMany("users", "user", null);
	}

	@Test
	public void testAddSameSourceTwiceIsNoop() {
		SBSource<String, Long, String> source = KVSource.of(users);
		SBDataloader loader = SBDataloader.create(executor).addSource("users", source);

		Assert.assertSame(loader, loader.addSource("users", source));
		Assert.assertEquals(Collections.singleton("users"), loader.sourceNames());
		Assert.assertSame(source, loader.getSource("users"));
	}

	@Test
	public void testAddSourceReplacesExisting() {
		SBDataloader loader = newLoader().load("users", "user", 1L);
		SBDataloader replaced = loader.addSource("users", KVSource.of(users));

		Assert.assertTrue(loader.hasPending());
		Assert.assertFalse(replaced.hasPending());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testAddSourceWithEmptyName() {
		SBDataloader.create().addSource(" ", KVSource.of(users));
	}

	@Test
	public void testDefaultExecutorIsCommonPool() {
		Assert.assertSame(DataloaderExecutors.defaultExecutor(), SBDataloader.create().getExecutor());
	}
}
