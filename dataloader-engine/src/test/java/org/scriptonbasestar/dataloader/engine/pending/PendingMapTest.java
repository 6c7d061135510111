package org.scriptonbasestar.dataloader.engine.pending;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * @author archmagece
 * @since 2025-02
 */
public class PendingMapTest {

	@Test
	public void testAddIsIdempotent() {
		PendingMap<String, Long> once = PendingMap.<String, Long>empty().add("user", 1L);
		PendingMap<String, Long> twice = once.add("user", 1L);

		Assert.assertSame(once, twice);
		Assert.assertTrue(once.contains("user", 1L));
	}

	@Test
	public void testDrainGroupsByGroupingKey() {
		PendingMap<String, Long> pending = PendingMap.<String, Long>empty()
			.add("user", 1L)
			.add("user", 2L)
			.add("post", 1L)
			.add("user", 1L);

		Map<String, Set<Long>> snapshot = pending.drain();

		Assert.assertEquals(2, snapshot.size());
		Assert.assertEquals(new HashSet<>(Arrays.asList(1L, 2L)), snapshot.get("user"));
		Assert.assertEquals(new HashSet<>(Arrays.asList(1L)), snapshot.get("post"));
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testDrainSnapshotIsUnmodifiable() {
		PendingMap<String, Long> pending = PendingMap.<String, Long>empty().add("user", 1L);

		pending.drain().get("user").add(2L);
	}

	@Test
	public void testRemoveDropsEmptyGroups() {
		PendingMap<String, Long> pending = PendingMap.<String, Long>empty().add("user", 1L);

		PendingMap<String, Long> removed = pending.remove("user", 1L);

		Assert.assertTrue(removed.isEmpty());
		Assert.assertSame(PendingMap.empty(), removed);
		Assert.assertSame(pending, pending.remove("user", 2L));
	}

	@Test
	public void testEmptyHasNoGroups() {
		Assert.assertTrue(PendingMap.empty().isEmpty());
		Assert.assertTrue(PendingMap.empty().drain().isEmpty());
		Assert.assertEquals(0, PendingMap.empty().groupCount());
	}
}
