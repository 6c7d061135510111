package org.scriptonbasestar.dataloader.core.result;

import org.junit.Assert;
import org.junit.Test;
import org.scriptonbasestar.dataloader.core.exception.SBBatchLoadFailException;

/**
 * @author archmagece
 * @since 2025-02
 */
public class FetchResultTest {

	@Test
	public void testSuccessHoldsValue() {
		FetchResult<String> result = FetchResult.success("Ben Wilson");

		Assert.assertTrue(result.isSuccess());
		Assert.assertFalse(result.isFailure());
		Assert.assertEquals("Ben Wilson", result.getValue());
		Assert.assertNull(result.getError());
	}

	@Test
	public void testSuccessWithNullIsStillSuccess() {
		FetchResult<String> result = FetchResult.success(null);

		Assert.assertTrue(result.isSuccess());
		Assert.assertNull(result.getValue());
		Assert.assertEquals(FetchResult.success(null), result);
	}

	@Test
	public void testFailureRethrowsOnGetValue() {
		SBBatchLoadFailException error = new SBBatchLoadFailException("users", "db down", null);
		FetchResult<String> result = FetchResult.failure(error);

		Assert.assertTrue(result.isFailure());
		Assert.assertSame(error, result.getError());
		try {
			result.getValue();
			Assert.fail("failure must throw");
		} catch (SBBatchLoadFailException e) {
			Assert.assertSame(error, e);
			Assert.assertEquals("users", e.getGroupingKey());
		}
	}

	@Test
	public void testEquality() {
		SBBatchLoadFailException error = new SBBatchLoadFailException("boom");

		Assert.assertEquals(FetchResult.success(1), FetchResult.success(1));
		Assert.assertNotEquals(FetchResult.success(1), FetchResult.success(2));
		Assert.assertEquals(FetchResult.failure(error), FetchResult.failure(error));
		Assert.assertNotEquals(FetchResult.failure(error), FetchResult.failure(new SBBatchLoadFailException("boom")));
		Assert.assertNotEquals(FetchResult.success(null), FetchResult.failure(error));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFailureRequiresError() {
		FetchResult.failure(null);
	}
}
