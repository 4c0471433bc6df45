package org.again.retry;

import java.io.IOException;
import java.math.BigDecimal;

import org.junit.Test;

import org.again.retry.strategy.RetryStrategies;
import org.again.retry.strategy.RetryStrategy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class RetryOptionsTest {

	@Test
	public void testDefaults() {
		RetryOptions options = RetryOptions.builder().build();
		assertFalse(options.getStrategy().iterator().hasNext());
		assertSame(RetryListener.NO_OP, options.getListener());
		assertNull(options.getUserContext());
		assertTrue(options.getExceptionPredicate().test(new IllegalStateException()));
	}

	@Test
	public void testBareStrategy() {
		RetryStrategy strategy = RetryStrategy.of(1, 2);
		RetryOptions options = RetryOptions.of(strategy);
		assertSame(strategy, options.getStrategy());
		assertSame(RetryListener.NO_OP, options.getListener());
	}

	@Test
	public void testRetryOn() {
		RetryOptions options = RetryOptions.builder().retryOn(IOException.class).build();
		assertTrue(options.getExceptionPredicate().test(new IOException()));
		assertFalse(options.getExceptionPredicate().test(new IllegalStateException()));
	}

	@Test
	public void testNotRetryOn() {
		RetryOptions options = RetryOptions.builder().notRetryOn(IllegalArgumentException.class).build();
		assertTrue(options.getExceptionPredicate().test(new IOException()));
		assertFalse(options.getExceptionPredicate().test(new IllegalArgumentException()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullStrategyIsRejected() {
		RetryOptions.builder().strategy(null);
	}

	@Test
	public void testReportEquality() {
		RuntimeException failure = new RuntimeException("planned");
		AttemptReport report = new AttemptReport(2, failure, new BigDecimal("12"), RetryStatus.RETRY, "ctx");
		AttemptReport same = new AttemptReport(2, failure, new BigDecimal("12.00"), RetryStatus.RETRY, "ctx");
		assertEquals(report, same);
		assertEquals(report.hashCode(), same.hashCode());
		assertNotEquals(report, new AttemptReport(2, failure, new BigDecimal("12"), RetryStatus.FAILURE, "ctx"));
		assertNotEquals(report, new AttemptReport(3, failure, new BigDecimal("12"), RetryStatus.RETRY, "ctx"));
		assertTrue(report.toString().contains("attempts=2"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testReportRejectsZeroAttempts() {
		new AttemptReport(0, null, BigDecimal.ZERO, RetryStatus.SUCCESS, null);
	}

	@Test
	public void testStopStrategyIsShared() {
		assertSame(RetryStrategies.stop(), RetryOptions.builder().build().getStrategy());
	}

}
