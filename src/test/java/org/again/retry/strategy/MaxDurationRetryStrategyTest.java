package org.again.retry.strategy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MaxDurationRetryStrategyTest {

	private static List<BigDecimal> take(int n, RetryStrategy strategy) {
		List<BigDecimal> result = new ArrayList<>();
		Iterator<BigDecimal> iterator = strategy.iterator();
		while (result.size() < n && iterator.hasNext()) {
			result.add(iterator.next());
		}
		return result;
	}

	private static BigDecimal sum(List<BigDecimal> delays) {
		BigDecimal total = BigDecimal.ZERO;
		for (BigDecimal delay : delays) {
			total = total.add(delay);
		}
		return total;
	}

	@Test
	public void testConstantDelaysFillTheBudgetExactly() {
		for (int timeout = 1; timeout <= 200; timeout++) {
			List<BigDecimal> delays = take(2 * timeout,
					RetryStrategies.maxDuration(timeout, RetryStrategies.constant(1)));
			assertEquals(timeout, delays.size());
			assertEquals(BigDecimal.valueOf(timeout), sum(delays));
		}
	}

	@Test
	public void testShortStrategyIsNotPadded() {
		List<BigDecimal> delays = take(10, RetryStrategies.maxDuration(10000, RetryStrategy.of(0)));
		assertEquals(Collections.singletonList(BigDecimal.ZERO), delays);
	}

	@Test
	public void testDelayCrossingTheBudgetIsStillEmitted() {
		List<BigDecimal> delays = take(10, RetryStrategies.maxDuration(10, RetryStrategy.of(4, 4, 4, 4)));
		assertEquals(3, delays.size());
		assertEquals(BigDecimal.valueOf(12), sum(delays));

		delays = take(10, RetryStrategies.maxDuration(10, RetryStrategy.of(100, 1)));
		assertEquals(Collections.singletonList(BigDecimal.valueOf(100)), delays);
	}

	@Test
	public void testOvershootIsBoundedByLastDelay() {
		for (long timeout = 1; timeout < 500; timeout += 7) {
			List<BigDecimal> delays = take(1000,
					RetryStrategies.maxDuration(timeout, RetryStrategies.additive(1, 3)));
			BigDecimal total = sum(delays);
			BigDecimal last = delays.get(delays.size() - 1);
			assertTrue(total.subtract(last).compareTo(BigDecimal.valueOf(timeout)) < 0);
			assertTrue(total.compareTo(BigDecimal.valueOf(timeout).add(last)) <= 0);
		}
	}

	@Test
	public void testZeroTimeoutMeansNoRetries() {
		assertTrue(take(10, RetryStrategies.maxDuration(0, RetryStrategies.constant(5))).isEmpty());
	}

	@Test
	public void testZeroDelaysNeverExhaustTheBudget() {
		assertEquals(100, take(100, RetryStrategies.maxDuration(1, RetryStrategies.immediate())).size());
	}

}
