package org.again.retry.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DelayRandomizerTest {

	private static final double[] FACTORS = { 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9 };

	@Test
	public void testRandomizedDelayStaysWithinBounds() {
		Random random = new Random(42);
		for (double factor : FACTORS) {
			DelayRandomizer randomizer = new DelayRandomizer(factor, random);
			BigDecimal f = BigDecimal.valueOf(factor);
			for (long delay = 1; delay < 2000; delay += 3) {
				BigDecimal d = BigDecimal.valueOf(delay);
				BigDecimal min = d.multiply(BigDecimal.ONE.subtract(f)).setScale(0, RoundingMode.DOWN);
				BigDecimal max = d.multiply(BigDecimal.ONE.add(f)).add(BigDecimal.ONE).setScale(0, RoundingMode.DOWN);
				BigDecimal randomized = randomizer.randomize(d);
				assertTrue(randomized.signum() >= 0);
				assertTrue(randomized + " < " + min, randomized.compareTo(min) >= 0);
				assertTrue(randomized + " > " + max, randomized.compareTo(max) <= 0);
				assertEquals(0, randomized.scale());
			}
		}
	}

	@Test
	public void testEveryWholeValueInRangeCanBeDrawn() {
		DelayRandomizer randomizer = new DelayRandomizer(0.8, new Random(7));
		Set<BigDecimal> seen = new HashSet<>();
		for (int i = 0; i < 1000; i++) {
			seen.add(randomizer.randomize(BigDecimal.ONE));
		}
		Set<BigDecimal> expected = new HashSet<>();
		expected.add(BigDecimal.ZERO);
		expected.add(BigDecimal.ONE);
		expected.add(BigDecimal.valueOf(2));
		assertEquals(expected, seen);
	}

	@Test
	public void testExtremeDrawsHitTheEndsOfTheRange() {
		DelayRandomizer lowest = new DelayRandomizer(0.5, new FixedRandom(0.0));
		assertEquals(BigDecimal.valueOf(50), lowest.randomize(BigDecimal.valueOf(100)));

		DelayRandomizer highest = new DelayRandomizer(0.5, new FixedRandom(0.9999999));
		assertEquals(BigDecimal.valueOf(150), highest.randomize(BigDecimal.valueOf(100)));
	}

	@Test
	public void testZeroDelayStaysZero() {
		DelayRandomizer randomizer = new DelayRandomizer(0.5, new FixedRandom(0.9999999));
		assertEquals(BigDecimal.ZERO, randomizer.randomize(BigDecimal.ZERO));
	}

	@Test
	public void testRandomizedStrategy() {
		for (double factor : FACTORS) {
			RetryStrategy strategy = RetryStrategies.maxRetries(50,
					RetryStrategies.randomize(factor, RetryStrategies.constant(1000)));
			long min = (long) Math.floor(1000 * (1 - factor));
			long max = (long) Math.floor(1000 * (1 + factor) + 1);
			int count = 0;
			for (BigDecimal delay : strategy) {
				assertTrue(delay.longValue() >= min);
				assertTrue(delay.longValue() <= max);
				count++;
			}
			assertEquals(50, count);
		}
	}

	@Test
	public void testSingleDelayHelper() {
		BigDecimal delay = RetryStrategies.randomizeDelay(0.5, 10);
		assertTrue(delay.compareTo(BigDecimal.valueOf(5)) >= 0);
		assertTrue(delay.compareTo(BigDecimal.valueOf(15)) <= 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFactorOfZeroIsRejected() {
		new DelayRandomizer(0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFactorOfOneIsRejected() {
		RetryStrategies.randomize(1.0, RetryStrategies.immediate());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeFactorIsRejected() {
		RetryStrategies.randomize(-0.5, RetryStrategies.immediate());
	}

	@SuppressWarnings("serial")
	private static class FixedRandom extends Random {

		private final double value;

		FixedRandom(double value) {
			this.value = value;
		}

		@Override
		public double nextDouble() {
			return this.value;
		}

	}

}
