/*
 * Copyright 2020-2024 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.again.retry.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

/**
 * Spreads a delay over {@code [delay - delay * factor, delay + delay * factor]} and
 * rounds the result down to a whole number of milliseconds.
 * <p>
 * The draw is {@code min + random * (max - min + 1)}, truncated. The extra {@code 1} gives
 * every whole number between {@code min} and {@code max} (both included) the same chance,
 * e.g. a delay of {@code 1} with factor {@code 0.8} yields 0, 1 or 2.
 *
 * 随机化延迟
 */
public class DelayRandomizer {

	private final BigDecimal factor;

	@Nullable
	private final Random random;

	/**
	 * Randomizer drawing from {@link ThreadLocalRandom}.
	 * @param factor the randomization factor, strictly between 0 and 1
	 */
	public DelayRandomizer(double factor) {
		this(factor, null);
	}

	/**
	 * @param factor the randomization factor, strictly between 0 and 1
	 * @param random the source of randomness, or null for {@link ThreadLocalRandom}
	 */
	public DelayRandomizer(double factor, @Nullable Random random) {
		Assert.isTrue(factor > 0 && factor < 1, () -> "randomization factor must be in (0, 1): " + factor);
		this.factor = BigDecimal.valueOf(factor);
		this.random = random;
	}

	public BigDecimal getFactor() {
		return this.factor;
	}

	/**
	 * @param delay a non-negative delay
	 * @return a random whole delay in the spread around {@code delay}, never negative
	 */
	public BigDecimal randomize(BigDecimal delay) {
		Assert.isTrue(delay.signum() >= 0, () -> "delay must not be negative: " + delay);
		BigDecimal delta = delay.multiply(this.factor);
		BigDecimal min = delay.subtract(delta);
		BigDecimal max = delay.add(delta);
		BigDecimal span = max.subtract(min).add(BigDecimal.ONE);
		BigDecimal drawn = min.add(span.multiply(BigDecimal.valueOf(nextDouble())));
		return drawn.setScale(0, RoundingMode.DOWN);
	}

	private double nextDouble() {
		return (this.random != null ? this.random.nextDouble() : ThreadLocalRandom.current().nextDouble());
	}

}
