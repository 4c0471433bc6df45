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
import java.util.Collections;
import java.util.Iterator;

/**
 * Static factory methods for the built-in strategies and their combinators. Generators
 * ({@link #constant}, {@link #additive}, ...) are infinite unless stated otherwise, so
 * they are normally wrapped with at least one of the limiting methods:
 *
 * <pre class="code">
 * RetryStrategy strategy = RetryStrategies.maxRetries(5,
 * 		RetryStrategies.clampDelay(2000, RetryStrategies.multiplicative(100, 2)));
 * </pre>
 *
 * All methods validate their arguments eagerly and throw
 * {@link IllegalArgumentException} before any retry takes place.
 *
 * 重试策略工厂
 * @see RetryStrategyBuilder
 */
public abstract class RetryStrategies {

	private static final RetryStrategy STOP = new RetryStrategy() {

		@Override
		public Iterator<BigDecimal> iterator() {
			return Collections.emptyIterator();
		}

		@Override
		public String toString() {
			return "StopRetryStrategy";
		}

	};

	private RetryStrategies() {
	}

	/**
	 * @param delay the delay between retries
	 * @return an infinite strategy repeating {@code delay}
	 */
	public static RetryStrategy constant(long delay) {
		return new ConstantRetryStrategy(delay);
	}

	/**
	 * @return an infinite strategy retrying without delay
	 */
	public static RetryStrategy immediate() {
		return constant(0);
	}

	/**
	 * @param increment used both as the first delay and the step
	 * @return an infinite, linearly growing strategy
	 */
	public static RetryStrategy additive(long increment) {
		return new AdditiveRetryStrategy(increment);
	}

	/**
	 * @param initialDelay the first delay
	 * @param increment added to the delay after every retry
	 * @return an infinite, linearly growing strategy
	 */
	public static RetryStrategy additive(long initialDelay, long increment) {
		return new AdditiveRetryStrategy(initialDelay, increment);
	}

	/**
	 * @param initialDelay the first delay
	 * @param multiplier the factor applied to the delay after every retry
	 * @return an infinite, exponentially growing strategy
	 */
	public static RetryStrategy multiplicative(long initialDelay, double multiplier) {
		return new MultiplicativeRetryStrategy(initialDelay, multiplier);
	}

	/**
	 * @return the empty strategy: the operation is tried once and never retried
	 */
	public static RetryStrategy stop() {
		return STOP;
	}

	public static RetryStrategy clampDelay(long maxDelay, RetryStrategy strategy) {
		return new ClampDelayRetryStrategy(maxDelay, strategy);
	}

	public static RetryStrategy maxDelay(long maxDelay, RetryStrategy strategy) {
		return new MaxDelayRetryStrategy(maxDelay, strategy);
	}

	public static RetryStrategy maxRetries(int maxRetries, RetryStrategy strategy) {
		return new MaxRetriesRetryStrategy(maxRetries, strategy);
	}

	public static RetryStrategy maxDuration(long timeout, RetryStrategy strategy) {
		return new MaxDurationRetryStrategy(timeout, strategy);
	}

	/**
	 * @param factor the randomization factor, strictly between 0 and 1
	 * @param strategy the strategy to randomize
	 * @return a strategy whose delays are each spread by {@code +/- factor}
	 * @see DelayRandomizer
	 */
	public static RetryStrategy randomize(double factor, RetryStrategy strategy) {
		return new RandomizedRetryStrategy(factor, strategy);
	}

	/**
	 * Randomize a single delay.
	 * @param factor the randomization factor, strictly between 0 and 1
	 * @param delay the delay
	 * @return a whole delay in {@code [delay * (1 - factor), delay * (1 + factor)]}
	 */
	public static BigDecimal randomizeDelay(double factor, long delay) {
		return new DelayRandomizer(factor).randomize(Delays.nonNegative(delay, "delay"));
	}

}
