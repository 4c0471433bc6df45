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
import java.util.Iterator;

/**
 * Infinite strategy whose delay grows by a fixed increment after each retry:
 * {@code initialDelay, initialDelay + increment, initialDelay + 2 * increment, ...}.
 *
 * 线性递增延迟策略
 * @see RetryStrategies#additive(long, long)
 */
public class AdditiveRetryStrategy implements RetryStrategy {

	private final BigDecimal initialDelay;

	private final BigDecimal increment;

	/**
	 * Use the increment as the initial delay too.
	 * @param increment the delay added after each retry
	 */
	public AdditiveRetryStrategy(Number increment) {
		this(increment, increment);
	}

	public AdditiveRetryStrategy(Number initialDelay, Number increment) {
		this.initialDelay = Delays.nonNegative(initialDelay, "initialDelay");
		this.increment = Delays.nonNegative(increment, "increment");
	}

	public BigDecimal getInitialDelay() {
		return this.initialDelay;
	}

	public BigDecimal getIncrement() {
		return this.increment;
	}

	@Override
	public Iterator<BigDecimal> iterator() {
		return new Iterator<BigDecimal>() {

			private BigDecimal next = AdditiveRetryStrategy.this.initialDelay;

			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public BigDecimal next() {
				BigDecimal current = this.next;
				this.next = current.add(AdditiveRetryStrategy.this.increment);
				return current;
			}

		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[initialDelay=" + this.initialDelay + ", increment=" + this.increment
				+ "]";
	}

}
