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
 * Infinite strategy with exponentially growing delays: each delay is the previous one
 * times the multiplier. Arithmetic is exact, so a multiplier of {@code 1.1} does not
 * drift however many delays are drawn.
 *
 * 指数递增延迟策略
 * @see RetryStrategies#multiplicative(long, double)
 */
public class MultiplicativeRetryStrategy implements RetryStrategy {

	private final BigDecimal initialDelay;

	private final BigDecimal multiplier;

	public MultiplicativeRetryStrategy(Number initialDelay, Number multiplier) {
		this.initialDelay = Delays.nonNegative(initialDelay, "initialDelay");
		this.multiplier = Delays.nonNegative(multiplier, "multiplier");
	}

	public BigDecimal getInitialDelay() {
		return this.initialDelay;
	}

	public BigDecimal getMultiplier() {
		return this.multiplier;
	}

	@Override
	public Iterator<BigDecimal> iterator() {
		return new Iterator<BigDecimal>() {

			private BigDecimal next = MultiplicativeRetryStrategy.this.initialDelay;

			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public BigDecimal next() {
				BigDecimal current = this.next;
				this.next = current.multiply(MultiplicativeRetryStrategy.this.multiplier);
				return current;
			}

		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[initialDelay=" + this.initialDelay + ", multiplier="
				+ this.multiplier + "]";
	}

}
