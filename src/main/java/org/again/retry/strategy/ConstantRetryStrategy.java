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
 * Infinite strategy that waits the same delay before every retry.
 *
 * 固定延迟策略
 * @see RetryStrategies#constant(long)
 */
public class ConstantRetryStrategy implements RetryStrategy {

	private final BigDecimal delay;

	public ConstantRetryStrategy(Number delay) {
		this.delay = Delays.nonNegative(delay, "delay");
	}

	public BigDecimal getDelay() {
		return this.delay;
	}

	@Override
	public Iterator<BigDecimal> iterator() {
		return new Iterator<BigDecimal>() {

			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public BigDecimal next() {
				return ConstantRetryStrategy.this.delay;
			}

		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[delay=" + this.delay + "]";
	}

}
