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
import java.util.NoSuchElementException;

import org.springframework.util.Assert;

/**
 * Limits the total time slept by another strategy. A delay is emitted as long as some of
 * the budget is left, and each emitted delay is subtracted from it. The delay that
 * exhausts the budget is still emitted in full, so the sum of the delays can exceed the
 * timeout by at most that last delay. Delays are never shortened.
 * <p>
 * This approximates a wall-clock limit on the sleeping only; the time spent in the
 * operation itself is not counted.
 *
 * 限制总休眠时长
 * @see RetryStrategies#maxDuration(long, RetryStrategy)
 */
public class MaxDurationRetryStrategy implements RetryStrategy {

	private final BigDecimal timeout;

	private final RetryStrategy delegate;

	public MaxDurationRetryStrategy(Number timeout, RetryStrategy delegate) {
		Assert.notNull(delegate, "delegate strategy must not be null");
		this.timeout = Delays.nonNegative(timeout, "timeout");
		this.delegate = delegate;
	}

	public BigDecimal getTimeout() {
		return this.timeout;
	}

	@Override
	public Iterator<BigDecimal> iterator() {
		Iterator<BigDecimal> source = this.delegate.iterator();
		return new Iterator<BigDecimal>() {

			private BigDecimal remaining = MaxDurationRetryStrategy.this.timeout;

			@Override
			public boolean hasNext() {
				return this.remaining.signum() > 0 && source.hasNext();
			}

			@Override
			public BigDecimal next() {
				if (!hasNext()) {
					throw new NoSuchElementException();
				}
				BigDecimal delay = source.next();
				this.remaining = this.remaining.subtract(delay);
				return delay;
			}

		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[timeout=" + this.timeout + ", delegate=" + this.delegate + "]";
	}

}
