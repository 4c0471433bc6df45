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
 * Stops another strategy at its first delay that is greater than or equal to a maximum.
 * That delay and everything after it are dropped, so all remaining delays are strictly
 * less than the maximum.
 *
 * 延迟达到上限即停止重试
 * @see RetryStrategies#maxDelay(long, RetryStrategy)
 */
public class MaxDelayRetryStrategy implements RetryStrategy {

	private final BigDecimal maxDelay;

	private final RetryStrategy delegate;

	public MaxDelayRetryStrategy(Number maxDelay, RetryStrategy delegate) {
		Assert.notNull(delegate, "delegate strategy must not be null");
		this.maxDelay = Delays.nonNegative(maxDelay, "maxDelay");
		this.delegate = delegate;
	}

	@Override
	public Iterator<BigDecimal> iterator() {
		Iterator<BigDecimal> source = this.delegate.iterator();
		return new Iterator<BigDecimal>() {

			private BigDecimal lookahead;

			private boolean done;

			@Override
			public boolean hasNext() {
				if (this.lookahead != null) {
					return true;
				}
				if (this.done || !source.hasNext()) {
					this.done = true;
					return false;
				}
				BigDecimal candidate = source.next();
				if (candidate.compareTo(MaxDelayRetryStrategy.this.maxDelay) >= 0) {
					this.done = true;
					return false;
				}
				this.lookahead = candidate;
				return true;
			}

			@Override
			public BigDecimal next() {
				if (!hasNext()) {
					throw new NoSuchElementException();
				}
				BigDecimal current = this.lookahead;
				this.lookahead = null;
				return current;
			}

		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[maxDelay=" + this.maxDelay + ", delegate=" + this.delegate + "]";
	}

}
