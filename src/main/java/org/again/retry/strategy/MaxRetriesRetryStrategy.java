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
 * Keeps at most the first {@code maxRetries} delays of another strategy. A shorter
 * strategy is passed through unchanged.
 *
 * 限制重试次数
 * @see RetryStrategies#maxRetries(int, RetryStrategy)
 */
public class MaxRetriesRetryStrategy implements RetryStrategy {

	private final int maxRetries;

	private final RetryStrategy delegate;

	public MaxRetriesRetryStrategy(int maxRetries, RetryStrategy delegate) {
		Assert.isTrue(maxRetries >= 0, () -> "maxRetries must not be negative: " + maxRetries);
		Assert.notNull(delegate, "delegate strategy must not be null");
		this.maxRetries = maxRetries;
		this.delegate = delegate;
	}

	public int getMaxRetries() {
		return this.maxRetries;
	}

	@Override
	public Iterator<BigDecimal> iterator() {
		Iterator<BigDecimal> source = this.delegate.iterator();
		return new Iterator<BigDecimal>() {

			private int taken;

			@Override
			public boolean hasNext() {
				// 不在达到上限后再拉取源序列
				return this.taken < MaxRetriesRetryStrategy.this.maxRetries && source.hasNext();
			}

			@Override
			public BigDecimal next() {
				if (!hasNext()) {
					throw new NoSuchElementException();
				}
				this.taken++;
				return source.next();
			}

		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[maxRetries=" + this.maxRetries + ", delegate=" + this.delegate + "]";
	}

}
