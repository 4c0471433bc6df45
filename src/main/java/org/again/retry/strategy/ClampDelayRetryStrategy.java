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

import org.springframework.util.Assert;

/**
 * Caps every delay of another strategy at a maximum. The length of the strategy is not
 * changed.
 *
 * 限制单次延迟上限
 * @see RetryStrategies#clampDelay(long, RetryStrategy)
 */
public class ClampDelayRetryStrategy implements RetryStrategy {

	private final BigDecimal maxDelay;

	private final RetryStrategy delegate;

	public ClampDelayRetryStrategy(Number maxDelay, RetryStrategy delegate) {
		Assert.notNull(delegate, "delegate strategy must not be null");
		this.maxDelay = Delays.nonNegative(maxDelay, "maxDelay");
		this.delegate = delegate;
	}

	@Override
	public Iterator<BigDecimal> iterator() {
		Iterator<BigDecimal> source = this.delegate.iterator();
		return new Iterator<BigDecimal>() {

			@Override
			public boolean hasNext() {
				return source.hasNext();
			}

			@Override
			public BigDecimal next() {
				return source.next().min(ClampDelayRetryStrategy.this.maxDelay);
			}

		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[maxDelay=" + this.maxDelay + ", delegate=" + this.delegate + "]";
	}

}
