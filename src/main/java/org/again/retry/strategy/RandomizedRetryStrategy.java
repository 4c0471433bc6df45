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
 * Passes every delay of another strategy through a {@link DelayRandomizer}. Values are
 * drawn lazily, so each traversal sees different delays.
 *
 * 随机化延迟策略
 * @see RetryStrategies#randomize(double, RetryStrategy)
 */
public class RandomizedRetryStrategy implements RetryStrategy {

	private final DelayRandomizer randomizer;

	private final RetryStrategy delegate;

	public RandomizedRetryStrategy(double factor, RetryStrategy delegate) {
		this(new DelayRandomizer(factor), delegate);
	}

	public RandomizedRetryStrategy(DelayRandomizer randomizer, RetryStrategy delegate) {
		Assert.notNull(randomizer, "randomizer must not be null");
		Assert.notNull(delegate, "delegate strategy must not be null");
		this.randomizer = randomizer;
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
				return RandomizedRetryStrategy.this.randomizer.randomize(source.next());
			}

		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[factor=" + this.randomizer.getFactor() + ", delegate="
				+ this.delegate + "]";
	}

}
