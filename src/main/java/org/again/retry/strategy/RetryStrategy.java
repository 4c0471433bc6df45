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
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A {@link RetryStrategy} is the schedule of a retry: the ordered, possibly infinite,
 * sequence of delays (conventionally in milliseconds) to wait before each retry. The
 * number of attempts an operation gets is the number of delays plus one, so an empty
 * strategy means "do not retry".
 * <p>
 * Strategies are stateless. Every call to {@link #iterator()} starts a new lazy traversal
 * of the same delays; only randomized strategies draw fresh values each time. Instances
 * can therefore be shared between threads and reused for any number of retries.
 *
 * 重试策略(延迟序列)
 * @see RetryStrategies
 * @see RetryStrategyBuilder
 */
public interface RetryStrategy extends Iterable<BigDecimal> {

	/**
	 * Start a new traversal of the delays. The returned iterator is not thread-safe and
	 * belongs to the caller.
	 * @return an iterator over the delays of this strategy
	 */
	@Override
	Iterator<BigDecimal> iterator();

	/**
	 * @return the delays as a sequential stream, possibly infinite
	 */
	default Stream<BigDecimal> stream() {
		return StreamSupport.stream(spliterator(), false);
	}

	/**
	 * Create a finite strategy from explicit delays.
	 * @param delays the delays, none negative
	 * @return a strategy over the given delays
	 */
	static RetryStrategy of(long... delays) {
		return new FixedDelaysRetryStrategy(delays);
	}

	/**
	 * Create a finite strategy from explicit delays.
	 * @param delays the delays, none null or negative
	 * @return a strategy over the given delays
	 */
	static RetryStrategy of(Iterable<? extends Number> delays) {
		return new FixedDelaysRetryStrategy(delays);
	}

}
