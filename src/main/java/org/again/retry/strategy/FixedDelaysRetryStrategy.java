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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.springframework.util.Assert;

/**
 * Finite strategy over an explicit list of delays, copied at construction. An empty list
 * is the "no retries" strategy.
 *
 * 显式延迟列表策略
 */
public class FixedDelaysRetryStrategy implements RetryStrategy {

	private final List<BigDecimal> delays;

	public FixedDelaysRetryStrategy(long... delays) {
		Assert.notNull(delays, "delays must not be null");
		List<BigDecimal> list = new ArrayList<>(delays.length);
		for (long delay : delays) {
			list.add(Delays.nonNegative(delay, "delay"));
		}
		this.delays = Collections.unmodifiableList(list);
	}

	public FixedDelaysRetryStrategy(Iterable<? extends Number> delays) {
		Assert.notNull(delays, "delays must not be null");
		List<BigDecimal> list = new ArrayList<>();
		for (Number delay : delays) {
			list.add(Delays.nonNegative(delay, "delay"));
		}
		this.delays = Collections.unmodifiableList(list);
	}

	/**
	 * @return the delays, unmodifiable
	 */
	public List<BigDecimal> getDelays() {
		return this.delays;
	}

	@Override
	public Iterator<BigDecimal> iterator() {
		return this.delays.iterator();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + this.delays;
	}

}
