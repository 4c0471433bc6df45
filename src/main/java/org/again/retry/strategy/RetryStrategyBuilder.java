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

import org.springframework.util.Assert;

/**
 * Fluent composition of a {@link RetryStrategy}. Start from one of the generator methods,
 * then apply manipulators in the order they should wrap each other:
 *
 * <pre class="code">
 * RetryStrategy strategy = RetryStrategyBuilder.multiplicative(100, 2)
 * 		.randomize(0.2)
 * 		.clampDelay(5000)
 * 		.maxDuration(30000)
 * 		.build();
 * </pre>
 *
 * The builder is not thread-safe; the strategies it builds are.
 *
 * 重试策略构建器
 */
public class RetryStrategyBuilder {

	private RetryStrategy strategy;

	private RetryStrategyBuilder(RetryStrategy strategy) {
		this.strategy = strategy;
	}

	public static RetryStrategyBuilder from(RetryStrategy strategy) {
		Assert.notNull(strategy, "strategy must not be null");
		return new RetryStrategyBuilder(strategy);
	}

	public static RetryStrategyBuilder constant(long delay) {
		return from(RetryStrategies.constant(delay));
	}

	public static RetryStrategyBuilder immediate() {
		return from(RetryStrategies.immediate());
	}

	public static RetryStrategyBuilder additive(long initialDelay, long increment) {
		return from(RetryStrategies.additive(initialDelay, increment));
	}

	public static RetryStrategyBuilder multiplicative(long initialDelay, double multiplier) {
		return from(RetryStrategies.multiplicative(initialDelay, multiplier));
	}

	public RetryStrategyBuilder clampDelay(long maxDelay) {
		this.strategy = RetryStrategies.clampDelay(maxDelay, this.strategy);
		return this;
	}

	public RetryStrategyBuilder maxDelay(long maxDelay) {
		this.strategy = RetryStrategies.maxDelay(maxDelay, this.strategy);
		return this;
	}

	public RetryStrategyBuilder maxRetries(int maxRetries) {
		this.strategy = RetryStrategies.maxRetries(maxRetries, this.strategy);
		return this;
	}

	public RetryStrategyBuilder maxDuration(long timeout) {
		this.strategy = RetryStrategies.maxDuration(timeout, this.strategy);
		return this;
	}

	public RetryStrategyBuilder randomize(double factor) {
		this.strategy = RetryStrategies.randomize(factor, this.strategy);
		return this;
	}

	public RetryStrategy build() {
		return this.strategy;
	}

}
