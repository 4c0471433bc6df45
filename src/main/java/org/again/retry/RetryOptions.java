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

package org.again.retry;

import java.util.function.Predicate;

import org.again.retry.classify.BinaryExceptionPredicate;
import org.again.retry.strategy.RetryStrategies;
import org.again.retry.strategy.RetryStrategy;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

/**
 * Immutable configuration of a single retry: the strategy to follow, the listener to
 * notify after each attempt, an opaque user context handed to that listener, and the
 * predicate deciding which failures may be retried.
 * <p>
 * A new instance is created via {@link #builder()}, e.g. <pre> {@code
 * RetryOptions.builder()
 *         .strategy(RetryStrategies.maxRetries(3, RetryStrategies.constant(100)))
 *         .listener(report -> RetryDecision.PROCEED)
 *         .retryOn(IOException.class)
 *         .build();
 * }</pre>
 *
 * 重试配置
 */
public final class RetryOptions {

	private static final Predicate<Throwable> ALWAYS = throwable -> true;

	private final RetryStrategy strategy;

	private final RetryListener listener;

	@Nullable
	private final Object userContext;

	private final Predicate<? super Throwable> exceptionPredicate;

	private RetryOptions(Builder builder) {
		this.strategy = builder.strategy;
		this.listener = builder.listener;
		this.userContext = builder.userContext;
		this.exceptionPredicate = builder.exceptionPredicate;
	}

	/**
	 * Options with the given strategy and everything else left at its default.
	 * @param strategy the strategy
	 * @return new options
	 */
	public static RetryOptions of(RetryStrategy strategy) {
		return builder().strategy(strategy).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the strategy, {@link RetryStrategies#stop()} unless set
	 */
	public RetryStrategy getStrategy() {
		return this.strategy;
	}

	/**
	 * @return the listener, {@link RetryListener#NO_OP} unless set
	 */
	public RetryListener getListener() {
		return this.listener;
	}

	@Nullable
	public Object getUserContext() {
		return this.userContext;
	}

	public Predicate<? super Throwable> getExceptionPredicate() {
		return this.exceptionPredicate;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[strategy=" + this.strategy + ", listener=" + this.listener
				+ ", userContext=" + this.userContext + ", exceptionPredicate=" + this.exceptionPredicate + "]";
	}

	/**
	 * Builder for {@link RetryOptions}. Not thread-safe.
	 */
	public static final class Builder {

		private RetryStrategy strategy = RetryStrategies.stop();

		private RetryListener listener = RetryListener.NO_OP;

		@Nullable
		private Object userContext;

		private Predicate<? super Throwable> exceptionPredicate = ALWAYS;

		private Builder() {
		}

		public Builder strategy(RetryStrategy strategy) {
			Assert.notNull(strategy, "strategy must not be null");
			this.strategy = strategy;
			return this;
		}

		public Builder listener(RetryListener listener) {
			Assert.notNull(listener, "listener must not be null");
			this.listener = listener;
			return this;
		}

		/**
		 * @param userContext any object, handed to the listener with every report; the
		 * retry never reads or changes it
		 * @return this builder
		 */
		public Builder userContext(@Nullable Object userContext) {
			this.userContext = userContext;
			return this;
		}

		public Builder exceptionPredicate(Predicate<? super Throwable> exceptionPredicate) {
			Assert.notNull(exceptionPredicate, "exceptionPredicate must not be null");
			this.exceptionPredicate = exceptionPredicate;
			return this;
		}

		/**
		 * Retry only the given exception types (and their subclasses).
		 * @param types retryable types
		 * @return this builder
		 */
		@SafeVarargs
		public final Builder retryOn(Class<? extends Throwable>... types) {
			Assert.notEmpty(types, "at least one exception type is required");
			return exceptionPredicate(BinaryExceptionPredicate.of(types, noTypes()));
		}

		/**
		 * Retry everything except the given exception types (and their subclasses).
		 * @param types non-retryable types
		 * @return this builder
		 */
		@SafeVarargs
		public final Builder notRetryOn(Class<? extends Throwable>... types) {
			Assert.notEmpty(types, "at least one exception type is required");
			return exceptionPredicate(BinaryExceptionPredicate.of(noTypes(), types));
		}

		public RetryOptions build() {
			return new RetryOptions(this);
		}

		@SuppressWarnings("unchecked")
		private static Class<? extends Throwable>[] noTypes() {
			return (Class<? extends Throwable>[]) new Class<?>[0];
		}

	}

}
