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

import org.again.retry.strategy.RetryStrategy;

/**
 * Defines the basic set of operations implemented by {@link RetryOperations} to execute
 * operations with configurable retry behaviour.
 *
 * 重试操作接口
 */
public interface RetryOperations {

	/**
	 * Execute the supplied {@link RetryCallback}, retrying after every failure for as
	 * long as the strategy has delays left. This is shorthand for
	 * {@code execute(RetryOptions.of(strategy), retryCallback)}.
	 * @param strategy the delays to wait between attempts
	 * @param retryCallback the operation
	 * @param <T> the return value
	 * @param <E> the exception thrown
	 * @return the value returned by the {@link RetryCallback} upon successful invocation.
	 * @throws E the failure of the last attempt, unchanged
	 */
	<T, E extends Throwable> T execute(RetryStrategy strategy, RetryCallback<T, E> retryCallback) throws E;

	/**
	 * Execute the supplied {@link RetryCallback} with the given options. Failures for which
	 * the exception predicate answers {@code false} are rethrown at once; others are
	 * retried until the strategy runs out or the listener forces a failure.
	 * @param options the strategy, listener, user context and exception predicate
	 * @param retryCallback the operation
	 * @param <T> the return value
	 * @param <E> the exception thrown
	 * @return the value returned by the {@link RetryCallback} upon successful invocation.
	 * @throws E the failure of the last attempt, unchanged
	 */
	<T, E extends Throwable> T execute(RetryOptions options, RetryCallback<T, E> retryCallback) throws E;

}
