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

/**
 * Interface for listener that can be used to add behaviour to a retry. Implementations
 * of {@link RetryOperations} call the listener exactly once after every attempt, with a
 * report describing its outcome.
 * <p>
 * Listeners run synchronously on the calling thread. An exception thrown by a listener
 * ends the retry and is propagated to the caller as is.
 *
 * 重试监听器
 */
@FunctionalInterface
public interface RetryListener {

	/**
	 * Listener that does nothing and never aborts.
	 */
	RetryListener NO_OP = report -> RetryDecision.PROCEED;

	/**
	 * Called after every attempt.
	 * @param report the outcome of the attempt that has just finished
	 * @return {@link RetryDecision#FORCE_FAIL} to stop retrying and rethrow the current
	 * failure, anything else (including {@code null}) to carry on
	 */
	RetryDecision onAttempt(AttemptReport report);

}
