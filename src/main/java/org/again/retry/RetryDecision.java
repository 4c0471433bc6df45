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
 * Value returned from {@link RetryListener#onAttempt(AttemptReport)}.
 *
 * 监听器的返回值
 */
public enum RetryDecision {

	/**
	 * Carry on as the strategy dictates.
	 */
	PROCEED,

	/**
	 * Abort the retry loop and rethrow the failure of the current attempt, ignoring any
	 * delays left in the strategy. Only honoured for {@link RetryStatus#RETRY} reports.
	 */
	FORCE_FAIL

}
