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
 * Outcome of a single attempt as reported to a {@link RetryListener}.
 */
public enum RetryStatus {

	/**
	 * The operation returned normally. No further attempt follows.
	 */
	SUCCESS,

	/**
	 * The operation failed and will be attempted again after the next delay.
	 */
	RETRY,

	/**
	 * The operation failed and the strategy is exhausted. The failure is rethrown.
	 */
	FAILURE

}
