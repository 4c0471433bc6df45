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
 * Thrown when the thread is interrupted while sleeping between two attempts. The
 * interrupt flag of the thread is set again before this is thrown, and the failure of
 * the attempt that preceded the sleep is attached as a suppressed exception.
 *
 * 休眠被中断
 */
@SuppressWarnings("serial")
public class RetryInterruptedException extends RetryException {

	public RetryInterruptedException(String msg, Throwable cause) {
		super(msg, cause);
	}

}
