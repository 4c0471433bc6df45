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

package org.again.retry.listener;

import org.again.retry.AttemptReport;
import org.again.retry.RetryDecision;
import org.again.retry.RetryListener;

/**
 * {@link RetryListener} that dispatches on the status of the report. Subclasses override
 * the callbacks they are interested in; the defaults do nothing and let the retry go on.
 */
public abstract class StatusDispatchingRetryListener implements RetryListener {

	@Override
	public final RetryDecision onAttempt(AttemptReport report) {
		switch (report.getStatus()) {
		case SUCCESS:
			onSuccess(report);
			return RetryDecision.PROCEED;
		case RETRY:
			return onRetry(report);
		case FAILURE:
			onFailure(report);
			return RetryDecision.PROCEED;
		default:
			throw new IllegalStateException("Unknown retry status: " + report.getStatus());
		}
	}

	/**
	 * Called when an attempt succeeded.
	 * @param report the report of the successful attempt
	 */
	protected void onSuccess(AttemptReport report) {
	}

	/**
	 * Called when an attempt failed and another one is about to follow.
	 * @param report the report of the failed attempt
	 * @return {@link RetryDecision#FORCE_FAIL} to give up now
	 */
	protected RetryDecision onRetry(AttemptReport report) {
		return RetryDecision.PROCEED;
	}

	/**
	 * Called when the last attempt failed and the failure is about to be rethrown.
	 * @param report the report of the failed attempt
	 */
	protected void onFailure(AttemptReport report) {
	}

}
