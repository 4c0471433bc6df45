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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.again.retry.AttemptReport;
import org.again.retry.RetryDecision;

/**
 * Logs every attempt: successes and retries at debug level, the final failure at warn
 * level together with its exception.
 *
 * 日志监听器
 */
public class LoggingRetryListener extends StatusDispatchingRetryListener {

	private final Log logger;

	public LoggingRetryListener() {
		this(LogFactory.getLog(LoggingRetryListener.class));
	}

	public LoggingRetryListener(Log logger) {
		this.logger = logger;
	}

	@Override
	protected void onSuccess(AttemptReport report) {
		if (this.logger.isDebugEnabled()) {
			if (report.getAttempts() > 1) {
				this.logger.debug("Succeeded after " + report.getAttempts() + " attempts: " + report);
			}
			else {
				this.logger.debug("Succeeded on first attempt: " + report);
			}
		}
	}

	@Override
	protected RetryDecision onRetry(AttemptReport report) {
		if (this.logger.isDebugEnabled()) {
			this.logger.debug("Attempt " + report.getAttempts() + " failed, retrying: " + report);
		}
		return super.onRetry(report);
	}

	@Override
	protected void onFailure(AttemptReport report) {
		this.logger.warn("Giving up after " + report.getAttempts() + " attempts, slept "
				+ report.getSlept().toPlainString() + "ms", report.getException());
	}

}
