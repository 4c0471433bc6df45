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

import java.math.BigDecimal;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;
import org.springframework.util.ObjectUtils;

/**
 * Immutable snapshot of a retry in progress, handed to a {@link RetryListener} after each
 * attempt. Two reports are equal when all of their fields are equal; delays are compared
 * numerically, so {@code 12} and {@code 12.0} are the same amount of sleep.
 *
 * 每次尝试后的报告
 */
public final class AttemptReport {

	private final int attempts;

	@Nullable
	private final Throwable exception;

	private final BigDecimal slept;

	private final RetryStatus status;

	@Nullable
	private final Object userContext;

	public AttemptReport(int attempts, @Nullable Throwable exception, BigDecimal slept, RetryStatus status,
			@Nullable Object userContext) {
		Assert.isTrue(attempts > 0, "attempts must be positive");
		Assert.notNull(slept, "slept must not be null");
		Assert.isTrue(slept.signum() >= 0, "slept must not be negative");
		Assert.notNull(status, "status must not be null");
		this.attempts = attempts;
		this.exception = exception;
		this.slept = slept;
		this.status = status;
		this.userContext = userContext;
	}

	/**
	 * @return the number of times the operation has been executed, starting at 1
	 */
	public int getAttempts() {
		return this.attempts;
	}

	/**
	 * @return the failure of the last attempt, or null if it succeeded
	 */
	@Nullable
	public Throwable getException() {
		return this.exception;
	}

	/**
	 * @return the sum of all the delays slept so far
	 */
	public BigDecimal getSlept() {
		return this.slept;
	}

	public RetryStatus getStatus() {
		return this.status;
	}

	/**
	 * @return the user context from the {@link RetryOptions}, passed through untouched
	 */
	@Nullable
	public Object getUserContext() {
		return this.userContext;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof AttemptReport)) {
			return false;
		}
		AttemptReport that = (AttemptReport) other;
		return this.attempts == that.attempts && this.status == that.status
				&& this.slept.compareTo(that.slept) == 0
				&& ObjectUtils.nullSafeEquals(this.exception, that.exception)
				&& ObjectUtils.nullSafeEquals(this.userContext, that.userContext);
	}

	@Override
	public int hashCode() {
		int result = this.attempts;
		result = 31 * result + this.status.hashCode();
		result = 31 * result + this.slept.stripTrailingZeros().hashCode();
		result = 31 * result + ObjectUtils.nullSafeHashCode(this.exception);
		result = 31 * result + ObjectUtils.nullSafeHashCode(this.userContext);
		return result;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder(getClass().getSimpleName());
		builder.append("[attempts=").append(this.attempts);
		builder.append(", status=").append(this.status);
		builder.append(", slept=").append(this.slept.toPlainString());
		if (this.exception != null) {
			builder.append(", exception=").append(this.exception);
		}
		if (this.userContext != null) {
			builder.append(", userContext=").append(this.userContext);
		}
		return builder.append("]").toString();
	}

}
