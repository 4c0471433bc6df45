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

package org.again.retry.support;

import java.math.BigDecimal;
import java.util.Iterator;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.again.retry.AttemptReport;
import org.again.retry.RetryCallback;
import org.again.retry.RetryDecision;
import org.again.retry.RetryInterruptedException;
import org.again.retry.RetryListener;
import org.again.retry.RetryOperations;
import org.again.retry.RetryOptions;
import org.again.retry.RetryStatus;
import org.again.retry.backoff.Sleeper;
import org.again.retry.backoff.ThreadWaitSleeper;
import org.again.retry.strategy.Delays;
import org.again.retry.strategy.RetryStrategy;

import org.springframework.util.Assert;

/**
 * Executes operations with retry semantics, following a {@link RetryStrategy}.
 * <p>
 * Each call walks a fresh traversal of the strategy. After every failure the exception
 * predicate of the {@link RetryOptions} is consulted first; a failure it rejects is
 * rethrown at once, without telling the listener. Otherwise the next delay is taken from
 * the strategy: if there is one, the listener sees a {@link RetryStatus#RETRY} report,
 * the calling thread sleeps for the delay and the operation runs again; if there is none,
 * the listener sees a {@link RetryStatus#FAILURE} report and the failure is rethrown. A
 * successful attempt is reported as {@link RetryStatus#SUCCESS} and its value returned.
 * The listener can cut a retry short by answering {@link RetryDecision#FORCE_FAIL}.
 * <p>
 * Failures are always rethrown as they were thrown by the operation. {@link Error}s are
 * not retried: they propagate straight away.
 * <p>
 * This class is thread-safe. Retry state lives on the stack of the calling thread, so
 * concurrent executions are independent of each other.
 *
 * 重试执行器
 */
public class RetryExecutor implements RetryOperations {

	protected final Log logger = LogFactory.getLog(getClass());

	/**
	 * 暂停接口，默认阻塞当前线程
	 */
	private volatile Sleeper sleeper = new ThreadWaitSleeper();

	/**
	 * Public setter for the {@link Sleeper} strategy.
	 * @param sleeper the sleeper to set, defaults to {@link ThreadWaitSleeper}.
	 */
	public void setSleeper(Sleeper sleeper) {
		Assert.notNull(sleeper, "sleeper must not be null");
		this.sleeper = sleeper;
	}

	@Override
	public final <T, E extends Throwable> T execute(RetryStrategy strategy, RetryCallback<T, E> retryCallback)
			throws E {
		return execute(RetryOptions.of(strategy), retryCallback);
	}

	@Override
	public final <T, E extends Throwable> T execute(RetryOptions options, RetryCallback<T, E> retryCallback)
			throws E {
		Assert.notNull(options, "options must not be null");
		Assert.notNull(retryCallback, "retryCallback must not be null");
		return doExecute(options, retryCallback);
	}

	/**
	 * Run the attempt loop.
	 * @param options the options of this retry
	 * @param retryCallback the operation
	 * @param <T> the type of the return value
	 * @param <E> the exception type to throw
	 * @return the value of the first successful attempt
	 * @throws E the failure that ended the retry
	 */
	protected <T, E extends Throwable> T doExecute(RetryOptions options, RetryCallback<T, E> retryCallback)
			throws E {

		Iterator<BigDecimal> delays = options.getStrategy().iterator();
		RetryListener listener = options.getListener();
		Object userContext = options.getUserContext();

		if (this.logger.isTraceEnabled()) {
			this.logger.trace("Starting retry with " + options);
		}

		int attempts = 1;
		BigDecimal slept = BigDecimal.ZERO;

		while (true) {
			T result;
			try {
				if (this.logger.isDebugEnabled()) {
					this.logger.debug("Retry: count=" + attempts);
				}
				result = retryCallback.doWithRetry();
			}
			catch (Throwable e) {
				if (e instanceof Error) {
					throw (Error) e;
				}

				// 不可重试的异常直接抛出，不通知监听器
				if (!canRetry(options, e)) {
					if (this.logger.isDebugEnabled()) {
						this.logger.debug("Not retrying non-retryable failure: count=" + attempts);
					}
					throw RetryExecutor.<E>rethrow(e);
				}

				// 策略已耗尽
				if (!delays.hasNext()) {
					notifyListener(listener, new AttemptReport(attempts, e, slept, RetryStatus.FAILURE, userContext));
					if (this.logger.isDebugEnabled()) {
						this.logger.debug("Retry failed last attempt: count=" + attempts);
					}
					throw RetryExecutor.<E>rethrow(e);
				}

				BigDecimal delay = delays.next();
				RetryDecision decision = notifyListener(listener,
						new AttemptReport(attempts, e, slept, RetryStatus.RETRY, userContext));
				if (decision == RetryDecision.FORCE_FAIL) {
					if (this.logger.isDebugEnabled()) {
						this.logger.debug("Retry aborted by listener: count=" + attempts);
					}
					throw RetryExecutor.<E>rethrow(e);
				}

				backOff(delay, e);
				attempts++;
				slept = slept.add(delay);
				continue;
			}

			notifyListener(listener, new AttemptReport(attempts, null, slept, RetryStatus.SUCCESS, userContext));
			return result;
		}
	}

	/**
	 * Decide whether a failure may be retried at all. Called before the strategy is
	 * consulted.
	 * @param options the options of this retry
	 * @param throwable the failure of the last attempt
	 * @return true if the failure is retryable
	 */
	protected boolean canRetry(RetryOptions options, Throwable throwable) {
		return options.getExceptionPredicate().test(throwable);
	}

	/**
	 * Block the calling thread for the given delay.
	 * @param delay the delay taken from the strategy
	 * @param lastFailure the failure that caused the retry
	 * @throws RetryInterruptedException if the thread is interrupted while sleeping
	 */
	protected void backOff(BigDecimal delay, Throwable lastFailure) {
		long millis = Delays.toMillis(delay);
		if (this.logger.isDebugEnabled()) {
			this.logger.debug("Sleeping for " + millis + "ms before next attempt");
		}
		try {
			this.sleeper.sleep(millis);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			RetryInterruptedException interrupted = new RetryInterruptedException(
					"Thread interrupted while sleeping before next attempt", ex);
			interrupted.addSuppressed(lastFailure);
			throw interrupted;
		}
	}

	private RetryDecision notifyListener(RetryListener listener, AttemptReport report) {
		RetryDecision decision = listener.onAttempt(report);
		return (decision != null ? decision : RetryDecision.PROCEED);
	}

	@SuppressWarnings("unchecked")
	private static <E extends Throwable> E rethrow(Throwable throwable) {
		return (E) throwable;
	}

}
