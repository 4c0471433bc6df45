package org.again.retry.listener;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import org.again.retry.AttemptReport;
import org.again.retry.RetryDecision;
import org.again.retry.RetryOptions;
import org.again.retry.RetryStatus;
import org.again.retry.backoff.DummySleeper;
import org.again.retry.strategy.RetryStrategy;
import org.again.retry.support.RetryExecutor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class StatusDispatchingRetryListenerTest {

	@Test
	public void testDispatchOnStatus() {
		RecordingListener listener = new RecordingListener();
		RuntimeException failure = new RuntimeException("planned");
		listener.onAttempt(new AttemptReport(1, failure, BigDecimal.ZERO, RetryStatus.RETRY, null));
		listener.onAttempt(new AttemptReport(2, failure, BigDecimal.ONE, RetryStatus.FAILURE, null));
		listener.onAttempt(new AttemptReport(3, null, BigDecimal.ONE, RetryStatus.SUCCESS, null));
		assertEquals(Arrays.asList("retry:1", "failure:2", "success:3"), listener.calls);
	}

	@Test
	public void testRetryCallbackCanForceFailure() {
		RecordingListener listener = new RecordingListener();
		listener.forceFail = true;
		RetryExecutor executor = new RetryExecutor();
		executor.setSleeper(new DummySleeper());
		AtomicInteger calls = new AtomicInteger();
		try {
			executor.execute(RetryOptions.builder().strategy(RetryStrategy.of(1, 1, 1)).listener(listener).build(),
					() -> {
						calls.incrementAndGet();
						throw new IllegalStateException("planned");
					});
			fail("Expected IllegalStateException");
		}
		catch (IllegalStateException e) {
			assertEquals("planned", e.getMessage());
		}
		assertEquals(1, calls.get());
		assertEquals(Arrays.asList("retry:1"), listener.calls);
	}

	@Test
	public void testLoggingListenerDoesNotInterfere() throws Exception {
		RetryExecutor executor = new RetryExecutor();
		executor.setSleeper(new DummySleeper());
		AtomicInteger calls = new AtomicInteger();
		String result = executor.execute(
				RetryOptions.builder().strategy(RetryStrategy.of(5, 5)).listener(new LoggingRetryListener()).build(),
				() -> {
					if (calls.incrementAndGet() < 3) {
						throw new IllegalStateException("planned");
					}
					return "done";
				});
		assertEquals("done", result);
		assertEquals(3, calls.get());
	}

	private static class RecordingListener extends StatusDispatchingRetryListener {

		private final List<String> calls = new ArrayList<>();

		private boolean forceFail;

		@Override
		protected void onSuccess(AttemptReport report) {
			this.calls.add("success:" + report.getAttempts());
		}

		@Override
		protected RetryDecision onRetry(AttemptReport report) {
			this.calls.add("retry:" + report.getAttempts());
			return (this.forceFail ? RetryDecision.FORCE_FAIL : RetryDecision.PROCEED);
		}

		@Override
		protected void onFailure(AttemptReport report) {
			this.calls.add("failure:" + report.getAttempts());
		}

	}

}
