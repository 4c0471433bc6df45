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

import java.util.Arrays;

import org.again.retry.AttemptReport;
import org.again.retry.RetryDecision;
import org.again.retry.RetryListener;

import org.springframework.util.Assert;

/**
 * A {@link RetryListener} that composes a list of other listeners and delegates calls to
 * them in order. Every listener sees every report; the retry is forced to fail if any of
 * them asks for it.
 *
 * 组合监听器
 */
public class CompositeRetryListener implements RetryListener {

	private volatile RetryListener[] listeners = new RetryListener[0];

	public CompositeRetryListener() {
	}

	public CompositeRetryListener(RetryListener... listeners) {
		setListeners(listeners);
	}

	/**
	 * Setter for listeners.
	 * @param listeners the {@link RetryListener}s
	 */
	public void setListeners(RetryListener[] listeners) {
		Assert.notNull(listeners, "listeners must not be null");
		Assert.noNullElements(listeners, "listeners must not contain null elements");
		this.listeners = Arrays.copyOf(listeners, listeners.length);
	}

	/**
	 * Register an additional listener at the end of the list.
	 * @param listener the {@link RetryListener}
	 */
	public void registerListener(RetryListener listener) {
		Assert.notNull(listener, "listener must not be null");
		RetryListener[] current = this.listeners;
		RetryListener[] updated = Arrays.copyOf(current, current.length + 1);
		updated[current.length] = listener;
		this.listeners = updated;
	}

	/**
	 * Return true if at least one listener is registered.
	 * @return true if listeners present.
	 */
	public boolean hasListeners() {
		return this.listeners.length > 0;
	}

	@Override
	public RetryDecision onAttempt(AttemptReport report) {
		// 任意一个监听器要求失败则失败，但所有监听器都会被调用
		boolean forceFail = false;
		for (RetryListener listener : this.listeners) {
			if (listener.onAttempt(report) == RetryDecision.FORCE_FAIL) {
				forceFail = true;
			}
		}
		return (forceFail ? RetryDecision.FORCE_FAIL : RetryDecision.PROCEED);
	}

}
