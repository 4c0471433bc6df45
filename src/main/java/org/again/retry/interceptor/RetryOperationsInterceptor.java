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

package org.again.retry.interceptor;

import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;

import org.again.retry.RetryOperations;
import org.again.retry.RetryOptions;
import org.again.retry.support.RetryExecutor;

import org.springframework.aop.ProxyMethodInvocation;
import org.springframework.util.Assert;

/**
 * A {@link MethodInterceptor} that can be used to automatically retry calls to a method
 * on a service if it fails. Each attempt proceeds on a fresh clone of the
 * {@link MethodInvocation}, so the rest of the interceptor chain runs again on every
 * attempt.
 * <p>
 * The {@link RetryOptions} control the number of retries. The default options have an
 * empty strategy, so the method is called once until {@link #setOptions} is used. The
 * attempts themselves are run by the injected {@link RetryOperations}, a plain
 * {@link RetryExecutor} unless set.
 *
 * 方法重试拦截器
 */
public class RetryOperationsInterceptor implements MethodInterceptor {

	private RetryOperations retryOperations = new RetryExecutor();

	private RetryOptions options = RetryOptions.builder().build();

	private String label;

	public void setRetryOperations(RetryOperations retryOperations) {
		Assert.notNull(retryOperations, "'retryOperations' cannot be null.");
		this.retryOperations = retryOperations;
	}

	public void setOptions(RetryOptions options) {
		Assert.notNull(options, "'options' cannot be null.");
		this.options = options;
	}

	/**
	 * @param label a label used in logs and error messages, defaults to the method
	 * signature
	 */
	public void setLabel(String label) {
		this.label = label;
	}

	public RetryOptions getOptions() {
		return this.options;
	}

	@Override
	public Object invoke(final MethodInvocation invocation) throws Throwable {
		if (!(invocation instanceof ProxyMethodInvocation)) {
			throw new IllegalStateException(
					"MethodInvocation of the wrong type detected - this should not happen with Spring AOP, "
							+ "so please raise an issue if you see this exception for "
							+ (this.label != null ? this.label : invocation.getMethod().toGenericString()));
		}
		final ProxyMethodInvocation proxyInvocation = (ProxyMethodInvocation) invocation;
		return this.retryOperations.execute(this.options, () -> {
			// 每次尝试都克隆调用，使拦截器链重新执行
			return proxyInvocation.invocableClone().proceed();
		});
	}

}
