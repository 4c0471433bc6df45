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

package org.again.retry.annotation;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.again.retry.RetryListener;
import org.again.retry.RetryOptions;
import org.again.retry.backoff.Sleeper;
import org.again.retry.classify.BinaryExceptionPredicate;
import org.again.retry.interceptor.RetryOperationsInterceptor;
import org.again.retry.listener.CompositeRetryListener;
import org.again.retry.strategy.RetryStrategy;
import org.again.retry.strategy.RetryStrategyBuilder;
import org.again.retry.support.RetryExecutor;

import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.BeanFactoryAware;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.expression.BeanFactoryResolver;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.expression.common.TemplateParserContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.util.ConcurrentReferenceHashMap;
import org.springframework.util.StringUtils;

/**
 * Interceptor that parses the retry metadata on the method it is invoking and delegates to an
 * appropriate {@link RetryOperationsInterceptor}. Delegates are built once per target and
 * method and cached.
 *
 * 基于注解的重试拦截器
 */
public class AnnotationAwareRetryOperationsInterceptor implements MethodInterceptor, BeanFactoryAware {

	private static final Log logger = LogFactory.getLog(AnnotationAwareRetryOperationsInterceptor.class);

	/**
	 * 模板解析上下文
	 */
	private static final TemplateParserContext PARSER_CONTEXT = new TemplateParserContext();

	/**
	 * Spring EL表达式解析器
	 */
	private static final SpelExpressionParser PARSER = new SpelExpressionParser();

	/**
	 * 无注解方法的占位拦截器
	 */
	private static final MethodInterceptor NULL_INTERCEPTOR = new MethodInterceptor() {
		@Override
		public Object invoke(MethodInvocation methodInvocation) throws Throwable {
			throw new UnsupportedOperationException("Not supported");
		}
	};

	private final StandardEvaluationContext evaluationContext = new StandardEvaluationContext();

	/**
	 * 对象-> 方法和方法拦截器的映射
	 */
	private final ConcurrentReferenceHashMap<Object, ConcurrentMap<Method, MethodInterceptor>> delegates = new ConcurrentReferenceHashMap<Object, ConcurrentMap<Method, MethodInterceptor>>();

	private Sleeper sleeper;

	private BeanFactory beanFactory;

	/**
	 * 全局监听器
	 */
	private RetryListener[] globalListeners;

	/**
	 * @param sleeper the sleeper to set
	 */
	public void setSleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
	}

	/**
	 * Default retry listeners to apply to all operations.
	 * @param globalListeners the default listeners
	 */
	public void setListeners(Collection<RetryListener> globalListeners) {
		ArrayList<RetryListener> retryListeners = new ArrayList<RetryListener>(globalListeners);
		AnnotationAwareOrderComparator.sort(retryListeners);
		this.globalListeners = retryListeners.toArray(new RetryListener[0]);
	}

	@Override
	public void setBeanFactory(BeanFactory beanFactory) throws BeansException {
		this.beanFactory = beanFactory;
		this.evaluationContext.setBeanResolver(new BeanFactoryResolver(beanFactory));
	}

	@Override
	public Object invoke(MethodInvocation invocation) throws Throwable {
		MethodInterceptor delegate = getDelegate(invocation.getThis(), invocation.getMethod());
		if (delegate != null) {
			return delegate.invoke(invocation);
		}
		else {
			return invocation.proceed();
		}
	}

	private MethodInterceptor getDelegate(Object target, Method method) {
		ConcurrentMap<Method, MethodInterceptor> cachedMethods = this.delegates.get(target);
		if (cachedMethods == null) {
			cachedMethods = new ConcurrentHashMap<Method, MethodInterceptor>();
		}
		MethodInterceptor delegate = cachedMethods.get(method);
		if (delegate == null) {
			MethodInterceptor interceptor = NULL_INTERCEPTOR;
			// 方法上的注解优先，其次是声明类，最后是目标对象
			Retryable retryable = AnnotatedElementUtils.findMergedAnnotation(method, Retryable.class);
			if (retryable == null) {
				retryable = AnnotatedElementUtils.findMergedAnnotation(method.getDeclaringClass(), Retryable.class);
			}
			if (retryable == null) {
				retryable = findAnnotationOnTarget(target, method, Retryable.class);
			}
			if (retryable != null) {
				interceptor = getStatelessInterceptor(method, retryable);
			}
			cachedMethods.putIfAbsent(method, interceptor);
			delegate = cachedMethods.get(method);
		}
		this.delegates.putIfAbsent(target, cachedMethods);
		return delegate == NULL_INTERCEPTOR ? null : delegate;
	}

	private <A extends Annotation> A findAnnotationOnTarget(Object target, Method method, Class<A> annotation) {
		if (target == null) {
			return null;
		}
		try {
			Method targetMethod = target.getClass().getMethod(method.getName(), method.getParameterTypes());
			A retryable = AnnotatedElementUtils.findMergedAnnotation(targetMethod, annotation);
			if (retryable == null) {
				retryable = AnnotatedElementUtils.findMergedAnnotation(targetMethod.getDeclaringClass(), annotation);
			}
			return retryable;
		}
		catch (NoSuchMethodException ex) {
			return null;
		}
	}

	private MethodInterceptor getStatelessInterceptor(Method method, Retryable retryable) {
		RetryExecutor executor = new RetryExecutor();
		if (this.sleeper != null) {
			executor.setSleeper(this.sleeper);
		}
		RetryOptions.Builder options = RetryOptions.builder()
				.strategy(getStrategy(retryable))
				.exceptionPredicate(BinaryExceptionPredicate.of(retryable.include(), retryable.exclude()));
		RetryListener listener = getListener(retryable.listeners());
		if (listener != null) {
			options.listener(listener);
		}
		String label = retryable.label();
		if (!StringUtils.hasText(label)) {
			label = method.toGenericString();
		}
		RetryOperationsInterceptor interceptor = new RetryOperationsInterceptor();
		interceptor.setRetryOperations(executor);
		interceptor.setOptions(options.build());
		interceptor.setLabel(label);
		if (logger.isDebugEnabled()) {
			logger.debug("Retrying " + label + " with " + interceptor.getOptions());
		}
		return interceptor;
	}

	private RetryListener getListener(String[] listenersBeanNames) {
		RetryListener[] listeners = this.globalListeners;
		if (listenersBeanNames.length > 0) {
			listeners = new RetryListener[listenersBeanNames.length];
			for (int i = 0; i < listeners.length; i++) {
				listeners[i] = this.beanFactory.getBean(listenersBeanNames[i], RetryListener.class);
			}
		}
		if (listeners == null || listeners.length == 0) {
			return null;
		}
		return (listeners.length == 1 ? listeners[0] : new CompositeRetryListener(listeners));
	}

	/**
	 * @param retryable the annotation
	 * @return the strategy bean, or a strategy built from the attributes
	 * @see Retryable
	 */
	private RetryStrategy getStrategy(Retryable retryable) {
		if (StringUtils.hasText(retryable.strategy())) {
			return this.beanFactory.getBean(retryable.strategy(), RetryStrategy.class);
		}
		long delay = retryable.delay();
		if (StringUtils.hasText(retryable.delayExpression())) {
			Long value = PARSER.parseExpression(resolve(retryable.delayExpression()), PARSER_CONTEXT)
					.getValue(this.evaluationContext, Long.class);
			if (value != null) {
				delay = value;
			}
		}
		int maxRetries = retryable.maxRetries();
		if (StringUtils.hasText(retryable.maxRetriesExpression())) {
			Integer value = PARSER.parseExpression(resolve(retryable.maxRetriesExpression()), PARSER_CONTEXT)
					.getValue(this.evaluationContext, Integer.class);
			if (value != null) {
				maxRetries = value;
			}
		}

		RetryStrategyBuilder builder;
		if (retryable.multiplier() > 0) {
			builder = RetryStrategyBuilder.multiplicative(delay, retryable.multiplier());
		}
		else if (retryable.increment() > 0) {
			builder = RetryStrategyBuilder.additive(delay, retryable.increment());
		}
		else {
			builder = RetryStrategyBuilder.constant(delay);
		}
		if (retryable.randomFactor() > 0) {
			builder.randomize(retryable.randomFactor());
		}
		if (retryable.clampDelay() > 0) {
			builder.clampDelay(retryable.clampDelay());
		}
		if (retryable.maxDelay() > 0) {
			builder.maxDelay(retryable.maxDelay());
		}
		if (retryable.maxDuration() > 0) {
			builder.maxDuration(retryable.maxDuration());
		}
		return builder.maxRetries(maxRetries).build();
	}

	/**
	 * Resolve the specified value if possible.
	 *
	 * @see ConfigurableBeanFactory#resolveEmbeddedValue
	 */
	private String resolve(String value) {
		if (this.beanFactory != null && this.beanFactory instanceof ConfigurableBeanFactory) {
			return ((ConfigurableBeanFactory) this.beanFactory).resolveEmbeddedValue(value);
		}
		return value;
	}

}
