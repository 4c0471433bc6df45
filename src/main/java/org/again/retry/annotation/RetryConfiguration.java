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
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.aopalliance.aop.Advice;

import org.again.retry.RetryListener;
import org.again.retry.backoff.Sleeper;

import org.springframework.aop.MethodMatcher;
import org.springframework.aop.Pointcut;
import org.springframework.aop.support.AbstractPointcutAdvisor;
import org.springframework.aop.support.StaticMethodMatcherPointcut;
import org.springframework.aop.support.annotation.AnnotationClassFilter;
import org.springframework.aop.support.annotation.AnnotationMethodMatcher;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.BeanFactoryAware;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.core.OrderComparator;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ObjectUtils;
import org.springframework.util.ReflectionUtils;

/**
 * Basic configuration for <code>@Retryable</code> processing. If there is a unique bean
 * elsewhere in the context of type {@link Sleeper} it is used by every retry interceptor,
 * and all {@link RetryListener} beans act as the default listeners of retries that do not
 * name their own.
 *
 * 重试配置
 */
@SuppressWarnings("serial")
@Component
public class RetryConfiguration extends AbstractPointcutAdvisor implements BeanFactoryAware, InitializingBean {

	/**
	 * 顾问
	 */
	private Advice advice;

	/**
	 * 切点
	 */
	private Pointcut pointcut;

	/**
	 * 重试监听器
	 */
	private List<RetryListener> retryListeners;

	/**
	 * 暂停接口
	 */
	private Sleeper sleeper;

	/**
	 * bean工厂
	 */
	private BeanFactory beanFactory;

	@Override
	public void afterPropertiesSet() throws Exception {
		this.retryListeners = findBeans(RetryListener.class);
		this.sleeper = findBean(Sleeper.class);
		this.pointcut = new AnnotationClassOrMethodPointcut(Retryable.class);
		this.advice = buildAdvice();
	}

	private <T> List<T> findBeans(Class<? extends T> type) {
		if (this.beanFactory instanceof ListableBeanFactory) {
			ListableBeanFactory listable = (ListableBeanFactory) this.beanFactory;
			if (listable.getBeanNamesForType(type).length > 0) {
				ArrayList<T> list = new ArrayList<T>(listable.getBeansOfType(type).values());
				OrderComparator.sort(list);
				return list;
			}
		}
		return null;
	}

	private <T> T findBean(Class<? extends T> type) {
		if (this.beanFactory instanceof ListableBeanFactory) {
			ListableBeanFactory listable = (ListableBeanFactory) this.beanFactory;
			if (listable.getBeanNamesForType(type).length == 1) {
				return listable.getBean(type);
			}
		}
		return null;
	}

	/**
	 * Set the {@code BeanFactory} to be used when looking up listeners and strategies by
	 * name.
	 */
	@Override
	public void setBeanFactory(BeanFactory beanFactory) {
		this.beanFactory = beanFactory;
	}

	@Override
	public Advice getAdvice() {
		return this.advice;
	}

	@Override
	public Pointcut getPointcut() {
		return this.pointcut;
	}

	protected Advice buildAdvice() {
		AnnotationAwareRetryOperationsInterceptor interceptor = new AnnotationAwareRetryOperationsInterceptor();
		if (this.retryListeners != null) {
			interceptor.setListeners(this.retryListeners);
		}
		if (this.sleeper != null) {
			interceptor.setSleeper(this.sleeper);
		}
		interceptor.setBeanFactory(this.beanFactory);
		return interceptor;
	}

	private static final class AnnotationClassOrMethodPointcut extends StaticMethodMatcherPointcut {

		private final MethodMatcher methodResolver;

		AnnotationClassOrMethodPointcut(Class<? extends Annotation> annotationType) {
			this.methodResolver = new AnnotationMethodMatcher(annotationType);
			setClassFilter(new AnnotationClassOrMethodFilter(annotationType));
		}

		@Override
		public boolean matches(Method method, Class<?> targetClass) {
			return getClassFilter().matches(targetClass) || this.methodResolver.matches(method, targetClass);
		}

		@Override
		public boolean equals(Object other) {
			if (this == other) {
				return true;
			}
			if (!(other instanceof AnnotationClassOrMethodPointcut)) {
				return false;
			}
			AnnotationClassOrMethodPointcut otherAdvisor = (AnnotationClassOrMethodPointcut) other;
			return ObjectUtils.nullSafeEquals(this.methodResolver, otherAdvisor.methodResolver);
		}

		@Override
		public int hashCode() {
			return this.methodResolver.hashCode();
		}

	}

	private static final class AnnotationClassOrMethodFilter extends AnnotationClassFilter {

		private final Class<? extends Annotation> annotationType;

		AnnotationClassOrMethodFilter(Class<? extends Annotation> annotationType) {
			super(annotationType, true);
			this.annotationType = annotationType;
		}

		@Override
		public boolean matches(Class<?> clazz) {
			return super.matches(clazz) || hasAnnotatedMethods(clazz);
		}

		private boolean hasAnnotatedMethods(Class<?> clazz) {
			final AtomicBoolean found = new AtomicBoolean(false);
			ReflectionUtils.doWithMethods(clazz, method -> {
				if (!found.get() && AnnotationUtils.findAnnotation(method, this.annotationType) != null) {
					found.set(true);
				}
			});
			return found.get();
		}

	}

}
