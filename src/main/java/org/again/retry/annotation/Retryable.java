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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.springframework.core.annotation.AliasFor;

/**
 * Annotation for a method invocation that is retryable. On a type it applies to every
 * method of that type.
 * <p>
 * Unless {@link #strategy()} names a strategy bean, the strategy is built from the other
 * attributes: a constant {@link #delay()}, growing by {@link #increment()} or by
 * {@link #multiplier()} when those are set, then spread by {@link #randomFactor()},
 * capped by {@link #clampDelay()}, cut at {@link #maxDelay()} and {@link #maxDuration()},
 * and finally limited to {@link #maxRetries()} retries. Zero leaves an optional limit
 * unset.
 *
 * 可重试注解
 */
@Target({ ElementType.METHOD, ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
public @interface Retryable {

	/**
	 * Exception types that are retryable. Synonym for include(). Defaults to empty (and
	 * if excludes is also empty all exceptions are retried).
	 * @return exception types to retry
	 */
	@AliasFor("include")
	Class<? extends Throwable>[] value() default {};

	/**
	 * Exception types that are retryable. Defaults to empty (and if excludes is also
	 * empty all exceptions are retried).
	 * @return exception types to retry
	 */
	@AliasFor("value")
	Class<? extends Throwable>[] include() default {};

	/**
	 * Exception types that are not retryable. Defaults to empty (and if includes is also
	 * empty all exceptions are retried).
	 * @return exception types not to retry
	 */
	Class<? extends Throwable>[] exclude() default {};

	/**
	 * Bean name of a {@link org.again.retry.strategy.RetryStrategy} to use instead of one
	 * built from the attributes below.
	 * @return the strategy bean name
	 */
	String strategy() default "";

	/**
	 * @return the first delay in milliseconds, default 0
	 */
	long delay() default 0;

	/**
	 * An expression evaluating to the first delay in milliseconds, overriding
	 * {@link #delay()}. Placeholders ({@code ${...}}) and templates ({@code #{...}}) are
	 * supported.
	 * @return the expression
	 */
	String delayExpression() default "";

	/**
	 * @return added to the delay after each retry, default 0 (no growth)
	 */
	long increment() default 0;

	/**
	 * @return multiplies the delay after each retry, takes precedence over
	 * {@link #increment()}; default 0 (no growth)
	 */
	double multiplier() default 0;

	/**
	 * @return the maximum number of retries (attempts minus one), default 3
	 */
	int maxRetries() default 3;

	/**
	 * An expression evaluating to the maximum number of retries, overriding
	 * {@link #maxRetries()}.
	 * @return the expression
	 */
	String maxRetriesExpression() default "";

	/**
	 * @return the cap applied to every delay, 0 for none
	 */
	long clampDelay() default 0;

	/**
	 * @return stop retrying once a delay reaches this value, 0 for no limit
	 */
	long maxDelay() default 0;

	/**
	 * @return stop retrying once this much time has been slept, 0 for no limit
	 */
	long maxDuration() default 0;

	/**
	 * @return the randomization factor, strictly between 0 and 1, 0 for none
	 */
	double randomFactor() default 0;

	/**
	 * Bean names of retry listeners to use instead of the default ones defined in Spring
	 * context.
	 * @return retry listeners bean names
	 */
	String[] listeners() default {};

	/**
	 * A unique label for statistics and logging.
	 * @return the label
	 */
	String label() default "";

}
