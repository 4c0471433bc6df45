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

package org.again.retry.strategy;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.springframework.util.Assert;

/**
 * Conversions between {@link Number}s and delays.
 */
public final class Delays {

	private static final BigDecimal MAX_MILLIS = BigDecimal.valueOf(Long.MAX_VALUE);

	private Delays() {
	}

	/**
	 * Exact conversion to {@link BigDecimal}. Doubles go through their canonical string
	 * form, so {@code 1.1} becomes exactly {@code 1.1}.
	 */
	public static BigDecimal toDecimal(Number value) {
		Assert.notNull(value, "value must not be null");
		if (value instanceof BigDecimal) {
			return (BigDecimal) value;
		}
		if (value instanceof BigInteger) {
			return new BigDecimal((BigInteger) value);
		}
		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return BigDecimal.valueOf(value.longValue());
		}
		double d = value.doubleValue();
		Assert.isTrue(!Double.isNaN(d) && !Double.isInfinite(d), () -> "value must be finite: " + value);
		return BigDecimal.valueOf(d);
	}

	public static BigDecimal nonNegative(Number value, String name) {
		BigDecimal decimal = toDecimal(value);
		Assert.isTrue(decimal.signum() >= 0, () -> name + " must not be negative: " + value);
		return decimal;
	}

	/**
	 * Whole milliseconds to sleep for a delay, truncated and capped at
	 * {@link Long#MAX_VALUE}.
	 * @param delay a non-negative delay
	 * @return the delay in whole milliseconds
	 */
	public static long toMillis(BigDecimal delay) {
		return delay.min(MAX_MILLIS).longValue();
	}

}
