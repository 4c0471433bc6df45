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

package org.again.retry.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import org.springframework.util.Assert;

/**
 * Exception predicate driven by a map from exception type to a retryable flag. The flag
 * of the closest superclass present in the map wins; exceptions matching none of the
 * types get the default value. Lookups are cached per concrete exception class.
 * <p>
 * With {@code traverseCauses} set, a throwable that does not match itself is classified
 * by the first cause in its chain that does.
 *
 * 基于异常类型的二元分类器
 */
public class BinaryExceptionPredicate implements Predicate<Throwable> {

	private final Map<Class<? extends Throwable>, Boolean> typeMap;

	private final boolean defaultValue;

	private final boolean traverseCauses;

	private final Map<Class<?>, Boolean> classified = new ConcurrentHashMap<>();

	public BinaryExceptionPredicate(Map<Class<? extends Throwable>, Boolean> typeMap, boolean defaultValue) {
		this(typeMap, defaultValue, false);
	}

	public BinaryExceptionPredicate(Map<Class<? extends Throwable>, Boolean> typeMap, boolean defaultValue,
			boolean traverseCauses) {
		Assert.notNull(typeMap, "typeMap must not be null");
		this.typeMap = Collections.unmodifiableMap(new LinkedHashMap<>(typeMap));
		this.defaultValue = defaultValue;
		this.traverseCauses = traverseCauses;
	}

	/**
	 * Build a predicate from include and exclude lists, the way {@code @Retryable} reads
	 * them: with no includes, everything that is not excluded is retryable; otherwise
	 * only the included types are, minus the excluded ones.
	 * @param includes retryable types
	 * @param excludes non-retryable types
	 * @return the predicate
	 */
	public static BinaryExceptionPredicate of(Class<? extends Throwable>[] includes,
			Class<? extends Throwable>[] excludes) {
		Map<Class<? extends Throwable>, Boolean> map = new LinkedHashMap<>();
		for (Class<? extends Throwable> type : includes) {
			map.put(type, true);
		}
		for (Class<? extends Throwable> type : excludes) {
			map.put(type, false);
		}
		return new BinaryExceptionPredicate(map, includes.length == 0);
	}

	@Override
	public boolean test(Throwable throwable) {
		if (throwable == null) {
			return this.defaultValue;
		}
		Boolean value = classifyType(throwable.getClass());
		if (value == null && this.traverseCauses) {
			Throwable cause = throwable.getCause();
			while (value == null && cause != null && cause != throwable) {
				value = classifyType(cause.getClass());
				throwable = cause;
				cause = cause.getCause();
			}
		}
		return (value != null ? value : this.defaultValue);
	}

	private Boolean classifyType(Class<?> type) {
		Boolean cached = this.classified.get(type);
		if (cached != null) {
			return cached;
		}
		// 沿继承链向上查找最近的匹配类型
		Class<?> current = type;
		while (current != null && current != Object.class) {
			Boolean value = this.typeMap.get(current);
			if (value != null) {
				this.classified.put(type, value);
				return value;
			}
			current = current.getSuperclass();
		}
		return null;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[typeMap=" + this.typeMap + ", default=" + this.defaultValue + "]";
	}

}
