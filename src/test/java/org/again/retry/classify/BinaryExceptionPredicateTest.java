package org.again.retry.classify;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.SocketException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BinaryExceptionPredicateTest {

	@Test
	public void testDefaultValue() {
		BinaryExceptionPredicate predicate = new BinaryExceptionPredicate(
				Collections.<Class<? extends Throwable>, Boolean>emptyMap(), true);
		assertTrue(predicate.test(new IllegalStateException()));
		assertTrue(predicate.test(null));
	}

	@Test
	public void testClosestSuperclassWins() {
		Map<Class<? extends Throwable>, Boolean> map = new HashMap<>();
		map.put(IOException.class, true);
		map.put(FileNotFoundException.class, false);
		BinaryExceptionPredicate predicate = new BinaryExceptionPredicate(map, false);
		assertTrue(predicate.test(new IOException()));
		assertFalse(predicate.test(new FileNotFoundException()));
		assertTrue(predicate.test(new SocketException()));
		assertFalse(predicate.test(new IllegalStateException()));
		// second lookup goes through the cache
		assertFalse(predicate.test(new FileNotFoundException()));
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testIncludesAndExcludes() {
		BinaryExceptionPredicate includeOnly = BinaryExceptionPredicate.of(new Class[] { IOException.class },
				new Class[0]);
		assertTrue(includeOnly.test(new FileNotFoundException()));
		assertFalse(includeOnly.test(new RuntimeException()));

		BinaryExceptionPredicate excludeOnly = BinaryExceptionPredicate.of(new Class[0],
				new Class[] { IllegalArgumentException.class });
		assertTrue(excludeOnly.test(new IOException()));
		assertFalse(excludeOnly.test(new NumberFormatException()));
	}

	@Test
	public void testTraverseCauses() {
		Map<Class<? extends Throwable>, Boolean> map = new HashMap<>();
		map.put(IOException.class, true);
		BinaryExceptionPredicate predicate = new BinaryExceptionPredicate(map, false, true);
		assertTrue(predicate.test(new IllegalStateException(new RuntimeException(new IOException()))));
		assertFalse(predicate.test(new IllegalStateException(new RuntimeException())));

		BinaryExceptionPredicate shallow = new BinaryExceptionPredicate(map, false);
		assertFalse(shallow.test(new IllegalStateException(new IOException())));
	}

}
