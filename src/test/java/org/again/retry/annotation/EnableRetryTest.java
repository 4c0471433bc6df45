package org.again.retry.annotation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.junit.Test;

import org.again.retry.AttemptReport;
import org.again.retry.RetryDecision;
import org.again.retry.RetryListener;
import org.again.retry.RetryStatus;
import org.again.retry.backoff.DummySleeper;
import org.again.retry.strategy.RetryStrategy;

import org.springframework.aop.support.AopUtils;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EnableRetryTest {

	@Test
	public void testRetryableMethod() {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TestConfiguration.class);
		Service service = context.getBean(Service.class);
		assertTrue(AopUtils.isAopProxy(service));
		service.service();
		assertEquals(3, service.getCount());
		DummySleeper sleeper = context.getBean(DummySleeper.class);
		assertEquals(Arrays.asList(100L, 200L), sleeper.getBackOffs());
		context.close();
	}

	@Test
	public void testGlobalListenerSeesEveryAttempt() {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TestConfiguration.class);
		Service service = context.getBean(Service.class);
		service.service();
		RecordingListener listener = context.getBean(RecordingListener.class);
		assertEquals(Arrays.asList(RetryStatus.RETRY, RetryStatus.RETRY, RetryStatus.SUCCESS), listener.statuses);
		context.close();
	}

	@Test
	public void testRetryableClassWithExhaustedStrategy() {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TestConfiguration.class);
		AlwaysFailingService service = context.getBean(AlwaysFailingService.class);
		try {
			service.service();
			fail("Expected IllegalStateException");
		}
		catch (IllegalStateException e) {
			assertEquals("always", e.getMessage());
		}
		assertEquals(3, service.getCount());
		context.close();
	}

	@Test
	public void testExcludedExceptionIsNotRetried() throws Exception {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TestConfiguration.class);
		ExcludingService service = context.getBean(ExcludingService.class);
		try {
			service.service();
			fail("Expected IOException");
		}
		catch (IOException e) {
			assertEquals("excluded", e.getMessage());
		}
		assertEquals(1, service.getCount());
		context.close();
	}

	@Test
	public void testStrategyBeanAndNamedListener() {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(
				NamedListenerConfiguration.class);
		StrategyBeanService service = context.getBean(StrategyBeanService.class);
		try {
			service.service();
			fail("Expected IllegalStateException");
		}
		catch (IllegalStateException e) {
			assertEquals("planned", e.getMessage());
		}
		// the named listener forces a failure on the second report
		assertEquals(2, service.getCount());
		context.close();
	}

	@Test
	public void testExpressions() {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TestConfiguration.class);
		ExpressionService service = context.getBean(ExpressionService.class);
		service.service();
		assertEquals(5, service.getCount());
		DummySleeper sleeper = context.getBean(DummySleeper.class);
		assertEquals(Arrays.asList(7L, 7L, 7L, 7L), sleeper.getBackOffs());
		context.close();
	}

	@Test
	public void testNonAnnotatedMethodIsCalledOnce() {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TestConfiguration.class);
		Service service = context.getBean(Service.class);
		try {
			service.notRetried();
			fail("Expected IllegalStateException");
		}
		catch (IllegalStateException e) {
			assertEquals("not retried", e.getMessage());
		}
		assertEquals(1, service.getCount());
		context.close();
	}

	@Test
	public void testPlainBeanIsNotProxied() {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TestConfiguration.class);
		assertFalse(AopUtils.isAopProxy(context.getBean(PlainService.class)));
		context.close();
	}

	@Configuration
	@EnableRetry(proxyTargetClass = true)
	protected static class TestConfiguration {

		@Bean
		public static PropertySourcesPlaceholderConfigurer placeholderConfigurer() {
			PropertySourcesPlaceholderConfigurer configurer = new PropertySourcesPlaceholderConfigurer();
			Properties properties = new Properties();
			properties.setProperty("retry.delay", "7");
			configurer.setProperties(properties);
			return configurer;
		}

		@Bean
		public DummySleeper sleeper() {
			return new DummySleeper();
		}

		@Bean
		public RecordingListener recordingListener() {
			return new RecordingListener();
		}

		@Bean
		public Service service() {
			return new Service();
		}

		@Bean
		public AlwaysFailingService alwaysFailingService() {
			return new AlwaysFailingService();
		}

		@Bean
		public ExcludingService excludingService() {
			return new ExcludingService();
		}

		@Bean
		public ExpressionService expressionService() {
			return new ExpressionService();
		}

		@Bean
		public PlainService plainService() {
			return new PlainService();
		}

	}

	@Configuration
	@EnableRetry
	protected static class NamedListenerConfiguration {

		@Bean
		public DummySleeper sleeper() {
			return new DummySleeper();
		}

		@Bean
		public RetryListener abortOnSecond() {
			return report -> (report.getAttempts() >= 2 ? RetryDecision.FORCE_FAIL : RetryDecision.PROCEED);
		}

		@Bean
		public RetryStrategy fastStrategy() {
			return RetryStrategy.of(1, 1, 1, 1, 1);
		}

		@Bean
		public StrategyBeanService strategyBeanService() {
			return new StrategyBeanService();
		}

	}

	protected static class RecordingListener implements RetryListener {

		private final List<RetryStatus> statuses = new ArrayList<>();

		@Override
		public RetryDecision onAttempt(AttemptReport report) {
			this.statuses.add(report.getStatus());
			return RetryDecision.PROCEED;
		}

	}

	protected static class Service {

		private int count = 0;

		@Retryable(delay = 100, multiplier = 2, maxRetries = 5)
		public void service() {
			if (this.count++ < 2) {
				throw new IllegalStateException("Planned");
			}
		}

		public void notRetried() {
			this.count++;
			throw new IllegalStateException("not retried");
		}

		public int getCount() {
			return this.count;
		}

	}

	@Retryable(maxRetries = 2)
	protected static class AlwaysFailingService {

		private int count = 0;

		public void service() {
			this.count++;
			throw new IllegalStateException("always");
		}

		public int getCount() {
			return this.count;
		}

	}

	protected static class ExcludingService {

		private int count = 0;

		@Retryable(exclude = IOException.class)
		public void service() throws IOException {
			this.count++;
			throw new IOException("excluded");
		}

		public int getCount() {
			return this.count;
		}

	}

	protected static class StrategyBeanService {

		private int count = 0;

		@Retryable(strategy = "fastStrategy", listeners = "abortOnSecond")
		public void service() {
			this.count++;
			throw new IllegalStateException("planned");
		}

		public int getCount() {
			return this.count;
		}

	}

	protected static class ExpressionService {

		private int count = 0;

		@Retryable(delayExpression = "${retry.delay}", maxRetriesExpression = "#{2 + 2}")
		public void service() {
			if (this.count++ < 4) {
				throw new IllegalStateException("planned");
			}
		}

		public int getCount() {
			return this.count;
		}

	}

	protected static class PlainService {

		public void service() {
		}

	}

}
