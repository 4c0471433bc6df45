package org.again.retry.backoff;

import org.junit.Test;

import static org.junit.Assert.assertTrue;

public class ThreadWaitSleeperTest {

	@Test
	public void testSingleBackOff() throws Exception {
		long start = System.nanoTime();
		new ThreadWaitSleeper().sleep(50);
		long elapsedMillis = (System.nanoTime() - start) / 1000000;
		assertTrue("Slept only " + elapsedMillis + "ms", elapsedMillis >= 45);
	}

	@Test(expected = InterruptedException.class)
	public void testInterrupted() throws Exception {
		Thread.currentThread().interrupt();
		new ThreadWaitSleeper().sleep(1000);
	}

}
