package org.again.retry.backoff;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link Sleeper} that does not sleep but records the requested back off periods.
 */
public class DummySleeper implements Sleeper {

	private final List<Long> backOffs = new ArrayList<Long>();

	/**
	 * Public getter for the long.
	 * @return the lastBackOff
	 */
	public long getLastBackOff() {
		return this.backOffs.get(this.backOffs.size() - 1);
	}

	public List<Long> getBackOffs() {
		return this.backOffs;
	}

	@Override
	public void sleep(long backOffPeriod) throws InterruptedException {
		this.backOffs.add(backOffPeriod);
	}

}
