/*-
 * #%L
 * This file is part of PhenoTag.
 * %%
 * Copyright (C) 2024 - 2025 PhenoTag developers
 * %%
 * PhenoTag is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PhenoTag is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PhenoTag.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package phenotag.lib.common;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for creating named threads and shutting down executors deterministically.
 * <p>
 * Named threads make it much easier to identify background work when debugging, e.g. using visualvm.
 * 
 * @author PhenoTag developers
 *
 */
public class ThreadTools {
	
	private static final Logger logger = LoggerFactory.getLogger(ThreadTools.class);
	
	/**
	 * Create a thread factory where each thread name starts with a prefix, followed by a counter.
	 * 
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return new NamedThreadFactory(prefix, daemon);
	}
	
	/**
	 * Shut down an executor and wait for running tasks to finish.
	 * <p>
	 * If the tasks do not complete within the timeout they are interrupted, and we wait once more.
	 * 
	 * @param executor
	 * @param timeout
	 * @param unit
	 * @return true if the executor terminated, false otherwise
	 */
	public static boolean shutdownAndAwait(ExecutorService executor, long timeout, TimeUnit unit) {
		executor.shutdown();
		try {
			if (executor.awaitTermination(timeout, unit))
				return true;
			executor.shutdownNow();
			boolean terminated = executor.awaitTermination(timeout, unit);
			if (!terminated)
				logger.warn("Executor did not terminate within {} {}", timeout, unit);
			return terminated;
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
			return false;
		}
	}
	
	
	static class NamedThreadFactory implements ThreadFactory {
		
		private final AtomicInteger threadNumber = new AtomicInteger(1);
		private final String prefix;
		private final boolean daemon;
	
		NamedThreadFactory(final String prefix, final boolean daemon) {
			this.prefix = prefix;
			this.daemon = daemon;
		}
	
		@Override
		public Thread newThread(Runnable r) {
			Thread t = new Thread(r, prefix + threadNumber.getAndIncrement());
			t.setDaemon(daemon);
			return t;
		}
		
	}
	
}
