/*-
 * #%L
 * This file is part of ImageComplexity.
 * %%
 * Copyright (C) 2024 ImageComplexity developers
 * %%
 * ImageComplexity is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * ImageComplexity is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with ImageComplexity.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package imcomp.lib.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Create thread factories that support adding a prefix to the name and setting daemon status.
 * <p>
 * Named threads make it much easier to follow batch measurement logs.
 */
public class ThreadTools {

	private ThreadTools() {
		throw new AssertionError();
	}

	/**
	 * Create a named thread factory with a specified priority.
	 * 
	 * @param prefix
	 * @param daemon
	 * @param priority
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon, int priority) {
		return new SimpleThreadFactory(prefix, daemon, priority);
	}

	/**
	 * Create a named thread factory with {@code Thread.NORM_PRIORITY}.
	 * 
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return createThreadFactory(prefix, daemon, Thread.NORM_PRIORITY);
	}

	/**
	 * Get the number of threads to use by default, based upon the available processors.
	 * @return
	 */
	public static int getParallelism() {
		return Math.max(1, Runtime.getRuntime().availableProcessors());
	}


	static class SimpleThreadFactory implements ThreadFactory {

		private final AtomicInteger threadNumber = new AtomicInteger(1);
		private final String prefix;
		private final boolean daemon;
		private final int priority;

		SimpleThreadFactory(final String prefix, final boolean daemon, final int priority) {
			this.prefix = prefix;
			this.daemon = daemon;
			this.priority = Math.max(Thread.MIN_PRIORITY, Math.min(Thread.MAX_PRIORITY, priority));
		}

		@Override
		public Thread newThread(Runnable r) {
			String name = prefix + threadNumber.getAndIncrement();
			Thread t = new Thread(r, name);
			t.setDaemon(daemon);
			if (t.getPriority() != priority)
				t.setPriority(priority);
			return t;
		}

	}

}
