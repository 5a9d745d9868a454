/*******************************************************************************
 * Copyright (c) 2026 Contributors to the Eclipse Foundation.
 * 
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v2.0
 * and Eclipse Distribution License v1.0 which accompany this distribution.
 * 
 * The Eclipse Public License is available at
 *    http://www.eclipse.org/legal/epl-v20.html
 * and the Eclipse Distribution License is available at
 *    http://www.eclipse.org/org/documents/edl-v10.html.
 * 
 ******************************************************************************/
package org.eclipse.m2mcse.elements.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory creating named threads.
 */
public class NamedThreadFactory implements ThreadFactory {

	/**
	 * The default thread group for CSE threads.
	 */
	public static final ThreadGroup CSE_THREAD_GROUP = new ThreadGroup("CSE"); //$NON-NLS-1$

	static {
		// reset daemon, may be set by parent group!
		CSE_THREAD_GROUP.setDaemon(false);
	}

	private final ThreadGroup group;
	private final AtomicLong index = new AtomicLong();
	private final String prefix;
	private final boolean daemon;

	/**
	 * Creates a new factory for non-daemon threads in the CSE thread group.
	 *
	 * @param threadPrefix the prefix, that becomes part of the name of all
	 *            threads, created by this factory.
	 */
	public NamedThreadFactory(String threadPrefix) {
		this(threadPrefix, null, false);
	}

	/**
	 * Creates a new factory.
	 *
	 * @param threadPrefix the prefix, that becomes part of the name of all
	 *            threads, created by this factory.
	 * @param threadGroup the thread group or {@code null} for the CSE
	 *            thread group
	 * @param daemon {@code true} to create daemon threads
	 */
	public NamedThreadFactory(String threadPrefix, ThreadGroup threadGroup, boolean daemon) {
		this.prefix = threadPrefix;
		this.group = threadGroup == null ? CSE_THREAD_GROUP : threadGroup;
		this.daemon = daemon;
	}

	/**
	 * Creates a new thread for executing a runnable.
	 * <p>
	 * The thread is named by the prefix and a running index. Its priority is
	 * set to {@link Thread#NORM_PRIORITY}.
	 * 
	 * @param runnable The runnable that should be executed by the created
	 *            thread.
	 * @return The newly created thread.
	 */
	@Override
	public Thread newThread(Runnable runnable) {
		Thread thread = new Thread(group, runnable, prefix + index.getAndIncrement(), 0);
		thread.setDaemon(daemon);
		if (thread.getPriority() != Thread.NORM_PRIORITY) {
			thread.setPriority(Thread.NORM_PRIORITY);
		}
		return thread;
	}
}
