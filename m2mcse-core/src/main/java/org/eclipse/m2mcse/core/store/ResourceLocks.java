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
package org.eclipse.m2mcse.core.store;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per resource id reentrant locks.
 * 
 * Serializes mutations of the same resource. Locks must be acquired top
 * down, parent before child, to prevent dead-locks. Unused locks are
 * released.
 */
public class ResourceLocks {

	private static class Entry {

		private final ReentrantLock lock = new ReentrantLock();
		private int users;
	}

	private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

	/**
	 * Lock resource ids in the provided order.
	 * 
	 * {@code null} ids are ignored.
	 * 
	 * <pre>
	 * <code>
	 * try (ResourceLocks.Guard guard = locks.lock(parentId, id)) {
	 * 	...
	 * }
	 * </code>
	 * </pre>
	 * 
	 * @param ids resource ids, parent before child
	 * @return guard to unlock the ids
	 */
	public Guard lock(String... ids) {
		List<String> locked = new ArrayList<>(ids.length);
		for (String id : ids) {
			if (id != null) {
				acquire(id);
				locked.add(id);
			}
		}
		return new Guard(locked);
	}

	/**
	 * Checks, if the resource id is locked by the current thread.
	 * 
	 * @param id resource id
	 * @return {@code true}, if locked by the current thread.
	 */
	public boolean isHeldByCurrentThread(String id) {
		Entry entry = locks.get(id);
		return entry != null && entry.lock.isHeldByCurrentThread();
	}

	/**
	 * Get number of ids with active users.
	 * 
	 * @return number of ids
	 */
	public int size() {
		return locks.size();
	}

	private void acquire(String id) {
		Entry entry = locks.compute(id, (key, current) -> {
			Entry result = current == null ? new Entry() : current;
			++result.users;
			return result;
		});
		entry.lock.lock();
	}

	private void release(String id) {
		Entry entry = locks.get(id);
		entry.lock.unlock();
		locks.computeIfPresent(id, (key, current) -> --current.users == 0 ? null : current);
	}

	/**
	 * Unlocks the locked ids in reverse order.
	 */
	public final class Guard implements AutoCloseable {

		private final List<String> ids;
		private boolean closed;

		private Guard(List<String> ids) {
			this.ids = ids;
		}

		@Override
		public void close() {
			if (!closed) {
				closed = true;
				for (int index = ids.size() - 1; index >= 0; --index) {
					release(ids.get(index));
				}
			}
		}
	}
}
