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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

import org.eclipse.m2mcse.core.resource.RemoteCse;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceFactory;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;

/**
 * A resource store that keeps all records in-memory.
 * 
 * Records are stored as deep copies of the attributes, indexed by id, by
 * structured path and by parent id.
 */
public final class InMemoryResourceStore implements ResourceStore {

	private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryResourceStore.class);

	private final ReadWriteLock lock = new ReentrantReadWriteLock();
	private final Map<String, JsonObject> records = new HashMap<>();
	private final Map<String, String> paths = new HashMap<>();
	private final Map<String, Set<String>> children = new HashMap<>();

	@Override
	public Resource get(String id) {
		if (id == null) {
			return null;
		}
		lock.readLock().lock();
		try {
			return restore(records.get(id));
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public Resource getByPath(String structuredPath) {
		if (structuredPath == null) {
			return null;
		}
		lock.readLock().lock();
		try {
			String id = paths.get(structuredPath);
			return id == null ? null : restore(records.get(id));
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public boolean exists(String id, String structuredPath) {
		lock.readLock().lock();
		try {
			return (id != null && records.containsKey(id))
					|| (structuredPath != null && paths.containsKey(structuredPath));
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public boolean create(Resource resource) {
		String id = resource.getId();
		String path = resource.getStructuredPath();
		if (id == null) {
			throw new IllegalArgumentException("resource " + resource + " has no id!");
		}
		lock.writeLock().lock();
		try {
			if (records.containsKey(id) || (path != null && paths.containsKey(path))) {
				LOGGER.debug("{} already bound", resource);
				return false;
			}
			records.put(id, resource.copyAttributes());
			if (path != null) {
				paths.put(path, id);
			}
			String parentId = resource.getParentId();
			if (parentId != null) {
				children.computeIfAbsent(parentId, key -> new LinkedHashSet<>()).add(id);
			}
			LOGGER.trace("created {}", resource);
			return true;
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public boolean update(Resource resource) {
		String id = resource.getId();
		lock.writeLock().lock();
		try {
			if (id == null || !records.containsKey(id)) {
				return false;
			}
			records.put(id, resource.copyAttributes());
			return true;
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public boolean delete(String id) {
		lock.writeLock().lock();
		try {
			JsonObject record = id == null ? null : records.remove(id);
			if (record == null) {
				return false;
			}
			Resource resource = restore(record);
			String path = resource.getStructuredPath();
			if (path != null) {
				paths.remove(path);
			}
			String parentId = resource.getParentId();
			if (parentId != null) {
				Set<String> siblings = children.get(parentId);
				if (siblings != null) {
					siblings.remove(id);
					if (siblings.isEmpty()) {
						children.remove(parentId);
					}
				}
			}
			children.remove(id);
			LOGGER.trace("deleted {}", resource);
			return true;
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public List<Resource> children(String parentId, ResourceType type) {
		lock.readLock().lock();
		try {
			List<Resource> result = new ArrayList<>();
			for (String id : childIds(parentId)) {
				Resource child = restore(records.get(id));
				if (child != null && (type == null || child.getType() == type)) {
					result.add(child);
				}
			}
			return result;
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public List<Resource> queryDescendants(String rootId, Predicate<Resource> condition, Integer limit,
			Integer level, Integer offset) {
		List<Resource> result = new ArrayList<>();
		if (limit != null && limit <= 0) {
			return result;
		}
		int skip = offset == null ? 0 : offset;
		lock.readLock().lock();
		try {
			Deque<String> current = new ArrayDeque<>(childIds(rootId));
			int depth = 1;
			while (!current.isEmpty() && (level == null || depth <= level)) {
				Deque<String> next = new ArrayDeque<>();
				for (String id : current) {
					Resource resource = restore(records.get(id));
					if (resource == null) {
						continue;
					}
					if (condition.test(resource)) {
						if (skip > 0) {
							--skip;
						} else {
							result.add(resource);
							if (limit != null && result.size() >= limit) {
								return result;
							}
						}
					}
					next.addAll(childIds(id));
				}
				current = next;
				++depth;
			}
			return result;
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public String resolveCseId(String cseId) {
		String normalized = RemoteCse.normalizeCseId(cseId);
		if (normalized == null) {
			return null;
		}
		lock.readLock().lock();
		try {
			for (JsonObject record : records.values()) {
				Resource resource = restore(record);
				if (resource instanceof RemoteCse && normalized.equals(((RemoteCse) resource).getCseId())) {
					return resource.getId();
				}
			}
			return null;
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public int size() {
		lock.readLock().lock();
		try {
			return records.size();
		} finally {
			lock.readLock().unlock();
		}
	}

	private Set<String> childIds(String parentId) {
		Set<String> ids = children.get(parentId);
		return ids == null ? Collections.<String>emptySet() : ids;
	}

	private static Resource restore(JsonObject record) {
		return record == null ? null : ResourceFactory.restore(record.deepCopy());
	}
}
