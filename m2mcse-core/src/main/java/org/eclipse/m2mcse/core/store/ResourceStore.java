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

import java.util.List;
import java.util.function.Predicate;

import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceType;

/**
 * Persistence of resource records.
 * 
 * Implementations must be thread-safe. Returned resources are copies,
 * changes are only visible to others after {@link #update(Resource)}.
 */
public interface ResourceStore {

	/**
	 * Get resource by id.
	 * 
	 * @param id resource id
	 * @return resource, or {@code null}, if not available.
	 */
	Resource get(String id);

	/**
	 * Get resource by structured path.
	 * 
	 * @param structuredPath structured path
	 * @return resource, or {@code null}, if not available.
	 */
	Resource getByPath(String structuredPath);

	/**
	 * Checks, if the id or the structured path is already bound.
	 * 
	 * @param id resource id. May be {@code null}.
	 * @param structuredPath structured path. May be {@code null}.
	 * @return {@code true}, if a resource with the id or path exists.
	 */
	boolean exists(String id, String structuredPath);

	/**
	 * Add new resource.
	 * 
	 * @param resource resource to add
	 * @return {@code true}, if added, {@code false}, if the id or
	 *         structured path is already bound.
	 */
	boolean create(Resource resource);

	/**
	 * Replace the record of a resource.
	 * 
	 * @param resource resource with changed attributes
	 * @return {@code true}, if replaced, {@code false}, if the resource is
	 *         not available.
	 */
	boolean update(Resource resource);

	/**
	 * Delete resource record.
	 * 
	 * Child records are not affected.
	 * 
	 * @param id resource id
	 * @return {@code true}, if deleted, {@code false}, if not available.
	 */
	boolean delete(String id);

	/**
	 * Get child resources in creation order.
	 * 
	 * @param parentId id of parent
	 * @param type type of children, or {@code null} for all types.
	 * @return list of child resources
	 */
	List<Resource> children(String parentId, ResourceType type);

	/**
	 * Query descendants of a resource.
	 * 
	 * The descendants are visited level by level, siblings in creation
	 * order. The root itself is not part of the result.
	 * 
	 * @param rootId id of the root resource
	 * @param condition condition the resources must match
	 * @param limit maximum number of results, {@code null} for unlimited.
	 * @param level maximum depth below the root, {@code 1} for direct
	 *            children, {@code null} for unlimited.
	 * @param offset number of matching resources to skip, {@code null} for
	 *            none.
	 * @return list of matching resources
	 */
	List<Resource> queryDescendants(String rootId, Predicate<Resource> condition, Integer limit, Integer level,
			Integer offset);

	/**
	 * Resolve the registration record of a CSE.
	 * 
	 * @param cseId CSE-ID, with or without leading "/".
	 * @return resource id of the remote CSE record, or {@code null}, if not
	 *         registered.
	 */
	String resolveCseId(String cseId);

	/**
	 * Get number of resources.
	 * 
	 * @return number of resources
	 */
	int size();
}
