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
package org.eclipse.m2mcse.core.resource;

import java.util.List;

import org.eclipse.m2mcse.core.dispatch.CseRequest;
import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.Result;
import org.eclipse.m2mcse.core.security.Permission;

/**
 * Services of the CSE available to the type specific resource hooks.
 * 
 * The operations bypass the access control. Resources returned are fresh
 * copies of the stored records.
 */
public interface ResourceServices {

	/**
	 * Retrieve resource by id.
	 * 
	 * @param id resource id
	 * @return resource, or {@code null}, if not available.
	 */
	Resource retrieveLocalResource(String id);

	/**
	 * Get child resources in creation order.
	 * 
	 * @param parentId id of parent
	 * @param type type of children, or {@code null} for all types.
	 * @return list of child resources
	 */
	List<Resource> childResources(String parentId, ResourceType type);

	/**
	 * Create and activate resource.
	 * 
	 * @param resource resource to create
	 * @param parent parent resource
	 * @param originator originator of the creation
	 * @return the created resource
	 * @throws DispatchException if the resource could not be created
	 */
	Resource createResource(Resource resource, Resource parent, String originator) throws DispatchException;

	/**
	 * Persist the changed attributes of the resource.
	 * 
	 * @param resource resource to persist
	 * @return {@code true}, if persisted, {@code false}, if the resource is
	 *         not longer available.
	 */
	boolean updateResource(Resource resource);

	/**
	 * Deactivate and delete resource.
	 * 
	 * @param resource resource to delete
	 * @param originator originator of the deletion
	 */
	void deleteResource(Resource resource, String originator);

	/**
	 * Checks, if the originator is granted the permission on the resource.
	 * 
	 * @param originator originator
	 * @param resource resource
	 * @param permission requested permission
	 * @return {@code true}, if granted, {@code false}, otherwise.
	 */
	boolean hasAccess(String originator, Resource resource, Permission permission);

	/**
	 * Dispatch a request.
	 * 
	 * @param request request
	 * @return result of the request
	 */
	Result process(CseRequest request);

	/**
	 * Get factory for auxiliary resources.
	 * 
	 * @return resource factory
	 */
	ResourceFactory getResourceFactory();
}
