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
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;
import org.eclipse.m2mcse.core.dispatch.Result;
import org.eclipse.m2mcse.core.security.Permission;

import com.google.gson.JsonObject;

/**
 * Virtual child of a container, referring to one of its content instances.
 * 
 * RETRIEVE returns and DELETE removes the referred instance.
 */
public abstract class ContainerInstanceReference extends VirtualResource {

	protected ContainerInstanceReference(ResourceType type, JsonObject attributes) {
		super(type, attributes);
	}

	/**
	 * Select the referred instance.
	 * 
	 * @param instances content instances of the container in creation order.
	 *            Not empty.
	 * @return selected instance
	 */
	protected abstract Resource select(List<Resource> instances);

	@Override
	public Result handleRetrieve(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		Resource instance = findInstance(services);
		if (!services.hasAccess(originator, instance, Permission.RETRIEVE)) {
			throw new DispatchException(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE,
					"originator has no privileges to retrieve " + instance.getId());
		}
		return Result.of(ResponseStatusCode.OK, instance);
	}

	@Override
	public Result handleDelete(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		Resource instance = findInstance(services);
		services.deleteResource(instance, originator);
		return Result.of(ResponseStatusCode.DELETED, instance);
	}

	private Resource findInstance(ResourceServices services) throws DispatchException {
		List<Resource> instances = services.childResources(getParentId(), ResourceType.CONTENT_INSTANCE);
		if (instances.isEmpty()) {
			throw new DispatchException(ResponseStatusCode.NOT_FOUND, "container has no content instance");
		}
		return select(instances);
	}
}
