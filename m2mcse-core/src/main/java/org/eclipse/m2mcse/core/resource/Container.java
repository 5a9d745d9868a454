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

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.eclipse.m2mcse.core.dispatch.DispatchException;

import com.google.gson.JsonObject;

/**
 * Container of content instances.
 * 
 * Keeps the number ({@code cni}) and accumulated size ({@code cbs}) of its
 * content instances and removes the oldest instances, if {@code mni} or
 * {@code mbs} is exceeded. The newest and oldest instance are addressable
 * by the virtual children "la" and "ol".
 */
public class Container extends Resource {

	public static final String CURRENT_NR_OF_INSTANCES = "cni";
	public static final String CURRENT_BYTE_SIZE = "cbs";
	public static final String MAX_NR_OF_INSTANCES = "mni";
	public static final String MAX_BYTE_SIZE = "mbs";

	public static final String LATEST_NAME = "la";
	public static final String OLDEST_NAME = "ol";

	private static final Set<ResourceType> CHILDREN = EnumSet.of(ResourceType.CONTAINER,
			ResourceType.CONTENT_INSTANCE, ResourceType.SUBSCRIPTION, ResourceType.CONTAINER_LATEST,
			ResourceType.CONTAINER_OLDEST);

	public Container(JsonObject attributes) {
		super(ResourceType.CONTAINER, attributes);
	}

	@Override
	public boolean canHaveChild(ResourceType childType) {
		return CHILDREN.contains(childType);
	}

	/**
	 * Get maximum byte size.
	 * 
	 * @return maximum byte size, or {@code null}, if not limited.
	 */
	public Integer getMaxByteSize() {
		return getInteger(MAX_BYTE_SIZE);
	}

	@Override
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
		requireCount(MAX_NR_OF_INSTANCES, false);
		requireCount(MAX_BYTE_SIZE, false);
		setAttribute(CURRENT_NR_OF_INSTANCES, 0);
		setAttribute(CURRENT_BYTE_SIZE, 0);
		setAttribute(STATE_TAG, 0);
		ResourceFactory factory = services.getResourceFactory();
		services.createResource(factory.create(ResourceType.CONTAINER_LATEST, LATEST_NAME, this), this, originator);
		services.createResource(factory.create(ResourceType.CONTAINER_OLDEST, OLDEST_NAME, this), this, originator);
	}

	@Override
	public void update(JsonObject changes, String originator, ResourceServices services) throws DispatchException {
		super.update(changes, originator, services);
		requireCount(MAX_NR_OF_INSTANCES, false);
		requireCount(MAX_BYTE_SIZE, false);
		enforceLimits(originator, services);
	}

	@Override
	protected boolean isUpdatable(String name) {
		return !CURRENT_NR_OF_INSTANCES.equals(name) && !CURRENT_BYTE_SIZE.equals(name) && super.isUpdatable(name);
	}

	@Override
	public void childAdded(Resource child, String originator, ResourceServices services) {
		if (child.getType() == ResourceType.CONTENT_INSTANCE) {
			enforceLimits(originator, services);
			services.updateResource(this);
		}
	}

	@Override
	public void childRemoved(Resource child, String originator, ResourceServices services) {
		if (child.getType() == ResourceType.CONTENT_INSTANCE) {
			List<Resource> instances = services.childResources(getId(), ResourceType.CONTENT_INSTANCE);
			long size = 0;
			for (Resource instance : instances) {
				size += ContentInstance.sizeOf(instance);
			}
			setAttribute(CURRENT_NR_OF_INSTANCES, instances.size());
			setAttribute(CURRENT_BYTE_SIZE, size);
			services.updateResource(this);
		}
	}

	/**
	 * Remove the oldest instances exceeding {@code mni} or {@code mbs} and
	 * refresh {@code cni} and {@code cbs}.
	 */
	private void enforceLimits(String originator, ResourceServices services) {
		List<Resource> instances = services.childResources(getId(), ResourceType.CONTENT_INSTANCE);
		Integer maxInstances = getInteger(MAX_NR_OF_INSTANCES);
		Integer maxSize = getInteger(MAX_BYTE_SIZE);
		long size = 0;
		for (Resource instance : instances) {
			size += ContentInstance.sizeOf(instance);
		}
		int index = 0;
		while (index < instances.size()) {
			int count = instances.size() - index;
			if ((maxInstances == null || count <= maxInstances) && (maxSize == null || size <= maxSize)) {
				break;
			}
			Resource oldest = instances.get(index++);
			size -= ContentInstance.sizeOf(oldest);
			services.deleteResource(oldest, originator);
		}
		setAttribute(CURRENT_NR_OF_INSTANCES, instances.size() - index);
		setAttribute(CURRENT_BYTE_SIZE, size);
	}
}
