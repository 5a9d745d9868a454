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

import com.google.gson.JsonObject;

/**
 * Refers to the newest content instance of the container.
 */
public class ContainerLatest extends ContainerInstanceReference {

	public ContainerLatest(JsonObject attributes) {
		super(ResourceType.CONTAINER_LATEST, attributes);
	}

	@Override
	protected Resource select(List<Resource> instances) {
		return instances.get(instances.size() - 1);
	}
}
