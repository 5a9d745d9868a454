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
import java.util.Set;

import com.google.gson.JsonObject;

/**
 * Root of the resource tree.
 */
public class CseBase extends Resource {

	public static final String CSE_ID = "csi";
	public static final String CSE_TYPE = "cst";
	public static final String SUPPORTED_RESOURCE_TYPES = "srt";

	private static final Set<ResourceType> CHILDREN = EnumSet.of(ResourceType.ACCESS_CONTROL_POLICY,
			ResourceType.APPLICATION_ENTITY, ResourceType.CONTAINER, ResourceType.GROUP, ResourceType.NODE,
			ResourceType.REMOTE_CSE, ResourceType.SUBSCRIPTION);

	public CseBase(JsonObject attributes) {
		super(ResourceType.CSE_BASE, attributes);
	}

	@Override
	public boolean canHaveChild(ResourceType childType) {
		return CHILDREN.contains(childType);
	}

	@Override
	protected boolean isUpdatable(String name) {
		return !CSE_ID.equals(name) && super.isUpdatable(name);
	}
}
