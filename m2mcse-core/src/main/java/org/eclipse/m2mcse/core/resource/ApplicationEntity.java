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

import org.eclipse.m2mcse.core.dispatch.DispatchException;

import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Application entity registration.
 * 
 * The AE-ID ({@code aei}) is assigned by the registration and is also the
 * resource id.
 */
public class ApplicationEntity extends Resource {

	public static final String APP_ID = "api";
	public static final String AE_ID = "aei";
	public static final String REQUEST_REACHABILITY = "rr";

	private static final Set<ResourceType> CHILDREN = EnumSet.of(ResourceType.ACCESS_CONTROL_POLICY,
			ResourceType.CONTAINER, ResourceType.GROUP, ResourceType.SUBSCRIPTION);

	public ApplicationEntity(JsonObject attributes) {
		super(ResourceType.APPLICATION_ENTITY, attributes);
	}

	public String getAeId() {
		return getString(AE_ID);
	}

	@Override
	public boolean canHaveChild(ResourceType childType) {
		return CHILDREN.contains(childType);
	}

	@Override
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
		requireString(APP_ID);
		if (!hasAttribute(REQUEST_REACHABILITY)) {
			setAttribute(REQUEST_REACHABILITY, new JsonPrimitive(false));
		}
	}

	@Override
	protected boolean isUpdatable(String name) {
		return !AE_ID.equals(name) && !APP_ID.equals(name) && super.isUpdatable(name);
	}
}
