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

/**
 * Registration record of a federated CSE.
 */
public class RemoteCse extends Resource {

	public static final String CSE_ID = "csi";
	public static final String POINT_OF_ACCESS = "poa";
	public static final String CSE_BASE = "cb";

	private static final Set<ResourceType> CHILDREN = EnumSet.of(ResourceType.ACCESS_CONTROL_POLICY,
			ResourceType.CONTAINER, ResourceType.GROUP, ResourceType.SUBSCRIPTION);

	public RemoteCse(JsonObject attributes) {
		super(ResourceType.REMOTE_CSE, attributes);
	}

	/**
	 * Get CSE-ID of the remote CSE.
	 * 
	 * @return CSE-ID without leading "/", or {@code null}, if not available.
	 */
	public String getCseId() {
		return normalizeCseId(getString(CSE_ID));
	}

	@Override
	public boolean canHaveChild(ResourceType childType) {
		return CHILDREN.contains(childType);
	}

	@Override
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
		requireString(CSE_ID);
	}

	@Override
	protected boolean isUpdatable(String name) {
		return !CSE_ID.equals(name) && super.isUpdatable(name);
	}

	/**
	 * Remove leading "/" of CSE-ID.
	 * 
	 * @param cseId CSE-ID. May be {@code null}.
	 * @return CSE-ID without leading "/"
	 */
	public static String normalizeCseId(String cseId) {
		if (cseId != null && cseId.startsWith("/")) {
			return cseId.substring(1);
		}
		return cseId;
	}
}
