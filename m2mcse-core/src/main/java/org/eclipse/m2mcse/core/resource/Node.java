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

import org.eclipse.m2mcse.core.dispatch.DispatchException;

import com.google.gson.JsonObject;

/**
 * Node, the parent of management objects.
 */
public class Node extends Resource {

	public static final String NODE_ID = "ni";

	public Node(JsonObject attributes) {
		super(ResourceType.NODE, attributes);
	}

	@Override
	public boolean canHaveChild(ResourceType childType) {
		return childType == ResourceType.MANAGEMENT_OBJECT || childType == ResourceType.SUBSCRIPTION;
	}

	@Override
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
		requireString(NODE_ID);
	}
}
