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

import com.google.gson.JsonObject;

/**
 * Management object. The specialization is selected by {@code mgd}.
 */
public class ManagementObject extends Resource {

	public static final String DEFINITION = "mgd";

	/**
	 * Create management object.
	 * 
	 * @param attributes attributes, containing a valid {@code mgd}
	 * @throws IllegalArgumentException if {@code mgd} is missing or unknown
	 */
	public ManagementObject(JsonObject attributes) {
		super(ResourceType.MANAGEMENT_OBJECT, attributes);
		Integer code = getInteger(DEFINITION);
		if (code == null || MgmtDefinition.fromCode(code) == null) {
			throw new IllegalArgumentException("management object requires valid mgd, not " + code);
		}
	}

	public MgmtDefinition getDefinition() {
		return MgmtDefinition.fromCode(getInteger(DEFINITION));
	}

	@Override
	public String getTypeTag() {
		return getDefinition().getTag();
	}

	@Override
	public boolean canHaveChild(ResourceType childType) {
		return childType == ResourceType.SUBSCRIPTION;
	}

	@Override
	protected boolean isUpdatable(String name) {
		return !DEFINITION.equals(name) && super.isUpdatable(name);
	}
}
