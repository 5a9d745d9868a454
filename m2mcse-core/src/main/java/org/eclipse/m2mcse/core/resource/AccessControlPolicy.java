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
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Access control policy.
 * 
 * {@code pv} holds the privileges granted on the resources referencing
 * this policy, {@code pvs} the privileges granted on the policy itself.
 * Both contain an {@code acr} list of rules with {@code acor} originator
 * patterns and {@code acop} operation masks.
 */
public class AccessControlPolicy extends Resource {

	public static final String PRIVILEGES = "pv";
	public static final String SELF_PRIVILEGES = "pvs";
	public static final String RULES = "acr";
	public static final String ORIGINATORS = "acor";
	public static final String OPERATIONS = "acop";

	public AccessControlPolicy(JsonObject attributes) {
		super(ResourceType.ACCESS_CONTROL_POLICY, attributes);
	}

	@Override
	public boolean canHaveChild(ResourceType childType) {
		return childType == ResourceType.SUBSCRIPTION;
	}

	@Override
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
		validate();
	}

	@Override
	public void update(JsonObject changes, String originator, ResourceServices services) throws DispatchException {
		super.update(changes, originator, services);
		validate();
	}

	/**
	 * Get privileges.
	 * 
	 * @param self {@code true} for the self privileges
	 * @return privileges object, or {@code null}, if not available.
	 */
	public JsonObject getPrivileges(boolean self) {
		JsonElement privileges = getAttribute(self ? SELF_PRIVILEGES : PRIVILEGES);
		return privileges != null && privileges.isJsonObject() ? privileges.getAsJsonObject() : null;
	}

	private void validate() throws DispatchException {
		checkPrivileges(PRIVILEGES);
		checkPrivileges(SELF_PRIVILEGES);
	}

	private void checkPrivileges(String name) throws DispatchException {
		JsonElement privileges = getAttribute(name);
		if (privileges == null || !privileges.isJsonObject()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attribute " + name + " is mandatory for "
					+ getTypeTag());
		}
		JsonElement rules = privileges.getAsJsonObject().get(RULES);
		if (rules != null && !rules.isJsonNull() && !rules.isJsonArray()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, name + "/" + RULES + " must be a list");
		}
	}
}
