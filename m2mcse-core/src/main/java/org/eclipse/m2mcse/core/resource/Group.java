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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Group of member resources.
 * 
 * The members ({@code mid}) are resource ids or structured paths. Requests
 * to the virtual child "fopt" are fanned out to all members.
 */
public class Group extends Resource {

	public static final String MEMBER_IDS = "mid";
	public static final String MAX_NR_OF_MEMBERS = "mnm";
	public static final String CURRENT_NR_OF_MEMBERS = "cnm";
	public static final String MEMBER_TYPE = "mt";

	public static final String FAN_OUT_POINT_NAME = "fopt";

	/**
	 * Member type for mixed member types.
	 */
	public static final int MIXED = 24;

	public Group(JsonObject attributes) {
		super(ResourceType.GROUP, attributes);
	}

	@Override
	public boolean canHaveChild(ResourceType childType) {
		return childType == ResourceType.SUBSCRIPTION || childType == ResourceType.GROUP_FAN_OUT_POINT;
	}

	public List<String> getMemberIds() {
		return getStringList(MEMBER_IDS);
	}

	@Override
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
		validateMembers();
		if (!hasAttribute(MEMBER_TYPE)) {
			setAttribute(MEMBER_TYPE, MIXED);
		}
		ResourceFactory factory = services.getResourceFactory();
		services.createResource(factory.create(ResourceType.GROUP_FAN_OUT_POINT, FAN_OUT_POINT_NAME, this), this,
				originator);
	}

	@Override
	public void update(JsonObject changes, String originator, ResourceServices services) throws DispatchException {
		super.update(changes, originator, services);
		validateMembers();
	}

	@Override
	protected boolean isUpdatable(String name) {
		return !CURRENT_NR_OF_MEMBERS.equals(name) && super.isUpdatable(name);
	}

	private void validateMembers() throws DispatchException {
		int maxMembers = requireCount(MAX_NR_OF_MEMBERS, true);
		JsonElement members = getAttribute(MEMBER_IDS);
		if (members == null || !members.isJsonArray()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attribute mid must be a list");
		}
		Set<String> unique = new LinkedHashSet<>();
		for (JsonElement member : members.getAsJsonArray()) {
			if (!member.isJsonPrimitive() || member.getAsString().isEmpty()) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "invalid member id " + member);
			}
			unique.add(member.getAsString());
		}
		if (unique.size() > maxMembers) {
			throw new DispatchException(ResponseStatusCode.MAX_NUMBER_OF_MEMBER_EXCEEDED,
					unique.size() + " members exceed maximum of " + maxMembers);
		}
		setAttribute(MEMBER_IDS, new ArrayList<>(unique));
		setAttribute(CURRENT_NR_OF_MEMBERS, unique.size());
	}
}
