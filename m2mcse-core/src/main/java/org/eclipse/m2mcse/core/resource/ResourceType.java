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

/**
 * Closed set of resource types.
 * 
 * Each type has the oneM2M type code, the type tag used as single key
 * wrapping the attributes in JSON, and a short name used for generated
 * identifiers. Virtual types are addressable nodes with computed CRUD
 * semantics.
 */
public enum ResourceType {

	ACCESS_CONTROL_POLICY(1, "m2m:acp", "acp"),
	APPLICATION_ENTITY(2, "m2m:ae", "ae"),
	CONTAINER(3, "m2m:cnt", "cnt"),
	CONTENT_INSTANCE(4, "m2m:cin", "cin"),
	CSE_BASE(5, "m2m:cb", "cb"),
	GROUP(9, "m2m:grp", "grp"),
	/**
	 * Management object. The tag of a concrete object depends on its
	 * {@link MgmtDefinition}.
	 */
	MANAGEMENT_OBJECT(13, "m2m:mgo", "mgo"),
	NODE(14, "m2m:nod", "nod"),
	REMOTE_CSE(16, "m2m:csr", "csr"),
	SUBSCRIPTION(23, "m2m:sub", "sub"),
	CONTAINER_LATEST(-20001, "m2m:la", "la", true),
	CONTAINER_OLDEST(-20002, "m2m:ol", "ol", true),
	GROUP_FAN_OUT_POINT(-20003, "m2m:fopt", "fopt", true);

	public final int code;
	private final String tag;
	private final String shortName;
	private final boolean virtual;

	private ResourceType(int code, String tag, String shortName) {
		this(code, tag, shortName, false);
	}

	private ResourceType(int code, String tag, String shortName, boolean virtual) {
		this.code = code;
		this.tag = tag;
		this.shortName = shortName;
		this.virtual = virtual;
	}

	public String getTag() {
		return tag;
	}

	public String getShortName() {
		return shortName;
	}

	public boolean isVirtual() {
		return virtual;
	}

	/**
	 * Get resource type by code.
	 * 
	 * @param code type code
	 * @return resource type, or {@code null}, if unknown.
	 */
	public static ResourceType fromCode(int code) {
		for (ResourceType type : values()) {
			if (type.code == code) {
				return type;
			}
		}
		return null;
	}

	/**
	 * Get resource type by tag.
	 * 
	 * Tags of management object specializations map to
	 * {@link #MANAGEMENT_OBJECT}.
	 * 
	 * @param tag type tag
	 * @return resource type, or {@code null}, if unknown.
	 */
	public static ResourceType fromTag(String tag) {
		for (ResourceType type : values()) {
			if (type.tag.equals(tag)) {
				return type;
			}
		}
		if (MgmtDefinition.fromTag(tag) != null) {
			return MANAGEMENT_OBJECT;
		}
		return null;
	}
}
