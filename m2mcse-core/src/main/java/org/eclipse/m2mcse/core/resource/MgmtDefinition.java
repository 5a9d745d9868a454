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
 * Specializations of management objects, selected by the {@code mgd}
 * attribute.
 */
public enum MgmtDefinition {

	FIRMWARE(1001, "m2m:fwr"),
	SOFTWARE(1002, "m2m:swr"),
	MEMORY(1003, "m2m:mem"),
	AREA_NWK_INFO(1004, "m2m:ani"),
	AREA_NWK_DEVICE_INFO(1005, "m2m:andi"),
	BATTERY(1006, "m2m:bat"),
	DEVICE_INFO(1007, "m2m:dvi"),
	DEVICE_CAPABILITY(1008, "m2m:dvc"),
	REBOOT(1009, "m2m:rbo"),
	EVENT_LOG(1010, "m2m:evl");

	public final int code;
	private final String tag;

	private MgmtDefinition(int code, String tag) {
		this.code = code;
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}

	public static MgmtDefinition fromCode(int code) {
		for (MgmtDefinition definition : values()) {
			if (definition.code == code) {
				return definition;
			}
		}
		return null;
	}

	public static MgmtDefinition fromTag(String tag) {
		for (MgmtDefinition definition : values()) {
			if (definition.tag.equals(tag)) {
				return definition;
			}
		}
		return null;
	}
}
