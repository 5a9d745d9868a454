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
package org.eclipse.m2mcse.core.dispatch;

/**
 * Result content, selects the shape of a response body.
 */
public enum ResultContent {

	NOTHING(0),
	ATTRIBUTES(1),
	ATTRIBUTES_AND_CHILD_RESOURCES(4),
	ATTRIBUTES_AND_CHILD_RESOURCE_REFERENCES(5),
	CHILD_RESOURCE_REFERENCES(6),
	CHILD_RESOURCES(8),
	MODIFIED_ATTRIBUTES(9),
	DISCOVERY_RESULT_REFERENCES(11);

	public final int value;

	private ResultContent(int value) {
		this.value = value;
	}

	/**
	 * Get result content by value.
	 * 
	 * @param value rcn value
	 * @return result content, or {@code null}, if not supported.
	 */
	public static ResultContent fromValue(int value) {
		for (ResultContent content : values()) {
			if (content.value == value) {
				return content;
			}
		}
		return null;
	}
}
