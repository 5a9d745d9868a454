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
 * Identifier presentation in reference lists.
 */
public enum DesiredIdentifierResultType {

	/**
	 * Structured path.
	 */
	STRUCTURED(1),
	/**
	 * Resource id.
	 */
	UNSTRUCTURED(2);

	public final int value;

	private DesiredIdentifierResultType(int value) {
		this.value = value;
	}

	public static DesiredIdentifierResultType fromValue(int value) {
		for (DesiredIdentifierResultType type : values()) {
			if (type.value == value) {
				return type;
			}
		}
		return null;
	}
}
