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
package org.eclipse.m2mcse.core.security;

/**
 * Access control operation bits.
 */
public enum Permission {

	CREATE(1),
	RETRIEVE(2),
	UPDATE(4),
	DELETE(8),
	NOTIFY(16),
	DISCOVERY(32);

	/**
	 * All operations.
	 */
	public static final int ALL = 63;

	/** The bit of the operation. */
	public final int bit;

	private Permission(int bit) {
		this.bit = bit;
	}

	/**
	 * Checks, if the operation mask grants this permission.
	 * 
	 * @param acop access control operations mask
	 * @return {@code true}, if granted, {@code false}, otherwise.
	 */
	public boolean isGrantedBy(int acop) {
		return (acop & bit) != 0;
	}
}
