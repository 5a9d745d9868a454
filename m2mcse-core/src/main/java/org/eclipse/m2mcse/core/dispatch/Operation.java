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

import org.eclipse.m2mcse.core.security.Permission;

/**
 * Request operations.
 */
public enum Operation {

	CREATE(1, Permission.CREATE),
	RETRIEVE(2, Permission.RETRIEVE),
	UPDATE(3, Permission.UPDATE),
	DELETE(4, Permission.DELETE);

	/** The oneM2M operation value. */
	public final int value;
	private final Permission permission;

	private Operation(int value, Permission permission) {
		this.value = value;
		this.permission = permission;
	}

	/**
	 * Get the permission required to execute the operation on its target.
	 * 
	 * @return required permission
	 */
	public Permission getPermission() {
		return permission;
	}
}
