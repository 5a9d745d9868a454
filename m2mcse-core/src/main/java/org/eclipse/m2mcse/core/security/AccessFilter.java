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

import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceType;

/**
 * Decides, if an originator holds a permission on a resource.
 */
public interface AccessFilter {

	/**
	 * Checks the permission.
	 * 
	 * @param originator originator of the request
	 * @param resource resource to access
	 * @param permission requested permission
	 * @param childType type of the child to create for
	 *            {@link Permission#CREATE}. May be {@code null}.
	 * @param checkSelf {@code true} to evaluate the self privileges of the
	 *            policies referenced by the resource, used to change the
	 *            policy references.
	 * @return {@code true}, if granted, {@code false}, otherwise.
	 */
	boolean hasAccess(String originator, Resource resource, Permission permission, ResourceType childType,
			boolean checkSelf);

	/**
	 * Checks the permission.
	 * 
	 * @param originator originator of the request
	 * @param resource resource to access
	 * @param permission requested permission
	 * @return {@code true}, if granted, {@code false}, otherwise.
	 */
	default boolean hasAccess(String originator, Resource resource, Permission permission) {
		return hasAccess(originator, resource, permission, null, false);
	}
}
