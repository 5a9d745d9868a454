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
 * Result of resolving an address.
 * 
 * For local targets the structured path may be set without a resource id,
 * if no resource is bound to the path. For remote targets the resource id
 * or structured path is the address within the remote CSE.
 */
public final class ResolvedAddress {

	private final String resourceId;
	private final String cseId;
	private final String structuredPath;

	public ResolvedAddress(String resourceId, String cseId, String structuredPath) {
		this.resourceId = resourceId;
		this.cseId = cseId;
		this.structuredPath = structuredPath;
	}

	/**
	 * Get resource id.
	 * 
	 * @return resource id, or {@code null}, if not resolved.
	 */
	public String getResourceId() {
		return resourceId;
	}

	/**
	 * Get CSE-ID of the target CSE.
	 * 
	 * @return CSE-ID without leading "/"
	 */
	public String getCseId() {
		return cseId;
	}

	/**
	 * Get structured path.
	 * 
	 * @return structured path, or {@code null}, if not available.
	 */
	public String getStructuredPath() {
		return structuredPath;
	}

	@Override
	public String toString() {
		return "ri=" + resourceId + ", csi=" + cseId + ", srn=" + structuredPath;
	}
}
