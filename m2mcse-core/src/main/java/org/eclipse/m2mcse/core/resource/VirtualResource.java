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

import org.eclipse.m2mcse.core.dispatch.CseRequest;
import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.Result;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;

import com.google.gson.JsonObject;

/**
 * Addressable node without own content.
 * 
 * The requests targeting a virtual resource are handed over to the
 * handlers of the resource instead of the generic CRUD algorithm. By
 * default CREATE, UPDATE and DELETE are not allowed.
 */
public abstract class VirtualResource extends Resource {

	protected VirtualResource(ResourceType type, JsonObject attributes) {
		super(type, attributes);
	}

	/**
	 * Handle RETRIEVE.
	 * 
	 * The handler checks the permissions for the resources it returns.
	 * 
	 * @param request the request
	 * @param originator originator of the request
	 * @param services services of the CSE
	 * @return result
	 * @throws DispatchException if the request fails
	 */
	public abstract Result handleRetrieve(CseRequest request, String originator, ResourceServices services)
			throws DispatchException;

	/**
	 * Handle CREATE.
	 * 
	 * @param request the request
	 * @param originator originator of the request
	 * @param services services of the CSE
	 * @return result
	 * @throws DispatchException if the request fails
	 */
	public Result handleCreate(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		throw new DispatchException(ResponseStatusCode.OPERATION_NOT_ALLOWED,
				"CREATE not allowed for " + getTypeTag());
	}

	/**
	 * Handle UPDATE.
	 * 
	 * @param request the request
	 * @param originator originator of the request
	 * @param services services of the CSE
	 * @return result
	 * @throws DispatchException if the request fails
	 */
	public Result handleUpdate(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		throw new DispatchException(ResponseStatusCode.OPERATION_NOT_ALLOWED,
				"UPDATE not allowed for " + getTypeTag());
	}

	/**
	 * Handle DELETE.
	 * 
	 * @param request the request
	 * @param originator originator of the request
	 * @param services services of the CSE
	 * @return result
	 * @throws DispatchException if the request fails
	 */
	public Result handleDelete(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		throw new DispatchException(ResponseStatusCode.OPERATION_NOT_ALLOWED,
				"DELETE not allowed for " + getTypeTag());
	}
}
