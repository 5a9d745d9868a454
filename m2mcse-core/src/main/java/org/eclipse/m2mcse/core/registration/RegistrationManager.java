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
package org.eclipse.m2mcse.core.registration;

import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.resource.Resource;

/**
 * Registration bookkeeping of created and deleted resources.
 */
public interface RegistrationManager {

	/**
	 * Check and record the creation of a resource.
	 * 
	 * @param resource resource to create, not yet persisted. May be
	 *            modified, e.g. an assigned AE-ID.
	 * @param originator originator of the request
	 * @param parent parent of the resource
	 * @return effective originator for the further processing
	 * @throws DispatchException if the creation is refused
	 */
	String checkResourceCreation(Resource resource, String originator, Resource parent) throws DispatchException;

	/**
	 * Check and record the deletion of a resource.
	 * 
	 * @param resource resource to delete
	 * @param originator originator of the request
	 * @throws DispatchException if the deletion is refused
	 */
	void checkResourceDeletion(Resource resource, String originator) throws DispatchException;
}
