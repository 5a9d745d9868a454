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
package org.eclipse.m2mcse.core.event;

import org.eclipse.m2mcse.core.resource.Resource;

/**
 * Listener for resource changes, e.g. the notification subsystem.
 * 
 * Called on the event thread of the {@link EventDispatcher}.
 */
public interface ResourceEventListener {

	/**
	 * Called, when a resource has been created and activated.
	 * 
	 * @param resource created resource
	 * @param originator originator of the creation
	 */
	default void onCreated(Resource resource, String originator) {
	}

	/**
	 * Called, when a resource has been deleted.
	 * 
	 * @param resource deleted resource
	 * @param originator originator of the deletion
	 */
	default void onDeleted(Resource resource, String originator) {
	}
}
