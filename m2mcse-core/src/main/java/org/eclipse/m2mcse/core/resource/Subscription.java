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

import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;

import com.google.gson.JsonObject;

/**
 * Subscription to changes of the parent resource.
 * 
 * Only the record is kept here, the notifications are delivered by the
 * listeners of the event sink.
 */
public class Subscription extends Resource {

	public static final String NOTIFICATION_URIS = "nu";
	public static final String NOTIFICATION_CONTENT_TYPE = "nct";

	public Subscription(JsonObject attributes) {
		super(ResourceType.SUBSCRIPTION, attributes);
	}

	@Override
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
		validate();
		if (!hasAttribute(NOTIFICATION_CONTENT_TYPE)) {
			setAttribute(NOTIFICATION_CONTENT_TYPE, 1);
		}
	}

	@Override
	public void update(JsonObject changes, String originator, ResourceServices services) throws DispatchException {
		super.update(changes, originator, services);
		validate();
	}

	private void validate() throws DispatchException {
		if (getStringList(NOTIFICATION_URIS).isEmpty()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attribute nu is mandatory for " + getTypeTag());
		}
	}
}
