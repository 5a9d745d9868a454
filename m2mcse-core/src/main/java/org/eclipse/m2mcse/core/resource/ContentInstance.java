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

import java.nio.charset.StandardCharsets;

import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Content instance, immutable after creation.
 */
public class ContentInstance extends Resource {

	public static final String CONTENT = "con";
	public static final String CONTENT_SIZE = "cs";
	public static final String CONTENT_INFO = "cnf";

	public ContentInstance(JsonObject attributes) {
		super(ResourceType.CONTENT_INSTANCE, attributes);
	}

	@Override
	public boolean isReadOnly() {
		return true;
	}

	@Override
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
		JsonElement content = getAttribute(CONTENT);
		if (content == null) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attribute con is mandatory for " + getTypeTag());
		}
		String text = content.isJsonPrimitive() ? content.getAsString() : content.toString();
		int size = text.getBytes(StandardCharsets.UTF_8).length;
		if (parent instanceof Container) {
			Integer maxSize = ((Container) parent).getMaxByteSize();
			if (maxSize != null && size > maxSize) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST,
						"content size " + size + " exceeds maximum byte size " + maxSize + " of container");
			}
		}
		setAttribute(CONTENT_SIZE, size);
		setAttribute(STATE_TAG, 0);
	}

	/**
	 * Get content size of a content instance.
	 * 
	 * @param instance content instance
	 * @return content size, {@code 0}, if not available.
	 */
	static long sizeOf(Resource instance) {
		Integer size = instance.getInteger(CONTENT_SIZE);
		return size == null ? 0 : size;
	}
}
