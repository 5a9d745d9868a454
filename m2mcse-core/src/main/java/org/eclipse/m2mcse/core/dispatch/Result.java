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

import org.eclipse.m2mcse.core.resource.Resource;

import com.google.gson.JsonObject;

/**
 * Result of a dispatched operation.
 * 
 * Carries the status code, an optional body and an optional diagnostic
 * message. Success results may carry the affected resource, the body then
 * defaults to the JSON presentation of that resource.
 */
public final class Result {

	private final ResponseStatusCode status;
	private final Resource resource;
	private final JsonObject body;
	private final String message;

	private Result(ResponseStatusCode status, Resource resource, JsonObject body, String message) {
		if (status == null) {
			throw new NullPointerException("status must not be null!");
		}
		this.status = status;
		this.resource = resource;
		this.body = body;
		this.message = message;
	}

	/**
	 * Create result for a resource.
	 * 
	 * @param status status code
	 * @param resource affected resource. May be {@code null}.
	 * @return result
	 */
	public static Result of(ResponseStatusCode status, Resource resource) {
		return new Result(status, resource, null, null);
	}

	/**
	 * Create result with explicit body.
	 * 
	 * @param status status code
	 * @param resource affected resource. May be {@code null}.
	 * @param body response body. May be {@code null} for no body.
	 * @return result
	 */
	public static Result of(ResponseStatusCode status, Resource resource, JsonObject body) {
		return new Result(status, resource, body == null ? new JsonObject() : body, null);
	}

	/**
	 * Create result without body.
	 * 
	 * @param status status code
	 * @return result
	 */
	public static Result empty(ResponseStatusCode status) {
		return new Result(status, null, null, null);
	}

	/**
	 * Create error result.
	 * 
	 * @param status error status code
	 * @param message diagnostic message
	 * @return error result
	 * @throws IllegalArgumentException if the status code is a success code.
	 */
	public static Result error(ResponseStatusCode status, String message) {
		if (status.isSuccess()) {
			throw new IllegalArgumentException("status code " + status + " must be an error-code!");
		}
		return new Result(status, null, null, message);
	}

	public ResponseStatusCode getStatus() {
		return status;
	}

	public boolean isSuccess() {
		return status.isSuccess();
	}

	/**
	 * Get affected resource.
	 * 
	 * @return affected resource, or {@code null}, if not available.
	 */
	public Resource getResource() {
		return resource;
	}

	/**
	 * Get response body.
	 * 
	 * @return explicit body, or the JSON presentation of the resource, or
	 *         {@code null}, if the result has no body.
	 */
	public JsonObject getBody() {
		if (body != null) {
			return body;
		}
		return resource == null ? null : resource.toJson();
	}

	/**
	 * Get diagnostic message.
	 * 
	 * @return diagnostic message, or {@code null}, if not available.
	 */
	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		if (message != null) {
			return status + ": " + message;
		}
		return status.toString();
	}
}
