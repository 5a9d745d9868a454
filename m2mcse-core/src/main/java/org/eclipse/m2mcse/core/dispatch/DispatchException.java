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
 * Exception reporting an error dispatching a request.
 * 
 * Converted into an error {@link Result} at the entry points of the
 * {@link Dispatcher}.
 */
public class DispatchException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Error status code.
	 */
	private final ResponseStatusCode status;

	/**
	 * Create a dispatch error.
	 * 
	 * @param status error status code
	 * @param message diagnostic message
	 * @throws NullPointerException if status is {@code null}.
	 * @throws IllegalArgumentException if status code is no error.
	 */
	public DispatchException(ResponseStatusCode status, String message) {
		super(message);
		if (status == null) {
			throw new NullPointerException("status must not be null!");
		}
		if (status.isSuccess()) {
			throw new IllegalArgumentException("status code " + status + " must be an error-code!");
		}
		this.status = status;
	}

	/**
	 * Get error status code.
	 * 
	 * @return error status code
	 */
	public ResponseStatusCode getStatus() {
		return status;
	}

	/**
	 * Convert into error result.
	 * 
	 * @return error result
	 */
	public Result toResult() {
		return Result.error(status, getMessage());
	}
}
