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

import java.util.HashMap;
import java.util.Map;

/**
 * Response status codes.
 * 
 * The numeric values are the oneM2M response status codes, the first digit
 * selects the class: 2 success, 4 originator error, 5 receiver error, 6
 * network error.
 */
public enum ResponseStatusCode {

	// Success
	OK(2000),
	CREATED(2001),
	DELETED(2002),
	UPDATED(2004),

	// Originator error
	BAD_REQUEST(4000),
	NOT_FOUND(4004),
	OPERATION_NOT_ALLOWED(4005),
	ORIGINATOR_HAS_NO_PRIVILEGE(4103),
	CONFLICT(4105),
	SECURITY_ASSOCIATION_REQUIRED(4107),
	INVALID_CHILD_RESOURCE_TYPE(4108),

	// Receiver error
	INTERNAL_SERVER_ERROR(5000),
	NOT_IMPLEMENTED(5001),
	TARGET_NOT_REACHABLE(5103),
	TARGET_NOT_SUBSCRIBABLE(5203),
	MAX_NUMBER_OF_MEMBER_EXCEEDED(6010),
	INVALID_ARGUMENTS(6023);

	private static final Map<Integer, ResponseStatusCode> CODES = new HashMap<>();

	static {
		for (ResponseStatusCode code : values()) {
			CODES.put(code.value, code);
		}
	}

	/** The code value. */
	public final int value;

	private ResponseStatusCode(int value) {
		this.value = value;
	}

	/**
	 * Checks, if the code reports a success.
	 * 
	 * @return {@code true}, for 2xxx codes, {@code false}, otherwise.
	 */
	public boolean isSuccess() {
		return value / 1000 == 2;
	}

	/**
	 * Converts the specified integer value to a response status code.
	 * 
	 * @param value the integer value
	 * @return the response status code
	 * @throws IllegalArgumentException if the integer value is unrecognized.
	 */
	public static ResponseStatusCode fromValue(int value) {
		ResponseStatusCode code = CODES.get(value);
		if (code == null) {
			throw new IllegalArgumentException("Unknown response status code " + value);
		}
		return code;
	}

	@Override
	public String toString() {
		return value + "/" + name();
	}
}
