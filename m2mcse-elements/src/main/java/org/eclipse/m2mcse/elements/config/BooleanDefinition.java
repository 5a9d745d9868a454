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
package org.eclipse.m2mcse.elements.config;

/**
 * Boolean definition.
 */
public class BooleanDefinition extends BasicDefinition<Boolean> {

	/**
	 * Creates boolean definition with default value.
	 * 
	 * @param key key for properties. Must be unique within the module.
	 * @param documentation documentation for properties.
	 * @param defaultValue default value returned instead of {@code null}.
	 * @throws NullPointerException if key is {@code null}
	 */
	public BooleanDefinition(String key, String documentation, Boolean defaultValue) {
		super(key, documentation, Boolean.class, defaultValue);
	}

	@Override
	public String writeValue(Boolean value) {
		return value.toString();
	}

	@Override
	protected Boolean parseValue(String value) throws ValueException {
		if ("true".equalsIgnoreCase(value)) {
			return Boolean.TRUE;
		} else if ("false".equalsIgnoreCase(value)) {
			return Boolean.FALSE;
		}
		throw new ValueException("'" + value + "' is no boolean");
	}
}
