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

import org.eclipse.m2mcse.elements.Definition;

/**
 * Documented configuration definition with optional default value.
 *
 * @param <T> value type
 * @see Configuration#get(BasicDefinition)
 * @see Configuration#set(BasicDefinition, Object)
 */
public abstract class BasicDefinition<T> extends Definition<T> {

	/**
	 * Documentation for properties.
	 */
	private final String documentation;
	/**
	 * Default value.
	 */
	private final T defaultValue;

	/**
	 * Creates definition with default value.
	 * 
	 * If the configuration value is mainly used with primitive types (e.g.
	 * `int`), {@code null} causes a {@link NullPointerException} on access.
	 * To prevent that, the default value is returned instead of a
	 * {@code null}.
	 * 
	 * @param key key for properties. Must be unique within the module.
	 * @param documentation documentation for properties.
	 * @param valueType value type.
	 * @param defaultValue default value returned instead of {@code null}.
	 * @throws NullPointerException if key is {@code null}
	 */
	protected BasicDefinition(String key, String documentation, Class<T> valueType, T defaultValue) {
		super(key, valueType);
		this.documentation = documentation;
		this.defaultValue = defaultValue;
	}

	/**
	 * Gets documentation for properties.
	 * 
	 * @return documentation for properties
	 */
	public String getDocumentation() {
		return documentation;
	}

	/**
	 * Gets the default-value.
	 * 
	 * @return default-value, returned by
	 *         {@link Configuration#get(BasicDefinition)} instead of
	 *         {@code null}.
	 */
	public T getDefaultValue() {
		return defaultValue;
	}

	/**
	 * Write typed value in textual presentation.
	 * 
	 * @param value value as type
	 * @return value in textual presentation
	 * @throws NullPointerException if value is {@code null}.
	 */
	public abstract String writeValue(T value);

	/**
	 * Reads textual presentation to type.
	 * 
	 * The textual value is trimmed before parsing.
	 * 
	 * @param value value in textual presentation.
	 * @return value as type
	 * @throws NullPointerException if value is {@code null}
	 * @throws IllegalArgumentException if value is empty or could not parsed.
	 */
	public T readValue(String value) {
		if (value == null) {
			throw new NullPointerException(String.format("Key '%s': textual value must not be null!", getKey()));
		}
		value = value.trim();
		if (value.isEmpty()) {
			throw new IllegalArgumentException(
					String.format("Key '%s': textual value must not be empty!", getKey()));
		}
		String errorMessage;
		try {
			return checkValue(parseValue(value));
		} catch (NumberFormatException e) {
			errorMessage = String.format("Key '%s': value '%s' is no %s", getKey(), value,
					getValueType().getSimpleName());
		} catch (ValueException e) {
			errorMessage = String.format("Key '%s': %s", getKey(), e.getMessage());
		}
		throw new IllegalArgumentException(errorMessage);
	}

	/**
	 * Check, if value is valid.
	 * 
	 * @param value value to check
	 * @return the value to store.
	 * @throws ValueException if the value is not valid, e.g. out of the
	 *             intended range.
	 */
	public T checkValue(T value) throws ValueException {
		return value;
	}

	/**
	 * Parse textual presentation to type.
	 * 
	 * @param value trimmed, none empty value in textual presentation.
	 * @return value as type
	 * @throws ValueException if the textual value doesn't fit.
	 */
	protected abstract T parseValue(String value) throws ValueException;
}
