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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * List of strings definition.
 *
 * The textual presentation is a comma separated list. The stored lists are
 * unmodifiable.
 */
public class StringListDefinition extends BasicDefinition<List<String>> {

	/**
	 * Creates string list definition with default values.
	 * 
	 * @param key key for properties. Must be unique within the module.
	 * @param documentation documentation for properties.
	 * @param defaultValues default values.
	 * @throws NullPointerException if key is {@code null}
	 */
	@SuppressWarnings("unchecked")
	public StringListDefinition(String key, String documentation, String... defaultValues) {
		super(key, documentation, (Class<List<String>>) (Class<?>) List.class,
				Collections.unmodifiableList(Arrays.asList(defaultValues)));
	}

	@Override
	public String writeValue(List<String> value) {
		return String.join(",", value);
	}

	@Override
	public List<String> checkValue(List<String> value) throws ValueException {
		if (value == null) {
			return null;
		}
		for (String item : value) {
			if (item == null || item.isEmpty()) {
				throw new ValueException("List " + value + " must not contain empty values!");
			}
		}
		return Collections.unmodifiableList(new ArrayList<>(value));
	}

	@Override
	protected List<String> parseValue(String value) {
		List<String> result = new ArrayList<>();
		for (String item : value.split(",")) {
			String trimmed = item.trim();
			if (!trimmed.isEmpty()) {
				result.add(trimmed);
			}
		}
		return result;
	}
}
