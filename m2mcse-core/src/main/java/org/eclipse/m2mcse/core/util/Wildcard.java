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
package org.eclipse.m2mcse.core.util;

import java.util.regex.Pattern;

/**
 * Simple patterns, where "*" matches any sequence of characters.
 */
public final class Wildcard {

	private Wildcard() {
	}

	/**
	 * Match value against pattern.
	 * 
	 * @param pattern pattern, "*" matches any sequence
	 * @param value value to match
	 * @return {@code true}, if the complete value matches
	 */
	public static boolean matches(String pattern, String value) {
		if (pattern.equals(value)) {
			return true;
		}
		if (pattern.indexOf('*') < 0) {
			return false;
		}
		String[] parts = pattern.split("\\*", -1);
		StringBuilder regex = new StringBuilder();
		for (int index = 0; index < parts.length; ++index) {
			if (index > 0) {
				regex.append(".*");
			}
			regex.append(Pattern.quote(parts[index]));
		}
		return Pattern.matches(regex.toString(), value);
	}
}
