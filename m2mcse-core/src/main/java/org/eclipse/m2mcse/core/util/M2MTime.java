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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timestamps in oneM2M basic format, {@code yyyyMMdd'T'HHmmss} with optional
 * {@code ,ffffff} fraction, always UTC.
 */
public final class M2MTime {

	private static final DateTimeFormatter BASIC = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
	private static final Pattern TIMESTAMP = Pattern.compile("(\\d{8}T\\d{6})(?:,(\\d{1,9}))?");

	private M2MTime() {
	}

	/**
	 * Current time.
	 * 
	 * @return current time with microseconds
	 */
	public static String now() {
		return format(Instant.now());
	}

	/**
	 * Format instant.
	 * 
	 * @param instant instant to format
	 * @return formatted time with microseconds
	 */
	public static String format(Instant instant) {
		LocalDateTime time = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
		return BASIC.format(time) + String.format(",%06d", time.getNano() / 1000);
	}

	/**
	 * Parse timestamp.
	 * 
	 * @param timestamp timestamp in basic format
	 * @return parsed instant
	 * @throws NullPointerException if timestamp is {@code null}
	 * @throws IllegalArgumentException if timestamp could not be parsed
	 */
	public static Instant parse(String timestamp) {
		if (timestamp == null) {
			throw new NullPointerException("timestamp must not be null!");
		}
		Matcher matcher = TIMESTAMP.matcher(timestamp.trim());
		if (!matcher.matches()) {
			throw new IllegalArgumentException("'" + timestamp + "' is no valid timestamp!");
		}
		try {
			LocalDateTime time = LocalDateTime.parse(matcher.group(1), BASIC);
			String fraction = matcher.group(2);
			if (fraction != null) {
				StringBuilder nanos = new StringBuilder(fraction);
				while (nanos.length() < 9) {
					nanos.append('0');
				}
				time = time.withNano(Integer.parseInt(nanos.toString()));
			}
			return time.toInstant(ZoneOffset.UTC);
		} catch (DateTimeParseException ex) {
			throw new IllegalArgumentException("'" + timestamp + "' is no valid timestamp!", ex);
		}
	}
}
