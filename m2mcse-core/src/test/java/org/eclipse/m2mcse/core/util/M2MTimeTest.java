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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.time.Instant;

import org.eclipse.m2mcse.elements.category.Small;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(Small.class)
public class M2MTimeTest {

	@Test
	public void testFormat() {
		assertThat(M2MTime.format(Instant.parse("2026-03-04T05:06:07.123456789Z")), is("20260304T050607,123456"));
		assertThat(M2MTime.format(Instant.parse("2026-03-04T05:06:07Z")), is("20260304T050607,000000"));
	}

	@Test
	public void testParse() {
		assertThat(M2MTime.parse("20260304T050607"), is(Instant.parse("2026-03-04T05:06:07Z")));
		assertThat(M2MTime.parse("20260304T050607,5"), is(Instant.parse("2026-03-04T05:06:07.500Z")));
		assertThat(M2MTime.parse(" 20260304T050607,000123 "), is(Instant.parse("2026-03-04T05:06:07.000123Z")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testParseMalformed() {
		M2MTime.parse("2026-03-04T05:06:07");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testParseInvalidDate() {
		M2MTime.parse("20261304T050607");
	}

	@Test(expected = NullPointerException.class)
	public void testParseNull() {
		M2MTime.parse(null);
	}
}
