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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.m2mcse.core.discovery.FilterCriteria;
import org.eclipse.m2mcse.core.discovery.FilterOperation;
import org.eclipse.m2mcse.core.discovery.FilterUsage;
import org.eclipse.m2mcse.core.util.M2MTime;
import org.eclipse.m2mcse.elements.category.Small;
import org.eclipse.m2mcse.elements.rule.TestNameLoggerRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(Small.class)
public class RequestArgumentsTest {

	@Rule
	public TestNameLoggerRule name = new TestNameLoggerRule();

	private static Map<String, List<String>> query(String... arguments) {
		Map<String, List<String>> query = new LinkedHashMap<>();
		for (String argument : arguments) {
			int index = argument.indexOf('=');
			query.computeIfAbsent(argument.substring(0, index), key -> new ArrayList<>())
					.add(argument.substring(index + 1));
		}
		return query;
	}

	@Test
	public void testDefaults() throws DispatchException {
		RequestArguments arguments = RequestArguments.parse(Collections.emptyMap(), Operation.RETRIEVE);
		assertThat(arguments.getResultContent(), is(ResultContent.ATTRIBUTES));
		assertThat(arguments.getDesiredIdentifierResultType(), is(DesiredIdentifierResultType.STRUCTURED));
		FilterCriteria criteria = arguments.getFilterCriteria();
		assertThat(criteria.getFilterUsage(), is(FilterUsage.CONDITIONAL_RETRIEVAL));
		assertThat(criteria.getFilterOperation(), is(FilterOperation.AND));
		assertThat(criteria.getLimit(), is(nullValue()));
		assertThat(criteria.getAttributes().isEmpty(), is(true));
	}

	@Test
	public void testDefaultResultContentDependsOnOperation() throws DispatchException {
		assertThat(RequestArguments.parse(query("fu=1"), Operation.RETRIEVE).getResultContent(),
				is(ResultContent.CHILD_RESOURCE_REFERENCES));
		assertThat(RequestArguments.parse(query(), Operation.DELETE).getResultContent(), is(ResultContent.NOTHING));
		assertThat(RequestArguments.parse(query(), Operation.CREATE).getResultContent(),
				is(ResultContent.ATTRIBUTES));
		assertThat(RequestArguments.parse(query(), Operation.UPDATE).getResultContent(),
				is(ResultContent.ATTRIBUTES));
	}

	@Test
	public void testHandlingAndConditions() throws DispatchException {
		RequestArguments arguments = RequestArguments.parse(query("fu=1", "rcn=11", "drt=2", "fo=2", "lim=5",
				"lvl=2", "ofst=1", "arp=la", "ty=4", "ty=3", "cty=text/plain", "lbl=a b", "lbq=tag*", "sza=10",
				"szb=100", "sts=3", "stb=1", "crb=20260101T000000", "cra=20250101T000000,5"), Operation.RETRIEVE);
		assertThat(arguments.getResultContent(), is(ResultContent.DISCOVERY_RESULT_REFERENCES));
		assertThat(arguments.getDesiredIdentifierResultType(), is(DesiredIdentifierResultType.UNSTRUCTURED));
		FilterCriteria criteria = arguments.getFilterCriteria();
		assertThat(criteria.isDiscovery(), is(true));
		assertThat(criteria.getFilterOperation(), is(FilterOperation.OR));
		assertThat(criteria.getLimit(), is(5));
		assertThat(criteria.getLevel(), is(2));
		assertThat(criteria.getOffset(), is(1));
		assertThat(criteria.getApplicableRelativePath(), is("la"));
		assertThat(criteria.getResourceTypes(), is(Arrays.asList(4, 3)));
		assertThat(criteria.getContentTypes(), is(Arrays.asList("text/plain")));
		assertThat(criteria.getLabels(), is(Arrays.asList("a", "b")));
		assertThat(criteria.getLabelQuery(), is(Arrays.asList("tag*")));
		assertThat(criteria.getSizeAbove(), is(10));
		assertThat(criteria.getSizeBelow(), is(100));
		assertThat(criteria.getStateTagSmaller(), is(3));
		assertThat(criteria.getStateTagBigger(), is(1));
		assertThat(criteria.getCreatedBefore(), is(M2MTime.parse("20260101T000000")));
		assertThat(criteria.getCreatedAfter(), is(M2MTime.parse("20250101T000000,5")));
	}

	@Test
	public void testUnknownArgumentsAreAttributePredicates() throws DispatchException {
		FilterCriteria criteria = RequestArguments.parse(query("fu=1", "api=Napp*", "rn=cnt1", "rn=cnt2"),
				Operation.RETRIEVE).getFilterCriteria();
		assertThat(criteria.getAttributes().size(), is(2));
		assertThat(criteria.getAttributes().get("api"), is(Arrays.asList("Napp*")));
		assertThat(criteria.getAttributes().get("rn"), is(Arrays.asList("cnt1", "cnt2")));
	}

	@Test
	public void testInvalidArguments() {
		assertInvalid("lim=ten");
		assertInvalid("ty=cin");
		assertInvalid("rcn=3");
		assertInvalid("fu=5");
		assertInvalid("drt=0");
		assertInvalid("fo=3");
		assertInvalid("crb=yesterday");
		assertInvalid("lim=1", "lim=2");
	}

	private static void assertInvalid(String... arguments) {
		DispatchException error = assertThrows(DispatchException.class,
				() -> RequestArguments.parse(query(arguments), Operation.RETRIEVE));
		assertThat(error.getStatus(), is(ResponseStatusCode.INVALID_ARGUMENTS));
	}
}
