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
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import org.eclipse.m2mcse.core.CseFixture;
import org.eclipse.m2mcse.core.resource.Container;
import org.eclipse.m2mcse.core.resource.Group;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.eclipse.m2mcse.elements.category.Small;
import org.eclipse.m2mcse.elements.rule.TestNameLoggerRule;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Requests distributed by the fan-out point of a group.
 * 
 * <pre>
 * cse-in/ae1/cnt1
 *           /cnt2
 *           /grp1 (mid cnt1 by path, cnt2 by id)
 *                /fopt
 * </pre>
 */
@Category(Small.class)
public class DispatcherFanOutTest {

	private static final String AE = "Cae1";
	private static final String GROUP = "cse-in/ae1/grp1";
	private static final String FAN_OUT = GROUP + "/fopt";

	@Rule
	public TestNameLoggerRule name = new TestNameLoggerRule();

	private CseFixture cse;
	private Resource cnt2;

	@Before
	public void setup() throws Exception {
		cse = new CseFixture();
		cse.createAe(AE, "ae1");
		cse.createContainer(AE, "cse-in/ae1", "cnt1");
		cnt2 = cse.createContainer(AE, "cse-in/ae1", "cnt2");
		Result result = cse.create(AE, "cse-in/ae1", ResourceType.GROUP,
				"{'m2m:grp':{'rn':'grp1','mt':3,'mnm':10,'mid':['cse-in/ae1/cnt1','" + cnt2.getId() + "']}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.CREATED));
	}

	@After
	public void tearDown() {
		cse.stop();
	}

	private static JsonArray responses(Result result) {
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		return result.getBody().getAsJsonObject("m2m:agr").getAsJsonArray("m2m:rsp");
	}

	@Test
	public void testGroupHasFanOutPoint() {
		Resource fanOutPoint = cse.store.getByPath(FAN_OUT);
		assertThat(fanOutPoint, is(notNullValue()));
		assertThat(fanOutPoint.getType(), is(ResourceType.GROUP_FAN_OUT_POINT));
		Resource group = cse.store.getByPath(GROUP);
		assertThat(group.getInteger(Group.CURRENT_NR_OF_MEMBERS), is(2));
	}

	@Test
	public void testRetrieveFanOut() {
		JsonArray responses = responses(cse.retrieve(AE, FAN_OUT));
		assertThat(responses.size(), is(2));
		JsonObject first = responses.get(0).getAsJsonObject();
		assertThat(first.get("to").getAsString(), is("cse-in/ae1/cnt1"));
		assertThat(first.get("rsc").getAsInt(), is(ResponseStatusCode.OK.value));
		assertThat(first.getAsJsonObject("pc").getAsJsonObject("m2m:cnt").get("rn").getAsString(), is("cnt1"));
		JsonObject second = responses.get(1).getAsJsonObject();
		assertThat(second.get("to").getAsString(), is(cnt2.getId()));
		assertThat(second.getAsJsonObject("pc").getAsJsonObject("m2m:cnt").get("rn").getAsString(), is("cnt2"));
	}

	@Test
	public void testCreateFanOut() {
		JsonArray responses = responses(cse.create(AE, FAN_OUT, ResourceType.CONTENT_INSTANCE,
				"{'m2m:cin':{'rn':'cin1','con':'hello'}}"));
		assertThat(responses.size(), is(2));
		for (int index = 0; index < responses.size(); ++index) {
			assertThat(responses.get(index).getAsJsonObject().get("rsc").getAsInt(),
					is(ResponseStatusCode.CREATED.value));
		}
		assertThat(cse.store.getByPath("cse-in/ae1/cnt1/cin1"), is(notNullValue()));
		assertThat(cse.store.getByPath("cse-in/ae1/cnt2/cin1"), is(notNullValue()));
		assertThat(cse.store.get(cnt2.getId()).getInteger(Container.CURRENT_NR_OF_INSTANCES), is(1));
	}

	@Test
	public void testFanOutWithSubPath() {
		cse.createInstance(AE, "cse-in/ae1/cnt1", "cin1", "one");
		JsonArray responses = responses(cse.retrieve(AE, FAN_OUT + "/la"));
		assertThat(responses.size(), is(2));
		JsonObject first = responses.get(0).getAsJsonObject();
		assertThat(first.get("to").getAsString(), is("cse-in/ae1/cnt1/la"));
		assertThat(first.get("rsc").getAsInt(), is(ResponseStatusCode.OK.value));
		assertThat(first.getAsJsonObject("pc").getAsJsonObject("m2m:cin").get("con").getAsString(), is("one"));
		JsonObject second = responses.get(1).getAsJsonObject();
		assertThat(second.get("rsc").getAsInt(), is(ResponseStatusCode.NOT_FOUND.value));
	}

	@Test
	public void testFanOutNoPrivilege() {
		cse.createAe("Cother", "other");
		Result result = cse.retrieve("Cother", FAN_OUT);
		assertThat(result.getStatus(), is(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE));
	}

	@Test
	public void testRecursiveFanOutRefused() {
		Result result = cse.update(AE, GROUP, "{'m2m:grp':{'mid':['" + FAN_OUT + "']}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.UPDATED));
		JsonArray responses = responses(cse.retrieve(AE, FAN_OUT));
		assertThat(responses.size(), is(1));
		assertThat(responses.get(0).getAsJsonObject().get("rsc").getAsInt(),
				is(ResponseStatusCode.OPERATION_NOT_ALLOWED.value));
	}

	@Test
	public void testMutualFanOutRefused() {
		Result result = cse.create(AE, "cse-in/ae1", ResourceType.GROUP,
				"{'m2m:grp':{'rn':'ga','mt':3,'mnm':10,'mid':['cse-in/ae1/gb/fopt']}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.CREATED));
		result = cse.create(AE, "cse-in/ae1", ResourceType.GROUP,
				"{'m2m:grp':{'rn':'gb','mt':3,'mnm':10,'mid':['cse-in/ae1/ga/fopt']}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.CREATED));

		JsonArray responses = responses(cse.retrieve(AE, "cse-in/ae1/ga/fopt"));
		assertThat(responses.size(), is(1));
		JsonObject outer = responses.get(0).getAsJsonObject();
		assertThat(outer.get("to").getAsString(), is("cse-in/ae1/gb/fopt"));
		assertThat(outer.get("rsc").getAsInt(), is(ResponseStatusCode.OK.value));
		JsonArray nested = outer.getAsJsonObject("pc").getAsJsonObject("m2m:agr").getAsJsonArray("m2m:rsp");
		assertThat(nested.size(), is(1));
		JsonObject inner = nested.get(0).getAsJsonObject();
		assertThat(inner.get("to").getAsString(), is("cse-in/ae1/ga/fopt"));
		assertThat(inner.get("rsc").getAsInt(), is(ResponseStatusCode.OPERATION_NOT_ALLOWED.value));

		// the expansion marker is released after the request
		responses = responses(cse.retrieve(AE, "cse-in/ae1/gb/fopt"));
		assertThat(responses.get(0).getAsJsonObject().get("rsc").getAsInt(), is(ResponseStatusCode.OK.value));
	}

	@Test
	public void testMaxMembersExceeded() {
		int size = cse.store.size();
		Result result = cse.create(AE, "cse-in/ae1", ResourceType.GROUP,
				"{'m2m:grp':{'rn':'grp2','mt':3,'mnm':1,'mid':['cse-in/ae1/cnt1','" + cnt2.getId() + "']}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.MAX_NUMBER_OF_MEMBER_EXCEEDED));
		assertThat(cse.store.size(), is(size));
	}
}
