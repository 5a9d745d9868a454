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

import java.util.Arrays;

import org.eclipse.m2mcse.core.CseFixture;
import org.eclipse.m2mcse.core.resource.Container;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.eclipse.m2mcse.elements.category.Small;
import org.eclipse.m2mcse.elements.rule.TestNameLoggerRule;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.google.gson.JsonObject;

@Category(Small.class)
public class DispatcherUpdateTest {

	private static final String AE = "Cae1";
	private static final String CONTAINER = "cse-in/ae1/cnt1";

	@Rule
	public TestNameLoggerRule name = new TestNameLoggerRule();

	private CseFixture cse;

	@Before
	public void setup() throws Exception {
		cse = new CseFixture();
		cse.createAe(AE, "ae1");
		cse.createContainer(AE, "cse-in/ae1", "cnt1", "'lbl':['old']");
	}

	@After
	public void tearDown() {
		cse.stop();
	}

	@Test
	public void testUpdateAttributes() {
		Result result = cse.update(AE, CONTAINER, "{'m2m:cnt':{'lbl':['new'],'mni':10}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.UPDATED));
		Resource container = cse.store.getByPath(CONTAINER);
		assertThat(container.getLabels(), is(Arrays.asList("new")));
		assertThat(container.getInteger(Container.MAX_NR_OF_INSTANCES), is(10));
		assertThat(container.getInteger(Resource.STATE_TAG), is(1));
		assertThat(result.getBody().getAsJsonObject("m2m:cnt").get("mni").getAsInt(), is(10));
	}

	@Test
	public void testUpdateModifiedAttributes() {
		Result result = cse.update(AE, CONTAINER, "{'m2m:cnt':{'lbl':null,'mni':10}}", "rcn=9");
		assertThat(result.getStatus(), is(ResponseStatusCode.UPDATED));
		JsonObject modified = result.getBody().getAsJsonObject("m2m:cnt");
		assertThat(modified.get("mni").getAsInt(), is(10));
		assertThat(modified.has("lbl"), is(false));
		assertThat(modified.get("st").getAsInt(), is(1));
		assertThat(modified.has("lt"), is(true));
		assertThat(modified.has("rn"), is(false));
		assertThat(modified.has("ri"), is(false));
		assertThat(modified.has("__srn__"), is(false));
		assertThat(cse.store.getByPath(CONTAINER).hasAttribute("lbl"), is(false));
	}

	@Test
	public void testUpdateWithoutBody() {
		Result result = cse.update(AE, CONTAINER, "{'m2m:cnt':{'mni':10}}", "rcn=0");
		assertThat(result.getStatus(), is(ResponseStatusCode.UPDATED));
		assertThat(result.getBody(), is(nullValue()));
	}

	@Test
	public void testUpdateReadOnly() {
		Resource instance = cse.createInstance(AE, CONTAINER, "cin1", "hello");
		Result result = cse.update(AE, CONTAINER + "/cin1", "{'m2m:cin':{'lbl':['x']}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.OPERATION_NOT_ALLOWED));
		assertThat(cse.store.get(instance.getId()).toJson(), is(instance.toJson()));
	}

	@Test
	public void testUpdateUnsupportedResultContent() {
		Resource before = cse.store.getByPath(CONTAINER);
		Result result = cse.update(AE, CONTAINER, "{'m2m:cnt':{'mni':10}}", "rcn=4");
		assertThat(result.getStatus(), is(ResponseStatusCode.NOT_IMPLEMENTED));
		assertThat(cse.store.getByPath(CONTAINER).toJson(), is(before.toJson()));
	}

	@Test
	public void testUpdateWrongType() {
		assertThat(cse.update(AE, CONTAINER, "{'m2m:cin':{'mni':10}}").getStatus(),
				is(ResponseStatusCode.BAD_REQUEST));
		assertThat(cse.update(AE, CONTAINER, "{'m2m:cnt':{'mni':10},'m2m:cin':{}}").getStatus(),
				is(ResponseStatusCode.BAD_REQUEST));
		assertThat(cse.update(AE, CONTAINER, "{'m2m:cnt':5}").getStatus(), is(ResponseStatusCode.BAD_REQUEST));
	}

	@Test
	public void testUpdateImmutableAttribute() {
		assertThat(cse.update(AE, CONTAINER, "{'m2m:cnt':{'rn':'renamed'}}").getStatus(),
				is(ResponseStatusCode.BAD_REQUEST));
		assertThat(cse.update(AE, CONTAINER, "{'m2m:cnt':{'cni':5}}").getStatus(),
				is(ResponseStatusCode.BAD_REQUEST));
		assertThat(cse.update(AE, CONTAINER, "{'m2m:cnt':{'mni':-1}}").getStatus(),
				is(ResponseStatusCode.BAD_REQUEST));
		assertThat(cse.store.getByPath(CONTAINER).getName(), is("cnt1"));
	}

	@Test
	public void testUpdateNoPrivilege() {
		cse.createAe("Cother", "other");
		assertThat(cse.update("Cother", CONTAINER, "{'m2m:cnt':{'mni':10}}").getStatus(),
				is(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE));
	}

	@Test
	public void testUpdatePolicyReferences() {
		cse.createAe("Cother", "other");
		Result result = cse.create(AE, "cse-in/ae1", ResourceType.ACCESS_CONTROL_POLICY,
				"{'m2m:acp':{'rn':'acp1','pv':{'acr':[{'acor':['Cother'],'acop':63}]},"
						+ "'pvs':{'acr':[{'acor':['Cae1'],'acop':63}]}}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.CREATED));
		String policyId = result.getResource().getId();

		assertThat(cse.update("Cother", CONTAINER, "{'m2m:cnt':{'acpi':['" + policyId + "']}}").getStatus(),
				is(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE));
		assertThat(cse.update(AE, CONTAINER, "{'m2m:cnt':{'acpi':['" + policyId + "']}}").getStatus(),
				is(ResponseStatusCode.UPDATED));

		// granted by pv of the policy now
		assertThat(cse.update("Cother", CONTAINER, "{'m2m:cnt':{'mni':3}}").getStatus(),
				is(ResponseStatusCode.UPDATED));
		// but pvs doesn't grant changing the references
		assertThat(cse.update("Cother", CONTAINER, "{'m2m:cnt':{'acpi':null}}").getStatus(),
				is(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE));
	}

	@Test
	public void testReducingMaxInstancesRemovesOldest() {
		cse.createInstance(AE, CONTAINER, "cin1", "a");
		cse.createInstance(AE, CONTAINER, "cin2", "b");
		cse.createInstance(AE, CONTAINER, "cin3", "c");
		Result result = cse.update(AE, CONTAINER, "{'m2m:cnt':{'mni':1}}");
		assertThat(result.getStatus(), is(ResponseStatusCode.UPDATED));
		assertThat(cse.store.getByPath(CONTAINER + "/cin1"), is(nullValue()));
		assertThat(cse.store.getByPath(CONTAINER + "/cin2"), is(nullValue()));
		Resource container = cse.store.getByPath(CONTAINER);
		assertThat(container.getInteger(Container.CURRENT_NR_OF_INSTANCES), is(1));
		assertThat(container.getInteger(Container.MAX_NR_OF_INSTANCES), is(1));
	}
}
