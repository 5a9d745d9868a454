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
package org.eclipse.m2mcse.core.server;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import org.eclipse.m2mcse.core.config.CseConfig;
import org.eclipse.m2mcse.core.dispatch.CseRequest;
import org.eclipse.m2mcse.core.dispatch.Operation;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;
import org.eclipse.m2mcse.core.dispatch.Result;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.eclipse.m2mcse.core.store.InMemoryResourceStore;
import org.eclipse.m2mcse.core.store.ResourceStore;
import org.eclipse.m2mcse.elements.category.Small;
import org.eclipse.m2mcse.elements.config.Configuration;
import org.eclipse.m2mcse.elements.rule.TestNameLoggerRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(Small.class)
public class CseRuntimeTest {

	@Rule
	public TestNameLoggerRule name = new TestNameLoggerRule();

	@Test
	public void testStartCreatesCseBaseAndAdminPolicy() throws Exception {
		CseRuntime runtime = new CseRuntime(new Configuration(CseConfig.DEFINITIONS));
		runtime.start();
		try {
			assertThat(runtime.isRunning(), is(true));
			ResourceStore store = runtime.getStore();
			Resource cseBase = store.get("id-in");
			assertThat(cseBase.getType(), is(ResourceType.CSE_BASE));
			assertThat(cseBase.getStructuredPath(), is("cse-in"));
			Resource policy = store.getByPath("cse-in/" + CseRuntime.ADMIN_POLICY_NAME);
			assertThat(policy, is(notNullValue()));
			assertThat(cseBase.getAccessControlPolicyIds().get(0), is(policy.getId()));
			assertThat(store.size(), is(2));
		} finally {
			runtime.stop();
		}
		assertThat(runtime.isRunning(), is(false));
	}

	@Test
	public void testConfiguredIdentity() throws Exception {
		Configuration config = new Configuration(CseConfig.DEFINITIONS);
		String properties = "CSE.ID=id-mn\nCSE.RESOURCE_ID=id-mn\nCSE.RESOURCE_NAME=cse-mn\nCSE.ADMIN_ORIGINATOR=CRoot\n";
		config.load(new ByteArrayInputStream(properties.getBytes(StandardCharsets.UTF_8)));
		CseRuntime runtime = new CseRuntime(config);
		runtime.start();
		try {
			Result result = runtime.getDispatcher()
					.process(CseRequest.builder(Operation.RETRIEVE, "/id-mn/cse-mn").originator("CRoot").build());
			assertThat(result.getStatus(), is(ResponseStatusCode.OK));
			assertThat(result.getBody().getAsJsonObject("m2m:cb").get("csi").getAsString(), is("/id-mn"));
			result = runtime.getDispatcher()
					.process(CseRequest.builder(Operation.RETRIEVE, "cse-mn").originator("CAdmin").build());
			assertThat(result.getStatus(), is(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE));
		} finally {
			runtime.stop();
		}
	}

	@Test
	public void testRestartKeepsStore() throws Exception {
		Configuration config = new Configuration(CseConfig.DEFINITIONS);
		InMemoryResourceStore store = new InMemoryResourceStore();
		CseRuntime runtime = new CseRuntime(config, store, null);
		runtime.start();
		runtime.stop();
		int size = store.size();
		CseRuntime restarted = new CseRuntime(config, store, null);
		restarted.start();
		restarted.stop();
		assertThat(store.size(), is(size));
	}

	@Test(expected = IllegalStateException.class)
	public void testStartTwice() throws Exception {
		CseRuntime runtime = new CseRuntime(new Configuration(CseConfig.DEFINITIONS));
		runtime.start();
		try {
			runtime.start();
		} finally {
			runtime.stop();
		}
	}
}
