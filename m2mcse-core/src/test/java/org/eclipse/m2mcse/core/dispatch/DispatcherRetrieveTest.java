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

import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.eclipse.m2mcse.core.CseFixture;
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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Retrieve and discovery on the tree
 * 
 * <pre>
 * cse-in/ae1/cnt1/cin1
 *                /cin2 (lbl tag1)
 *                /cnt2/cin3
 * </pre>
 */
@Category(Small.class)
public class DispatcherRetrieveTest {

	private static final String AE = "Cae1";
	private static final String CONTAINER = "cse-in/ae1/cnt1";

	@Rule
	public TestNameLoggerRule name = new TestNameLoggerRule();

	private CseFixture cse;
	private Resource cin1;
	private Resource cin2;
	private Resource cin3;

	@Before
	public void setup() throws Exception {
		cse = new CseFixture();
		cse.createAe(AE, "ae1");
		cse.createContainer(AE, "cse-in/ae1", "cnt1");
		cin1 = cse.createInstance(AE, CONTAINER, "cin1", "one");
		Result result = cse.create(AE, CONTAINER, ResourceType.CONTENT_INSTANCE,
				"{'m2m:cin':{'rn':'cin2','lbl':['tag1'],'cnf':'application/json:0','con':'two'}}");
		cin2 = result.getResource();
		cse.createContainer(AE, CONTAINER, "cnt2");
		cin3 = cse.createInstance(AE, CONTAINER + "/cnt2", "cin3", "three");
	}

	@After
	public void tearDown() {
		cse.stop();
	}

	private static List<String> values(JsonArray references) {
		List<String> values = new ArrayList<>();
		for (JsonElement reference : references) {
			values.add(reference.getAsJsonObject().get("val").getAsString());
		}
		return values;
	}

	private static JsonArray referenceList(Result result) {
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		return result.getBody().getAsJsonObject("m2m:rrl").getAsJsonArray("rrf");
	}

	@Test
	public void testRetrieveAttributes() {
		Result result = cse.retrieve(AE, CONTAINER);
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		JsonObject container = result.getBody().getAsJsonObject("m2m:cnt");
		assertThat(container.get("rn").getAsString(), is("cnt1"));
		assertThat(container.get("cni").getAsInt(), is(2));
		assertThat(container.has("__srn__"), is(false));
	}

	@Test
	public void testRetrieveNotFound() {
		assertThat(cse.retrieve(AE, CONTAINER + "/unknown").getStatus(), is(ResponseStatusCode.NOT_FOUND));
		assertThat(cse.retrieve(AE, "unknown").getStatus(), is(ResponseStatusCode.NOT_FOUND));
	}

	@Test
	public void testRetrieveNoPrivilege() {
		cse.createAe("Cother", "other");
		assertThat(cse.retrieve("Cother", CONTAINER).getStatus(), is(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE));
		assertThat(cse.retrieve("Cother", CONTAINER, "fu=1").getStatus(),
				is(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE));
	}

	@Test
	public void testRetrieveWithChildResources() {
		Result result = cse.retrieve(AE, CONTAINER, "rcn=4");
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		JsonObject container = result.getBody().getAsJsonObject("m2m:cnt");
		assertThat(container.get("rn").getAsString(), is("cnt1"));
		assertThat(container.getAsJsonArray("m2m:cin").size(), is(2));
		JsonArray containers = container.getAsJsonArray("m2m:cnt");
		assertThat(containers.size(), is(1));
		JsonObject child = containers.get(0).getAsJsonObject();
		assertThat(child.get("rn").getAsString(), is("cnt2"));
		assertThat(child.getAsJsonArray("m2m:cin").size(), is(1));
		assertThat(child.getAsJsonArray("m2m:cin").get(0).getAsJsonObject().get("rn").getAsString(), is("cin3"));
		assertThat(container.has("m2m:la"), is(false));
		assertThat(container.has("m2m:ol"), is(false));
	}

	@Test
	public void testRetrieveWithChildResourceReferences() {
		Result result = cse.retrieve(AE, CONTAINER, "rcn=5");
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		JsonObject container = result.getBody().getAsJsonObject("m2m:cnt");
		assertThat(container.get("rn").getAsString(), is("cnt1"));
		assertThat(values(container.getAsJsonArray("ch")),
				is(Arrays.asList(CONTAINER + "/cin1", CONTAINER + "/cin2", CONTAINER + "/cnt2", CONTAINER + "/cnt2/cin3")));

		result = cse.retrieve(AE, CONTAINER, "rcn=5", "lvl=1");
		container = result.getBody().getAsJsonObject("m2m:cnt");
		assertThat(container.getAsJsonArray("ch").size(), is(3));
	}

	@Test
	public void testRetrieveChildReferences() {
		JsonArray references = referenceList(cse.retrieve(AE, CONTAINER, "rcn=6", "drt=2"));
		assertThat(values(references), is(Arrays.asList(cin1.getId(), cin2.getId(),
				cse.store.getByPath(CONTAINER + "/cnt2").getId(), cin3.getId())));
		JsonObject reference = references.get(0).getAsJsonObject();
		assertThat(reference.get("nm").getAsString(), is("cin1"));
		assertThat(reference.get("typ").getAsInt(), is(4));
	}

	@Test
	public void testRetrieveChildResources() {
		Result result = cse.retrieve(AE, CONTAINER, "rcn=8");
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		JsonObject container = result.getBody().getAsJsonObject("m2m:cnt");
		assertThat(container.has("rn"), is(false));
		assertThat(container.getAsJsonArray("m2m:cin").size(), is(2));
	}

	@Test
	public void testRetrieveUnsupportedResultContent() {
		assertThat(cse.retrieve(AE, CONTAINER, "rcn=9").getStatus(), is(ResponseStatusCode.INVALID_ARGUMENTS));
		assertThat(cse.retrieve(AE, CONTAINER, "rcn=0").getStatus(), is(ResponseStatusCode.INVALID_ARGUMENTS));
		assertThat(cse.retrieve(AE, CONTAINER, "fu=1", "rcn=9").getStatus(),
				is(ResponseStatusCode.INVALID_ARGUMENTS));
		assertThat(cse.retrieve(AE, CONTAINER, "lim=x").getStatus(), is(ResponseStatusCode.INVALID_ARGUMENTS));
	}

	@Test
	public void testDiscoveryWithAttributesIsRetrieval() {
		Result result = cse.retrieve(AE, CONTAINER, "fu=1", "rcn=1", "ty=4");
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		JsonObject container = result.getBody().getAsJsonObject("m2m:cnt");
		assertThat(container.get("rn").getAsString(), is("cnt1"));
		assertThat(container.has("m2m:cin"), is(false));
		assertThat(result.getBody().has("m2m:rrl"), is(false));
	}

	@Test
	public void testDiscoverByResourceType() {
		JsonArray references = referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "ty=4"));
		assertThat(values(references),
				is(Arrays.asList(CONTAINER + "/cin1", CONTAINER + "/cin2", CONTAINER + "/cnt2/cin3")));
	}

	@Test
	public void testDiscoverUriList() {
		Result result = cse.retrieve(AE, CONTAINER, "fu=1", "ty=4", "rcn=11", "drt=2");
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		JsonArray uris = result.getBody().getAsJsonArray("m2m:uril");
		assertThat(uris.size(), is(3));
		assertThat(uris.get(2).getAsString(), is(cin3.getId()));
	}

	@Test
	public void testDiscoverWithLimitAndOffset() {
		assertThat(values(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "ty=4", "lim=2"))),
				is(Arrays.asList(CONTAINER + "/cin1", CONTAINER + "/cin2")));
		assertThat(values(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "ty=4", "ofst=1"))),
				is(Arrays.asList(CONTAINER + "/cin2", CONTAINER + "/cnt2/cin3")));
		assertThat(values(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "ty=4", "lvl=1"))),
				is(Arrays.asList(CONTAINER + "/cin1", CONTAINER + "/cin2")));
	}

	@Test
	public void testDiscoverWithFilterOperation() {
		assertThat(values(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "ty=4", "lbl=tag1"))),
				is(Arrays.asList(CONTAINER + "/cin2")));
		assertThat(values(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "ty=3", "lbl=tag1", "fo=2"))),
				is(Arrays.asList(CONTAINER + "/cin2", CONTAINER + "/cnt2")));
	}

	@Test
	public void testDiscoverByConditions() {
		assertThat(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "ty=4", "cra=20000101T000000")).size(),
				is(3));
		assertThat(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "crb=20000101T000000")).size(), is(0));
		assertThat(values(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "cty=application/json"))),
				is(Arrays.asList(CONTAINER + "/cin2")));
		assertThat(values(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "sza=5"))),
				is(Arrays.asList(CONTAINER + "/cnt2/cin3")));
		assertThat(values(referenceList(cse.retrieve(AE, CONTAINER, "fu=1", "rn=cin*"))),
				is(Arrays.asList(CONTAINER + "/cin1", CONTAINER + "/cin2", CONTAINER + "/cnt2/cin3")));
	}

	@Test
	public void testDiscoverWithApplicableRelativePath() {
		assertThat(values(referenceList(cse.retrieve(AE, "cse-in/ae1", "fu=1", "ty=3", "arp=cin1"))),
				is(Arrays.asList(CONTAINER + "/cin1")));
	}

	@Test
	public void testDiscoverTree() {
		Result result = cse.retrieve(AE, CONTAINER, "fu=1", "ty=4", "rcn=4");
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		JsonObject container = result.getBody().getAsJsonObject("m2m:cnt");
		assertThat(container.get("rn").getAsString(), is("cnt1"));
		assertThat(container.getAsJsonArray("m2m:cin").size(), is(3));
	}

	@Test
	public void testRetrieveLatestAndOldest() {
		Result result = cse.retrieve(AE, CONTAINER + "/la");
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		assertThat(result.getResource().getId(), is(cin2.getId()));
		result = cse.retrieve(AE, CONTAINER + "/ol");
		assertThat(result.getStatus(), is(ResponseStatusCode.OK));
		assertThat(result.getResource().getId(), is(cin1.getId()));
		assertThat(result.getBody().has("m2m:cin"), is(true));
	}

	@Test
	public void testRetrieveLatestOfEmptyContainer() {
		cse.createContainer(AE, "cse-in/ae1", "empty");
		assertThat(cse.retrieve(AE, "cse-in/ae1/empty/la").getStatus(), is(ResponseStatusCode.NOT_FOUND));
	}

	@Test
	public void testRetrieveCseBaseAsAdmin() {
		Result result = cse.retrieve(CseFixture.ADMIN, "cse-in", "fu=1", "ty=2");
		assertThat(values(referenceList(result)), hasItems("cse-in/ae1"));
		result = cse.retrieve(CseFixture.ADMIN, "id-in");
		assertThat(result.getBody().getAsJsonObject("m2m:cb").get("csi").getAsString(), is("/id-in"));
	}
}
