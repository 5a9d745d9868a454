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
package org.eclipse.m2mcse.core.result;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.eclipse.m2mcse.core.dispatch.DesiredIdentifierResultType;
import org.eclipse.m2mcse.core.resource.CseBase;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceFactory;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.eclipse.m2mcse.elements.category.Small;
import org.eclipse.m2mcse.elements.rule.TestNameLoggerRule;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Result shapes of the resources
 * 
 * <pre>
 * cse-in/cnt1/cin1
 *            /cin2
 *            /la
 *            /cnt2/cin3
 *                 /cnt3/cin4
 * </pre>
 */
@Category(Small.class)
public class ResultTreeBuilderTest {

	@Rule
	public TestNameLoggerRule name = new TestNameLoggerRule();

	private final ResourceFactory factory = new ResourceFactory(8);

	private Resource cnt1;
	private Resource cin1;
	private Resource cin2;
	private Resource latest;
	private Resource cnt2;
	private Resource cin3;
	private Resource cnt3;
	private Resource cin4;

	@Before
	public void setup() {
		JsonObject attributes = new JsonObject();
		attributes.addProperty(Resource.ID, "id-in");
		attributes.addProperty(Resource.NAME, "cse-in");
		Resource cseBase = new CseBase(attributes);
		cseBase.setStructuredPath("cse-in");
		cnt1 = factory.create(ResourceType.CONTAINER, "cnt1", cseBase);
		cin1 = factory.create(ResourceType.CONTENT_INSTANCE, "cin1", cnt1);
		cin2 = factory.create(ResourceType.CONTENT_INSTANCE, "cin2", cnt1);
		latest = factory.create(ResourceType.CONTAINER_LATEST, "la", cnt1);
		cnt2 = factory.create(ResourceType.CONTAINER, "cnt2", cnt1);
		cin3 = factory.create(ResourceType.CONTENT_INSTANCE, "cin3", cnt2);
		cnt3 = factory.create(ResourceType.CONTAINER, "cnt3", cnt2);
		cin4 = factory.create(ResourceType.CONTENT_INSTANCE, "cin4", cnt3);
	}

	private List<Resource> descendants() {
		return new ArrayList<>(Arrays.asList(cin1, cin2, latest, cnt2, cin3, cnt3, cin4));
	}

	private static List<String> names(JsonArray array) {
		List<String> names = new ArrayList<>();
		for (JsonElement element : array) {
			names.add(element.getAsJsonObject().get(Resource.NAME).getAsString());
		}
		return names;
	}

	/**
	 * Count the resources (objects with "ri") nested in the node.
	 */
	private static int count(JsonObject node) {
		int count = 0;
		for (Map.Entry<String, JsonElement> entry : node.entrySet()) {
			if (entry.getValue().isJsonArray()) {
				for (JsonElement element : entry.getValue().getAsJsonArray()) {
					if (element.isJsonObject() && element.getAsJsonObject().has(Resource.ID)) {
						count += 1 + count(element.getAsJsonObject());
					}
				}
			}
		}
		return count;
	}

	@Test
	public void testFullTree() {
		JsonObject body = ResultTreeBuilder.fullTree(cnt1, descendants());
		JsonObject root = body.getAsJsonObject("m2m:cnt");
		assertThat(root.get(Resource.NAME).getAsString(), is("cnt1"));
		assertThat(names(root.getAsJsonArray("m2m:cin")), is(Arrays.asList("cin1", "cin2")));
		assertThat(root.has("m2m:la"), is(false));
		JsonArray containers = root.getAsJsonArray("m2m:cnt");
		assertThat(names(containers), is(Arrays.asList("cnt2")));
		JsonObject second = containers.get(0).getAsJsonObject();
		assertThat(names(second.getAsJsonArray("m2m:cin")), is(Arrays.asList("cin3")));
		JsonObject third = second.getAsJsonArray("m2m:cnt").get(0).getAsJsonObject();
		assertThat(names(third.getAsJsonArray("m2m:cin")), is(Arrays.asList("cin4")));
		assertThat(count(root), is(6));
	}

	@Test
	public void testFullTreeIndependentOfOrder() {
		List<Resource> resources = descendants();
		Collections.reverse(resources);
		JsonObject root = ResultTreeBuilder.fullTree(cnt1, resources).getAsJsonObject("m2m:cnt");
		assertThat(count(root), is(6));
		JsonObject second = root.getAsJsonArray("m2m:cnt").get(0).getAsJsonObject();
		assertThat(names(second.getAsJsonArray("m2m:cin")), is(Arrays.asList("cin3")));
		assertThat(names(root.getAsJsonArray("m2m:cin")), is(Arrays.asList("cin2", "cin1")));
	}

	@Test
	public void testFullTreeAttachesToNearestAncestor() {
		// cnt2 not part of the result, e.g. not permitted
		List<Resource> resources = new ArrayList<>(Arrays.asList(cin1, cin3, cnt3, cin4));
		JsonObject root = ResultTreeBuilder.fullTree(cnt1, resources).getAsJsonObject("m2m:cnt");
		assertThat(count(root), is(4));
		assertThat(names(root.getAsJsonArray("m2m:cin")), is(Arrays.asList("cin1", "cin3")));
		JsonObject third = root.getAsJsonArray("m2m:cnt").get(0).getAsJsonObject();
		assertThat(third.get(Resource.NAME).getAsString(), is("cnt3"));
		assertThat(names(third.getAsJsonArray("m2m:cin")), is(Arrays.asList("cin4")));
	}

	@Test
	public void testChildTreeWithoutRootAttributes() {
		JsonObject root = ResultTreeBuilder.childTree(cnt1, descendants()).getAsJsonObject("m2m:cnt");
		assertThat(root.has(Resource.NAME), is(false));
		assertThat(root.has(Resource.ID), is(false));
		assertThat(count(root), is(6));
	}

	@Test
	public void testReferenceListStructured() {
		JsonObject body = ResultTreeBuilder.referenceList(descendants(), DesiredIdentifierResultType.STRUCTURED);
		JsonArray references = body.getAsJsonObject("m2m:rrl").getAsJsonArray("rrf");
		assertThat(references.size(), is(6));
		JsonObject first = references.get(0).getAsJsonObject();
		assertThat(first.get("nm").getAsString(), is("cin1"));
		assertThat(first.get("typ").getAsInt(), is(ResourceType.CONTENT_INSTANCE.code));
		assertThat(first.get("val").getAsString(), is("cse-in/cnt1/cin1"));
	}

	@Test
	public void testReferenceListUnstructured() {
		JsonObject body = ResultTreeBuilder.referenceList(descendants(), DesiredIdentifierResultType.UNSTRUCTURED);
		JsonArray references = body.getAsJsonObject("m2m:rrl").getAsJsonArray("rrf");
		assertThat(references.get(3).getAsJsonObject().get("val").getAsString(), is(cin3.getId()));
	}

	@Test
	public void testChildReferences() {
		JsonObject body = ResultTreeBuilder.childReferences(Arrays.asList(cin1, latest, cnt2), cnt1,
				DesiredIdentifierResultType.STRUCTURED);
		JsonObject root = body.getAsJsonObject("m2m:cnt");
		assertThat(root.get(Resource.NAME).getAsString(), is("cnt1"));
		JsonArray references = root.getAsJsonArray("ch");
		assertThat(references.size(), is(2));
		assertThat(references.get(1).getAsJsonObject().get("val").getAsString(), is("cse-in/cnt1/cnt2"));

		body = ResultTreeBuilder.childReferences(Arrays.asList(cin1, latest, cnt2), null,
				DesiredIdentifierResultType.STRUCTURED);
		assertThat(body.getAsJsonArray("m2m:ch").size(), is(2));
	}

	@Test
	public void testUriList() {
		JsonObject body = ResultTreeBuilder.uriList(Arrays.asList(cin1, latest, cin4),
				DesiredIdentifierResultType.STRUCTURED);
		JsonArray uris = body.getAsJsonArray("m2m:uril");
		assertThat(uris.size(), is(2));
		assertThat(uris.get(1).getAsString(), is("cse-in/cnt1/cnt2/cnt3/cin4"));
	}
}
