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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.m2mcse.core.dispatch.DesiredIdentifierResultType;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceType;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Result tree utility class.
 * 
 * Shapes flat, access filtered resource lists into response bodies. The
 * "latest" and "oldest" children of containers are never part of the
 * output.
 */
public final class ResultTreeBuilder {

	public static final String REFERENCE_LIST = "m2m:rrl";
	public static final String REFERENCES = "rrf";
	public static final String URI_LIST = "m2m:uril";
	public static final String CHILD_REFERENCES = "ch";
	public static final String CHILD_REFERENCES_QUALIFIED = "m2m:ch";
	public static final String REFERENCE_NAME = "nm";
	public static final String REFERENCE_TYPE = "typ";
	public static final String REFERENCE_VALUE = "val";

	private ResultTreeBuilder() {
	}

	/**
	 * Get references of the resources.
	 * 
	 * @param resources resources
	 * @param type desired identifier result type
	 * @return array of references with name, type and identifier
	 */
	public static JsonArray references(List<Resource> resources, DesiredIdentifierResultType type) {
		JsonArray references = new JsonArray();
		for (Resource resource : resources) {
			if (isIncluded(resource)) {
				JsonObject reference = new JsonObject();
				reference.addProperty(REFERENCE_NAME, resource.getName());
				reference.addProperty(REFERENCE_TYPE, resource.getType().code);
				reference.addProperty(REFERENCE_VALUE, identifier(resource, type));
				references.add(reference);
			}
		}
		return references;
	}

	/**
	 * Get reference list.
	 * 
	 * @param resources resources
	 * @param type desired identifier result type
	 * @return {@code {"m2m:rrl":{"rrf":[...]}}}
	 */
	public static JsonObject referenceList(List<Resource> resources, DesiredIdentifierResultType type) {
		JsonObject list = new JsonObject();
		list.add(REFERENCES, references(resources, type));
		JsonObject body = new JsonObject();
		body.add(REFERENCE_LIST, list);
		return body;
	}

	/**
	 * Get URI list.
	 * 
	 * @param resources resources
	 * @param type desired identifier result type
	 * @return {@code {"m2m:uril":[...]}}
	 */
	public static JsonObject uriList(List<Resource> resources, DesiredIdentifierResultType type) {
		JsonArray uris = new JsonArray();
		for (Resource resource : resources) {
			if (isIncluded(resource)) {
				uris.add(identifier(resource, type));
			}
		}
		JsonObject body = new JsonObject();
		body.add(URI_LIST, uris);
		return body;
	}

	/**
	 * Get child references.
	 * 
	 * @param resources resources to reference
	 * @param target resource to add the references as {@code ch}. If
	 *            {@code null}, the references are returned as
	 *            {@code {"m2m:ch":[...]}}.
	 * @param type desired identifier result type
	 * @return body with references
	 */
	public static JsonObject childReferences(List<Resource> resources, Resource target,
			DesiredIdentifierResultType type) {
		JsonArray references = references(resources, type);
		if (target == null) {
			JsonObject body = new JsonObject();
			body.add(CHILD_REFERENCES_QUALIFIED, references);
			return body;
		}
		JsonObject attributes = target.toJsonAttributes();
		attributes.add(CHILD_REFERENCES, references);
		JsonObject body = new JsonObject();
		body.add(target.getTypeTag(), attributes);
		return body;
	}

	/**
	 * Get root with nested descendants.
	 * 
	 * @param root root resource
	 * @param resources descendants of the root
	 * @return {@code {<root-tag>:{<root attributes>, <child-tag>:[...]}}}
	 */
	public static JsonObject fullTree(Resource root, List<Resource> resources) {
		return tree(root, root.toJsonAttributes(), resources);
	}

	/**
	 * Get nested descendants without the attributes of the root.
	 * 
	 * @param root root resource
	 * @param resources descendants of the root
	 * @return {@code {<root-tag>:{<child-tag>:[...]}}}
	 */
	public static JsonObject childTree(Resource root, List<Resource> resources) {
		return tree(root, new JsonObject(), resources);
	}

	private static JsonObject tree(Resource root, JsonObject node, List<Resource> resources) {
		List<Resource> remaining = new ArrayList<>();
		for (Resource resource : resources) {
			if (isIncluded(resource) && !resource.getId().equals(root.getId())) {
				remaining.add(resource);
			}
		}
		Map<String, String> parents = effectiveParents(root, remaining);
		remaining = attachChildren(root.getId(), node, remaining, parents);
		if (!remaining.isEmpty()) {
			throw new IllegalStateException(remaining.size() + " resources not placed below " + root.getId());
		}
		JsonObject body = new JsonObject();
		body.add(root.getTypeTag(), node);
		return body;
	}

	/**
	 * Attach the direct children of a node.
	 * 
	 * The children are grouped by their type tag. Each child is removed from
	 * the resources before its own children are attached.
	 * 
	 * @param parentId id of the node
	 * @param node attributes of the node
	 * @param resources resources not yet placed
	 * @param parents effective parent ids of the resources
	 * @return resources not yet placed
	 */
	private static List<Resource> attachChildren(String parentId, JsonObject node, List<Resource> resources,
			Map<String, String> parents) {
		Map<String, List<Resource>> children = new LinkedHashMap<>();
		List<Resource> remaining = new ArrayList<>();
		for (Resource resource : resources) {
			if (parentId.equals(parents.get(resource.getId()))) {
				children.computeIfAbsent(resource.getTypeTag(), tag -> new ArrayList<>()).add(resource);
			} else {
				remaining.add(resource);
			}
		}
		for (Map.Entry<String, List<Resource>> group : children.entrySet()) {
			JsonArray array = new JsonArray();
			for (Resource child : group.getValue()) {
				JsonObject attributes = child.toJsonAttributes();
				remaining = attachChildren(child.getId(), attributes, remaining, parents);
				array.add(attributes);
			}
			node.add(group.getKey(), array);
		}
		return remaining;
	}

	/**
	 * Map resources to the nearest ancestor within the resources.
	 * 
	 * Resources, which parent is not part of the list, are attached to the
	 * nearest ancestor by structured path, or to the root.
	 * 
	 * @param root root resource
	 * @param resources resources
	 * @return map of resource ids to parent ids
	 */
	private static Map<String, String> effectiveParents(Resource root, List<Resource> resources) {
		Map<String, String> ids = new HashMap<>();
		Map<String, String> paths = new HashMap<>();
		for (Resource resource : resources) {
			ids.put(resource.getId(), resource.getStructuredPath());
			if (resource.getStructuredPath() != null) {
				paths.put(resource.getStructuredPath(), resource.getId());
			}
		}
		Map<String, String> parents = new HashMap<>();
		for (Resource resource : resources) {
			String parentId = resource.getParentId();
			if (parentId == null || !ids.containsKey(parentId)) {
				parentId = root.getId();
				String path = resource.getStructuredPath();
				int index = path == null ? -1 : path.lastIndexOf('/');
				while (index > 0) {
					path = path.substring(0, index);
					String ancestor = paths.get(path);
					if (ancestor != null) {
						parentId = ancestor;
						break;
					}
					index = path.lastIndexOf('/');
				}
			}
			parents.put(resource.getId(), parentId);
		}
		return parents;
	}

	private static boolean isIncluded(Resource resource) {
		ResourceType type = resource.getType();
		return type != ResourceType.CONTAINER_LATEST && type != ResourceType.CONTAINER_OLDEST;
	}

	private static String identifier(Resource resource, DesiredIdentifierResultType type) {
		if (type == DesiredIdentifierResultType.UNSTRUCTURED || resource.getStructuredPath() == null) {
			return resource.getId();
		}
		return resource.getStructuredPath();
	}
}
