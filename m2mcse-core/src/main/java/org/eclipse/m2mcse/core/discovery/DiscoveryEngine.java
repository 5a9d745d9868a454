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
package org.eclipse.m2mcse.core.discovery;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import org.eclipse.m2mcse.core.resource.ContentInstance;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.store.ResourceStore;
import org.eclipse.m2mcse.core.util.M2MTime;
import org.eclipse.m2mcse.core.util.Wildcard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;

/**
 * Evaluates filter criteria against the descendants of a resource.
 * <p>
 * Resource type and content type conditions match any of their values.
 * All other distinct conditions are combined by the filter operation of
 * the criteria. No access control is applied here, the caller filters the
 * results.
 */
public class DiscoveryEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(DiscoveryEngine.class);

	private final ResourceStore store;
	private final int maxResults;

	/**
	 * Create discovery engine.
	 * 
	 * @param store resource store
	 * @param maxResults maximum number of results of a discovery
	 */
	public DiscoveryEngine(ResourceStore store, int maxResults) {
		this.store = store;
		this.maxResults = maxResults;
	}

	/**
	 * Discover matching descendants.
	 * 
	 * @param root root resource
	 * @param criteria filter criteria
	 * @return matching descendants
	 */
	public List<Resource> discover(Resource root, FilterCriteria criteria) {
		return query(root, criteria, resource -> matches(resource, criteria));
	}

	/**
	 * Discover descendants applying only the handling options.
	 * 
	 * @param root root resource
	 * @param criteria filter criteria providing limit, level and offset
	 * @return descendants
	 */
	public List<Resource> discoverDescendants(Resource root, FilterCriteria criteria) {
		return query(root, criteria, resource -> true);
	}

	private List<Resource> query(Resource root, FilterCriteria criteria, Predicate<Resource> condition) {
		Integer limit = criteria.getLimit();
		if (limit == null || limit > maxResults) {
			limit = maxResults;
		}
		List<Resource> result = store.queryDescendants(root.getId(), condition, limit, criteria.getLevel(),
				criteria.getOffset());
		LOGGER.debug("discovered {} resources below {}", result.size(), root.getId());
		return result;
	}

	/**
	 * Evaluate the conditions of the criteria.
	 * 
	 * @param resource resource to check
	 * @param criteria filter criteria
	 * @return {@code true}, if the resource matches, or no condition is set.
	 */
	public boolean matches(Resource resource, FilterCriteria criteria) {
		List<Boolean> results = new ArrayList<>();
		if (criteria.getCreatedBefore() != null) {
			Instant time = timeOf(resource, Resource.CREATION_TIME);
			results.add(time != null && time.isBefore(criteria.getCreatedBefore()));
		}
		if (criteria.getCreatedAfter() != null) {
			Instant time = timeOf(resource, Resource.CREATION_TIME);
			results.add(time != null && time.isAfter(criteria.getCreatedAfter()));
		}
		if (criteria.getModifiedSince() != null) {
			Instant time = timeOf(resource, Resource.LAST_MODIFIED_TIME);
			results.add(time != null && time.isAfter(criteria.getModifiedSince()));
		}
		if (criteria.getUnmodifiedSince() != null) {
			Instant time = timeOf(resource, Resource.LAST_MODIFIED_TIME);
			results.add(time != null && time.isBefore(criteria.getUnmodifiedSince()));
		}
		if (criteria.getExpireBefore() != null) {
			Instant time = timeOf(resource, Resource.EXPIRATION_TIME);
			results.add(time != null && time.isBefore(criteria.getExpireBefore()));
		}
		if (criteria.getExpireAfter() != null) {
			Instant time = timeOf(resource, Resource.EXPIRATION_TIME);
			results.add(time != null && time.isAfter(criteria.getExpireAfter()));
		}
		if (criteria.getStateTagSmaller() != null) {
			Integer stateTag = resource.getInteger(Resource.STATE_TAG);
			results.add(stateTag != null && stateTag < criteria.getStateTagSmaller());
		}
		if (criteria.getStateTagBigger() != null) {
			Integer stateTag = resource.getInteger(Resource.STATE_TAG);
			results.add(stateTag != null && stateTag > criteria.getStateTagBigger());
		}
		if (criteria.getSizeAbove() != null) {
			Integer size = resource.getInteger(ContentInstance.CONTENT_SIZE);
			results.add(size != null && size >= criteria.getSizeAbove());
		}
		if (criteria.getSizeBelow() != null) {
			Integer size = resource.getInteger(ContentInstance.CONTENT_SIZE);
			results.add(size != null && size < criteria.getSizeBelow());
		}
		if (!criteria.getLabels().isEmpty()) {
			boolean found = false;
			for (String label : resource.getLabels()) {
				found |= criteria.getLabels().contains(label);
			}
			results.add(found);
		}
		if (!criteria.getLabelQuery().isEmpty()) {
			results.add(anyMatch(criteria.getLabelQuery(), resource.getLabels()));
		}
		if (!criteria.getContentTypes().isEmpty()) {
			String contentInfo = resource.getString(ContentInstance.CONTENT_INFO);
			String contentType = contentInfo == null ? null : contentInfo.split(":", 2)[0];
			results.add(contentType != null && criteria.getContentTypes().contains(contentType));
		}
		if (!criteria.getResourceTypes().isEmpty()) {
			results.add(criteria.getResourceTypes().contains(resource.getType().code));
		}
		for (Map.Entry<String, List<String>> attribute : criteria.getAttributes().entrySet()) {
			results.add(anyMatch(attribute.getValue(), valuesOf(resource, attribute.getKey())));
		}
		if (results.isEmpty()) {
			return true;
		}
		if (criteria.getFilterOperation() == FilterOperation.OR) {
			return results.contains(Boolean.TRUE);
		}
		return !results.contains(Boolean.FALSE);
	}

	private static Instant timeOf(Resource resource, String name) {
		String value = resource.getString(name);
		if (value == null) {
			return null;
		}
		try {
			return M2MTime.parse(value);
		} catch (IllegalArgumentException ex) {
			LOGGER.debug("{} of {} is no timestamp: {}", name, resource.getId(), value);
			return null;
		}
	}

	private static List<String> valuesOf(Resource resource, String name) {
		List<String> values = new ArrayList<>();
		JsonElement value = resource.getAttribute(name);
		if (value != null && !Resource.isInternal(name)) {
			if (value.isJsonArray()) {
				for (JsonElement item : value.getAsJsonArray()) {
					values.add(item.isJsonPrimitive() ? item.getAsString() : item.toString());
				}
			} else {
				values.add(value.isJsonPrimitive() ? value.getAsString() : value.toString());
			}
		}
		return values;
	}

	private static boolean anyMatch(List<String> patterns, List<String> values) {
		for (String pattern : patterns) {
			for (String value : values) {
				if (Wildcard.matches(pattern, value)) {
					return true;
				}
			}
		}
		return false;
	}
}
