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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filter criteria of a RETRIEVE.
 * <p>
 * Contains the filter usage, the handling options (limit, level, offset,
 * applicable relative path) and the conditions. Unset conditions are
 * {@code null} or empty and are ignored.
 */
public final class FilterCriteria {

	private final FilterUsage filterUsage;
	private final FilterOperation filterOperation;
	private final Integer limit;
	private final Integer level;
	private final Integer offset;
	private final String applicableRelativePath;
	private final Instant createdBefore;
	private final Instant createdAfter;
	private final Instant modifiedSince;
	private final Instant unmodifiedSince;
	private final Instant expireBefore;
	private final Instant expireAfter;
	private final Integer stateTagSmaller;
	private final Integer stateTagBigger;
	private final Integer sizeAbove;
	private final Integer sizeBelow;
	private final List<String> labels;
	private final List<String> labelQuery;
	private final List<String> contentTypes;
	private final List<Integer> resourceTypes;
	private final Map<String, List<String>> attributes;

	private FilterCriteria(Builder builder) {
		this.filterUsage = builder.filterUsage;
		this.filterOperation = builder.filterOperation;
		this.limit = builder.limit;
		this.level = builder.level;
		this.offset = builder.offset;
		this.applicableRelativePath = builder.applicableRelativePath;
		this.createdBefore = builder.createdBefore;
		this.createdAfter = builder.createdAfter;
		this.modifiedSince = builder.modifiedSince;
		this.unmodifiedSince = builder.unmodifiedSince;
		this.expireBefore = builder.expireBefore;
		this.expireAfter = builder.expireAfter;
		this.stateTagSmaller = builder.stateTagSmaller;
		this.stateTagBigger = builder.stateTagBigger;
		this.sizeAbove = builder.sizeAbove;
		this.sizeBelow = builder.sizeBelow;
		this.labels = Collections.unmodifiableList(new ArrayList<>(builder.labels));
		this.labelQuery = Collections.unmodifiableList(new ArrayList<>(builder.labelQuery));
		this.contentTypes = Collections.unmodifiableList(new ArrayList<>(builder.contentTypes));
		this.resourceTypes = Collections.unmodifiableList(new ArrayList<>(builder.resourceTypes));
		Map<String, List<String>> attributes = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> entry : builder.attributes.entrySet()) {
			attributes.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
		}
		this.attributes = Collections.unmodifiableMap(attributes);
	}

	public FilterUsage getFilterUsage() {
		return filterUsage;
	}

	public boolean isDiscovery() {
		return filterUsage == FilterUsage.DISCOVERY;
	}

	public FilterOperation getFilterOperation() {
		return filterOperation;
	}

	public Integer getLimit() {
		return limit;
	}

	public Integer getLevel() {
		return level;
	}

	public Integer getOffset() {
		return offset;
	}

	public String getApplicableRelativePath() {
		return applicableRelativePath;
	}

	public Instant getCreatedBefore() {
		return createdBefore;
	}

	public Instant getCreatedAfter() {
		return createdAfter;
	}

	public Instant getModifiedSince() {
		return modifiedSince;
	}

	public Instant getUnmodifiedSince() {
		return unmodifiedSince;
	}

	public Instant getExpireBefore() {
		return expireBefore;
	}

	public Instant getExpireAfter() {
		return expireAfter;
	}

	public Integer getStateTagSmaller() {
		return stateTagSmaller;
	}

	public Integer getStateTagBigger() {
		return stateTagBigger;
	}

	public Integer getSizeAbove() {
		return sizeAbove;
	}

	public Integer getSizeBelow() {
		return sizeBelow;
	}

	public List<String> getLabels() {
		return labels;
	}

	public List<String> getLabelQuery() {
		return labelQuery;
	}

	public List<String> getContentTypes() {
		return contentTypes;
	}

	public List<Integer> getResourceTypes() {
		return resourceTypes;
	}

	/**
	 * Get attribute predicates.
	 * 
	 * @return map of attribute names to accepted values
	 */
	public Map<String, List<String>> getAttributes() {
		return attributes;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder of filter criteria.
	 */
	public static final class Builder {

		private FilterUsage filterUsage = FilterUsage.CONDITIONAL_RETRIEVAL;
		private FilterOperation filterOperation = FilterOperation.AND;
		private Integer limit;
		private Integer level;
		private Integer offset;
		private String applicableRelativePath;
		private Instant createdBefore;
		private Instant createdAfter;
		private Instant modifiedSince;
		private Instant unmodifiedSince;
		private Instant expireBefore;
		private Instant expireAfter;
		private Integer stateTagSmaller;
		private Integer stateTagBigger;
		private Integer sizeAbove;
		private Integer sizeBelow;
		private final List<String> labels = new ArrayList<>();
		private final List<String> labelQuery = new ArrayList<>();
		private final List<String> contentTypes = new ArrayList<>();
		private final List<Integer> resourceTypes = new ArrayList<>();
		private final Map<String, List<String>> attributes = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder filterUsage(FilterUsage filterUsage) {
			this.filterUsage = filterUsage;
			return this;
		}

		public Builder filterOperation(FilterOperation filterOperation) {
			this.filterOperation = filterOperation;
			return this;
		}

		public Builder limit(Integer limit) {
			this.limit = limit;
			return this;
		}

		public Builder level(Integer level) {
			this.level = level;
			return this;
		}

		public Builder offset(Integer offset) {
			this.offset = offset;
			return this;
		}

		public Builder applicableRelativePath(String applicableRelativePath) {
			this.applicableRelativePath = applicableRelativePath;
			return this;
		}

		public Builder createdBefore(Instant createdBefore) {
			this.createdBefore = createdBefore;
			return this;
		}

		public Builder createdAfter(Instant createdAfter) {
			this.createdAfter = createdAfter;
			return this;
		}

		public Builder modifiedSince(Instant modifiedSince) {
			this.modifiedSince = modifiedSince;
			return this;
		}

		public Builder unmodifiedSince(Instant unmodifiedSince) {
			this.unmodifiedSince = unmodifiedSince;
			return this;
		}

		public Builder expireBefore(Instant expireBefore) {
			this.expireBefore = expireBefore;
			return this;
		}

		public Builder expireAfter(Instant expireAfter) {
			this.expireAfter = expireAfter;
			return this;
		}

		public Builder stateTagSmaller(Integer stateTagSmaller) {
			this.stateTagSmaller = stateTagSmaller;
			return this;
		}

		public Builder stateTagBigger(Integer stateTagBigger) {
			this.stateTagBigger = stateTagBigger;
			return this;
		}

		public Builder sizeAbove(Integer sizeAbove) {
			this.sizeAbove = sizeAbove;
			return this;
		}

		public Builder sizeBelow(Integer sizeBelow) {
			this.sizeBelow = sizeBelow;
			return this;
		}

		public Builder labels(List<String> labels) {
			this.labels.addAll(labels);
			return this;
		}

		public Builder labelQuery(List<String> labelQuery) {
			this.labelQuery.addAll(labelQuery);
			return this;
		}

		public Builder contentTypes(List<String> contentTypes) {
			this.contentTypes.addAll(contentTypes);
			return this;
		}

		public Builder resourceTypes(List<Integer> resourceTypes) {
			this.resourceTypes.addAll(resourceTypes);
			return this;
		}

		public Builder attribute(String name, List<String> values) {
			this.attributes.computeIfAbsent(name, key -> new ArrayList<>()).addAll(values);
			return this;
		}

		public FilterCriteria build() {
			return new FilterCriteria(this);
		}
	}
}
