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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.m2mcse.core.discovery.FilterCriteria;
import org.eclipse.m2mcse.core.discovery.FilterOperation;
import org.eclipse.m2mcse.core.discovery.FilterUsage;
import org.eclipse.m2mcse.core.util.M2MTime;

/**
 * Parsed request arguments.
 * 
 * Filter usage, desired identifier result type, result content and the
 * filter criteria of a request. Arguments not known as request or filter
 * arguments are taken as attribute predicates.
 */
public final class RequestArguments {

	public static final String FILTER_USAGE = "fu";
	public static final String DESIRED_IDENTIFIER_RESULT_TYPE = "drt";
	public static final String RESULT_CONTENT = "rcn";
	public static final String FILTER_OPERATION = "fo";
	public static final String LIMIT = "lim";
	public static final String LEVEL = "lvl";
	public static final String OFFSET = "ofst";
	public static final String APPLICABLE_RELATIVE_PATH = "arp";
	public static final String CREATED_BEFORE = "crb";
	public static final String CREATED_AFTER = "cra";
	public static final String MODIFIED_SINCE = "ms";
	public static final String UNMODIFIED_SINCE = "us";
	public static final String STATE_TAG_SMALLER = "sts";
	public static final String STATE_TAG_BIGGER = "stb";
	public static final String EXPIRE_BEFORE = "exb";
	public static final String EXPIRE_AFTER = "exa";
	public static final String LABELS = "lbl";
	public static final String LABEL_QUERY = "lbq";
	public static final String SIZE_ABOVE = "sza";
	public static final String SIZE_BELOW = "szb";
	public static final String CONTENT_TYPE = "cty";
	public static final String RESOURCE_TYPE = "ty";

	/**
	 * Request arguments not used as attribute predicates.
	 */
	private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(FILTER_USAGE,
			DESIRED_IDENTIFIER_RESULT_TYPE, RESULT_CONTENT, FILTER_OPERATION, LIMIT, LEVEL, OFFSET,
			APPLICABLE_RELATIVE_PATH, CREATED_BEFORE, CREATED_AFTER, MODIFIED_SINCE, UNMODIFIED_SINCE,
			STATE_TAG_SMALLER, STATE_TAG_BIGGER, EXPIRE_BEFORE, EXPIRE_AFTER, LABELS, LABEL_QUERY, SIZE_ABOVE,
			SIZE_BELOW, CONTENT_TYPE, RESOURCE_TYPE, "rt", "rp", "rqi", "da"));

	private final ResultContent resultContent;
	private final DesiredIdentifierResultType desiredIdentifierResultType;
	private final FilterCriteria filterCriteria;

	private RequestArguments(ResultContent resultContent, DesiredIdentifierResultType desiredIdentifierResultType,
			FilterCriteria filterCriteria) {
		this.resultContent = resultContent;
		this.desiredIdentifierResultType = desiredIdentifierResultType;
		this.filterCriteria = filterCriteria;
	}

	public ResultContent getResultContent() {
		return resultContent;
	}

	public DesiredIdentifierResultType getDesiredIdentifierResultType() {
		return desiredIdentifierResultType;
	}

	public FilterCriteria getFilterCriteria() {
		return filterCriteria;
	}

	/**
	 * Parse request arguments.
	 * 
	 * @param query multi-valued request arguments
	 * @param operation operation of the request
	 * @return parsed arguments
	 * @throws DispatchException with
	 *             {@link ResponseStatusCode#INVALID_ARGUMENTS}, if a value
	 *             is malformed or not supported.
	 */
	public static RequestArguments parse(Map<String, List<String>> query, Operation operation)
			throws DispatchException {
		FilterCriteria.Builder builder = FilterCriteria.builder();

		Integer fu = integer(query, FILTER_USAGE);
		FilterUsage filterUsage = FilterUsage.CONDITIONAL_RETRIEVAL;
		if (fu != null) {
			filterUsage = FilterUsage.fromValue(fu);
			if (filterUsage == null) {
				throw invalid(FILTER_USAGE, fu);
			}
		}
		builder.filterUsage(filterUsage);

		Integer drt = integer(query, DESIRED_IDENTIFIER_RESULT_TYPE);
		DesiredIdentifierResultType identifierType = DesiredIdentifierResultType.STRUCTURED;
		if (drt != null) {
			identifierType = DesiredIdentifierResultType.fromValue(drt);
			if (identifierType == null) {
				throw invalid(DESIRED_IDENTIFIER_RESULT_TYPE, drt);
			}
		}

		Integer rcn = integer(query, RESULT_CONTENT);
		ResultContent resultContent;
		if (rcn != null) {
			resultContent = ResultContent.fromValue(rcn);
			if (resultContent == null) {
				throw invalid(RESULT_CONTENT, rcn);
			}
		} else if (operation == Operation.RETRIEVE && filterUsage == FilterUsage.DISCOVERY) {
			resultContent = ResultContent.CHILD_RESOURCE_REFERENCES;
		} else if (operation == Operation.DELETE) {
			resultContent = ResultContent.NOTHING;
		} else {
			resultContent = ResultContent.ATTRIBUTES;
		}

		Integer fo = integer(query, FILTER_OPERATION);
		if (fo != null) {
			FilterOperation filterOperation = FilterOperation.fromValue(fo);
			if (filterOperation == null) {
				throw invalid(FILTER_OPERATION, fo);
			}
			builder.filterOperation(filterOperation);
		}

		builder.limit(integer(query, LIMIT));
		builder.level(integer(query, LEVEL));
		builder.offset(integer(query, OFFSET));
		builder.applicableRelativePath(single(query, APPLICABLE_RELATIVE_PATH));
		builder.createdBefore(timestamp(query, CREATED_BEFORE));
		builder.createdAfter(timestamp(query, CREATED_AFTER));
		builder.modifiedSince(timestamp(query, MODIFIED_SINCE));
		builder.unmodifiedSince(timestamp(query, UNMODIFIED_SINCE));
		builder.expireBefore(timestamp(query, EXPIRE_BEFORE));
		builder.expireAfter(timestamp(query, EXPIRE_AFTER));
		builder.stateTagSmaller(integer(query, STATE_TAG_SMALLER));
		builder.stateTagBigger(integer(query, STATE_TAG_BIGGER));
		builder.sizeAbove(integer(query, SIZE_ABOVE));
		builder.sizeBelow(integer(query, SIZE_BELOW));
		builder.labels(multi(query, LABELS));
		builder.labelQuery(multi(query, LABEL_QUERY));
		builder.contentTypes(multi(query, CONTENT_TYPE));
		List<Integer> types = new ArrayList<>();
		for (String type : multi(query, RESOURCE_TYPE)) {
			types.add(parseInteger(RESOURCE_TYPE, type));
		}
		builder.resourceTypes(types);

		for (Map.Entry<String, List<String>> entry : query.entrySet()) {
			if (!RESERVED.contains(entry.getKey()) && !entry.getValue().isEmpty()) {
				builder.attribute(entry.getKey(), entry.getValue());
			}
		}
		return new RequestArguments(resultContent, identifierType, builder.build());
	}

	private static String single(Map<String, List<String>> query, String name) throws DispatchException {
		List<String> values = query.get(name);
		if (values == null || values.isEmpty()) {
			return null;
		}
		if (values.size() > 1) {
			throw new DispatchException(ResponseStatusCode.INVALID_ARGUMENTS, name + " must not be repeated");
		}
		return values.get(0);
	}

	private static List<String> multi(Map<String, List<String>> query, String name) {
		List<String> values = query.get(name);
		if (values == null) {
			return Collections.emptyList();
		}
		List<String> result = new ArrayList<>();
		for (String value : values) {
			for (String item : value.trim().split("\\s+")) {
				if (!item.isEmpty()) {
					result.add(item);
				}
			}
		}
		return result;
	}

	private static Integer integer(Map<String, List<String>> query, String name) throws DispatchException {
		String value = single(query, name);
		return value == null ? null : parseInteger(name, value);
	}

	private static Integer parseInteger(String name, String value) throws DispatchException {
		try {
			return Integer.valueOf(value.trim());
		} catch (NumberFormatException ex) {
			throw invalid(name, value);
		}
	}

	private static Instant timestamp(Map<String, List<String>> query, String name) throws DispatchException {
		String value = single(query, name);
		if (value == null) {
			return null;
		}
		try {
			return M2MTime.parse(value);
		} catch (IllegalArgumentException ex) {
			throw invalid(name, value);
		}
	}

	private static DispatchException invalid(String name, Object value) {
		return new DispatchException(ResponseStatusCode.INVALID_ARGUMENTS, "invalid " + name + " " + value);
	}
}
