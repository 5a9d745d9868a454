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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.m2mcse.core.resource.ResourceType;

/**
 * Transport independent request.
 * 
 * <pre>
 * <code>
 * CseRequest request = CseRequest.builder(Operation.RETRIEVE, "cse-in/cnt1")
 * 		.originator("CApp1")
 * 		.query("fu", "1")
 * 		.query("ty", "4")
 * 		.build();
 * </code>
 * </pre>
 */
public final class CseRequest {

	private final Operation operation;
	private final String to;
	private final String originator;
	private final String requestIdentifier;
	private final String contentType;
	private final ResourceType resourceType;
	private final String content;
	private final Map<String, List<String>> query;

	private CseRequest(Builder builder) {
		this.operation = builder.operation;
		this.to = builder.to;
		this.originator = builder.originator;
		this.requestIdentifier = builder.requestIdentifier;
		this.contentType = builder.contentType;
		this.resourceType = builder.resourceType;
		this.content = builder.content;
		Map<String, List<String>> query = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> entry : builder.query.entrySet()) {
			query.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
		}
		this.query = Collections.unmodifiableMap(query);
	}

	public Operation getOperation() {
		return operation;
	}

	/**
	 * Get target address.
	 * 
	 * @return target address, resource id or structured path in one of the
	 *         addressing modes.
	 */
	public String getTo() {
		return to;
	}

	public String getOriginator() {
		return originator;
	}

	public String getRequestIdentifier() {
		return requestIdentifier;
	}

	public String getContentType() {
		return contentType;
	}

	/**
	 * Get declared resource type of a CREATE.
	 * 
	 * @return declared resource type, or {@code null}, if not provided.
	 */
	public ResourceType getResourceType() {
		return resourceType;
	}

	/**
	 * Get the textual payload.
	 * 
	 * @return payload, or {@code null}, if not provided.
	 */
	public String getContent() {
		return content;
	}

	/**
	 * Get request query arguments.
	 * 
	 * @return unmodifiable map of multi-valued arguments
	 */
	public Map<String, List<String>> getQuery() {
		return query;
	}

	/**
	 * Create builder initialized with the values of this request.
	 * 
	 * @return builder
	 */
	public Builder toBuilder() {
		Builder builder = new Builder(operation, to);
		builder.originator = originator;
		builder.requestIdentifier = requestIdentifier;
		builder.contentType = contentType;
		builder.resourceType = resourceType;
		builder.content = content;
		for (Map.Entry<String, List<String>> entry : query.entrySet()) {
			builder.query.put(entry.getKey(), new ArrayList<>(entry.getValue()));
		}
		return builder;
	}

	@Override
	public String toString() {
		return operation + " " + to + " from " + originator;
	}

	/**
	 * Create builder.
	 * 
	 * @param operation operation
	 * @param to target address
	 * @return builder
	 * @throws NullPointerException if any parameter is {@code null}
	 */
	public static Builder builder(Operation operation, String to) {
		return new Builder(operation, to);
	}

	/**
	 * Builder of requests.
	 */
	public static final class Builder {

		private final Operation operation;
		private String to;
		private String originator;
		private String requestIdentifier;
		private String contentType;
		private ResourceType resourceType;
		private String content;
		private final Map<String, List<String>> query = new LinkedHashMap<>();

		private Builder(Operation operation, String to) {
			if (operation == null) {
				throw new NullPointerException("operation must not be null!");
			}
			if (to == null) {
				throw new NullPointerException("to must not be null!");
			}
			this.operation = operation;
			this.to = to;
		}

		public Builder to(String to) {
			if (to == null) {
				throw new NullPointerException("to must not be null!");
			}
			this.to = to;
			return this;
		}

		public Builder originator(String originator) {
			this.originator = originator;
			return this;
		}

		public Builder requestIdentifier(String requestIdentifier) {
			this.requestIdentifier = requestIdentifier;
			return this;
		}

		public Builder contentType(String contentType) {
			this.contentType = contentType;
			return this;
		}

		public Builder resourceType(ResourceType resourceType) {
			this.resourceType = resourceType;
			return this;
		}

		public Builder content(String content) {
			this.content = content;
			return this;
		}

		/**
		 * Add query argument values.
		 * 
		 * @param name argument name
		 * @param values values to append
		 * @return builder for chaining
		 */
		public Builder query(String name, String... values) {
			query.computeIfAbsent(name, key -> new ArrayList<>()).addAll(Arrays.asList(values));
			return this;
		}

		public CseRequest build() {
			return new CseRequest(this);
		}
	}
}
