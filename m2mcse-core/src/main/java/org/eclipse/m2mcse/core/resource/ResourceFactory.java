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
package org.eclipse.m2mcse.core.resource;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;
import org.eclipse.m2mcse.core.util.M2MTime;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Maps JSON documents to typed resources.
 * 
 * The resource type is taken from the single key wrapping the attributes,
 * or from an embedded {@code ty}, and verified against the declared type
 * before the resource is constructed.
 */
public class ResourceFactory {

	private static final String CHARACTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

	/**
	 * Attributes assigned by the CSE and rejected in requests.
	 */
	private static final Set<String> ASSIGNED = new HashSet<>(Arrays.asList(Resource.ID, Resource.PARENT_ID,
			Resource.CREATION_TIME, Resource.LAST_MODIFIED_TIME, Resource.STATE_TAG));

	private final Random random = new SecureRandom();
	private final int idLength;

	/**
	 * Create factory.
	 * 
	 * @param idLength number of random characters of generated identifiers
	 * @throws IllegalArgumentException if idLength is less than 1
	 */
	public ResourceFactory(int idLength) {
		if (idLength < 1) {
			throw new IllegalArgumentException("id length must be at least 1, not " + idLength);
		}
		this.idLength = idLength;
	}

	/**
	 * Create random alphanumeric identifier.
	 * 
	 * @return random identifier, never containing "fopt"
	 */
	public String randomIdentifier() {
		String identifier;
		do {
			StringBuilder builder = new StringBuilder(idLength);
			for (int index = 0; index < idLength; ++index) {
				builder.append(CHARACTERS.charAt(random.nextInt(CHARACTERS.length())));
			}
			identifier = builder.toString();
		} while (identifier.contains(Group.FAN_OUT_POINT_NAME));
		return identifier;
	}

	public String newResourceId(ResourceType type) {
		return type.getShortName() + randomIdentifier();
	}

	public String newResourceName(ResourceType type) {
		return type.getShortName() + "_" + randomIdentifier();
	}

	/**
	 * Create resource from request payload.
	 * 
	 * @param payload request payload, a single type tag wrapping the
	 *            attributes.
	 * @param declaredType declared type of the request. May be {@code null}.
	 * @param parent parent resource
	 * @return resource, not yet persisted
	 * @throws DispatchException with {@link ResponseStatusCode#BAD_REQUEST},
	 *             if the payload is malformed or doesn't match the declared
	 *             type.
	 */
	public Resource fromRequest(JsonObject payload, ResourceType declaredType, Resource parent)
			throws DispatchException {
		if (payload.size() != 1) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "payload must contain exactly one resource");
		}
		Map.Entry<String, JsonElement> entry = payload.entrySet().iterator().next();
		String tag = entry.getKey();
		if (!entry.getValue().isJsonObject()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attributes of " + tag + " must be an object");
		}
		ResourceType type = ResourceType.fromTag(tag);
		if (type == null) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "unknown resource type " + tag);
		}
		JsonObject attributes = entry.getValue().getAsJsonObject().deepCopy();
		if (attributes.has(Resource.TYPE)) {
			JsonElement code = attributes.get(Resource.TYPE);
			if (!code.isJsonPrimitive() || !code.getAsJsonPrimitive().isNumber() || code.getAsInt() != type.code) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "ty " + code + " doesn't match " + tag);
			}
		}
		if (declaredType != null && declaredType != type) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST,
					"declared type " + declaredType + " doesn't match " + tag);
		}
		if (type.isVirtual()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, tag + " can not be created");
		}
		for (String name : attributes.keySet()) {
			if (Resource.isInternal(name) || ASSIGNED.contains(name)) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attribute " + name + " is not permitted");
			}
		}
		if (type == ResourceType.MANAGEMENT_OBJECT) {
			applyMgmtDefinition(tag, attributes);
		}
		if (attributes.has(Resource.NAME)) {
			JsonElement name = attributes.get(Resource.NAME);
			if (!name.isJsonPrimitive() || name.getAsString().isEmpty() || name.getAsString().contains("/")) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "invalid resource name " + name);
			}
		}
		return initialize(type, attributes, parent);
	}

	/**
	 * Create auxiliary resource.
	 * 
	 * @param type resource type
	 * @param name resource name
	 * @param parent parent resource
	 * @return resource, not yet persisted
	 */
	public Resource create(ResourceType type, String name, Resource parent) {
		JsonObject attributes = new JsonObject();
		attributes.addProperty(Resource.NAME, name);
		return initialize(type, attributes, parent);
	}

	/**
	 * Restore resource from stored attributes.
	 * 
	 * @param attributes stored attributes including {@code ty}
	 * @return resource
	 * @throws IllegalArgumentException if the {@code ty} is missing or
	 *             unknown
	 */
	public static Resource restore(JsonObject attributes) {
		JsonElement code = attributes.get(Resource.TYPE);
		ResourceType type = code == null ? null : ResourceType.fromCode(code.getAsInt());
		if (type == null) {
			throw new IllegalArgumentException("unknown resource type " + code);
		}
		return newInstance(type, attributes);
	}

	private Resource initialize(ResourceType type, JsonObject attributes, Resource parent) {
		String now = M2MTime.now();
		attributes.addProperty(Resource.ID, newResourceId(type));
		if (!attributes.has(Resource.NAME)) {
			attributes.addProperty(Resource.NAME, newResourceName(type));
		}
		attributes.addProperty(Resource.PARENT_ID, parent.getId());
		attributes.addProperty(Resource.CREATION_TIME, now);
		attributes.addProperty(Resource.LAST_MODIFIED_TIME, now);
		Resource resource = newInstance(type, attributes);
		resource.setStructuredPath(parent.getStructuredPath() + "/" + resource.getName());
		return resource;
	}

	private static void applyMgmtDefinition(String tag, JsonObject attributes) throws DispatchException {
		MgmtDefinition definition = MgmtDefinition.fromTag(tag);
		JsonElement mgd = attributes.get(ManagementObject.DEFINITION);
		if (mgd != null) {
			MgmtDefinition declared = mgd.isJsonPrimitive() && mgd.getAsJsonPrimitive().isNumber()
					? MgmtDefinition.fromCode(mgd.getAsInt())
					: null;
			if (declared == null || (definition != null && declared != definition)) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "mgd " + mgd + " doesn't match " + tag);
			}
			definition = declared;
		}
		if (definition == null) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attribute mgd is mandatory for " + tag);
		}
		attributes.addProperty(ManagementObject.DEFINITION, definition.code);
	}

	private static Resource newInstance(ResourceType type, JsonObject attributes) {
		switch (type) {
		case ACCESS_CONTROL_POLICY:
			return new AccessControlPolicy(attributes);
		case APPLICATION_ENTITY:
			return new ApplicationEntity(attributes);
		case CONTAINER:
			return new Container(attributes);
		case CONTENT_INSTANCE:
			return new ContentInstance(attributes);
		case CSE_BASE:
			return new CseBase(attributes);
		case GROUP:
			return new Group(attributes);
		case MANAGEMENT_OBJECT:
			return new ManagementObject(attributes);
		case NODE:
			return new Node(attributes);
		case REMOTE_CSE:
			return new RemoteCse(attributes);
		case SUBSCRIPTION:
			return new Subscription(attributes);
		case CONTAINER_LATEST:
			return new ContainerLatest(attributes);
		case CONTAINER_OLDEST:
			return new ContainerOldest(attributes);
		case GROUP_FAN_OUT_POINT:
			return new FanOutPoint(attributes);
		default:
			throw new IllegalArgumentException("unsupported resource type " + type);
		}
	}
}
