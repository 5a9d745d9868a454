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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;
import org.eclipse.m2mcse.core.util.M2MTime;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * A typed node of the resource tree.
 * 
 * The attributes are kept as JSON document. Attributes starting with
 * {@code "__"} are internal and never part of the JSON presentation.
 * Relations to other resources are expressed by ids only, the parent is
 * looked up by {@link #getParentId()}.
 * <p>
 * The type specific behavior is provided by overriding the hooks
 * {@link #canHaveChild(ResourceType)},
 * {@link #activate(Resource, String, ResourceServices)},
 * {@link #update(JsonObject, String, ResourceServices)},
 * {@link #deactivate(String, ResourceServices)},
 * {@link #childAdded(Resource, String, ResourceServices)} and
 * {@link #childRemoved(Resource, String, ResourceServices)}.
 */
public abstract class Resource {

	public static final String TYPE = "ty";
	public static final String ID = "ri";
	public static final String NAME = "rn";
	public static final String PARENT_ID = "pi";
	public static final String CREATION_TIME = "ct";
	public static final String LAST_MODIFIED_TIME = "lt";
	public static final String EXPIRATION_TIME = "et";
	public static final String LABELS = "lbl";
	public static final String ACP_IDS = "acpi";
	public static final String STATE_TAG = "st";
	/**
	 * Internal attribute, cached structured path.
	 */
	public static final String STRUCTURED_PATH = "__srn__";

	private static final Set<String> IMMUTABLE = new HashSet<>(
			Arrays.asList(TYPE, ID, NAME, PARENT_ID, CREATION_TIME));

	private final ResourceType type;
	private final JsonObject attributes;

	/**
	 * Create resource.
	 * 
	 * @param type resource type
	 * @param attributes attributes. Not copied.
	 * @throws NullPointerException if any parameter is {@code null}
	 */
	protected Resource(ResourceType type, JsonObject attributes) {
		if (type == null) {
			throw new NullPointerException("type must not be null!");
		}
		if (attributes == null) {
			throw new NullPointerException("attributes must not be null!");
		}
		this.type = type;
		this.attributes = attributes;
		attributes.addProperty(TYPE, type.code);
	}

	public ResourceType getType() {
		return type;
	}

	/**
	 * Get the tag wrapping the attributes in the JSON presentation.
	 * 
	 * @return type tag
	 */
	public String getTypeTag() {
		return type.getTag();
	}

	public String getId() {
		return getString(ID);
	}

	public String getName() {
		return getString(NAME);
	}

	/**
	 * Get the id of the parent.
	 * 
	 * @return id of parent, or {@code null}, for the root.
	 */
	public String getParentId() {
		return getString(PARENT_ID);
	}

	public String getStructuredPath() {
		return getString(STRUCTURED_PATH);
	}

	public void setStructuredPath(String structuredPath) {
		attributes.addProperty(STRUCTURED_PATH, structuredPath);
	}

	/**
	 * Get ids of the access control policies.
	 * 
	 * @return list of ids. Empty, if the evaluation is inherited from the
	 *         parent.
	 */
	public List<String> getAccessControlPolicyIds() {
		return getStringList(ACP_IDS);
	}

	public List<String> getLabels() {
		return getStringList(LABELS);
	}

	/**
	 * Checks, if UPDATE is refused for this resource.
	 * 
	 * @return {@code true}, if read-only, {@code false}, otherwise.
	 */
	public boolean isReadOnly() {
		return false;
	}

	public boolean isVirtual() {
		return type.isVirtual();
	}

	public boolean hasAttribute(String name) {
		return attributes.has(name);
	}

	/**
	 * Get attribute.
	 * 
	 * @param name attribute name
	 * @return attribute value, or {@code null}, if not available. Modifying
	 *         the value modifies this resource.
	 */
	public JsonElement getAttribute(String name) {
		JsonElement value = attributes.get(name);
		return value == null || value.isJsonNull() ? null : value;
	}

	/**
	 * Get attribute as string.
	 * 
	 * @param name attribute name
	 * @return string value, or {@code null}, if not available or not a
	 *         primitive.
	 */
	public String getString(String name) {
		JsonElement value = getAttribute(name);
		return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
	}

	/**
	 * Get attribute as integer.
	 * 
	 * @param name attribute name
	 * @return integer value, or {@code null}, if not available or not a
	 *         number.
	 */
	public Integer getInteger(String name) {
		JsonElement value = getAttribute(name);
		if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
			return value.getAsInt();
		}
		return null;
	}

	/**
	 * Get attribute as list of strings.
	 * 
	 * A single primitive value is returned as list with one item.
	 * 
	 * @param name attribute name
	 * @return list of strings. Empty, if not available.
	 */
	public List<String> getStringList(String name) {
		JsonElement value = getAttribute(name);
		if (value == null) {
			return Collections.emptyList();
		}
		List<String> result = new ArrayList<>();
		if (value.isJsonArray()) {
			for (JsonElement item : value.getAsJsonArray()) {
				if (item.isJsonPrimitive()) {
					result.add(item.getAsString());
				}
			}
		} else if (value.isJsonPrimitive()) {
			result.add(value.getAsString());
		}
		return result;
	}

	public void setAttribute(String name, JsonElement value) {
		attributes.add(name, value);
	}

	public void setAttribute(String name, String value) {
		attributes.addProperty(name, value);
	}

	public void setAttribute(String name, Number value) {
		attributes.addProperty(name, value);
	}

	public void setAttribute(String name, List<String> values) {
		JsonArray array = new JsonArray();
		for (String value : values) {
			array.add(value);
		}
		attributes.add(name, array);
	}

	public void removeAttribute(String name) {
		attributes.remove(name);
	}

	/**
	 * Copy all attributes including the internal ones.
	 * 
	 * @return deep copy of attributes
	 */
	public JsonObject copyAttributes() {
		return attributes.deepCopy();
	}

	/**
	 * Get the public attributes.
	 * 
	 * @return deep copy of the attributes without internal ones
	 */
	public JsonObject toJsonAttributes() {
		JsonObject result = new JsonObject();
		for (Map.Entry<String, JsonElement> entry : attributes.entrySet()) {
			if (!isInternal(entry.getKey())) {
				result.add(entry.getKey(), entry.getValue().deepCopy());
			}
		}
		return result;
	}

	/**
	 * Get JSON presentation.
	 * 
	 * @return public attributes wrapped by the type tag
	 */
	public JsonObject toJson() {
		JsonObject json = new JsonObject();
		json.add(getTypeTag(), toJsonAttributes());
		return json;
	}

	/**
	 * Checks, if a resource of the provided type may be created as child.
	 * 
	 * @param childType type of the child
	 * @return {@code true}, if allowed, {@code false}, otherwise.
	 */
	public boolean canHaveChild(ResourceType childType) {
		return false;
	}

	/**
	 * Activate the resource.
	 * 
	 * Called after the resource has been persisted the first time. May
	 * create auxiliary child resources and mutate attributes, the resource
	 * is persisted again afterwards.
	 * 
	 * @param parent parent resource
	 * @param originator originator of the creation
	 * @param services services of the CSE
	 * @throws DispatchException if the resource is not valid. The resource
	 *             is removed again.
	 */
	public void activate(Resource parent, String originator, ResourceServices services) throws DispatchException {
	}

	/**
	 * Update the resource.
	 * 
	 * Applies the provided attributes. A JSON null removes an attribute.
	 * Refreshes the last modified time and increments the state tag, if
	 * available.
	 * 
	 * @param changes attributes to apply
	 * @param originator originator of the update
	 * @param services services of the CSE
	 * @throws DispatchException if the changes are not valid
	 */
	public void update(JsonObject changes, String originator, ResourceServices services) throws DispatchException {
		for (String name : changes.keySet()) {
			if (isInternal(name) || !isUpdatable(name)) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attribute " + name + " is not updatable");
			}
		}
		for (Map.Entry<String, JsonElement> entry : changes.entrySet()) {
			if (entry.getValue().isJsonNull()) {
				attributes.remove(entry.getKey());
			} else {
				attributes.add(entry.getKey(), entry.getValue().deepCopy());
			}
		}
		setAttribute(LAST_MODIFIED_TIME, M2MTime.now());
		Integer stateTag = getInteger(STATE_TAG);
		if (stateTag != null) {
			setAttribute(STATE_TAG, stateTag + 1);
		}
	}

	/**
	 * Checks, if an attribute may be changed by an UPDATE.
	 * 
	 * @param name attribute name
	 * @return {@code true}, if updatable, {@code false}, otherwise.
	 */
	protected boolean isUpdatable(String name) {
		return !IMMUTABLE.contains(name);
	}

	/**
	 * Deactivate the resource before it gets deleted.
	 * 
	 * Deletes the child resources.
	 * 
	 * @param originator originator of the deletion
	 * @param services services of the CSE
	 */
	public void deactivate(String originator, ResourceServices services) {
		for (Resource child : services.childResources(getId(), null)) {
			services.deleteResource(child, originator);
		}
	}

	/**
	 * Called after a child has been created and activated.
	 * 
	 * @param child the new child
	 * @param originator originator of the creation
	 * @param services services of the CSE
	 */
	public void childAdded(Resource child, String originator, ResourceServices services) {
	}

	/**
	 * Called after a child has been deleted.
	 * 
	 * @param child the deleted child
	 * @param originator originator of the deletion
	 * @param services services of the CSE
	 */
	public void childRemoved(Resource child, String originator, ResourceServices services) {
	}

	/**
	 * Checks, if the attribute is internal.
	 * 
	 * @param name attribute name
	 * @return {@code true}, if the name starts with "__"
	 */
	public static boolean isInternal(String name) {
		return name.startsWith("__");
	}

	/**
	 * Require string attribute.
	 * 
	 * @param name attribute name
	 * @return string value
	 * @throws DispatchException with {@link ResponseStatusCode#BAD_REQUEST},
	 *             if the attribute is missing.
	 */
	protected String requireString(String name) throws DispatchException {
		String value = getString(name);
		if (value == null || value.isEmpty()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST,
					"attribute " + name + " is mandatory for " + getTypeTag());
		}
		return value;
	}

	/**
	 * Require non negative integer attribute.
	 * 
	 * @param name attribute name
	 * @param mandatory {@code true}, if the attribute must be available
	 * @return integer value, or {@code null}, if not available and not
	 *         mandatory.
	 * @throws DispatchException with {@link ResponseStatusCode#BAD_REQUEST},
	 *             if the attribute is missing or no non negative number.
	 */
	protected Integer requireCount(String name, boolean mandatory) throws DispatchException {
		JsonElement value = getAttribute(name);
		if (value == null) {
			if (mandatory) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST,
						"attribute " + name + " is mandatory for " + getTypeTag());
			}
			return null;
		}
		Integer count = getInteger(name);
		if (count == null || count < 0) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST,
					"attribute " + name + " must be a non negative number");
		}
		return count;
	}

	@Override
	public String toString() {
		return getTypeTag() + "[" + getId() + ", " + getStructuredPath() + "]";
	}
}
