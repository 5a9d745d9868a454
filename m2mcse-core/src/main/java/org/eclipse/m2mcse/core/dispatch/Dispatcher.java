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
import java.util.List;
import java.util.Map;

import org.eclipse.m2mcse.core.config.CseConfig;
import org.eclipse.m2mcse.core.discovery.DiscoveryEngine;
import org.eclipse.m2mcse.core.discovery.FilterCriteria;
import org.eclipse.m2mcse.core.event.EventSink;
import org.eclipse.m2mcse.core.registration.Federation;
import org.eclipse.m2mcse.core.registration.RegistrationManager;
import org.eclipse.m2mcse.core.resource.FanOutPoint;
import org.eclipse.m2mcse.core.resource.Group;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceFactory;
import org.eclipse.m2mcse.core.resource.ResourceServices;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.eclipse.m2mcse.core.resource.VirtualResource;
import org.eclipse.m2mcse.core.result.ResultTreeBuilder;
import org.eclipse.m2mcse.core.security.AccessFilter;
import org.eclipse.m2mcse.core.security.Permission;
import org.eclipse.m2mcse.core.store.ResourceLocks;
import org.eclipse.m2mcse.core.store.ResourceStore;
import org.eclipse.m2mcse.elements.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Dispatches requests to the resource tree.
 * <p>
 * Each request passes the same preamble: the target is resolved, requests
 * for remote CSEs are forwarded, requests to a fan-out point or below it
 * are distributed to the group members. Otherwise the generic CRUD
 * algorithm is executed, or, for virtual resources, the handler of the
 * resource.
 * <p>
 * Mutations are serialized per resource id, CREATE on the parent, UPDATE
 * on the target, DELETE on the parent and the target.
 */
public class Dispatcher implements ResourceServices {

	private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);

	private static final String FAN_OUT_SEGMENT = "/" + Group.FAN_OUT_POINT_NAME;

	private final ResourceStore store;
	private final AccessFilter accessFilter;
	private final RegistrationManager registration;
	private final Federation federation;
	private final EventSink events;
	private final ResourceFactory factory;
	private final AddressResolver resolver;
	private final DiscoveryEngine discovery;
	private final ResourceLocks locks = new ResourceLocks();
	private final boolean enableTransit;

	/**
	 * Create dispatcher.
	 * 
	 * @param config configuration with {@link CseConfig} definitions
	 * @param store resource store
	 * @param accessFilter access filter
	 * @param registration registration bookkeeping
	 * @param federation federation with remote CSEs
	 * @param events sink for resource events
	 * @param factory resource factory
	 */
	public Dispatcher(Configuration config, ResourceStore store, AccessFilter accessFilter,
			RegistrationManager registration, Federation federation, EventSink events, ResourceFactory factory) {
		this.store = store;
		this.accessFilter = accessFilter;
		this.registration = registration;
		this.federation = federation;
		this.events = events;
		this.factory = factory;
		this.resolver = new AddressResolver(config.get(CseConfig.CSE_ID), config.get(CseConfig.CSE_RESOURCE_ID),
				config.get(CseConfig.CSE_RESOURCE_NAME), store);
		this.discovery = new DiscoveryEngine(store, config.get(CseConfig.DISCOVERY_RESULT_LIMIT));
		this.enableTransit = config.get(CseConfig.ENABLE_TRANSIT_REQUESTS);
	}

	public AddressResolver getAddressResolver() {
		return resolver;
	}

	@Override
	public Result process(CseRequest request) {
		try {
			ResolvedAddress address = resolver.resolve(request.getTo());
			if (address == null) {
				throw new DispatchException(ResponseStatusCode.NOT_FOUND, "target " + request.getTo() + " not found");
			}
			Result result = redirect(request, address);
			if (result == null) {
				switch (request.getOperation()) {
				case CREATE:
					result = processCreate(request, address);
					break;
				case RETRIEVE:
					result = processRetrieve(request, address);
					break;
				case UPDATE:
					result = processUpdate(request, address);
					break;
				case DELETE:
					result = processDelete(request, address);
					break;
				default:
					throw new DispatchException(ResponseStatusCode.OPERATION_NOT_ALLOWED,
							"unsupported operation " + request.getOperation());
				}
			}
			LOGGER.debug("{} {} => {}", request.getOperation(), request.getTo(), result.getStatus());
			return result;
		} catch (DispatchException ex) {
			LOGGER.debug("{} {} failed: {} {}", request.getOperation(), request.getTo(), ex.getStatus(),
					ex.getMessage());
			return ex.toResult();
		} catch (RuntimeException ex) {
			LOGGER.error("{} {} failed!", request.getOperation(), request.getTo(), ex);
			return Result.error(ResponseStatusCode.INTERNAL_SERVER_ERROR, "internal error");
		}
	}

	/**
	 * Forward request to remote CSE or distribute it by a fan-out point.
	 * 
	 * @param request request
	 * @param address resolved target
	 * @return result, or {@code null}, if the request is processed locally.
	 * @throws DispatchException if the target is not available or transit
	 *             requests are disabled.
	 */
	private Result redirect(CseRequest request, ResolvedAddress address) throws DispatchException {
		if (federation.isRemoteTarget(address.getCseId())) {
			if (!enableTransit) {
				throw new DispatchException(ResponseStatusCode.OPERATION_NOT_ALLOWED,
						"transit requests are disabled");
			}
			String target = address.getStructuredPath() != null ? address.getStructuredPath()
					: address.getResourceId();
			LOGGER.debug("transit {} to {}", request.getOperation(), address);
			return federation.forward(request, address.getCseId(), target);
		}
		if (address.getResourceId() == null && address.getStructuredPath() == null) {
			throw new DispatchException(ResponseStatusCode.NOT_FOUND, "target " + request.getTo() + " not found");
		}
		String path = address.getStructuredPath();
		if (path != null) {
			int index = path.indexOf(FAN_OUT_SEGMENT);
			while (index >= 0) {
				int end = index + FAN_OUT_SEGMENT.length();
				if (end == path.length() || path.charAt(end) == '/') {
					Resource fanOutPoint = store.getByPath(path.substring(0, end));
					if (fanOutPoint instanceof FanOutPoint) {
						LOGGER.debug("fan-out {} {}", request.getOperation(), path);
						return ((FanOutPoint) fanOutPoint).fanOut(request, request.getOriginator(),
								path.substring(end), this);
					}
				}
				index = path.indexOf(FAN_OUT_SEGMENT, end);
			}
		}
		return null;
	}

	private Resource requireTarget(CseRequest request, ResolvedAddress address) throws DispatchException {
		Resource resource = null;
		if (address.getResourceId() != null) {
			resource = store.get(address.getResourceId());
		}
		if (resource == null) {
			throw new DispatchException(ResponseStatusCode.NOT_FOUND, "target " + request.getTo() + " not found");
		}
		return resource;
	}

	private void checkAccess(String originator, Resource resource, Permission permission) throws DispatchException {
		if (!accessFilter.hasAccess(originator, resource, permission)) {
			throw noPrivilege(originator, resource, permission);
		}
	}

	private static DispatchException noPrivilege(String originator, Resource resource, Permission permission) {
		return new DispatchException(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE,
				"originator " + originator + " has no " + permission + " privilege for " + resource.getId());
	}

	private Result processRetrieve(CseRequest request, ResolvedAddress address) throws DispatchException {
		Resource resource = requireTarget(request, address);
		RequestArguments arguments = RequestArguments.parse(request.getQuery(), Operation.RETRIEVE);
		String originator = request.getOriginator();
		if (resource instanceof VirtualResource) {
			return ((VirtualResource) resource).handleRetrieve(request, originator, this);
		}
		FilterCriteria criteria = arguments.getFilterCriteria();
		ResultContent content = arguments.getResultContent();
		if (criteria.isDiscovery() && content != ResultContent.ATTRIBUTES) {
			return discover(resource, originator, arguments);
		}
		checkAccess(originator, resource, Permission.RETRIEVE);
		DesiredIdentifierResultType identifierType = arguments.getDesiredIdentifierResultType();
		switch (content) {
		case ATTRIBUTES:
			return Result.of(ResponseStatusCode.OK, resource);
		case ATTRIBUTES_AND_CHILD_RESOURCES:
			return Result.of(ResponseStatusCode.OK, resource,
					ResultTreeBuilder.fullTree(resource, descendants(resource, originator, criteria)));
		case ATTRIBUTES_AND_CHILD_RESOURCE_REFERENCES:
			return Result.of(ResponseStatusCode.OK, resource, ResultTreeBuilder
					.childReferences(descendants(resource, originator, criteria), resource, identifierType));
		case CHILD_RESOURCE_REFERENCES:
			return Result.of(ResponseStatusCode.OK, resource,
					ResultTreeBuilder.referenceList(descendants(resource, originator, criteria), identifierType));
		case CHILD_RESOURCES:
			return Result.of(ResponseStatusCode.OK, resource,
					ResultTreeBuilder.childTree(resource, descendants(resource, originator, criteria)));
		default:
			throw new DispatchException(ResponseStatusCode.INVALID_ARGUMENTS,
					"result content " + content.value + " not supported for RETRIEVE");
		}
	}

	/**
	 * Get the descendants the originator may retrieve.
	 */
	private List<Resource> descendants(Resource resource, String originator, FilterCriteria criteria) {
		List<Resource> result = new ArrayList<>();
		for (Resource descendant : discovery.discoverDescendants(resource, criteria)) {
			if (accessFilter.hasAccess(originator, descendant, Permission.RETRIEVE)) {
				result.add(descendant);
			}
		}
		return result;
	}

	private Result discover(Resource root, String originator, RequestArguments arguments) throws DispatchException {
		ResultContent content = arguments.getResultContent();
		switch (content) {
		case ATTRIBUTES_AND_CHILD_RESOURCES:
		case ATTRIBUTES_AND_CHILD_RESOURCE_REFERENCES:
		case CHILD_RESOURCE_REFERENCES:
		case CHILD_RESOURCES:
		case DISCOVERY_RESULT_REFERENCES:
			break;
		default:
			throw new DispatchException(ResponseStatusCode.INVALID_ARGUMENTS,
					"result content " + content.value + " not supported for discovery");
		}
		checkAccess(originator, root, Permission.DISCOVERY);
		FilterCriteria criteria = arguments.getFilterCriteria();
		String relativePath = criteria.getApplicableRelativePath();
		List<Resource> found = new ArrayList<>();
		for (Resource resource : discovery.discover(root, criteria)) {
			if (relativePath != null) {
				resource = store.getByPath(resource.getStructuredPath() + "/" + relativePath);
			}
			if (resource != null && accessFilter.hasAccess(originator, resource, Permission.DISCOVERY)) {
				found.add(resource);
			}
		}
		LOGGER.debug("discovery below {} found {} resources for {}", root.getId(), found.size(), originator);
		DesiredIdentifierResultType identifierType = arguments.getDesiredIdentifierResultType();
		boolean attributes = accessFilter.hasAccess(originator, root, Permission.RETRIEVE);
		JsonObject body;
		switch (content) {
		case ATTRIBUTES_AND_CHILD_RESOURCES:
			body = attributes ? ResultTreeBuilder.fullTree(root, found) : ResultTreeBuilder.childTree(root, found);
			break;
		case ATTRIBUTES_AND_CHILD_RESOURCE_REFERENCES:
			body = ResultTreeBuilder.childReferences(found, attributes ? root : null, identifierType);
			break;
		case CHILD_RESOURCES:
			body = ResultTreeBuilder.childTree(root, found);
			break;
		case DISCOVERY_RESULT_REFERENCES:
			body = ResultTreeBuilder.uriList(found, identifierType);
			break;
		default:
			body = ResultTreeBuilder.referenceList(found, identifierType);
			break;
		}
		return Result.of(ResponseStatusCode.OK, null, body);
	}

	private Result processCreate(CseRequest request, ResolvedAddress address) throws DispatchException {
		ResourceType type = request.getResourceType();
		if (request.getContentType() == null || type == null) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "content type and resource type required");
		}
		Resource parent = requireTarget(request, address);
		ResultContent content = RequestArguments.parse(request.getQuery(), Operation.CREATE).getResultContent();
		if (content != ResultContent.NOTHING && content != ResultContent.ATTRIBUTES) {
			throw new DispatchException(ResponseStatusCode.INVALID_ARGUMENTS,
					"result content " + content.value + " not supported for CREATE");
		}
		String originator = request.getOriginator();
		if (parent instanceof VirtualResource) {
			checkAccess(originator, parent, Permission.CREATE);
			try (ResourceLocks.Guard guard = locks.lock(parent.getParentId())) {
				return ((VirtualResource) parent).handleCreate(request, originator, this);
			}
		}
		if (!accessFilter.hasAccess(originator, parent, Permission.CREATE, type, false)) {
			if (type == ResourceType.APPLICATION_ENTITY) {
				throw new DispatchException(ResponseStatusCode.SECURITY_ASSOCIATION_REQUIRED,
						"originator " + originator + " is not allowed to register");
			}
			throw noPrivilege(originator, parent, Permission.CREATE);
		}
		JsonObject payload = parsePayload(request);
		try (ResourceLocks.Guard guard = locks.lock(parent.getId())) {
			parent = store.get(parent.getId());
			if (parent == null) {
				throw new DispatchException(ResponseStatusCode.NOT_FOUND, "target " + request.getTo() + " not found");
			}
			Resource resource = factory.fromRequest(payload, type, parent);
			if (!parent.canHaveChild(resource.getType())) {
				if (resource.getType() == ResourceType.SUBSCRIPTION) {
					throw new DispatchException(ResponseStatusCode.TARGET_NOT_SUBSCRIBABLE,
							parent.getTypeTag() + " is not subscribable");
				}
				throw new DispatchException(ResponseStatusCode.INVALID_CHILD_RESOURCE_TYPE,
						resource.getTypeTag() + " is no valid child of " + parent.getTypeTag());
			}
			if (store.exists(resource.getId(), resource.getStructuredPath())) {
				throw new DispatchException(ResponseStatusCode.CONFLICT,
						"resource " + resource.getStructuredPath() + " already exists");
			}
			String effectiveOriginator = registration.checkResourceCreation(resource, originator, parent);
			try {
				resource = createResource(resource, parent, effectiveOriginator);
			} catch (DispatchException | RuntimeException ex) {
				deregister(resource, effectiveOriginator);
				throw ex;
			}
			LOGGER.debug("created {} by {}", resource, effectiveOriginator);
			if (content == ResultContent.NOTHING) {
				return Result.empty(ResponseStatusCode.CREATED);
			}
			return Result.of(ResponseStatusCode.CREATED, resource);
		}
	}

	private void deregister(Resource resource, String originator) {
		try {
			registration.checkResourceDeletion(resource, originator);
		} catch (DispatchException ex) {
			LOGGER.error("deregistration of {} failed: {}", resource.getId(), ex.getMessage());
		}
	}

	private Result processUpdate(CseRequest request, ResolvedAddress address) throws DispatchException {
		Resource resource = requireTarget(request, address);
		ResultContent content = RequestArguments.parse(request.getQuery(), Operation.UPDATE).getResultContent();
		if (content != ResultContent.NOTHING && content != ResultContent.ATTRIBUTES
				&& content != ResultContent.MODIFIED_ATTRIBUTES) {
			throw new DispatchException(ResponseStatusCode.NOT_IMPLEMENTED,
					"result content " + content.value + " not supported for UPDATE");
		}
		String originator = request.getOriginator();
		if (resource instanceof VirtualResource) {
			checkAccess(originator, resource, Permission.UPDATE);
			try (ResourceLocks.Guard guard = locks.lock(resource.getParentId())) {
				return ((VirtualResource) resource).handleUpdate(request, originator, this);
			}
		}
		if (resource.isReadOnly()) {
			throw new DispatchException(ResponseStatusCode.OPERATION_NOT_ALLOWED,
					resource.getTypeTag() + " is read-only");
		}
		JsonObject payload = parsePayload(request);
		JsonElement element = payload.get(resource.getTypeTag());
		if (payload.size() != 1 || element == null || !element.isJsonObject()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST,
					"payload must contain " + resource.getTypeTag() + " attributes");
		}
		JsonObject changes = element.getAsJsonObject();
		JsonElement policies = changes.get(Resource.ACP_IDS);
		if (policies != null) {
			Permission permission = policies.isJsonNull() ? Permission.DELETE : Permission.UPDATE;
			if (!accessFilter.hasAccess(originator, resource, permission, null, true)) {
				throw noPrivilege(originator, resource, permission);
			}
		} else {
			checkAccess(originator, resource, Permission.UPDATE);
		}
		try (ResourceLocks.Guard guard = locks.lock(resource.getId())) {
			resource = store.get(resource.getId());
			if (resource == null) {
				throw new DispatchException(ResponseStatusCode.NOT_FOUND, "target " + request.getTo() + " not found");
			}
			JsonObject before = resource.toJsonAttributes();
			resource.update(changes, originator, this);
			if (!store.update(resource)) {
				throw new DispatchException(ResponseStatusCode.NOT_FOUND, "target " + request.getTo() + " not found");
			}
			LOGGER.debug("updated {} by {}", resource, originator);
			switch (content) {
			case NOTHING:
				return Result.empty(ResponseStatusCode.UPDATED);
			case MODIFIED_ATTRIBUTES:
				JsonObject body = new JsonObject();
				body.add(resource.getTypeTag(), modifiedAttributes(before, resource.toJsonAttributes()));
				return Result.of(ResponseStatusCode.UPDATED, resource, body);
			default:
				return Result.of(ResponseStatusCode.UPDATED, resource);
			}
		}
	}

	/**
	 * Get the attributes, which are changed or added.
	 * 
	 * @param before attributes before the update
	 * @param after attributes after the update
	 * @return changed and added attributes
	 */
	static JsonObject modifiedAttributes(JsonObject before, JsonObject after) {
		JsonObject modified = new JsonObject();
		for (Map.Entry<String, JsonElement> entry : after.entrySet()) {
			if (!Resource.isInternal(entry.getKey()) && !entry.getValue().equals(before.get(entry.getKey()))) {
				modified.add(entry.getKey(), entry.getValue().deepCopy());
			}
		}
		return modified;
	}

	private Result processDelete(CseRequest request, ResolvedAddress address) throws DispatchException {
		Resource resource = requireTarget(request, address);
		ResultContent content = RequestArguments.parse(request.getQuery(), Operation.DELETE).getResultContent();
		if (content != ResultContent.NOTHING && content != ResultContent.ATTRIBUTES) {
			throw new DispatchException(ResponseStatusCode.INVALID_ARGUMENTS,
					"result content " + content.value + " not supported for DELETE");
		}
		String originator = request.getOriginator();
		if (resource instanceof VirtualResource) {
			checkAccess(originator, resource, Permission.DELETE);
			try (ResourceLocks.Guard guard = locks.lock(resource.getParentId())) {
				return ((VirtualResource) resource).handleDelete(request, originator, this);
			}
		}
		checkAccess(originator, resource, Permission.DELETE);
		try (ResourceLocks.Guard guard = locks.lock(resource.getParentId(), resource.getId())) {
			resource = store.get(resource.getId());
			if (resource == null) {
				throw new DispatchException(ResponseStatusCode.NOT_FOUND, "target " + request.getTo() + " not found");
			}
			try {
				registration.checkResourceDeletion(resource, originator);
			} catch (DispatchException ex) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST, ex.getMessage());
			}
			deleteResource(resource, originator);
			LOGGER.debug("deleted {} by {}", resource, originator);
		}
		if (content == ResultContent.NOTHING) {
			return Result.empty(ResponseStatusCode.DELETED);
		}
		return Result.of(ResponseStatusCode.DELETED, resource);
	}

	private static JsonObject parsePayload(CseRequest request) throws DispatchException {
		String content = request.getContent();
		if (content == null || content.isEmpty()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "payload required");
		}
		try {
			JsonElement element = JsonParser.parseString(content);
			if (!element.isJsonObject()) {
				throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "payload must be a JSON object");
			}
			return element.getAsJsonObject();
		} catch (JsonParseException ex) {
			LOGGER.warn("malformed payload from {}: {}", request.getOriginator(), ex.getMessage());
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "malformed payload");
		}
	}

	@Override
	public Resource retrieveLocalResource(String id) {
		return id == null ? null : store.get(id);
	}

	@Override
	public List<Resource> childResources(String parentId, ResourceType type) {
		return store.children(parentId, type);
	}

	@Override
	public Resource createResource(Resource resource, Resource parent, String originator) throws DispatchException {
		if (!store.create(resource)) {
			throw new DispatchException(ResponseStatusCode.CONFLICT,
					"resource " + resource.getId() + " already exists");
		}
		try {
			resource.activate(parent, originator, this);
		} catch (DispatchException | RuntimeException ex) {
			LOGGER.info("activation of {} failed: {}", resource.getId(), ex.getMessage());
			removeSubtree(resource);
			throw ex;
		}
		store.update(resource);
		Resource current = parent == null ? null : store.get(parent.getId());
		if (current != null) {
			current.childAdded(resource, originator, this);
		}
		events.resourceCreated(resource, originator);
		return resource;
	}

	private void removeSubtree(Resource resource) {
		List<Resource> descendants = store.queryDescendants(resource.getId(), descendant -> true, null, null, null);
		for (int index = descendants.size() - 1; index >= 0; --index) {
			store.delete(descendants.get(index).getId());
		}
		if (!store.delete(resource.getId())) {
			LOGGER.error("removing {} failed!", resource.getId());
		}
	}

	@Override
	public boolean updateResource(Resource resource) {
		return store.update(resource);
	}

	@Override
	public void deleteResource(Resource resource, String originator) {
		Resource parent = retrieveLocalResource(resource.getParentId());
		resource.deactivate(originator, this);
		if (!store.delete(resource.getId())) {
			LOGGER.debug("{} already removed", resource.getId());
		}
		events.resourceDeleted(resource, originator);
		if (parent != null) {
			parent.childRemoved(resource, originator, this);
		}
	}

	@Override
	public boolean hasAccess(String originator, Resource resource, Permission permission) {
		return accessFilter.hasAccess(originator, resource, permission);
	}

	@Override
	public ResourceFactory getResourceFactory() {
		return factory;
	}
}
