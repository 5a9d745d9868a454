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

import java.util.HashSet;
import java.util.Set;

import org.eclipse.m2mcse.core.dispatch.CseRequest;
import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;
import org.eclipse.m2mcse.core.dispatch.Result;
import org.eclipse.m2mcse.core.security.Permission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Fan-out point of a group.
 * 
 * Requests to the fan-out point, or to a path below it, are dispatched to
 * every member of the group, with the path below the fan-out point
 * appended to the member's address. The responses are aggregated into an
 * {@code m2m:agr} body.
 */
public class FanOutPoint extends VirtualResource {

	private static final Logger LOGGER = LoggerFactory.getLogger(FanOutPoint.class);

	public static final String AGGREGATED_RESPONSE = "m2m:agr";
	public static final String RESPONSE = "m2m:rsp";

	/**
	 * Ids of the fan-out points currently expanded by the calling thread.
	 * Nested dispatches run on the same thread.
	 */
	private static final ThreadLocal<Set<String>> EXPANDING = ThreadLocal.withInitial(HashSet::new);

	public FanOutPoint(JsonObject attributes) {
		super(ResourceType.GROUP_FAN_OUT_POINT, attributes);
	}

	@Override
	public Result handleRetrieve(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		return fanOut(request, originator, "", services);
	}

	@Override
	public Result handleCreate(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		return fanOut(request, originator, "", services);
	}

	@Override
	public Result handleUpdate(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		return fanOut(request, originator, "", services);
	}

	@Override
	public Result handleDelete(CseRequest request, String originator, ResourceServices services)
			throws DispatchException {
		return fanOut(request, originator, "", services);
	}

	/**
	 * Dispatch the request to all members of the group.
	 * 
	 * @param request request
	 * @param originator originator of the request
	 * @param subPath path below the fan-out point, starting with "/", or
	 *            empty.
	 * @param services services of the CSE
	 * @return aggregated result
	 * @throws DispatchException if the group is not available, the
	 *             originator has no privileges on the group, or this
	 *             fan-out point is already expanded by an enclosing
	 *             fan-out.
	 */
	public Result fanOut(CseRequest request, String originator, String subPath, ResourceServices services)
			throws DispatchException {
		Resource resource = services.retrieveLocalResource(getParentId());
		if (!(resource instanceof Group)) {
			throw new DispatchException(ResponseStatusCode.NOT_FOUND, "group of fan-out point not found");
		}
		Group group = (Group) resource;
		Permission permission = request.getOperation().getPermission();
		if (!services.hasAccess(originator, group, permission)) {
			throw new DispatchException(ResponseStatusCode.ORIGINATOR_HAS_NO_PRIVILEGE,
					"originator has no privileges for " + request.getOperation() + " on group " + group.getId());
		}
		Set<String> expanding = EXPANDING.get();
		if (!expanding.add(getId())) {
			throw new DispatchException(ResponseStatusCode.OPERATION_NOT_ALLOWED,
					"recursive fan-out of group " + group.getId());
		}
		try {
			return Result.of(ResponseStatusCode.OK, null, distribute(request, group, subPath, services));
		} finally {
			expanding.remove(getId());
		}
	}

	private JsonObject distribute(CseRequest request, Group group, String subPath, ResourceServices services) {
		JsonArray responses = new JsonArray();
		for (String member : group.getMemberIds()) {
			String target = member + subPath;
			JsonObject response = new JsonObject();
			response.addProperty("to", target);
			if (isFanOutOf(group, target)) {
				response.addProperty("rsc", ResponseStatusCode.OPERATION_NOT_ALLOWED.value);
				response.addProperty("dbg", "recursive fan-out");
			} else {
				LOGGER.debug("fan-out {} to {}", request.getOperation(), target);
				Result result = services.process(request.toBuilder().to(target).build());
				response.addProperty("rsc", result.getStatus().value);
				JsonObject body = result.getBody();
				if (body != null) {
					response.add("pc", body);
				}
				if (result.getMessage() != null) {
					response.addProperty("dbg", result.getMessage());
				}
			}
			responses.add(response);
		}
		JsonObject aggregated = new JsonObject();
		aggregated.add(RESPONSE, responses);
		JsonObject body = new JsonObject();
		body.add(AGGREGATED_RESPONSE, aggregated);
		return body;
	}

	private static boolean isFanOutOf(Group group, String target) {
		String suffix = "/" + Group.FAN_OUT_POINT_NAME;
		return isBelow(target, group.getId() + suffix) || isBelow(target, group.getStructuredPath() + suffix);
	}

	private static boolean isBelow(String target, String path) {
		return target.equals(path) || target.startsWith(path + "/");
	}
}
