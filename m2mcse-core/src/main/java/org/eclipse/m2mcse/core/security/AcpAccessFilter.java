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
package org.eclipse.m2mcse.core.security;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.eclipse.m2mcse.core.resource.AccessControlPolicy;
import org.eclipse.m2mcse.core.resource.ApplicationEntity;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.eclipse.m2mcse.core.store.ResourceStore;
import org.eclipse.m2mcse.core.util.Wildcard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Access filter evaluating access control policies.
 * <p>
 * The rules are evaluated in this order:
 * <ol>
 * <li>the admin originator is always granted.</li>
 * <li>AE registrations are granted for originators matching one of the
 * allowed AE originator patterns.</li>
 * <li>the originator of an AE is granted on the AE and its
 * descendants.</li>
 * <li>policies are evaluated with their self privileges ({@code pvs}) for
 * access control policies themselves and for self checks, with their
 * privileges ({@code pv}) otherwise. A resource without policy references
 * inherits the evaluation of its parent. The CSE base without policy
 * references grants nothing.</li>
 * </ol>
 */
public class AcpAccessFilter implements AccessFilter {

	private static final Logger LOGGER = LoggerFactory.getLogger(AcpAccessFilter.class);

	/**
	 * Originator pattern matching all originators.
	 */
	public static final String ALL = "all";

	private final ResourceStore store;
	private final String adminOriginator;
	private final List<Pattern> allowedAeOriginators = new ArrayList<>();

	/**
	 * Create access filter.
	 * 
	 * @param store resource store to lookup policies and ancestors
	 * @param adminOriginator admin originator
	 * @param allowedAeOriginators regular expressions of originators allowed
	 *            to register AEs
	 * @throws java.util.regex.PatternSyntaxException if a regular expression
	 *             is invalid
	 */
	public AcpAccessFilter(ResourceStore store, String adminOriginator, List<String> allowedAeOriginators) {
		this.store = store;
		this.adminOriginator = adminOriginator;
		for (String expression : allowedAeOriginators) {
			this.allowedAeOriginators.add(Pattern.compile(expression));
		}
	}

	@Override
	public boolean hasAccess(String originator, Resource resource, Permission permission, ResourceType childType,
			boolean checkSelf) {
		if (adminOriginator.equals(originator)) {
			return true;
		}
		if (permission == Permission.CREATE && childType == ResourceType.APPLICATION_ENTITY) {
			return isAllowedAeOriginator(originator);
		}
		if (originator == null || originator.isEmpty()) {
			return false;
		}
		if (isCreatorAe(originator, resource)) {
			return true;
		}
		if (resource.getType() == ResourceType.ACCESS_CONTROL_POLICY) {
			return isGranted(originator, (AccessControlPolicy) resource, permission, true);
		}
		Resource current = resource;
		while (current != null) {
			List<String> policyIds = current.getAccessControlPolicyIds();
			if (!policyIds.isEmpty()) {
				return isGranted(originator, policyIds, permission, checkSelf);
			}
			if (current.getType() == ResourceType.CSE_BASE || checkSelf) {
				break;
			}
			current = store.get(current.getParentId());
		}
		LOGGER.debug("no policy grants {} for {} to {}", permission, resource, originator);
		return false;
	}

	private boolean isAllowedAeOriginator(String originator) {
		String candidate = originator == null ? "" : originator;
		for (Pattern pattern : allowedAeOriginators) {
			if (pattern.matcher(candidate).matches()) {
				return true;
			}
		}
		LOGGER.debug("AE registration of {} not allowed", originator);
		return false;
	}

	private boolean isCreatorAe(String originator, Resource resource) {
		Resource current = resource;
		while (current != null && current.getType() != ResourceType.CSE_BASE) {
			if (current instanceof ApplicationEntity) {
				return originator.equals(((ApplicationEntity) current).getAeId());
			}
			current = store.get(current.getParentId());
		}
		return false;
	}

	private boolean isGranted(String originator, List<String> policyIds, Permission permission, boolean self) {
		for (String policyId : policyIds) {
			Resource policy = store.get(policyId);
			if (policy instanceof AccessControlPolicy
					&& isGranted(originator, (AccessControlPolicy) policy, permission, self)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isGranted(String originator, AccessControlPolicy policy, Permission permission,
			boolean self) {
		JsonObject privileges = policy.getPrivileges(self);
		if (privileges == null) {
			return false;
		}
		JsonElement rules = privileges.get(AccessControlPolicy.RULES);
		if (rules == null || !rules.isJsonArray()) {
			return false;
		}
		for (JsonElement rule : rules.getAsJsonArray()) {
			if (rule.isJsonObject() && isGranted(originator, rule.getAsJsonObject(), permission)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isGranted(String originator, JsonObject rule, Permission permission) {
		JsonElement operations = rule.get(AccessControlPolicy.OPERATIONS);
		if (operations == null || !operations.isJsonPrimitive() || !operations.getAsJsonPrimitive().isNumber()
				|| !permission.isGrantedBy(operations.getAsInt())) {
			return false;
		}
		JsonElement originators = rule.get(AccessControlPolicy.ORIGINATORS);
		if (originators == null || !originators.isJsonArray()) {
			return false;
		}
		for (JsonElement pattern : originators.getAsJsonArray()) {
			if (pattern.isJsonPrimitive() && matches(pattern.getAsString(), originator)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Match originator against {@code acor} pattern.
	 * 
	 * @param pattern pattern, "all" or with "*" wildcards
	 * @param originator originator
	 * @return {@code true}, if matching.
	 */
	static boolean matches(String pattern, String originator) {
		return ALL.equals(pattern) || Wildcard.matches(pattern, originator);
	}
}
