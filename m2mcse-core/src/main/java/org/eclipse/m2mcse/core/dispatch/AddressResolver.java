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

import java.util.Arrays;

import org.eclipse.m2mcse.core.resource.RemoteCse;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves request targets.
 * <p>
 * Three addressing modes are supported:
 * <dl>
 * <dt>SP-relative</dt>
 * <dd>{@code ~/<csi>/<ri>} or {@code ~/<csi>/<cse-rn>/<path>}</dd>
 * <dt>Absolute</dt>
 * <dd>{@code _/<spid>/<csi>/<ri>} or
 * {@code _/<spid>/<csi>/<cse-rn>/<path>}</dd>
 * <dt>CSE-relative</dt>
 * <dd>{@code <ri>} or {@code <cse-rn>/<path>}</dd>
 * </dl>
 * A resource id followed by a sub path, as in {@code <ri>/fopt}, is
 * resolved relative to the structured path of the resource.
 * A target with a leading "//" is taken as absolute, with a leading "/" as
 * SP-relative. A target naming only a CSE resolves to the CSE base, if
 * local, or to the registration record of the remote CSE.
 */
public class AddressResolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(AddressResolver.class);

	public static final String SP_RELATIVE = "~";
	public static final String ABSOLUTE = "_";

	private final String cseId;
	private final String cseResourceId;
	private final String cseResourceName;
	private final ResourceStore store;

	/**
	 * Create resolver.
	 * 
	 * @param cseId CSE-ID of the local CSE, with or without leading "/".
	 * @param cseResourceId resource id of the CSE base
	 * @param cseResourceName resource name of the CSE base
	 * @param store resource store
	 */
	public AddressResolver(String cseId, String cseResourceId, String cseResourceName, ResourceStore store) {
		this.cseId = RemoteCse.normalizeCseId(cseId);
		this.cseResourceId = cseResourceId;
		this.cseResourceName = cseResourceName;
		this.store = store;
	}

	/**
	 * Resolve target.
	 * 
	 * @param target target of the request
	 * @return resolved address, or {@code null}, if the target is malformed
	 *         or names an unknown CSE.
	 */
	public ResolvedAddress resolve(String target) {
		if (target == null || target.isEmpty()) {
			return null;
		}
		String path = normalize(target);
		String[] segments = path.split("/", -1);
		for (String segment : segments) {
			if (segment.isEmpty()) {
				LOGGER.debug("empty segment in {}", target);
				return null;
			}
		}
		ResolvedAddress address;
		if (SP_RELATIVE.equals(segments[0])) {
			address = resolveCseScoped(segments, 1);
		} else if (ABSOLUTE.equals(segments[0])) {
			address = resolveCseScoped(segments, 2);
		} else if (segments.length == 1 && (!segments[0].equals(cseResourceName) || segments[0].equals(cseResourceId))) {
			address = local(segments[0], null);
		} else if (segments[0].equals(cseResourceName)) {
			address = local(null, path);
		} else {
			address = local(segments[0], path.substring(segments[0].length() + 1));
		}
		LOGGER.trace("{} => {}", target, address);
		return address;
	}

	/**
	 * Resolve a target starting with a CSE-ID.
	 * 
	 * @param segments segments of the target
	 * @param cseIndex index of the CSE-ID segment
	 * @return resolved address, or {@code null}, if not resolvable.
	 */
	private ResolvedAddress resolveCseScoped(String[] segments, int cseIndex) {
		if (segments.length <= cseIndex) {
			return null;
		}
		String csi = segments[cseIndex];
		int first = cseIndex + 1;
		if (segments.length == first) {
			if (csi.equals(cseId)) {
				return local(cseResourceId, null);
			}
			String id = store.resolveCseId(csi);
			if (id == null) {
				LOGGER.debug("CSE {} not registered", csi);
				return null;
			}
			return local(id, null);
		}
		String remainder = String.join("/", Arrays.copyOfRange(segments, first, segments.length));
		boolean structured = segments.length > first + 1;
		if (!csi.equals(cseId)) {
			return structured ? new ResolvedAddress(null, csi, remainder) : new ResolvedAddress(remainder, csi, null);
		}
		if (segments[first].equals(cseResourceName)) {
			return local(null, remainder);
		}
		if (structured) {
			return local(segments[first], remainder.substring(segments[first].length() + 1));
		}
		return local(remainder, null);
	}

	/**
	 * Complete a local address.
	 * 
	 * A resource id followed by a sub path is resolved to the structured
	 * path of the resource extended by the sub path.
	 * 
	 * @param id resource id. May be {@code null}.
	 * @param path structured path, or sub path, if an id is provided. May
	 *            be {@code null}.
	 * @return resolved address
	 */
	private ResolvedAddress local(String id, String path) {
		if (id != null) {
			Resource resource = store.get(id);
			if (path != null) {
				if (resource == null) {
					return null;
				}
				return local(null, resource.getStructuredPath() + "/" + path);
			}
			return new ResolvedAddress(id, cseId, resource == null ? null : resource.getStructuredPath());
		}
		Resource resource = store.getByPath(path);
		return new ResolvedAddress(resource == null ? null : resource.getId(), cseId, path);
	}

	private static String normalize(String target) {
		if (target.startsWith("//")) {
			return ABSOLUTE + target.substring(1);
		} else if (target.startsWith("/")) {
			return SP_RELATIVE + target;
		}
		return target;
	}
}
