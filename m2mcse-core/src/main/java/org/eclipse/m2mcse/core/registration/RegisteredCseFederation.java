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
package org.eclipse.m2mcse.core.registration;

import org.eclipse.m2mcse.core.dispatch.CseRequest;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;
import org.eclipse.m2mcse.core.dispatch.Result;
import org.eclipse.m2mcse.core.resource.RemoteCse;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Federation forwarding to the registered remote CSEs.
 * 
 * The registration record of the target CSE is looked up and handed to
 * the {@link TransitForwarder} together with the request.
 */
public class RegisteredCseFederation implements Federation {

	private static final Logger LOGGER = LoggerFactory.getLogger(RegisteredCseFederation.class);

	private final String localCseId;
	private final ResourceStore store;
	private final TransitForwarder forwarder;

	/**
	 * Create federation.
	 * 
	 * @param localCseId CSE-ID of the local CSE
	 * @param store resource store with the registration records
	 * @param forwarder transport binding. May be {@code null}, if no binding
	 *            is available.
	 */
	public RegisteredCseFederation(String localCseId, ResourceStore store, TransitForwarder forwarder) {
		this.localCseId = RemoteCse.normalizeCseId(localCseId);
		this.store = store;
		this.forwarder = forwarder;
	}

	@Override
	public boolean isRemoteTarget(String cseId) {
		String normalized = RemoteCse.normalizeCseId(cseId);
		return normalized != null && !normalized.isEmpty() && !normalized.equals(localCseId);
	}

	@Override
	public Result forward(CseRequest request, String cseId, String target) {
		String id = store.resolveCseId(cseId);
		Resource remoteCse = id == null ? null : store.get(id);
		if (remoteCse == null) {
			LOGGER.debug("CSE {} not registered", cseId);
			return Result.error(ResponseStatusCode.TARGET_NOT_REACHABLE, "CSE " + cseId + " not registered");
		}
		if (forwarder == null) {
			return Result.error(ResponseStatusCode.TARGET_NOT_REACHABLE, "no transit forwarder available");
		}
		LOGGER.debug("forward {} to {} of {}", request.getOperation(), target, cseId);
		try {
			Result result = forwarder.forward(remoteCse, request, target);
			if (result == null) {
				return Result.error(ResponseStatusCode.TARGET_NOT_REACHABLE, "no response from " + cseId);
			}
			return result;
		} catch (RuntimeException ex) {
			LOGGER.error("forwarding to {} failed", cseId, ex);
			return Result.error(ResponseStatusCode.TARGET_NOT_REACHABLE, "forwarding to " + cseId + " failed");
		}
	}
}
