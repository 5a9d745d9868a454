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

import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.ResponseStatusCode;
import org.eclipse.m2mcse.core.resource.ApplicationEntity;
import org.eclipse.m2mcse.core.resource.RemoteCse;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceFactory;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.eclipse.m2mcse.core.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration of AEs and remote CSEs.
 * <p>
 * An AE gets the originator as AE-ID and resource id. The originators "C"
 * and "S", or an empty originator, get a generated AE-ID with that prefix.
 * A remote CSE gets its CSE-ID as resource id. The CSE base can not be
 * deleted.
 */
public class DefaultRegistrationManager implements RegistrationManager {

	private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRegistrationManager.class);

	private final ResourceStore store;
	private final ResourceFactory factory;

	public DefaultRegistrationManager(ResourceStore store, ResourceFactory factory) {
		this.store = store;
		this.factory = factory;
	}

	@Override
	public String checkResourceCreation(Resource resource, String originator, Resource parent)
			throws DispatchException {
		if (resource.getType() == ResourceType.APPLICATION_ENTITY) {
			return registerAe(resource, originator);
		} else if (resource.getType() == ResourceType.REMOTE_CSE) {
			registerRemoteCse(resource);
		}
		return originator;
	}

	@Override
	public void checkResourceDeletion(Resource resource, String originator) throws DispatchException {
		if (resource.getType() == ResourceType.CSE_BASE) {
			throw new DispatchException(ResponseStatusCode.OPERATION_NOT_ALLOWED, "CSE base can not be deleted");
		}
		if (resource.getType() == ResourceType.APPLICATION_ENTITY || resource.getType() == ResourceType.REMOTE_CSE) {
			LOGGER.info("deregistered {}", resource.getId());
		}
	}

	private String registerAe(Resource resource, String originator) throws DispatchException {
		String aeId;
		if (originator == null || originator.isEmpty() || originator.equals("C")) {
			aeId = "C" + factory.randomIdentifier();
		} else if (originator.equals("S")) {
			aeId = "S" + factory.randomIdentifier();
		} else {
			aeId = originator;
		}
		if (store.exists(aeId, null)) {
			throw new DispatchException(ResponseStatusCode.CONFLICT, "originator " + aeId + " already registered");
		}
		resource.setAttribute(Resource.ID, aeId);
		resource.setAttribute(ApplicationEntity.AE_ID, aeId);
		LOGGER.info("registered AE {}", aeId);
		return aeId;
	}

	private void registerRemoteCse(Resource resource) throws DispatchException {
		String cseId = RemoteCse.normalizeCseId(resource.getString(RemoteCse.CSE_ID));
		if (cseId == null || cseId.isEmpty()) {
			throw new DispatchException(ResponseStatusCode.BAD_REQUEST, "attribute csi is mandatory for "
					+ resource.getTypeTag());
		}
		if (store.resolveCseId(cseId) != null || store.exists(cseId, null)) {
			throw new DispatchException(ResponseStatusCode.CONFLICT, "CSE " + cseId + " already registered");
		}
		resource.setAttribute(Resource.ID, cseId);
		LOGGER.info("registered remote CSE {}", cseId);
	}
}
