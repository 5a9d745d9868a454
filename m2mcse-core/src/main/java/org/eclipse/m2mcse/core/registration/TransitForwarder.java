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
import org.eclipse.m2mcse.core.dispatch.Result;
import org.eclipse.m2mcse.core.resource.Resource;

/**
 * Transport binding forwarding requests to a remote CSE.
 */
@FunctionalInterface
public interface TransitForwarder {

	/**
	 * Forward request.
	 * 
	 * @param remoteCse registration record of the remote CSE, providing the
	 *            points of access.
	 * @param request original request
	 * @param target address of the target within the remote CSE
	 * @return result of the remote CSE
	 */
	Result forward(Resource remoteCse, CseRequest request, String target);
}
