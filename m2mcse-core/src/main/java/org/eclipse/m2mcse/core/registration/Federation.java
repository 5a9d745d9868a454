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

/**
 * Federation with other CSEs.
 */
public interface Federation {

	/**
	 * Checks, if the CSE-ID names a remote CSE.
	 * 
	 * @param cseId CSE-ID. May be {@code null}.
	 * @return {@code true}, if the CSE is remote, {@code false}, if local or
	 *         {@code null}.
	 */
	boolean isRemoteTarget(String cseId);

	/**
	 * Forward a request to a remote CSE.
	 * 
	 * @param request original request
	 * @param cseId CSE-ID of the remote CSE
	 * @param target address of the target within the remote CSE
	 * @return result of the remote CSE
	 */
	Result forward(CseRequest request, String cseId, String target);
}
