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
package org.eclipse.m2mcse.core.config;

import org.eclipse.m2mcse.elements.config.BooleanDefinition;
import org.eclipse.m2mcse.elements.config.Configuration;
import org.eclipse.m2mcse.elements.config.Configuration.ModuleDefinitionsProvider;
import org.eclipse.m2mcse.elements.config.IntegerDefinition;
import org.eclipse.m2mcse.elements.config.StringDefinition;
import org.eclipse.m2mcse.elements.config.StringListDefinition;

/**
 * Configuration definitions of the CSE.
 * 
 * <pre>
 * <code>
 * Configuration config = new Configuration(CseConfig.DEFINITIONS);
 * </code>
 * </pre>
 */
public final class CseConfig {

	public static final String MODULE = "CSE.";

	/**
	 * CSE-ID of the local CSE, without leading "/".
	 */
	public static final StringDefinition CSE_ID = new StringDefinition(MODULE + "ID",
			"CSE-ID of the local CSE.", "id-in");
	/**
	 * Resource id of the CSE base resource.
	 */
	public static final StringDefinition CSE_RESOURCE_ID = new StringDefinition(MODULE + "RESOURCE_ID",
			"Resource id of the CSE base resource.", "id-in");
	/**
	 * Resource name of the CSE base resource. First segment of every
	 * structured path.
	 */
	public static final StringDefinition CSE_RESOURCE_NAME = new StringDefinition(MODULE + "RESOURCE_NAME",
			"Resource name of the CSE base resource.", "cse-in");
	public static final StringDefinition SP_ID = new StringDefinition(MODULE + "SP_ID",
			"Service provider id.", "m2m.example.com");
	/**
	 * Originator always granted by the access control.
	 */
	public static final StringDefinition ADMIN_ORIGINATOR = new StringDefinition(MODULE + "ADMIN_ORIGINATOR",
			"Admin originator, always granted.", "CAdmin");
	public static final BooleanDefinition ENABLE_TRANSIT_REQUESTS = new BooleanDefinition(
			MODULE + "ENABLE_TRANSIT_REQUESTS", "Forward requests targeting registered remote CSEs.", true);
	/**
	 * Regular expressions of originators allowed to register AEs.
	 */
	public static final StringListDefinition REGISTRATION_ALLOWED_AE_ORIGINATORS = new StringListDefinition(
			MODULE + "REGISTRATION_ALLOWED_AE_ORIGINATORS",
			"Regular expressions of originators allowed to register AEs.", "C.*", "S.*");
	public static final IntegerDefinition DISCOVERY_RESULT_LIMIT = new IntegerDefinition(
			MODULE + "DISCOVERY_RESULT_LIMIT", "Maximum number of resources found by a discovery.", 1000, 1);
	public static final IntegerDefinition RESOURCE_ID_LENGTH = new IntegerDefinition(MODULE + "RESOURCE_ID_LENGTH",
			"Number of random characters in generated resource ids and names.", 10, 4);

	public static final ModuleDefinitionsProvider DEFINITIONS = new ModuleDefinitionsProvider() {

		@Override
		public String getModule() {
			return MODULE;
		}

		@Override
		public void applyDefinitions(Configuration config) {
			config.set(CSE_ID, "id-in");
			config.set(CSE_RESOURCE_ID, "id-in");
			config.set(CSE_RESOURCE_NAME, "cse-in");
			config.set(SP_ID, "m2m.example.com");
			config.set(ADMIN_ORIGINATOR, "CAdmin");
			config.set(ENABLE_TRANSIT_REQUESTS, true);
			config.set(REGISTRATION_ALLOWED_AE_ORIGINATORS, null);
			config.set(DISCOVERY_RESULT_LIMIT, 1000);
			config.set(RESOURCE_ID_LENGTH, 10);
		}
	};

	private CseConfig() {
	}
}
