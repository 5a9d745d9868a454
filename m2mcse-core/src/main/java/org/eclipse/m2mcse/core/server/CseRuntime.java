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
package org.eclipse.m2mcse.core.server;

import org.eclipse.m2mcse.core.config.CseConfig;
import org.eclipse.m2mcse.core.dispatch.DispatchException;
import org.eclipse.m2mcse.core.dispatch.Dispatcher;
import org.eclipse.m2mcse.core.event.EventDispatcher;
import org.eclipse.m2mcse.core.registration.DefaultRegistrationManager;
import org.eclipse.m2mcse.core.registration.RegisteredCseFederation;
import org.eclipse.m2mcse.core.registration.TransitForwarder;
import org.eclipse.m2mcse.core.resource.AccessControlPolicy;
import org.eclipse.m2mcse.core.resource.CseBase;
import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.core.resource.ResourceFactory;
import org.eclipse.m2mcse.core.resource.ResourceType;
import org.eclipse.m2mcse.core.security.AcpAccessFilter;
import org.eclipse.m2mcse.core.security.Permission;
import org.eclipse.m2mcse.core.store.InMemoryResourceStore;
import org.eclipse.m2mcse.core.store.ResourceStore;
import org.eclipse.m2mcse.core.util.M2MTime;
import org.eclipse.m2mcse.elements.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Wires the components of a CSE.
 * 
 * <pre>
 * <code>
 * CseRuntime cse = new CseRuntime(new Configuration(CseConfig.DEFINITIONS));
 * cse.start();
 * Result result = cse.getDispatcher().process(request);
 * cse.stop();
 * </code>
 * </pre>
 */
public class CseRuntime {

	private static final Logger LOGGER = LoggerFactory.getLogger(CseRuntime.class);

	/**
	 * Resource name of the access control policy of the admin.
	 */
	public static final String ADMIN_POLICY_NAME = "acpAdmin";
	/**
	 * CSE type of an infrastructure node CSE.
	 */
	public static final int CSE_TYPE_IN = 1;

	private final Configuration config;
	private final ResourceStore store;
	private final ResourceFactory factory;
	private final EventDispatcher events;
	private final Dispatcher dispatcher;
	private boolean running;

	/**
	 * Create CSE with in-memory store and without transit binding.
	 * 
	 * @param config configuration with {@link CseConfig} definitions
	 */
	public CseRuntime(Configuration config) {
		this(config, new InMemoryResourceStore(), null);
	}

	/**
	 * Create CSE.
	 * 
	 * @param config configuration with {@link CseConfig} definitions
	 * @param store resource store
	 * @param forwarder transport binding for transit requests. May be
	 *            {@code null}.
	 */
	public CseRuntime(Configuration config, ResourceStore store, TransitForwarder forwarder) {
		this.config = config;
		this.store = store;
		this.factory = new ResourceFactory(config.get(CseConfig.RESOURCE_ID_LENGTH));
		this.events = new EventDispatcher();
		AcpAccessFilter accessFilter = new AcpAccessFilter(store, config.get(CseConfig.ADMIN_ORIGINATOR),
				config.get(CseConfig.REGISTRATION_ALLOWED_AE_ORIGINATORS));
		this.dispatcher = new Dispatcher(config, store, accessFilter, new DefaultRegistrationManager(store, factory),
				new RegisteredCseFederation(config.get(CseConfig.CSE_ID), store, forwarder), events, factory);
	}

	/**
	 * Start the CSE.
	 * 
	 * Creates the CSE base and the admin policy, if the store is empty.
	 * 
	 * @throws DispatchException if the CSE base could not be created
	 * @throws IllegalStateException if already started
	 */
	public synchronized void start() throws DispatchException {
		if (running) {
			throw new IllegalStateException("CSE already started!");
		}
		if (store.size() == 0) {
			bootstrap();
		} else {
			LOGGER.info("CSE {} started with {} resources", config.get(CseConfig.CSE_ID), store.size());
		}
		running = true;
	}

	/**
	 * Stop the CSE.
	 * 
	 * Waits for pending events to be delivered.
	 */
	public synchronized void stop() {
		if (running) {
			running = false;
			try {
				if (!events.shutdown(2000)) {
					LOGGER.warn("pending events of CSE {} dropped", config.get(CseConfig.CSE_ID));
				}
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
			LOGGER.info("CSE {} stopped", config.get(CseConfig.CSE_ID));
		}
	}

	public synchronized boolean isRunning() {
		return running;
	}

	private void bootstrap() throws DispatchException {
		String admin = config.get(CseConfig.ADMIN_ORIGINATOR);
		String name = config.get(CseConfig.CSE_RESOURCE_NAME);
		String now = M2MTime.now();
		JsonObject attributes = new JsonObject();
		attributes.addProperty(Resource.ID, config.get(CseConfig.CSE_RESOURCE_ID));
		attributes.addProperty(Resource.NAME, name);
		attributes.addProperty(Resource.CREATION_TIME, now);
		attributes.addProperty(Resource.LAST_MODIFIED_TIME, now);
		attributes.addProperty(CseBase.CSE_ID, "/" + config.get(CseConfig.CSE_ID));
		attributes.addProperty(CseBase.CSE_TYPE, CSE_TYPE_IN);
		JsonArray types = new JsonArray();
		for (ResourceType type : ResourceType.values()) {
			if (!type.isVirtual()) {
				types.add(type.code);
			}
		}
		attributes.add(CseBase.SUPPORTED_RESOURCE_TYPES, types);
		CseBase cseBase = new CseBase(attributes);
		cseBase.setStructuredPath(name);

		Resource policy = factory.create(ResourceType.ACCESS_CONTROL_POLICY, ADMIN_POLICY_NAME, cseBase);
		policy.setAttribute(AccessControlPolicy.PRIVILEGES, privileges(admin));
		policy.setAttribute(AccessControlPolicy.SELF_PRIVILEGES, privileges(admin));
		JsonArray policies = new JsonArray();
		policies.add(policy.getId());
		cseBase.setAttribute(Resource.ACP_IDS, policies);

		dispatcher.createResource(cseBase, null, admin);
		dispatcher.createResource(policy, cseBase, admin);
		LOGGER.info("CSE {} created as {}", config.get(CseConfig.CSE_ID), name);
	}

	private static JsonObject privileges(String originator) {
		JsonArray originators = new JsonArray();
		originators.add(originator);
		JsonObject rule = new JsonObject();
		rule.add(AccessControlPolicy.ORIGINATORS, originators);
		rule.addProperty(AccessControlPolicy.OPERATIONS, Permission.ALL);
		JsonArray rules = new JsonArray();
		rules.add(rule);
		JsonObject privileges = new JsonObject();
		privileges.add(AccessControlPolicy.RULES, rules);
		return privileges;
	}

	public Configuration getConfiguration() {
		return config;
	}

	public ResourceStore getStore() {
		return store;
	}

	public ResourceFactory getResourceFactory() {
		return factory;
	}

	public EventDispatcher getEventDispatcher() {
		return events;
	}

	public Dispatcher getDispatcher() {
		return dispatcher;
	}
}
