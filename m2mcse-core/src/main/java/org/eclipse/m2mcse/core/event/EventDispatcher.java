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
package org.eclipse.m2mcse.core.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import org.eclipse.m2mcse.core.resource.Resource;
import org.eclipse.m2mcse.elements.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event sink delivering the events to the registered listeners.
 * 
 * The events are delivered in order on a single named thread. Failures of
 * listeners are logged.
 */
public class EventDispatcher implements EventSink {

	private static final Logger LOGGER = LoggerFactory.getLogger(EventDispatcher.class);

	private final List<ResourceEventListener> listeners = new CopyOnWriteArrayList<>();
	private final ExecutorService executor;

	public EventDispatcher() {
		this.executor = Executors.newSingleThreadExecutor(new NamedThreadFactory("CSE-Events#", null, true));
	}

	public void addListener(ResourceEventListener listener) {
		if (listener == null) {
			throw new NullPointerException("listener must not be null!");
		}
		listeners.add(listener);
	}

	public void removeListener(ResourceEventListener listener) {
		listeners.remove(listener);
	}

	@Override
	public void resourceCreated(Resource resource, String originator) {
		fire("created", resource, originator, (listener, event) -> listener.onCreated(event, originator));
	}

	@Override
	public void resourceDeleted(Resource resource, String originator) {
		fire("deleted", resource, originator, (listener, event) -> listener.onDeleted(event, originator));
	}

	/**
	 * Stop delivering events.
	 * 
	 * Pending events are delivered before the thread terminates.
	 * 
	 * @param timeoutMillis time to wait for pending events
	 * @return {@code true}, if all pending events are delivered,
	 *         {@code false}, if the timeout expired.
	 * @throws InterruptedException if interrupted while waiting
	 */
	public boolean shutdown(long timeoutMillis) throws InterruptedException {
		executor.shutdown();
		return executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
	}

	private void fire(String event, Resource resource, String originator,
			BiConsumer<ResourceEventListener, Resource> delivery) {
		if (listeners.isEmpty()) {
			return;
		}
		try {
			executor.execute(() -> {
				for (ResourceEventListener listener : listeners) {
					try {
						delivery.accept(listener, resource);
					} catch (RuntimeException ex) {
						LOGGER.error("listener failed on {} {}", event, resource, ex);
					}
				}
			});
		} catch (RejectedExecutionException ex) {
			LOGGER.warn("{} {} by {} not delivered, events are stopped", event, resource, originator);
		}
	}
}
