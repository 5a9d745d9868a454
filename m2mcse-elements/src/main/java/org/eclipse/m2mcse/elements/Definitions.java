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
package org.eclipse.m2mcse.elements;

import java.util.Iterator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Named set of {@link Definition}s with unique keys.
 *
 * @param <T> type of definitions
 */
public class Definitions<T extends Definition<?>> implements Iterable<T> {

	private final String name;
	private final ConcurrentMap<String, T> definitions = new ConcurrentHashMap<>();

	/**
	 * Create definitions set.
	 *
	 * @param name name of definition set
	 */
	public Definitions(String name) {
		this.name = name;
	}

	/**
	 * Gets name of definition set.
	 *
	 * @return name of definition set.
	 */
	public String getName() {
		return name;
	}

	/**
	 * Add definition.
	 *
	 * Adding the same definition twice is accepted.
	 *
	 * @param definition definition with unique {@link Definition#getKey()}.
	 * @return the definition set for chaining
	 * @throws NullPointerException if definition is {@code null}
	 * @throws IllegalArgumentException if an other definition with the same
	 *             key was already added.
	 */
	public Definitions<T> add(T definition) {
		if (definition == null) {
			throw new NullPointerException("Definition must not be null!");
		}
		T previous = definitions.putIfAbsent(definition.getKey(), definition);
		if (previous != null && previous != definition) {
			throw new IllegalArgumentException(name + " already contains " + definition.getKey() + "!");
		}
		return this;
	}

	/**
	 * Checks, if the definition is contained.
	 *
	 * @param definition definition to check.
	 * @return {@code true}, if contained, {@code false}, if not.
	 */
	public boolean contains(T definition) {
		return definitions.get(definition.getKey()) == definition;
	}

	/**
	 * Get definition.
	 *
	 * @param key {@link Definition#getKey()} of definition.
	 * @return definition, or {@code null}, if not available.
	 */
	public T get(String key) {
		return definitions.get(key);
	}

	/**
	 * Get number of available definitions.
	 *
	 * @return number of available definitions.
	 */
	public int size() {
		return definitions.size();
	}

	@Override
	public Iterator<T> iterator() {
		return definitions.values().iterator();
	}
}
