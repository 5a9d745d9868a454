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
package org.eclipse.m2mcse.elements.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.eclipse.m2mcse.elements.Definitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed configuration values.
 * 
 * Values are registered by {@link ModuleDefinitionsProvider}s, which
 * define the keys and defaults of a module. Textual values are loaded from
 * {@link Properties} and converted by the {@link BasicDefinition} of the
 * key.
 * 
 * <pre>
 * <code>
 * Configuration config = new Configuration(CseConfig.DEFINITIONS);
 * config.set(CseConfig.CSE_ID, "id-mn");
 * String cseId = config.get(CseConfig.CSE_ID);
 * </code>
 * </pre>
 * 
 * Access is synchronized, a configuration may be shared between threads.
 */
public final class Configuration {

	/**
	 * Handler for setup of the {@link BasicDefinition}s of a module.
	 */
	public interface ModuleDefinitionsProvider {

		/**
		 * Get module name.
		 * 
		 * @return module name, e.g. "CSE."
		 */
		String getModule();

		/**
		 * Apply definitions.
		 * 
		 * Use {@link Configuration#set(BasicDefinition, Object)} to apply
		 * the default values.
		 * 
		 * @param config configuration to apply the definitions.
		 */
		void applyDefinitions(Configuration config);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Configuration.class);

	/**
	 * Modules.
	 */
	private final ConcurrentMap<String, ModuleDefinitionsProvider> modules = new ConcurrentHashMap<>();
	/**
	 * Definitions.
	 */
	private final Definitions<BasicDefinition<?>> definitions = new Definitions<>("Configuration");
	/**
	 * The typed values.
	 */
	private final Map<String, Object> values = new HashMap<>();

	/**
	 * Instantiates a new configuration and sets the value definitions using
	 * the provided {@link ModuleDefinitionsProvider}s.
	 * 
	 * @param providers module definitions provider
	 * @throws IllegalArgumentException if a different provider is already
	 *             registered for the same module name.
	 */
	public Configuration(ModuleDefinitionsProvider... providers) {
		for (ModuleDefinitionsProvider provider : providers) {
			String module = provider.getModule();
			if (module == null || module.isEmpty()) {
				throw new IllegalArgumentException("DefinitionsProvider's module must not be empty!");
			}
			ModuleDefinitionsProvider previous = modules.putIfAbsent(module, provider);
			if (previous != null && previous != provider) {
				throw new IllegalArgumentException("Module " + module + " already registered with different provider!");
			}
			if (previous == null) {
				LOGGER.trace("added {}", module);
				provider.applyDefinitions(this);
			}
		}
	}

	/**
	 * Checks, if the module is registered.
	 * 
	 * @param module module name
	 * @return {@code true}, if registered, {@code false}, otherwise.
	 */
	public boolean hasModule(String module) {
		return modules.containsKey(module);
	}

	/**
	 * Loads properties from an input stream.
	 * 
	 * @param inStream the input stream
	 * @throws NullPointerException if the inStream is {@code null}.
	 * @throws IOException if an error occurred when reading from the input
	 *             stream
	 * @see #add(Properties)
	 */
	public void load(InputStream inStream) throws IOException {
		if (inStream == null) {
			throw new NullPointerException("input stream must not be null");
		}
		Properties properties = new Properties();
		properties.load(inStream);
		add(properties);
	}

	/**
	 * Add properties.
	 * 
	 * Unknown or invalid values are ignored and the
	 * {@link BasicDefinition#getDefaultValue()} will be used instead.
	 * 
	 * @param properties properties to convert and add
	 * @throws NullPointerException if properties is {@code null}.
	 * @throws IllegalStateException if configuration has no definitions.
	 */
	public void add(Properties properties) {
		if (properties == null) {
			throw new NullPointerException("properties must not be null!");
		}
		if (definitions.size() == 0) {
			throw new IllegalStateException("Configuration contains no definitions!");
		}
		for (String key : properties.stringPropertyNames()) {
			BasicDefinition<?> definition = definitions.get(key);
			if (definition == null) {
				LOGGER.warn("Ignore {}, no configuration definition available!", key);
				continue;
			}
			String text = properties.getProperty(key);
			try {
				Object value = definition.readValue(text);
				synchronized (values) {
					values.put(key, value);
				}
			} catch (IllegalArgumentException ex) {
				LOGGER.warn("{}, using default", ex.getMessage());
			}
		}
	}

	/**
	 * Associates the specified value with the specified definition.
	 * 
	 * A {@code null} value resets the definition to its default.
	 * 
	 * @param <T> value type
	 * @param definition the value definition
	 * @param value the value
	 * @return the configuration for chaining
	 * @throws NullPointerException if the definition is {@code null}
	 * @throws IllegalArgumentException if a different definition is already
	 *             available for the key or the value is not valid.
	 */
	public <T> Configuration set(BasicDefinition<T> definition, T value) {
		register(definition);
		T checked;
		try {
			checked = definition.checkValue(value);
		} catch (ValueException e) {
			throw new IllegalArgumentException(String.format("Key '%s': %s", definition.getKey(), e.getMessage()));
		}
		synchronized (values) {
			if (checked == null) {
				values.remove(definition.getKey());
			} else {
				values.put(definition.getKey(), checked);
			}
		}
		return this;
	}

	/**
	 * Associates the specified textual value with the specified definition.
	 * 
	 * @param <T> value type
	 * @param definition the value definition
	 * @param text the value in textual presentation
	 * @return the configuration for chaining
	 * @throws NullPointerException if any parameter is {@code null}
	 * @throws IllegalArgumentException if the text could not be converted.
	 */
	public <T> Configuration setFromText(BasicDefinition<T> definition, String text) {
		return set(definition, definition.readValue(text));
	}

	/**
	 * Gets the associated value.
	 * 
	 * @param <T> value type
	 * @param definition the value definition
	 * @return the value, or the default value, if not set.
	 * @throws NullPointerException if the definition is {@code null}
	 * @throws IllegalArgumentException if a different definition is already
	 *             available for the key of the provided definition.
	 */
	public <T> T get(BasicDefinition<T> definition) {
		register(definition);
		Object value;
		synchronized (values) {
			value = values.get(definition.getKey());
		}
		if (value == null) {
			return definition.getDefaultValue();
		}
		return definition.getValueType().cast(value);
	}

	private void register(BasicDefinition<?> definition) {
		if (definition == null) {
			throw new NullPointerException("Definition must not be null!");
		}
		definitions.add(definition);
	}
}
