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
package org.eclipse.m2mcse.elements.rule;

import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule to write test names using the logger.
 */
public class TestNameLoggerRule extends TestWatcher {

	public static final Logger LOGGER = LoggerFactory.getLogger(TestNameLoggerRule.class);

	private String name = "";

	/**
	 * Get current test name.
	 * 
	 * @return current test name, or empty string, if no test is running.
	 */
	public synchronized String getName() {
		return name;
	}

	private synchronized void setName(String name) {
		this.name = name;
	}

	@Override
	protected void starting(Description description) {
		setName(description.getMethodName());
		LOGGER.info("Test {}", description.getMethodName());
	}

	@Override
	protected void finished(Description description) {
		setName("");
		LOGGER.debug("Test {} finished", description.getMethodName());
	}
}
