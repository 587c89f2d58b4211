package org.metricshub.jsasp.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jsasp
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the SLF4J loggers of Jsasp.
 * <p>
 * SLF4J's own initialization messages are silenced. Syntax errors found in
 * user programs go to a dedicated {@link #DIAGNOSTICS} logger, so a host
 * can show them to the user, or mute them, independently of the parser's
 * debug output.
 */
public final class SaspLogger {

	/** Name of the logger that receives one line per syntax error. */
	public static final String DIAGNOSTICS = "org.metricshub.jsasp.diagnostics";

	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private SaspLogger() {}

	/**
	 * @param clazz class the logger is for
	 * @return the logger named after the class
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * @return the logger that receives formatted syntax errors
	 */
	public static Logger getDiagnosticsLogger() {
		return LoggerFactory.getLogger(DIAGNOSTICS);
	}
}
