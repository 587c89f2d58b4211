package org.metricshub.jsasp;

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

/**
 * Thrown when a program cannot be parsed at all, i.e. when recovering
 * from a syntax error does not move the parser forward. Regular syntax
 * errors never end up here: they are counted in the parsed program.
 */
public class InvalidProgramException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new exception with the provided message.
	 *
	 * @param message description of the failure
	 */
	public InvalidProgramException(String message) {
		super(message);
	}

	/**
	 * Creates a new exception with the provided message and cause.
	 *
	 * @param message description of the failure
	 * @param cause the syntax error the parser could not recover from
	 */
	public InvalidProgramException(String message, Throwable cause) {
		super(message, cause);
	}
}
