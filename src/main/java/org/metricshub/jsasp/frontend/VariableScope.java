package org.metricshub.jsasp.frontend;

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

import org.metricshub.jsasp.program.Variable;

/**
 * Names the anonymous variables ({@code _}) of one statement.
 * <p>
 * Each statement gets its own scope, so numbering restarts at
 * {@code _V1} for every statement.
 */
public final class VariableScope {

	/** Prefix of the names given to anonymous variables. */
	public static final String FRESH_PREFIX = "_V";

	private int counter;

	/**
	 * @return a variable whose name is unique within this scope
	 */
	public Variable fresh() {
		counter++;
		return new Variable(FRESH_PREFIX + counter);
	}

	/**
	 * @return how many variables this scope has created
	 */
	public int count() {
		return counter;
	}
}
