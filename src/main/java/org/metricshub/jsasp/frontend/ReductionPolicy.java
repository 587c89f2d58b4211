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

/**
 * How the expression engine decides, when an operator arrives, whether
 * the operator on top of the stack is reduced first.
 */
public enum ReductionPolicy {

	/**
	 * Reduce a stacked operator of strictly lower priority number. At equal
	 * priority, reduce only when both operators are left-associative, keep
	 * stacking when both are right-associative, and report a priority clash
	 * otherwise.
	 */
	ASSOCIATIVITY_AWARE,

	/**
	 * Reduce any stacked operator whose priority number is lower or equal,
	 * whatever its class. Chains of equal priority always fold to the left.
	 */
	PRIORITY_ONLY
}
