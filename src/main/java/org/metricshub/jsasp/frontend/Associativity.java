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
 * How a chain of binary operators of the same priority nests.
 */
public enum Associativity {
	/** {@code xfx}: {@code a = b = c} is an error. */
	NON_ASSOC("xfx"),
	/** {@code yfx}: {@code a - b - c} is {@code (a - b) - c}. */
	LEFT_ASSOC("yfx"),
	/** {@code xfy}: {@code a ^ b ^ c} is {@code a ^ (b ^ c)}. */
	RIGHT_ASSOC("xfy");

	private final String specifier;

	Associativity(String specifier) {
		this.specifier = specifier;
	}

	/**
	 * @return the Prolog style operator type, e.g. {@code yfx}
	 */
	public String getSpecifier() {
		return specifier;
	}

	/**
	 * @param specifier {@code xfx}, {@code yfx} or {@code xfy}
	 * @return the matching associativity class
	 */
	public static Associativity fromSpecifier(String specifier) {
		for (Associativity associativity : values()) {
			if (associativity.specifier.equals(specifier)) {
				return associativity;
			}
		}
		throw new IllegalArgumentException("Unsupported operator type: " + specifier);
	}
}
