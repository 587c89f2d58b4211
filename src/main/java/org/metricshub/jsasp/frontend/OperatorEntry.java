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

import java.util.Objects;

/**
 * One infix operator: its symbol, associativity class and priority
 * (lower binds tighter), and the reduction policy it is parsed with.
 */
public final class OperatorEntry {

	private final String symbol;
	private final Associativity associativity;
	private final int priority;
	private final ReductionPolicy policy;

	public OperatorEntry(String symbol, Associativity associativity, int priority) {
		this(symbol, associativity, priority, ReductionPolicy.ASSOCIATIVITY_AWARE);
	}

	public OperatorEntry(String symbol, Associativity associativity, int priority, ReductionPolicy policy) {
		this.symbol = Objects.requireNonNull(symbol, "symbol");
		this.associativity = Objects.requireNonNull(associativity, "associativity");
		this.policy = Objects.requireNonNull(policy, "policy");
		if (priority <= 0) {
			throw new IllegalArgumentException("Priority of operator " + symbol + " must be positive: " + priority);
		}
		this.priority = priority;
	}

	public String getSymbol() {
		return symbol;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	public int getPriority() {
		return priority;
	}

	public ReductionPolicy getPolicy() {
		return policy;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof OperatorEntry)) {
			return false;
		}
		OperatorEntry other = (OperatorEntry) o;
		return priority == other.priority
				&& symbol.equals(other.symbol)
				&& associativity == other.associativity
				&& policy == other.policy;
	}

	@Override
	public int hashCode() {
		return Objects.hash(symbol, associativity, priority, policy);
	}

	@Override
	public String toString() {
		return "op(" + priority + ", " + associativity.getSpecifier() + ", " + symbol + ")";
	}
}
