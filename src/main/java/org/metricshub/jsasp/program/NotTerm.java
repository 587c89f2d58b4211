package org.metricshub.jsasp.program;

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
 * Negation as failure: {@code not p}. Classical negation is not a wrapper;
 * it is part of the predicate's identity (see {@link PredicateKey}).
 */
public final class NotTerm extends Term {

	private final Term goal;

	public NotTerm(Term goal) {
		this.goal = Objects.requireNonNull(goal, "goal");
	}

	public Term getGoal() {
		return goal;
	}

	@Override
	public Kind getKind() {
		return Kind.NOT;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof NotTerm && goal.equals(((NotTerm) o).goal);
	}

	@Override
	public int hashCode() {
		return 31 * goal.hashCode() + 1;
	}

	@Override
	public String toString() {
		return "not " + goal;
	}
}
