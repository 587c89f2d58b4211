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

/** {@code #abducible p(X).}: a predicate that may be assumed either way. */
public final class AbducibleDirective extends Directive {

	private final Term predicate;

	public AbducibleDirective(Term predicate) {
		this.predicate = Objects.requireNonNull(predicate, "predicate");
	}

	/**
	 * @return the declared predicate; a {@link Predicate}, or a
	 *         {@link BuiltinCall} when a built-in was named
	 */
	public Term getPredicate() {
		return predicate;
	}

	@Override
	public Kind getKind() {
		return Kind.ABDUCIBLE;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof AbducibleDirective && predicate.equals(((AbducibleDirective) o).predicate);
	}

	@Override
	public int hashCode() {
		return predicate.hashCode();
	}

	@Override
	public String toString() {
		return "#abducible " + predicate + ".";
	}
}
