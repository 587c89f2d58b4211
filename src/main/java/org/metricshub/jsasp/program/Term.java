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

/**
 * Base class of everything that can appear as a rule head, a body goal or
 * an argument.
 * <p>
 * Subclasses are immutable values: two terms built from the same tokens
 * are {@code equals()}. {@link #toString()} renders the term in prefix
 * form with canonical predicate names, e.g. {@code +(1,*(2,3))} or
 * {@code p_1(X)}.
 */
public abstract class Term {

	/** Term kinds, for callers that prefer a switch over {@code instanceof}. */
	public enum Kind {
		PREDICATE,
		VARIABLE,
		INTEGER,
		FLOAT,
		RATIONAL,
		LIST_CONS,
		LIST_EMPTY,
		BUILTIN_CALL,
		OPERATION,
		NOT
	}

	Term() {}

	/**
	 * @return the kind of this term
	 */
	public abstract Kind getKind();

	@Override
	public abstract boolean equals(Object o);

	@Override
	public abstract int hashCode();

	static void appendArguments(StringBuilder sb, Iterable<? extends Term> args) {
		sb.append('(');
		boolean first = true;
		for (Term arg : args) {
			if (!first) {
				sb.append(',');
			}
			sb.append(arg);
			first = false;
		}
		sb.append(')');
	}
}
