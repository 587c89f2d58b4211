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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An atom or compound term: a {@link PredicateKey} and its arguments.
 */
public final class Predicate extends Term {

	private final PredicateKey key;
	private final List<Term> arguments;

	/**
	 * @param key relation identity; its arity must match {@code arguments}
	 * @param arguments the arguments, in source order
	 */
	public Predicate(PredicateKey key, List<? extends Term> arguments) {
		this.key = Objects.requireNonNull(key, "key");
		this.arguments = Collections.unmodifiableList(new ArrayList<Term>(arguments));
		if (key.getArity() != this.arguments.size()) {
			throw new IllegalArgumentException(
					"Arity " + key.getArity() + " of " + key.getName() + " does not match " + this.arguments.size()
							+ " arguments");
		}
	}

	/**
	 * @param key relation identity of arity 0
	 * @return the atom
	 */
	public static Predicate atom(PredicateKey key) {
		return new Predicate(key, Collections.<Term>emptyList());
	}

	public PredicateKey getKey() {
		return key;
	}

	/**
	 * @return the canonical relation name, e.g. {@code p_1}
	 */
	public String getCanonicalName() {
		return key.canonicalName();
	}

	public List<Term> getArguments() {
		return arguments;
	}

	@Override
	public Kind getKind() {
		return Kind.PREDICATE;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Predicate)) {
			return false;
		}
		Predicate other = (Predicate) o;
		return key.equals(other.key) && arguments.equals(other.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, arguments);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(key.canonicalName());
		if (!arguments.isEmpty()) {
			appendArguments(sb, arguments);
		}
		return sb.toString();
	}
}
