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
 * Identity of a relation: the source name, the arity, and the two naming
 * rewrites the front end may apply.
 * <p>
 * The canonical string form is only formed in {@link #canonicalName()},
 * as {@code [c_][d_]name_arity}: {@code c_} marks classical negation,
 * {@code d_} marks a user name that had to be disambiguated from
 * internally generated ones.
 */
public final class PredicateKey {

	/** Prefix of classically negated predicates. */
	public static final String NEGATION_PREFIX = "c_";

	/** Prefix added to user names that could clash with internal names. */
	public static final String DISAMBIGUATION_PREFIX = "d_";

	/** Head of headless rules (integrity constraints). */
	public static final PredicateKey FALSITY = new PredicateKey("_false", 0, false, false);

	private final String name;
	private final int arity;
	private final boolean classicallyNegated;
	private final boolean disambiguated;

	/**
	 * @param name name as written in the source
	 * @param arity number of arguments
	 * @param classicallyNegated whether the atom was written {@code -name}
	 * @param disambiguated whether the name gets the {@link #DISAMBIGUATION_PREFIX}
	 */
	public PredicateKey(String name, int arity, boolean classicallyNegated, boolean disambiguated) {
		this.name = Objects.requireNonNull(name, "name");
		if (arity < 0) {
			throw new IllegalArgumentException("Negative arity " + arity + " for " + name);
		}
		this.arity = arity;
		this.classicallyNegated = classicallyNegated;
		this.disambiguated = disambiguated;
	}

	public String getName() {
		return name;
	}

	public int getArity() {
		return arity;
	}

	public boolean isClassicallyNegated() {
		return classicallyNegated;
	}

	public boolean isDisambiguated() {
		return disambiguated;
	}

	/**
	 * Atoms written with a leading underscore are not shown when printing
	 * solutions.
	 *
	 * @return whether the source name starts with an underscore
	 */
	public boolean isHidden() {
		return name.startsWith("_");
	}

	/**
	 * @return the same relation with classical negation toggled
	 */
	public PredicateKey negate() {
		return new PredicateKey(name, arity, !classicallyNegated, disambiguated);
	}

	/**
	 * @return the canonical relation name, e.g. {@code c_d__x_1}
	 */
	public String canonicalName() {
		StringBuilder sb = new StringBuilder();
		if (classicallyNegated) {
			sb.append(NEGATION_PREFIX);
		}
		if (disambiguated) {
			sb.append(DISAMBIGUATION_PREFIX);
		}
		return sb.append(name).append('_').append(arity).toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PredicateKey)) {
			return false;
		}
		PredicateKey other = (PredicateKey) o;
		return arity == other.arity
				&& classicallyNegated == other.classicallyNegated
				&& disambiguated == other.disambiguated
				&& name.equals(other.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arity, classicallyNegated, disambiguated);
	}

	@Override
	public String toString() {
		return canonicalName();
	}
}
