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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * A binary operator applied to two operands, as resolved by the
 * expression engine ({@code 1+2*3} is {@code +(1,*(2,3))}).
 */
public final class Operation extends Term {

	/** Symbol of the conjunction operator. */
	public static final String CONJUNCTION = ",";

	private final String operator;
	private final Term left;
	private final Term right;

	public Operation(String operator, Term left, Term right) {
		this.operator = Objects.requireNonNull(operator, "operator");
		this.left = Objects.requireNonNull(left, "left");
		this.right = Objects.requireNonNull(right, "right");
	}

	public String getOperator() {
		return operator;
	}

	public Term getLeft() {
		return left;
	}

	public Term getRight() {
		return right;
	}

	/**
	 * @return whether this is a {@code ,} (conjunction)
	 */
	public boolean isConjunction() {
		return CONJUNCTION.equals(operator);
	}

	/**
	 * Flattens nested conjunctions, on both sides, into the list of their
	 * conjuncts. Any term that is not a conjunction is a one element list.
	 *
	 * @param term the term to flatten
	 * @return the conjuncts, left to right
	 */
	public static List<Term> conjuncts(Term term) {
		List<Term> result = new ArrayList<Term>();
		addConjuncts(term, result);
		return result;
	}

	// bodies are long right spines of ",", so no recursion here
	private static void addConjuncts(Term term, List<Term> result) {
		Deque<Term> pending = new ArrayDeque<Term>();
		pending.push(term);
		while (!pending.isEmpty()) {
			Term next = pending.pop();
			if (next instanceof Operation && ((Operation) next).isConjunction()) {
				pending.push(((Operation) next).right);
				pending.push(((Operation) next).left);
			} else {
				result.add(next);
			}
		}
	}

	@Override
	public Kind getKind() {
		return Kind.OPERATION;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Operation)) {
			return false;
		}
		Operation other = (Operation) o;
		return operator.equals(other.operator) && left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, left, right);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(operator);
		appendArguments(sb, Arrays.asList(left, right));
		return sb.toString();
	}
}
