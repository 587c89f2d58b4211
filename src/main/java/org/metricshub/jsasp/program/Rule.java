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
 * A program statement: a head and the ordered goals of its body.
 * <ul>
 * <li>a fact has an empty body;</li>
 * <li>a headless rule (integrity constraint) has the
 * {@link PredicateKey#FALSITY} head.</li>
 * </ul>
 */
public final class Rule {

	private final Term head;
	private final List<Term> body;

	public Rule(Term head, List<? extends Term> body) {
		this.head = Objects.requireNonNull(head, "head");
		this.body = Collections.unmodifiableList(new ArrayList<Term>(body));
	}

	/**
	 * @param body goals that must never hold together
	 * @return a rule with the falsity head
	 */
	public static Rule constraint(List<? extends Term> body) {
		return new Rule(Predicate.atom(PredicateKey.FALSITY), body);
	}

	public Term getHead() {
		return head;
	}

	public List<Term> getBody() {
		return body;
	}

	public boolean isFact() {
		return body.isEmpty();
	}

	public boolean isConstraint() {
		return head instanceof Predicate && ((Predicate) head).getKey().equals(PredicateKey.FALSITY);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Rule)) {
			return false;
		}
		Rule other = (Rule) o;
		return head.equals(other.head) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(head, body);
	}

	@Override
	public String toString() {
		if (body.isEmpty()) {
			return head + ".";
		}
		StringBuilder sb = new StringBuilder();
		sb.append(head).append(" :- ");
		for (int i = 0; i < body.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(body.get(i));
		}
		return sb.append('.').toString();
	}
}
