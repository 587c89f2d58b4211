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
import java.util.List;
import java.util.Objects;

/**
 * A list cell: one element and the rest of the list. The tail is usually
 * another {@code ListCons} or {@link ListEmpty#INSTANCE}, but an explicit
 * {@code [H|T]} tail may be any term (typically a variable).
 */
public final class ListCons extends Term {

	private final Term head;
	private final Term tail;

	public ListCons(Term head, Term tail) {
		this.head = Objects.requireNonNull(head, "head");
		this.tail = Objects.requireNonNull(tail, "tail");
	}

	/**
	 * Builds the right-nested list {@code [e1, ..., en | tail]}.
	 *
	 * @param elements the elements, in order
	 * @param tail the final tail
	 * @return {@code tail} itself when {@code elements} is empty
	 */
	public static Term of(List<? extends Term> elements, Term tail) {
		Term list = tail;
		for (int i = elements.size() - 1; i >= 0; i--) {
			list = new ListCons(elements.get(i), list);
		}
		return list;
	}

	public Term getHead() {
		return head;
	}

	public Term getTail() {
		return tail;
	}

	/**
	 * @return the elements up to the first tail that is not a {@code ListCons}
	 */
	public List<Term> elements() {
		List<Term> elements = new ArrayList<Term>();
		Term cell = this;
		while (cell instanceof ListCons) {
			elements.add(((ListCons) cell).head);
			cell = ((ListCons) cell).tail;
		}
		return elements;
	}

	@Override
	public Kind getKind() {
		return Kind.LIST_CONS;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof ListCons)) {
			return false;
		}
		ListCons other = (ListCons) o;
		return head.equals(other.head) && tail.equals(other.tail);
	}

	@Override
	public int hashCode() {
		return Objects.hash(head, tail);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		sb.append(head);
		Term cell = tail;
		while (cell instanceof ListCons) {
			sb.append(',').append(((ListCons) cell).head);
			cell = ((ListCons) cell).tail;
		}
		if (!(cell instanceof ListEmpty)) {
			sb.append('|').append(cell);
		}
		return sb.append(']').toString();
	}
}
