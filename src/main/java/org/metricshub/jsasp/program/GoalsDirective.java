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
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * {@code #table}, {@code #show} and {@code #pred}: a keyword and a list of
 * goals.
 */
public final class GoalsDirective extends Directive {

	private static final EnumSet<Kind> GOAL_KINDS = EnumSet.of(Kind.TABLE, Kind.SHOW, Kind.PRED);

	private final Kind kind;
	private final List<Term> goals;

	public GoalsDirective(Kind kind, List<? extends Term> goals) {
		if (!GOAL_KINDS.contains(kind)) {
			throw new IllegalArgumentException("Not a goal list directive: " + kind);
		}
		this.kind = kind;
		this.goals = Collections.unmodifiableList(new ArrayList<Term>(goals));
	}

	@Override
	public Kind getKind() {
		return kind;
	}

	public List<Term> getGoals() {
		return goals;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof GoalsDirective)) {
			return false;
		}
		GoalsDirective other = (GoalsDirective) o;
		return kind == other.kind && goals.equals(other.goals);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, goals);
	}

	@Override
	public String toString() {
		return "#" + kind.getKeyword() + " " + goals + ".";
	}
}
