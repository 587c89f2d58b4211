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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code #compute N { goals }.}: how many models to compute and the
 * query to compute them for. A {@code ?- goals.} query is a compute
 * directive for one model.
 */
public final class ComputeDirective extends Directive {

	private final BigInteger modelCount;
	private final List<Term> goals;

	public ComputeDirective(BigInteger modelCount, List<? extends Term> goals) {
		this.modelCount = Objects.requireNonNull(modelCount, "modelCount");
		this.goals = Collections.unmodifiableList(new ArrayList<Term>(goals));
	}

	/**
	 * @param goals the query goals
	 * @return the compute directive a {@code ?-} query stands for
	 */
	public static ComputeDirective query(List<? extends Term> goals) {
		return new ComputeDirective(BigInteger.ONE, goals);
	}

	public BigInteger getModelCount() {
		return modelCount;
	}

	public List<Term> getGoals() {
		return goals;
	}

	@Override
	public Kind getKind() {
		return Kind.COMPUTE;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof ComputeDirective)) {
			return false;
		}
		ComputeDirective other = (ComputeDirective) o;
		return modelCount.equals(other.modelCount) && goals.equals(other.goals);
	}

	@Override
	public int hashCode() {
		return Objects.hash(modelCount, goals);
	}

	@Override
	public String toString() {
		return "#compute " + modelCount + " " + goals + ".";
	}
}
