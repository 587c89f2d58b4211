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
import java.util.Objects;

/**
 * A rational constant, kept as written: numerator and denominator are not
 * reduced here.
 */
public final class RationalTerm extends Term {

	private final BigInteger numerator;
	private final BigInteger denominator;

	public RationalTerm(BigInteger numerator, BigInteger denominator) {
		this.numerator = Objects.requireNonNull(numerator, "numerator");
		this.denominator = Objects.requireNonNull(denominator, "denominator");
		if (denominator.signum() == 0) {
			throw new IllegalArgumentException("Zero denominator in rational " + numerator + "/0");
		}
	}

	public BigInteger getNumerator() {
		return numerator;
	}

	public BigInteger getDenominator() {
		return denominator;
	}

	@Override
	public Kind getKind() {
		return Kind.RATIONAL;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof RationalTerm)) {
			return false;
		}
		RationalTerm other = (RationalTerm) o;
		return numerator.equals(other.numerator) && denominator.equals(other.denominator);
	}

	@Override
	public int hashCode() {
		return Objects.hash(numerator, denominator);
	}

	@Override
	public String toString() {
		return numerator + "r" + denominator;
	}
}
