package org.metricshub.jsasp.util;

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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.metricshub.jsasp.frontend.OperatorTable;

/**
 * A simple container for the parameters of the parser.
 * These values have defaults, which may be changed when invoking the
 * parser programmatically.
 */
public class ParserSettings {

	/**
	 * Prefixes the front end and the solver add to generated predicate names
	 * ({@code c_} classical negation, {@code d_} disambiguation, {@code n_}
	 * duals, {@code o_} other generated rules).
	 */
	public static final List<String> DEFAULT_INTERNAL_PREFIXES = Collections
			.unmodifiableList(Arrays.asList("c_", "d_", "n_", "o_"));

	/**
	 * Names of predicates the solver generates itself.
	 */
	public static final List<String> DEFAULT_RESERVED_PREFIXES = Collections
			.unmodifiableList(Arrays.asList("nmr_check", "add_to_query"));

	/**
	 * Infix operators recognized in expressions;
	 * {@link OperatorTable#standard()} by default.
	 */
	private OperatorTable operatorTable = OperatorTable.standard();

	/**
	 * User predicate names starting with one of these get the
	 * disambiguation prefix.
	 */
	private List<String> internalPrefixes = new ArrayList<String>(DEFAULT_INTERNAL_PREFIXES);

	/**
	 * User predicate names starting with one of these get the
	 * disambiguation prefix too.
	 */
	private List<String> reservedPrefixes = new ArrayList<String>(DEFAULT_RESERVED_PREFIXES);

	/**
	 * Whether {@code - - p} is a syntax error;
	 * <code>true</code> by default. When <code>false</code>, the two
	 * negations cancel out.
	 */
	private boolean rejectDoubleNegation = true;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("operatorTable = ").append(getOperatorTable()).append(newLine);
		desc.append("internalPrefixes = ").append(getInternalPrefixes()).append(newLine);
		desc.append("reservedPrefixes = ").append(getReservedPrefixes()).append(newLine);
		desc.append("rejectDoubleNegation = ").append(isRejectDoubleNegation()).append(newLine);

		return desc.toString();
	}

	public OperatorTable getOperatorTable() {
		return operatorTable;
	}

	public void setOperatorTable(OperatorTable operatorTable) {
		this.operatorTable = Objects.requireNonNull(operatorTable, "operatorTable");
	}

	public List<String> getInternalPrefixes() {
		return Collections.unmodifiableList(internalPrefixes);
	}

	public void setInternalPrefixes(List<String> internalPrefixes) {
		this.internalPrefixes = new ArrayList<String>(internalPrefixes);
	}

	public List<String> getReservedPrefixes() {
		return Collections.unmodifiableList(reservedPrefixes);
	}

	public void setReservedPrefixes(List<String> reservedPrefixes) {
		this.reservedPrefixes = new ArrayList<String>(reservedPrefixes);
	}

	public boolean isRejectDoubleNegation() {
		return rejectDoubleNegation;
	}

	public void setRejectDoubleNegation(boolean rejectDoubleNegation) {
		this.rejectDoubleNegation = rejectDoubleNegation;
	}
}
