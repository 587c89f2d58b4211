package org.metricshub.jsasp.frontend;

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lookup of infix operator symbols.
 * <p>
 * {@link #standard()} holds the operators of the language; other tables
 * can be assembled with {@link #builder()}, e.g. to switch an operator to
 * {@link ReductionPolicy#PRIORITY_ONLY}.
 */
public final class OperatorTable {

	private static final OperatorTable STANDARD;

	static {
		Builder builder = builder();
		builder.add(",", Associativity.RIGHT_ASSOC, 1000);
		for (String symbol : new String[] {
				"=", "\\=", "==", "\\==", "<", ">", "=<", ">=", "=:=", "=\\=", "is",
				"@<", "@>", "@=<", "@>=",
				".=.", ".<>.", ".<.", ".>.", ".=<.", ".>=." }) {
			builder.add(symbol, Associativity.NON_ASSOC, 700);
		}
		for (String symbol : new String[] { "+", "-", "/\\", "\\/", "xor" }) {
			builder.add(symbol, Associativity.LEFT_ASSOC, 500);
		}
		for (String symbol : new String[] { "*", "/", "//", "mod", "rem", "div", "<<", ">>" }) {
			builder.add(symbol, Associativity.LEFT_ASSOC, 400);
		}
		builder.add("**", Associativity.NON_ASSOC, 200);
		builder.add("^", Associativity.RIGHT_ASSOC, 200);
		STANDARD = builder.build();
	}

	private final Map<String, OperatorEntry> entries;

	private OperatorTable(Map<String, OperatorEntry> entries) {
		this.entries = Collections.unmodifiableMap(new LinkedHashMap<String, OperatorEntry>(entries));
	}

	/**
	 * @return the default operator table
	 */
	public static OperatorTable standard() {
		return STANDARD;
	}

	/**
	 * @return an empty builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a builder pre-filled with this table's operators
	 */
	public Builder toBuilder() {
		Builder builder = new Builder();
		builder.entries.putAll(entries);
		return builder;
	}

	/**
	 * @param symbol operator symbol
	 * @return the entry, or {@code null} when {@code symbol} is not an infix operator
	 */
	public OperatorEntry lookup(String symbol) {
		return entries.get(symbol);
	}

	/**
	 * @param token a token
	 * @return the entry for the operator that {@code token} spells, or
	 *         {@code null} when it is not an operator token
	 */
	public OperatorEntry lookup(Token token) {
		if (token.getKind() != TokenKind.KEYWORD) {
			return null;
		}
		return entries.get(token.getText());
	}

	public Collection<OperatorEntry> entries() {
		return entries.values();
	}

	@Override
	public String toString() {
		return entries.values().toString();
	}

	/**
	 * Assembles an {@link OperatorTable}. Adding a symbol twice replaces
	 * the previous entry.
	 */
	public static final class Builder {

		private final Map<String, OperatorEntry> entries = new LinkedHashMap<String, OperatorEntry>();

		private Builder() {}

		public Builder add(OperatorEntry entry) {
			entries.put(entry.getSymbol(), entry);
			return this;
		}

		public Builder add(String symbol, Associativity associativity, int priority) {
			return add(new OperatorEntry(symbol, associativity, priority));
		}

		public Builder add(String symbol, Associativity associativity, int priority, ReductionPolicy policy) {
			return add(new OperatorEntry(symbol, associativity, priority, policy));
		}

		public Builder remove(String symbol) {
			entries.remove(symbol);
			return this;
		}

		public OperatorTable build() {
			return new OperatorTable(entries);
		}
	}
}
