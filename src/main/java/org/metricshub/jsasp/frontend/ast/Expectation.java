package org.metricshub.jsasp.frontend.ast;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What the parser was looking for when it failed, and the message that
 * describes it.
 * <p>
 * The known keys form a closed table. Any other expected token gets the
 * generic {@code Expected "x"} message through {@link #token(String)}.
 */
public final class Expectation {

	private static final Map<String, Expectation> KNOWN = new LinkedHashMap<String, Expectation>();

	public static final Expectation STATEMENT = known(
			"statement",
			"Invalid start of statement. Expected \"#\", \":-\", \"?-\" or identifier");
	public static final Expectation TERM = known("term", "Invalid term. Expected integer, identifier or \"_\"");
	public static final Expectation TERMS = known(
			"terms",
			"Invalid operator in list of terms. Expected \",\" or \")\"");
	public static final Expectation NEGATED_LITERAL = known(
			"negated_lit",
			"Invalid token after negation! Expected an atom");
	public static final Expectation DOUBLE_NEGATION = known("double_negation", "Double negation is not allowed");
	public static final Expectation RULE = known("rule", "Invalid token in rule. Expected \":-\" or \".\"");
	public static final Expectation BODY = known("body", "Invalid token in rule body. Expected \",\" or \".\"");
	public static final Expectation LIST = known("list", "Invalid list. Expected \",\", \"|\" or \"]\"");
	public static final Expectation DIRECTIVE = known(
			"directive",
			"Invalid directive. Expected include, table, show, pred, compute or abducible");
	public static final Expectation INCLUDE = known("include", "Expected quoted file name");
	public static final Expectation OPERATOR = known(
			"operator",
			"Operator priority clash. Use parentheses to group operators of equal priority");
	public static final Expectation LITERAL = known("literal", "Expected literal");
	public static final Expectation ATOM = known("atom", "Expected atom");
	public static final Expectation INTEGER = known("integer", "Expected integer");
	public static final Expectation OPEN_BRACE = known("{", "Expected \"{\"");
	public static final Expectation CLOSE_BRACE = known("}", "Expected \"}\"");
	public static final Expectation OPEN_BRACKET = known("[", "Expected \"[\"");
	public static final Expectation CLOSE_BRACKET = known("]", "Expected \"]\"");
	public static final Expectation OPEN_PAREN = known("(", "Expected \"(\"");
	public static final Expectation CLOSE_PAREN = known(")", "Expected \")\"");

	private final String key;
	private final String message;
	private final boolean specific;

	private Expectation(String key, String message, boolean specific) {
		this.key = key;
		this.message = message;
		this.specific = specific;
	}

	private static Expectation known(String key, String message) {
		Expectation expectation = new Expectation(key, message, true);
		KNOWN.put(key, expectation);
		return expectation;
	}

	/**
	 * Looks up the expectation for a key, falling back to the generic
	 * message for a token nobody described.
	 *
	 * @param key an expectation key or the literal of the expected token
	 * @return the matching expectation
	 */
	public static Expectation token(String key) {
		Expectation expectation = KNOWN.get(key);
		if (expectation != null) {
			return expectation;
		}
		return new Expectation(key, "Expected \"" + key + "\"", false);
	}

	/**
	 * @return the closed table of described expectations, by key
	 */
	public static Map<String, Expectation> knownExpectations() {
		return Collections.unmodifiableMap(KNOWN);
	}

	public String getKey() {
		return key;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * @return {@code false} when this expectation uses the generic message
	 */
	public boolean isSpecific() {
		return specific;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Expectation)) {
			return false;
		}
		Expectation other = (Expectation) o;
		return key.equals(other.key) && message.equals(other.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, message);
	}

	@Override
	public String toString() {
		return key;
	}
}
