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

import java.util.Objects;
import org.metricshub.jsasp.frontend.SourcePosition;
import org.metricshub.jsasp.frontend.Token;

/**
 * One syntax error, as a value: where it happened, the offending token
 * and what was expected instead.
 */
public final class Diagnostic {

	private final SyntaxErrorKind kind;
	private final SourcePosition position;
	private final String tokenText;
	private final Expectation expectation;

	private Diagnostic(SyntaxErrorKind kind, SourcePosition position, String tokenText, Expectation expectation) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.position = position;
		this.tokenText = tokenText;
		this.expectation = Objects.requireNonNull(expectation, "expectation");
	}

	/**
	 * @param kind class of the error
	 * @param offending the token at which parsing failed
	 * @param expectation what was expected instead
	 * @return a diagnostic located at the token
	 */
	public static Diagnostic at(SyntaxErrorKind kind, Token offending, Expectation expectation) {
		return new Diagnostic(kind, offending.getPosition(), offending.visibleText(), expectation);
	}

	/**
	 * @param expectation what was expected when the tokens ran out
	 * @return a diagnostic without position
	 */
	public static Diagnostic endOfInput(Expectation expectation) {
		return new Diagnostic(SyntaxErrorKind.UNEXPECTED_END_OF_INPUT, null, null, expectation);
	}

	public SyntaxErrorKind getKind() {
		return kind;
	}

	/**
	 * @return the position of the offending token, {@code null} at end of input
	 */
	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * @return the text of the offending token, {@code null} at end of input
	 */
	public String getTokenText() {
		return tokenText;
	}

	public Expectation getExpectation() {
		return expectation;
	}

	/**
	 * @return the one-line, human readable form of this diagnostic
	 */
	public String format() {
		if (position == null) {
			return "ERROR: Unexpected end of file. " + expectation.getMessage() + ".";
		}
		return String
				.format(
						"ERROR: %s:%d:%d: Syntax error at \"%s\". %s.",
						position.getSource(),
						position.getLine(),
						position.getColumn(),
						tokenText,
						expectation.getMessage());
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Diagnostic)) {
			return false;
		}
		Diagnostic other = (Diagnostic) o;
		return kind == other.kind
				&& Objects.equals(position, other.position)
				&& Objects.equals(tokenText, other.tokenText)
				&& expectation.equals(other.expectation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, position, tokenText, expectation);
	}

	@Override
	public String toString() {
		return format();
	}
}
