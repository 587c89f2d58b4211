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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Objects;
import org.metricshub.jsasp.frontend.ast.Diagnostic;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.frontend.ast.ParserException;
import org.metricshub.jsasp.frontend.ast.SyntaxErrorKind;

/**
 * Left to right reader over an already materialized token sequence.
 * The position can be saved and restored, which is how recovery goes back
 * to the start of a failed statement.
 */
public final class TokenCursor {

	private final List<Token> tokens;
	private int index;

	/**
	 * @param tokens the tokens to read; the list is read in place, not copied
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Token lists are only read; copying them would double memory for large programs")
	public TokenCursor(List<Token> tokens) {
		this.tokens = Objects.requireNonNull(tokens, "tokens");
	}

	/**
	 * @return the next token, without consuming it, or {@code null} at end of input
	 */
	public Token peek() {
		return index < tokens.size() ? tokens.get(index) : null;
	}

	/**
	 * @param literal a fixed punctuation or keyword literal
	 * @return whether the next token is that literal
	 */
	public boolean peekIs(String literal) {
		Token token = peek();
		return token != null && token.is(literal);
	}

	/**
	 * Consumes the next token.
	 *
	 * @return the consumed token
	 * @throws ParserException at end of input
	 */
	public Token next() {
		Token token = peek();
		if (token == null) {
			throw new ParserException(Diagnostic.endOfInput(Expectation.TERM));
		}
		index++;
		return token;
	}

	/**
	 * Consumes the next token if it is {@code literal}.
	 *
	 * @param literal a fixed punctuation or keyword literal
	 * @return whether a token was consumed
	 */
	public boolean accept(String literal) {
		if (peekIs(literal)) {
			index++;
			return true;
		}
		return false;
	}

	/**
	 * Consumes the terminal {@code literal}, or fails with its expectation.
	 *
	 * @param literal the expected literal
	 * @return the consumed token
	 * @throws ParserException when the next token is anything else
	 */
	public Token expect(String literal) {
		return expect(literal, Expectation.token(literal));
	}

	/**
	 * Consumes the terminal {@code literal}, or fails with the given
	 * expectation.
	 *
	 * @param literal the expected literal
	 * @param expectation what to report on failure
	 * @return the consumed token
	 * @throws ParserException when the next token is anything else
	 */
	public Token expect(String literal, Expectation expectation) {
		if (!peekIs(literal)) {
			throw syntaxError(SyntaxErrorKind.TOKEN_MISMATCH, expectation);
		}
		return next();
	}

	public boolean atEnd() {
		return index >= tokens.size();
	}

	/**
	 * @return the index of the next token, to be given back to {@link #reset(int)}
	 */
	public int position() {
		return index;
	}

	public void reset(int position) {
		if (position < 0 || position > tokens.size()) {
			throw new IllegalArgumentException("Position " + position + " is outside of 0.." + tokens.size());
		}
		index = position;
	}

	/**
	 * Builds the error for a failure at the next token.
	 *
	 * @param kind class of the error
	 * @param expectation what was expected at the next token
	 * @return the exception to throw; it reports end of input when there is
	 *         no next token
	 */
	public ParserException syntaxError(SyntaxErrorKind kind, Expectation expectation) {
		Token token = peek();
		if (token == null) {
			return new ParserException(Diagnostic.endOfInput(expectation));
		}
		return new ParserException(Diagnostic.at(kind, token, expectation));
	}

	/**
	 * Builds the error for a failure at an already consumed token.
	 *
	 * @param token the offending token
	 * @param kind class of the error
	 * @param expectation what was expected
	 * @return the exception to throw
	 */
	public ParserException syntaxError(Token token, SyntaxErrorKind kind, Expectation expectation) {
		return new ParserException(Diagnostic.at(kind, token, expectation));
	}
}
