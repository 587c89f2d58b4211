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

import java.util.Objects;

/**
 * One lexer token: its kind, its text as it appeared in the source, and
 * where it started. Tokens are immutable.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;
	private final SourcePosition position;

	/**
	 * <p>
	 * Constructor for Token.
	 * </p>
	 *
	 * @param kind the token class
	 * @param text the token text; for {@link TokenKind#KEYWORD} tokens, the
	 *        literal itself (e.g. {@code ":-"})
	 * @param position where the token starts
	 */
	public Token(TokenKind kind, String text, SourcePosition position) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = Objects.requireNonNull(text, "text");
		this.position = Objects.requireNonNull(position, "position");
	}

	/**
	 * Shorthand for a fixed punctuation or keyword token.
	 *
	 * @param literal the literal
	 * @param position where the token starts
	 * @return a new {@link TokenKind#KEYWORD} token
	 */
	public static Token keyword(String literal, SourcePosition position) {
		return new Token(TokenKind.KEYWORD, literal, position);
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * @param literal a fixed punctuation or keyword literal
	 * @return whether this is the {@link TokenKind#KEYWORD} token spelled {@code literal}
	 */
	public boolean is(String literal) {
		return kind == TokenKind.KEYWORD && text.equals(literal);
	}

	/**
	 * Matches a word that some lexers emit as a keyword and others as a
	 * plain identifier ({@code include}, {@code compute}...).
	 *
	 * @param word the word
	 * @return whether this token is that word
	 */
	public boolean isWord(String word) {
		return (kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER) && text.equals(word);
	}

	/**
	 * Printable rendering used in diagnostics.
	 *
	 * @return the token text
	 */
	public String visibleText() {
		return text;
	}

	@Override
	public String toString() {
		return kind + "(" + text + ")@" + position;
	}
}
