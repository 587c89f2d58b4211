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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.frontend.ast.SyntaxErrorKind;
import org.metricshub.jsasp.program.BuiltinCall;
import org.metricshub.jsasp.program.FloatTerm;
import org.metricshub.jsasp.program.IntegerTerm;
import org.metricshub.jsasp.program.NotTerm;
import org.metricshub.jsasp.program.Predicate;
import org.metricshub.jsasp.program.PredicateKey;
import org.metricshub.jsasp.program.RationalTerm;
import org.metricshub.jsasp.program.Term;
import org.metricshub.jsasp.program.Variable;
import org.metricshub.jsasp.util.ParserSettings;

/**
 * Builds terms and predicates from the tokens under the cursor.
 * <p>
 * Predicate identity is settled here: the arity is known once the
 * argument list has been read, names that could clash with generated
 * names are marked for disambiguation, and a leading {@code -} makes the
 * predicate classically negated.
 */
public final class TermBuilder {

	private final TokenCursor cursor;
	private final ParserSettings settings;
	private final ExpressionEngine expressions;
	private final ListBuilder lists;

	/**
	 * @param cursor where tokens are read from
	 * @param settings naming and operator settings
	 */
	public TermBuilder(TokenCursor cursor, ParserSettings settings) {
		this.cursor = cursor;
		this.settings = settings;
		this.expressions = new ExpressionEngine(cursor, settings.getOperatorTable(), this);
		this.lists = new ListBuilder(cursor, expressions);
	}

	/**
	 * @return the expression engine sharing this builder's cursor
	 */
	public ExpressionEngine expressions() {
		return expressions;
	}

	// CHECKSTYLE.OFF: MethodName

	// TERM : [not] PREDICATE | LIST | variable | integer | float | rational | _
	Term TERM(VariableScope scope) {
		Token token = cursor.peek();
		if (token == null) {
			throw cursor.syntaxError(SyntaxErrorKind.UNEXPECTED_END_OF_INPUT, Expectation.TERM);
		}
		if (token.is("not")) {
			cursor.next();
			if (!startsPredicate(cursor.peek())) {
				throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.NEGATED_LITERAL);
			}
			return new NotTerm(PREDICATE(scope));
		}
		if (startsPredicate(token)) {
			return PREDICATE(scope);
		}
		if (token.is("[")) {
			return lists.LIST(scope);
		}
		if (token.is("_")) {
			cursor.next();
			return scope.fresh();
		}
		switch (token.getKind()) {
		case VARIABLE:
			cursor.next();
			return "_".equals(token.getText()) ? scope.fresh() : new Variable(token.getText());
		case INTEGER:
			return new IntegerTerm(parseInteger(cursor.next()));
		case FLOAT:
			return parseFloat(cursor.next());
		case RATIONAL:
			return parseRational(cursor.next());
		default:
			throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.TERM);
		}
	}

	// PREDICATE : - ATOM [ ( ARGUMENTS ) ] | builtin [ ( ARGUMENTS ) ] | ATOM [ ( ARGUMENTS ) ]
	Term PREDICATE(VariableScope scope) {
		Token token = cursor.peek();
		if (token != null && token.getKind() == TokenKind.BUILTIN) {
			cursor.next();
			return new BuiltinCall(token.getText(), optArguments(scope));
		}
		boolean negated = false;
		while (cursor.peekIs("-")) {
			Token minus = cursor.next();
			if (negated && settings.isRejectDoubleNegation()) {
				throw cursor.syntaxError(minus, SyntaxErrorKind.DOUBLE_NEGATION, Expectation.DOUBLE_NEGATION);
			}
			negated = !negated;
			if (!cursor.peekIs("-") && !isAtom(cursor.peek())) {
				throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.NEGATED_LITERAL);
			}
		}
		if (!isAtom(cursor.peek())) {
			throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.ATOM);
		}
		String name = cursor.next().getText();
		List<Term> arguments = optArguments(scope);
		PredicateKey key = new PredicateKey(name, arguments.size(), negated, needsDisambiguation(name));
		return new Predicate(key, arguments);
	}

	// ARGUMENTS : EXPRESSION { , EXPRESSION }
	private List<Term> optArguments(VariableScope scope) {
		if (!cursor.accept("(")) {
			return Collections.emptyList();
		}
		List<Term> arguments = new ArrayList<Term>();
		while (true) {
			arguments.add(expressions.EXPRESSION(scope, false));
			if (cursor.accept(",")) {
				continue;
			}
			if (cursor.accept(")")) {
				return arguments;
			}
			throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.TERMS);
		}
	}

	// CHECKSTYLE.ON: MethodName

	/**
	 * Whether a predicate (possibly negated, possibly a built-in) starts at
	 * {@code token}.
	 *
	 * @param token a token, or {@code null} at end of input
	 * @return {@code true} for {@code -}, a built-in, an identifier or a string
	 */
	public boolean startsPredicate(Token token) {
		return token != null && (token.is("-") || token.getKind() == TokenKind.BUILTIN || isAtom(token));
	}

	private static boolean isAtom(Token token) {
		return token != null && (token.getKind() == TokenKind.IDENTIFIER || token.getKind() == TokenKind.STRING);
	}

	/**
	 * A user name needs the disambiguation prefix when it already carries an
	 * internal prefix, starts with a reserved prefix, or starts with an
	 * underscore.
	 *
	 * @param name a predicate name, as written
	 * @return whether the name gets {@link PredicateKey#DISAMBIGUATION_PREFIX}
	 */
	public boolean needsDisambiguation(String name) {
		if (name.startsWith("_")) {
			return true;
		}
		for (String prefix : settings.getInternalPrefixes()) {
			if (name.startsWith(prefix)) {
				return true;
			}
		}
		for (String prefix : settings.getReservedPrefixes()) {
			if (name.startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}

	private BigInteger parseInteger(Token token) {
		try {
			return new BigInteger(token.getText());
		} catch (NumberFormatException e) {
			throw cursor.syntaxError(token, SyntaxErrorKind.STRUCTURAL, Expectation.INTEGER);
		}
	}

	private Term parseFloat(Token token) {
		try {
			return new FloatTerm(Double.parseDouble(token.getText()));
		} catch (NumberFormatException e) {
			throw cursor.syntaxError(token, SyntaxErrorKind.STRUCTURAL, Expectation.TERM);
		}
	}

	// rationals come as N/D or NrD
	private Term parseRational(Token token) {
		String text = token.getText();
		int separator = text.indexOf('r');
		if (separator < 0) {
			separator = text.indexOf('/');
		}
		if (separator <= 0) {
			throw cursor.syntaxError(token, SyntaxErrorKind.STRUCTURAL, Expectation.TERM);
		}
		try {
			BigInteger numerator = new BigInteger(text.substring(0, separator));
			BigInteger denominator = new BigInteger(text.substring(separator + 1));
			return new RationalTerm(numerator, denominator);
		} catch (IllegalArgumentException e) {
			// NumberFormatException, or a zero denominator
			throw cursor.syntaxError(token, SyntaxErrorKind.STRUCTURAL, Expectation.TERM);
		}
	}
}
