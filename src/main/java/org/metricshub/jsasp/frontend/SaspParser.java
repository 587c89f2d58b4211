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
import java.util.List;
import java.util.Objects;
import org.metricshub.jsasp.InvalidProgramException;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.frontend.ast.ParserException;
import org.metricshub.jsasp.frontend.ast.SyntaxErrorKind;
import org.metricshub.jsasp.program.AbducibleDirective;
import org.metricshub.jsasp.program.ComputeDirective;
import org.metricshub.jsasp.program.Directive;
import org.metricshub.jsasp.program.GoalsDirective;
import org.metricshub.jsasp.program.IncludeDirective;
import org.metricshub.jsasp.program.Operation;
import org.metricshub.jsasp.program.Program;
import org.metricshub.jsasp.program.Rule;
import org.metricshub.jsasp.program.Term;
import org.metricshub.jsasp.util.ParserSettings;
import org.metricshub.jsasp.util.SaspLogger;
import org.slf4j.Logger;

/**
 * Converts the token sequence of a program into its rules and directives.
 * <p>
 * Input programs are normal logic programs with the following additions:
 * <ul>
 * <li>{@code #include "file.asp".} includes another file;</li>
 * <li>{@code #compute N { Q }.} computes N stable models for query Q;</li>
 * <li>{@code #abducible p(X).} declares a predicate that can be assumed
 * either true or false;</li>
 * <li>{@code #table}, {@code #show} and {@code #pred} take a list of goals;</li>
 * <li>{@code ?- Q.} is a query, handled as {@code #compute 1 { Q }.};</li>
 * <li>atoms and predicates may begin with an underscore, in which case they
 * are not shown when printing solutions.</li>
 * </ul>
 * A statement that fails to parse is reported, skipped up to its
 * terminating {@code .}, and parsing goes on with the next one.
 * <p>
 * It contains the internal state of the parse, so an instance must not be
 * shared by concurrent parses.
 */
public class SaspParser {

	private static final Logger LOG = SaspLogger.getLogger(SaspParser.class);

	private final ParserSettings settings;

	private TokenCursor cursor;
	private TermBuilder terms;
	private ErrorReporter reporter;

	/**
	 * <p>
	 * Constructor for SaspParser.
	 * </p>
	 *
	 * @param settings operator and naming settings
	 */
	public SaspParser(ParserSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	/**
	 * Parses a whole program.
	 *
	 * @param tokens the tokens of the program
	 * @return the statements and directives, in source order, and the
	 *         syntax errors met
	 * @throws InvalidProgramException if the parse cannot make progress,
	 *         which should never happen
	 */
	public Program parseProgram(List<Token> tokens) {
		LOG.debug("Parsing input ({} tokens)", tokens.size());
		start(tokens);
		List<Rule> statements = new ArrayList<Rule>();
		List<Directive> directives = new ArrayList<Directive>();
		int errors = STATEMENTS(statements, directives);
		LOG
				.debug(
						"Parsed {} statements and {} directives, {} errors",
						statements.size(),
						directives.size(),
						errors);
		return new Program(statements, directives, reporter.getDiagnostics(), errors);
	}

	/**
	 * Parses a query entered by the user: goals followed by {@code .}.
	 *
	 * @param tokens the tokens of the query
	 * @return the query goals
	 * @throws ParserException if the tokens are not a valid query; the error
	 *         has been logged already
	 */
	public List<Term> parseQuery(List<Token> tokens) {
		LOG.debug("Parsing user query");
		start(tokens);
		try {
			return QUERY(new VariableScope());
		} catch (ParserException e) {
			reporter.report(e.getDiagnostic());
			throw e;
		}
	}

	private void start(List<Token> tokens) {
		cursor = new TokenCursor(tokens);
		terms = new TermBuilder(cursor, settings);
		reporter = new ErrorReporter();
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// STATEMENTS : { DIRECTIVE | STATEMENT }
	int STATEMENTS(List<Rule> statements, List<Directive> directives) {
		int errors = 0;
		while (!cursor.atEnd()) {
			int statementStart = cursor.position();
			// each statement numbers its anonymous variables from 1
			VariableScope scope = new VariableScope();
			try {
				if (cursor.peekIs("#")) {
					directives.add(DIRECTIVE(scope));
				} else {
					STATEMENT(scope, statements, directives);
				}
			} catch (ParserException e) {
				reporter.report(e.getDiagnostic());
				reporter.recover(cursor, statementStart);
				errors++;
				if (cursor.position() <= statementStart) {
					throw new InvalidProgramException(
							"Parser made no progress at token " + statementStart + ": " + e.getMessage(),
							e);
				}
			}
		}
		return errors;
	}

	// STATEMENT : ?- QUERY | :- BODY . | PREDICATE [ :- BODY ] .
	void STATEMENT(VariableScope scope, List<Rule> statements, List<Directive> directives) {
		if (cursor.accept("?-")) {
			directives.add(ComputeDirective.query(QUERY(scope)));
		} else if (cursor.accept(":-")) {
			List<Term> body = BODY(scope);
			cursor.expect(".", Expectation.BODY);
			statements.add(Rule.constraint(body));
		} else if (terms.startsPredicate(cursor.peek())) {
			statements.add(RULE(scope));
		} else {
			throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.STATEMENT);
		}
	}

	// RULE : PREDICATE :- BODY . | PREDICATE .
	Rule RULE(VariableScope scope) {
		Term head = terms.PREDICATE(scope);
		if (cursor.accept(":-")) {
			List<Term> body = BODY(scope);
			cursor.expect(".", Expectation.BODY);
			return new Rule(head, body);
		}
		if (cursor.peekIs(".")) {
			cursor.next();
			return new Rule(head, new ArrayList<Term>());
		}
		throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.RULE);
	}

	// QUERY : BODY .
	List<Term> QUERY(VariableScope scope) {
		List<Term> goals = BODY(scope);
		cursor.expect(".");
		return goals;
	}

	// BODY : EXPRESSION, split on its top level commas
	List<Term> BODY(VariableScope scope) {
		return Operation.conjuncts(terms.expressions().EXPRESSION(scope, true));
	}

	// DIRECTIVE : # ( include INCLUDE | table BODY | show BODY | pred BODY | compute COMPUTE | abducible PREDICATE ) .
	Directive DIRECTIVE(VariableScope scope) {
		cursor.expect("#");
		Token keyword = cursor.peek();
		if (keyword == null) {
			throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.DIRECTIVE);
		}
		Directive directive;
		if (keyword.isWord(Directive.Kind.INCLUDE.getKeyword())) {
			cursor.next();
			directive = new IncludeDirective(INCLUDE());
		} else if (keyword.isWord(Directive.Kind.TABLE.getKeyword())) {
			cursor.next();
			directive = new GoalsDirective(Directive.Kind.TABLE, BODY(scope));
		} else if (keyword.isWord(Directive.Kind.SHOW.getKeyword())) {
			cursor.next();
			directive = new GoalsDirective(Directive.Kind.SHOW, BODY(scope));
		} else if (keyword.isWord(Directive.Kind.PRED.getKeyword())) {
			cursor.next();
			directive = new GoalsDirective(Directive.Kind.PRED, BODY(scope));
		} else if (keyword.isWord(Directive.Kind.COMPUTE.getKeyword())) {
			cursor.next();
			directive = COMPUTE(scope);
		} else if (keyword.isWord(Directive.Kind.ABDUCIBLE.getKeyword())) {
			cursor.next();
			if (!terms.startsPredicate(cursor.peek())) {
				throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.ATOM);
			}
			directive = new AbducibleDirective(terms.PREDICATE(scope));
		} else {
			throw cursor.syntaxError(SyntaxErrorKind.STRUCTURAL, Expectation.DIRECTIVE);
		}
		cursor.expect(".");
		return directive;
	}

	// INCLUDE : ( string ) | string
	String INCLUDE() {
		boolean parenthesized = cursor.accept("(");
		Token token = cursor.peek();
		if (token == null || token.getKind() != TokenKind.STRING) {
			throw cursor.syntaxError(SyntaxErrorKind.TOKEN_MISMATCH, Expectation.INCLUDE);
		}
		cursor.next();
		if (parenthesized) {
			cursor.expect(")", Expectation.CLOSE_PAREN);
		}
		return stripQuotes(token.getText());
	}

	// COMPUTE : integer { BODY }
	ComputeDirective COMPUTE(VariableScope scope) {
		Token count = cursor.peek();
		if (count == null || count.getKind() != TokenKind.INTEGER) {
			throw cursor.syntaxError(SyntaxErrorKind.TOKEN_MISMATCH, Expectation.INTEGER);
		}
		cursor.next();
		BigInteger modelCount;
		try {
			modelCount = new BigInteger(count.getText());
		} catch (NumberFormatException e) {
			throw cursor.syntaxError(count, SyntaxErrorKind.STRUCTURAL, Expectation.INTEGER);
		}
		cursor.expect("{", Expectation.OPEN_BRACE);
		List<Term> goals = BODY(scope);
		cursor.expect("}", Expectation.CLOSE_BRACE);
		return new ComputeDirective(modelCount, goals);
	}

	// CHECKSTYLE.ON: MethodName

	/**
	 * Strips one character from each end of a string that starts with a
	 * single or double quote. The closing character is not checked.
	 *
	 * @param text the string, possibly quoted
	 * @return the string without its quotes
	 */
	static String stripQuotes(String text) {
		if (text.length() >= 2) {
			char first = text.charAt(0);
			if (first == '"' || first == '\'') {
				return text.substring(1, text.length() - 1);
			}
		}
		return text;
	}
}
