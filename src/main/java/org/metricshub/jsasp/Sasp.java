package org.metricshub.jsasp;

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

import java.util.List;
import org.metricshub.jsasp.frontend.SaspParser;
import org.metricshub.jsasp.frontend.Token;
import org.metricshub.jsasp.frontend.ast.ParserException;
import org.metricshub.jsasp.program.Program;
import org.metricshub.jsasp.program.Term;
import org.metricshub.jsasp.util.ParserSettings;

/**
 * Entry point into the parsing of s(ASP) programs and queries, when Jsasp
 * is used as a library.
 * <p>
 * The tokens come from a lexer; this class turns them into the rules,
 * facts, queries and directives handed to the solver.
 * <p>
 * Instances can be shared: every call uses a parser of its own.
 */
public class Sasp {

	private final ParserSettings settings;

	/**
	 * Create a new instance of Sasp with the default settings.
	 */
	public Sasp() {
		this(new ParserSettings());
	}

	/**
	 * Create a new instance of Sasp.
	 *
	 * @param settings operator and naming settings; they must not be changed
	 *        while a parse is running
	 */
	public Sasp(ParserSettings settings) {
		this.settings = settings;
	}

	/**
	 * Parses a program. Syntax errors do not stop the parse: each failed
	 * statement is reported, skipped and counted in the result.
	 *
	 * @param tokens the tokens of the program
	 * @return the parsed statements and directives, with the error count
	 * @throws InvalidProgramException if the parser cannot make progress
	 */
	public Program parseProgram(List<Token> tokens) {
		return new SaspParser(settings).parseProgram(tokens);
	}

	/**
	 * Parses one interactive query, {@code goals .}.
	 *
	 * @param tokens the tokens of the query
	 * @return the query goals
	 * @throws ParserException if the query is not valid
	 */
	public List<Term> parseQuery(List<Token> tokens) {
		return new SaspParser(settings).parseQuery(tokens);
	}
}
