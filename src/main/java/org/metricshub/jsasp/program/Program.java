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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jsasp.frontend.ast.Diagnostic;

/**
 * Result of parsing a whole token sequence: the statements and the
 * directives, each in source order, plus the syntax errors met on the way.
 * <p>
 * Statements and directives are kept apart; a statement that failed to
 * parse appears in neither list and counts once in {@link #getErrorCount()}.
 */
public final class Program {

	private final List<Rule> statements;
	private final List<Directive> directives;
	private final List<Diagnostic> diagnostics;
	private final int errorCount;

	public Program(List<Rule> statements, List<Directive> directives, List<Diagnostic> diagnostics, int errorCount) {
		this.statements = Collections.unmodifiableList(new ArrayList<Rule>(statements));
		this.directives = Collections.unmodifiableList(new ArrayList<Directive>(directives));
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
		this.errorCount = errorCount;
	}

	public List<Rule> getStatements() {
		return statements;
	}

	public List<Directive> getDirectives() {
		return directives;
	}

	/**
	 * @return one diagnostic per failed statement or directive
	 */
	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public int getErrorCount() {
		return errorCount;
	}

	public boolean hasErrors() {
		return errorCount > 0;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Directive directive : directives) {
			sb.append(directive).append('\n');
		}
		for (Rule rule : statements) {
			sb.append(rule).append('\n');
		}
		return sb.toString();
	}
}
