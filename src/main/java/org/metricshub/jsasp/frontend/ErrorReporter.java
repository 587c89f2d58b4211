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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jsasp.frontend.ast.Diagnostic;
import org.metricshub.jsasp.util.SaspLogger;
import org.slf4j.Logger;

/**
 * Collects the diagnostics of a parse and logs each of them once, and
 * resynchronizes the token cursor after a failed statement.
 */
public final class ErrorReporter {

	private static final Logger LOG = SaspLogger.getLogger(ErrorReporter.class);
	private static final Logger DIAGNOSTICS = SaspLogger.getDiagnosticsLogger();

	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

	/**
	 * Records and logs a syntax error.
	 *
	 * @param diagnostic the error
	 */
	public void report(Diagnostic diagnostic) {
		diagnostics.add(diagnostic);
		DIAGNOSTICS.error(diagnostic.format());
	}

	/**
	 * Skips the failed statement: goes back to where it started, then
	 * consumes tokens up to and including the next {@code .}, or to the end
	 * of input.
	 *
	 * @param cursor the cursor to move
	 * @param statementStart position of the first token of the failed statement
	 * @return how many tokens were skipped
	 */
	public int recover(TokenCursor cursor, int statementStart) {
		cursor.reset(statementStart);
		int skipped = 0;
		while (!cursor.atEnd()) {
			Token token = cursor.next();
			skipped++;
			if (token.is(".")) {
				break;
			}
		}
		LOG.debug("Skipped {} tokens after a syntax error", skipped);
		return skipped;
	}

	public List<Diagnostic> getDiagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	public int getErrorCount() {
		return diagnostics.size();
	}
}
