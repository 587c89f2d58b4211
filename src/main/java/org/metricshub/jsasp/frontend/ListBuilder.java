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

import java.util.List;
import org.metricshub.jsasp.frontend.ast.Expectation;
import org.metricshub.jsasp.frontend.ast.SyntaxErrorKind;
import org.metricshub.jsasp.program.ListCons;
import org.metricshub.jsasp.program.ListEmpty;
import org.metricshub.jsasp.program.Operation;
import org.metricshub.jsasp.program.Term;

/**
 * Reads bracketed lists. The elements are read as one comma joined
 * expression by the {@link ExpressionEngine} and split afterwards.
 */
public final class ListBuilder {

	private final TokenCursor cursor;
	private final ExpressionEngine expressions;

	ListBuilder(TokenCursor cursor, ExpressionEngine expressions) {
		this.cursor = cursor;
		this.expressions = expressions;
	}

	// CHECKSTYLE.OFF: MethodName

	// LIST : [ ] | [ EXPRESSION [ | EXPRESSION ] ]
	Term LIST(VariableScope scope) {
		cursor.expect("[", Expectation.OPEN_BRACKET);
		if (cursor.accept("]")) {
			return ListEmpty.INSTANCE;
		}
		List<Term> elements = Operation.conjuncts(expressions.EXPRESSION(scope, true));
		Term tail = ListEmpty.INSTANCE;
		if (cursor.peekIs("|")) {
			Token bar = cursor.next();
			tail = expressions.EXPRESSION(scope, true);
			if (tail instanceof Operation && ((Operation) tail).isConjunction()) {
				throw cursor.syntaxError(bar, SyntaxErrorKind.STRUCTURAL, Expectation.LIST);
			}
		}
		cursor.expect("]", Expectation.LIST);
		return ListCons.of(elements, tail);
	}

	// CHECKSTYLE.ON: MethodName
}
