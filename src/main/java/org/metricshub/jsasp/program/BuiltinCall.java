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
import java.util.Objects;

/**
 * A call to a solver built-in. The name is kept exactly as the lexer
 * tagged it: no prefix or arity rewriting applies.
 */
public final class BuiltinCall extends Term {

	private final String name;
	private final List<Term> arguments;

	public BuiltinCall(String name, List<? extends Term> arguments) {
		this.name = Objects.requireNonNull(name, "name");
		this.arguments = Collections.unmodifiableList(new ArrayList<Term>(arguments));
	}

	public String getName() {
		return name;
	}

	public List<Term> getArguments() {
		return arguments;
	}

	@Override
	public Kind getKind() {
		return Kind.BUILTIN_CALL;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof BuiltinCall)) {
			return false;
		}
		BuiltinCall other = (BuiltinCall) o;
		return name.equals(other.name) && arguments.equals(other.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(name);
		if (!arguments.isEmpty()) {
			appendArguments(sb, arguments);
		}
		return sb.toString();
	}
}
