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
 * Where a token starts: the source it was read from, and the 1-based
 * line and column within that source.
 */
public final class SourcePosition {

	private final String source;
	private final int line;
	private final int column;

	/**
	 * @param source description of the source (usually a file name)
	 * @param line 1-based line number
	 * @param column 1-based column number
	 */
	public SourcePosition(String source, int line, int column) {
		this.source = Objects.requireNonNull(source, "source");
		this.line = line;
		this.column = column;
	}

	public String getSource() {
		return source;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourcePosition)) {
			return false;
		}
		SourcePosition other = (SourcePosition) o;
		return line == other.line && column == other.column && source.equals(other.source);
	}

	@Override
	public int hashCode() {
		return Objects.hash(source, line, column);
	}

	@Override
	public String toString() {
		return source + ":" + line + ":" + column;
	}
}
