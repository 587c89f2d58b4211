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

/**
 * A top level instruction introduced by {@code #}, or a query.
 */
public abstract class Directive {

	/** Directive kinds. */
	public enum Kind {
		INCLUDE("include"),
		TABLE("table"),
		SHOW("show"),
		PRED("pred"),
		COMPUTE("compute"),
		ABDUCIBLE("abducible");

		private final String keyword;

		Kind(String keyword) {
			this.keyword = keyword;
		}

		/**
		 * @return the word following {@code #} in the source
		 */
		public String getKeyword() {
			return keyword;
		}
	}

	Directive() {}

	public abstract Kind getKind();
}
