package org.metricshub.jvast.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JVast
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
 * The target of an assignment or a gate output terminal.
 */
public abstract class Lvalue extends AstNode {

	/**
	 * Discriminant of the lvalue variants.
	 */
	public enum Type {
		NET_IDENTIFIER(false),
		VAR_IDENTIFIER(false),
		GENVAR_IDENTIFIER(false),
		NET_CONCATENATION(true),
		VAR_CONCATENATION(true);

		private final boolean concatenation;

		Type(boolean concatenation) {
			this.concatenation = concatenation;
		}

		/**
		 * @return whether this lvalue kind holds a concatenation rather than an identifier
		 */
		public boolean isConcatenation() {
			return concatenation;
		}
	}

	private final Type type;

	protected Lvalue(Type type) {
		this.type = type;
	}

	public final Type getType() {
		return type;
	}

	@Override
	public String toString() {
		return "Lvalue(" + type + ")";
	}
}
