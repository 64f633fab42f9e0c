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
 * The smallest unit of an expression tree: a literal, an identifier
 * reference, a concatenation, a function call...
 * <p>
 * {@link Kind} tells which expression grammar the primary belongs to,
 * {@link #getValueType()} tells which value variant it is.
 */
public abstract class Primary extends AstNode {

	/**
	 * Grammar the primary was reduced in.
	 */
	public enum Kind {
		CONSTANT_PRIMARY,
		PRIMARY,
		MODULE_PATH_PRIMARY
	}

	/**
	 * Discriminant of the primary value variants.
	 */
	public enum ValueType {
		NUMBER,
		IDENTIFIER,
		CONCATENATION,
		FUNCTION_CALL,
		MINTYPMAX_EXPRESSION,
		MACRO_USAGE
	}

	private final Kind kind;

	protected Primary(Kind kind) {
		this.kind = kind;
	}

	public final Kind getKind() {
		return kind;
	}

	public abstract ValueType getValueType();

	@Override
	public String toString() {
		return kind + ":" + getValueType();
	}
}
