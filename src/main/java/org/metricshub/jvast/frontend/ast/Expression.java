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
 * An expression or constant expression.
 * <p>
 * Each variant carries its own operands. Whether the expression is constant
 * is recorded when it is built: callers state it for unary and binary
 * expressions, primary expressions derive it from the wrapped primary.
 */
public abstract class Expression extends AstNode {

	/**
	 * Discriminant of the expression variants.
	 */
	public enum Type {
		PRIMARY_EXPRESSION,
		UNARY_EXPRESSION,
		BINARY_EXPRESSION,
		RANGE_EXPRESSION_UP_DOWN,
		RANGE_EXPRESSION_INDEX,
		MINTYPMAX_EXPRESSION,
		CONDITIONAL_EXPRESSION,
		STRING_EXPRESSION
	}

	private final boolean constant;
	private final AttributeList attributes;

	protected Expression(boolean constant, AttributeList attributes) {
		this.constant = constant;
		this.attributes = attributes;
	}

	public abstract Type getType();

	public final boolean isConstant() {
		return constant;
	}

	/**
	 * @return the attributes attached to the operator, or <code>null</code>
	 */
	public final AttributeList getAttributes() {
		return attributes;
	}

	@Override
	public String toString() {
		return getType().name();
	}
}
