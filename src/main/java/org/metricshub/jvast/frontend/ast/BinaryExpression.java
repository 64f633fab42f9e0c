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

public final class BinaryExpression extends Expression {

	private final Expression left;
	private final Operator operation;
	private final Expression right;

	public BinaryExpression(Expression left, Operator operation, Expression right, AttributeList attributes, boolean constant) {
		super(constant, attributes);
		this.left = left;
		this.operation = operation;
		this.right = right;
	}

	@Override
	public Type getType() {
		return Type.BINARY_EXPRESSION;
	}

	public Expression getLeft() {
		return left;
	}

	public Operator getOperation() {
		return operation;
	}

	public Expression getRight() {
		return right;
	}
}
