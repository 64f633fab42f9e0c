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
 * <code>.port(expression)</code>, or a positional connection when the port
 * name is <code>null</code>. Also used for parameter value assignments.
 */
public final class PortConnection extends AstNode {

	private final Identifier portName;
	private final Expression expression;

	public PortConnection(Identifier portName, Expression expression) {
		this.portName = portName;
		this.expression = expression;
	}

	public Identifier getPortName() {
		return portName;
	}

	/**
	 * @return the connected expression, <code>null</code> for an unconnected port
	 */
	public Expression getExpression() {
		return expression;
	}

	public boolean isNamed() {
		return portName != null;
	}
}
