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

import org.metricshub.jvast.util.AstList;

/**
 * A call to a user function or a system function (<code>$clog2</code>...).
 * <p>
 * A call without arguments has an empty argument list, never <code>null</code>.
 */
public final class FunctionCall extends AstNode {

	private final Identifier function;
	private final boolean constant;
	private final boolean system;
	private final AttributeList attributes;
	private final AstList<Expression> arguments;

	public FunctionCall(Identifier function, boolean constant, boolean system, AttributeList attributes, AstList<Expression> arguments) {
		this.function = function;
		this.constant = constant;
		this.system = system;
		this.attributes = attributes;
		this.arguments = arguments;
	}

	public Identifier getFunction() {
		return function;
	}

	public boolean isConstant() {
		return constant;
	}

	public boolean isSystem() {
		return system;
	}

	public AttributeList getAttributes() {
		return attributes;
	}

	public AstList<Expression> getArguments() {
		return arguments;
	}
}
