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

public final class UdpInstance extends AstNode {

	private final Identifier identifier;
	private final Range range;
	private final Lvalue output;
	private final AstList<Expression> inputs;

	public UdpInstance(Identifier identifier, Range range, Lvalue output, AstList<Expression> inputs) {
		this.identifier = identifier;
		this.range = range;
		this.output = output;
		this.inputs = inputs;
	}

	/**
	 * @return the instance name, <code>null</code> for an unnamed instance
	 */
	public Identifier getIdentifier() {
		return identifier;
	}

	public Range getRange() {
		return range;
	}

	public Lvalue getOutput() {
		return output;
	}

	public AstList<Expression> getInputs() {
		return inputs;
	}
}
