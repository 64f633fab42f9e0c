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
 * An n-input gate instance, e.g. a 3-to-1 NAND.
 */
public final class NInputGateInstance extends AstNode {

	private final Identifier name;
	private final AstList<Expression> inputTerminals;
	private final Lvalue outputTerminal;

	public NInputGateInstance(Identifier name, AstList<Expression> inputTerminals, Lvalue outputTerminal) {
		this.name = name;
		this.inputTerminals = inputTerminals;
		this.outputTerminal = outputTerminal;
	}

	public Identifier getName() {
		return name;
	}

	public AstList<Expression> getInputTerminals() {
		return inputTerminals;
	}

	public Lvalue getOutputTerminal() {
		return outputTerminal;
	}
}
