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
 * A single CMOS switch (transistor pair) instance.
 */
public final class CmosSwitchInstance extends AstNode {

	private final Identifier name;
	private final Lvalue outputTerminal;
	private final Expression ncontrolTerminal;
	private final Expression pcontrolTerminal;
	private final Expression inputTerminal;

	public CmosSwitchInstance(
			Identifier name,
			Lvalue outputTerminal,
			Expression ncontrolTerminal,
			Expression pcontrolTerminal,
			Expression inputTerminal) {
		this.name = name;
		this.outputTerminal = outputTerminal;
		this.ncontrolTerminal = ncontrolTerminal;
		this.pcontrolTerminal = pcontrolTerminal;
		this.inputTerminal = inputTerminal;
	}

	public Identifier getName() {
		return name;
	}

	public Lvalue getOutputTerminal() {
		return outputTerminal;
	}

	public Expression getNcontrolTerminal() {
		return ncontrolTerminal;
	}

	public Expression getPcontrolTerminal() {
		return pcontrolTerminal;
	}

	public Expression getInputTerminal() {
		return inputTerminal;
	}
}
