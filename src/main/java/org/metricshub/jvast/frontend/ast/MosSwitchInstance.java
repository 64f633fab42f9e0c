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
 * A single MOS switch (transistor) instance.
 */
public final class MosSwitchInstance extends AstNode {

	private final Identifier name;
	private final Lvalue outputTerminal;
	private final Expression enableTerminal;
	private final Expression inputTerminal;

	public MosSwitchInstance(Identifier name, Lvalue outputTerminal, Expression enableTerminal, Expression inputTerminal) {
		this.name = name;
		this.outputTerminal = outputTerminal;
		this.enableTerminal = enableTerminal;
		this.inputTerminal = inputTerminal;
	}

	public Identifier getName() {
		return name;
	}

	public Lvalue getOutputTerminal() {
		return outputTerminal;
	}

	public Expression getEnableTerminal() {
		return enableTerminal;
	}

	public Expression getInputTerminal() {
		return inputTerminal;
	}
}
