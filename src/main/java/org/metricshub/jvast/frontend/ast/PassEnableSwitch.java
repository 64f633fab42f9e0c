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
 * A single <code>tranif</code> / <code>rtranif</code> instance.
 */
public final class PassEnableSwitch extends AstNode {

	private final Identifier name;
	private final Lvalue terminal1;
	private final Lvalue terminal2;
	private final Expression enable;

	public PassEnableSwitch(Identifier name, Lvalue terminal1, Lvalue terminal2, Expression enable) {
		this.name = name;
		this.terminal1 = terminal1;
		this.terminal2 = terminal2;
		this.enable = enable;
	}

	public Identifier getName() {
		return name;
	}

	public Lvalue getTerminal1() {
		return terminal1;
	}

	public Lvalue getTerminal2() {
		return terminal2;
	}

	public Expression getEnable() {
		return enable;
	}
}
