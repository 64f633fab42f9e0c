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
 * <code>output reg signed [7:0] a, b;</code>
 */
public final class PortDeclaration extends AstNode {

	private final PortDirection direction;
	private final NetType netType;
	private final boolean netSigned;
	private final boolean reg;
	private final boolean variable;
	private final Range range;
	private final AstList<Identifier> portNames;

	public PortDeclaration(
			PortDirection direction,
			NetType netType,
			boolean netSigned,
			boolean reg,
			boolean variable,
			Range range,
			AstList<Identifier> portNames) {
		this.direction = direction;
		this.netType = netType;
		this.netSigned = netSigned;
		this.reg = reg;
		this.variable = variable;
		this.range = range;
		this.portNames = portNames;
	}

	public PortDirection getDirection() {
		return direction;
	}

	public NetType getNetType() {
		return netType;
	}

	public boolean isNetSigned() {
		return netSigned;
	}

	public boolean isReg() {
		return reg;
	}

	public boolean isVariable() {
		return variable;
	}

	public Range getRange() {
		return range;
	}

	public AstList<Identifier> getPortNames() {
		return portNames;
	}
}
