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
 * <code>output [reg] q [= initial];</code>
 */
public final class UdpOutputPort extends UdpPort {

	private final Identifier identifier;
	private final boolean reg;
	private final Expression defaultValue;

	public UdpOutputPort(PortDirection direction, Identifier identifier, AttributeList attributes, boolean reg, Expression defaultValue) {
		super(direction, attributes);
		this.identifier = identifier;
		this.reg = reg;
		this.defaultValue = defaultValue;
	}

	public Identifier getIdentifier() {
		return identifier;
	}

	public boolean isReg() {
		return reg;
	}

	public Expression getDefaultValue() {
		return defaultValue;
	}
}
