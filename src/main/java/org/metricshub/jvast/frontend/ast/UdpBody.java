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
 * The table (and the initial statement for sequential primitives) of a UDP,
 * before it is folded into its {@link UdpDeclaration}.
 */
public final class UdpBody extends AstNode {

	/**
	 * Discriminant of UDP bodies.
	 */
	public enum Type {
		SEQUENTIAL,
		COMBINATORIAL
	}

	private final Type type;
	private final UdpInitialStatement initial;
	private final AstList<UdpEntry> entries;

	public UdpBody(Type type, UdpInitialStatement initial, AstList<UdpEntry> entries) {
		this.type = type;
		this.initial = initial;
		this.entries = entries;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the initial statement, sequential bodies only, may be <code>null</code>
	 */
	public UdpInitialStatement getInitial() {
		return initial;
	}

	public AstList<UdpEntry> getEntries() {
		return entries;
	}
}
