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
 * Pull direction and strengths shared by the instances of a
 * <code>pullup</code> or <code>pulldown</code> gate instantiation.
 */
public final class PrimitivePullStrength extends AstNode {

	private final PullDirection direction;
	private final PrimitiveStrength strength1;
	private final PrimitiveStrength strength0;

	public PrimitivePullStrength(PullDirection direction, PrimitiveStrength strength1, PrimitiveStrength strength0) {
		this.direction = direction;
		this.strength1 = strength1;
		this.strength0 = strength0;
	}

	public PullDirection getDirection() {
		return direction;
	}

	public PrimitiveStrength getStrength1() {
		return strength1;
	}

	public PrimitiveStrength getStrength0() {
		return strength0;
	}
}
