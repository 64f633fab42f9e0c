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
 * Edge symbols of sequential UDP tables.
 */
public enum EdgeSymbol implements UdpInputSymbol {
	/** <code>(01)</code> */
	RISING('r'),
	/** <code>(10)</code> */
	FALLING('f'),
	/** <code>(01)</code>, <code>(0x)</code> or <code>(x1)</code> */
	POSITIVE('p'),
	/** <code>(10)</code>, <code>(1x)</code> or <code>(x0)</code> */
	NEGATIVE('n'),
	/** <code>(??)</code> */
	ANY('*');

	private final char symbol;

	EdgeSymbol(char symbol) {
		this.symbol = symbol;
	}

	@Override
	public char symbol() {
		return symbol;
	}
}
