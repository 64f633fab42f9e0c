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
 * Signals that a node constructor was called in a way the grammar never
 * allows: a discriminant outside of the subset accepted by the constructor,
 * a "no edge" event, a construct that does not match its tag...
 * <p>
 * This is a programming error in the caller (the grammar actions of the
 * parser), not a diagnostic about the parsed source. It is never caught by
 * this library.
 */
public class AstContractError extends Error {

	private static final long serialVersionUID = 1L;

	/**
	 * @param message description of the violated contract
	 */
	public AstContractError(String message) {
		super(message);
	}

	/**
	 * Throws an {@link AstContractError} unless <code>condition</code> holds.
	 *
	 * @param condition the contract
	 * @param message description of the violated contract
	 */
	public static void check(boolean condition, String message) {
		if (!condition) {
			throw new AstContractError(message);
		}
	}
}
