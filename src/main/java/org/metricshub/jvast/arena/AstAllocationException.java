package org.metricshub.jvast.arena;

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
 * Thrown when an {@link AstArena} cannot grant a new block, either because the
 * configured block limit is reached or because the JVM ran out of memory
 * while the block was being constructed.
 * <p>
 * Unlike contract violations, this is meant to be handled by the driver that
 * owns the arena, which typically releases it and reports the failure.
 */
public class AstAllocationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param message description of the exhausted resource
	 */
	public AstAllocationException(String message) {
		super(message);
	}

	/**
	 * @param message description of the exhausted resource
	 * @param cause underlying cause of the failure
	 */
	public AstAllocationException(String message, Throwable cause) {
		super(message, cause);
	}
}
