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
 * <code>parameter [signed] [range] a = 1, b = 2;</code> or the
 * <code>localparam</code> / typed (<code>integer</code>, <code>real</code>...)
 * forms. Only generic parameters have a range and signedness.
 */
public final class ParameterDeclarations extends AstNode {

	/**
	 * Discriminant of parameter declarations.
	 */
	public enum Type {
		GENERIC,
		INTEGER,
		REAL,
		REALTIME,
		TIME
	}

	private final AstList<SingleAssignment> assignments;
	private final boolean signedValues;
	private final boolean local;
	private final Range range;
	private final Type type;

	public ParameterDeclarations(AstList<SingleAssignment> assignments, boolean signedValues, boolean local, Range range, Type type) {
		this.assignments = assignments;
		this.type = type;
		this.local = local;
		if (type == Type.GENERIC) {
			this.signedValues = signedValues;
			this.range = range;
		} else {
			this.signedValues = false;
			this.range = null;
		}
	}

	public AstList<SingleAssignment> getAssignments() {
		return assignments;
	}

	public boolean isSignedValues() {
		return signedValues;
	}

	/**
	 * @return whether this is a <code>localparam</code> declaration
	 */
	public boolean isLocal() {
		return local;
	}

	public Range getRange() {
		return range;
	}

	public Type getType() {
		return type;
	}
}
