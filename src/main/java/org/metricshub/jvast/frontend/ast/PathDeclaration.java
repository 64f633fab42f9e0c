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
 * A path declaration of a specify block, optionally guarded by a state
 * (<code>if (cond)</code>) or by <code>ifnone</code>.
 */
public final class PathDeclaration extends AstNode {

	/**
	 * Discriminant of path declarations.
	 */
	public enum Type {
		SIMPLE_PARALLEL_PATH(false, false, Guard.NONE),
		SIMPLE_FULL_PATH(false, true, Guard.NONE),
		EDGE_SENSITIVE_PARALLEL_PATH(true, false, Guard.NONE),
		EDGE_SENSITIVE_FULL_PATH(true, true, Guard.NONE),
		STATE_DEPENDENT_PARALLEL_PATH(false, false, Guard.STATE),
		STATE_DEPENDENT_FULL_PATH(false, true, Guard.STATE),
		STATE_DEPENDENT_EDGE_PARALLEL_PATH(true, false, Guard.STATE),
		STATE_DEPENDENT_EDGE_FULL_PATH(true, true, Guard.STATE),
		IF_NONE_SIMPLE_PARALLEL_PATH(false, false, Guard.IF_NONE),
		IF_NONE_SIMPLE_FULL_PATH(false, true, Guard.IF_NONE);

		private final boolean edgeSensitive;
		private final boolean full;
		private final Guard guard;

		Type(boolean edgeSensitive, boolean full, Guard guard) {
			this.edgeSensitive = edgeSensitive;
			this.full = full;
			this.guard = guard;
		}

		/**
		 * @param description a path description
		 * @return whether the description has the terminal shape this type declares
		 */
		public boolean accepts(PathDescription description) {
			return description != null && description.isEdgeSensitive() == edgeSensitive && description.isFull() == full;
		}

		public boolean isStateDependent() {
			return guard == Guard.STATE;
		}

		public boolean isIfNone() {
			return guard == Guard.IF_NONE;
		}
	}

	private enum Guard {
		NONE,
		STATE,
		IF_NONE
	}

	private final Type type;
	private final Expression stateExpression;
	private final PathDescription description;

	public PathDeclaration(Type type, Expression stateExpression, PathDescription description) {
		this.type = type;
		this.stateExpression = stateExpression;
		this.description = description;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the <code>if</code> condition of a state dependent path, <code>null</code> otherwise
	 */
	public Expression getStateExpression() {
		return stateExpression;
	}

	public PathDescription getDescription() {
		return description;
	}

	@Override
	public String toString() {
		return "PathDeclaration(" + type + ")";
	}
}
