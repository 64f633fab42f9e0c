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
 * Procedural continuous assignments: <code>assign</code>/<code>force</code>
 * take a whole assignment, <code>deassign</code>/<code>release</code> only
 * name their target.
 */
public final class HybridAssignment extends Assignment {

	/**
	 * Discriminant of procedural continuous assignments.
	 */
	public enum Kind {
		ASSIGN(true),
		DEASSIGN(false),
		FORCE_NET(true),
		FORCE_VAR(true),
		RELEASE_NET(false),
		RELEASE_VAR(false);

		private final boolean withAssignment;

		Kind(boolean withAssignment) {
			this.withAssignment = withAssignment;
		}

		/**
		 * @return whether this kind carries a full assignment rather than an lvalue alone
		 */
		public boolean isWithAssignment() {
			return withAssignment;
		}
	}

	private final Kind kind;
	private final SingleAssignment assignment;
	private final Lvalue lvalue;

	private HybridAssignment(Kind kind, SingleAssignment assignment, Lvalue lvalue) {
		this.kind = kind;
		this.assignment = assignment;
		this.lvalue = lvalue;
	}

	public static HybridAssignment ofAssignment(Kind kind, SingleAssignment assignment) {
		return new HybridAssignment(kind, assignment, null);
	}

	public static HybridAssignment ofLvalue(Kind kind, Lvalue lvalue) {
		return new HybridAssignment(kind, null, lvalue);
	}

	@Override
	public Type getType() {
		return Type.HYBRID;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the assignment, for kinds where {@link Kind#isWithAssignment()} holds
	 */
	public SingleAssignment getAssignment() {
		return assignment;
	}

	/**
	 * @return the target: the lvalue itself, or the lvalue of the assignment
	 */
	public Lvalue getLvalue() {
		return assignment != null ? assignment.getLvalue() : lvalue;
	}
}
