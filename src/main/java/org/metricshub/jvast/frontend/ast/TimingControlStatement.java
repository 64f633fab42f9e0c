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
 * A statement preceded by a delay or event control, or the intra-assignment
 * timing control of a procedural assignment (then without statement).
 */
public abstract class TimingControlStatement extends AstNode {

	/**
	 * Discriminant of timing controls.
	 */
	public enum Type {
		DELAY_CONTROL,
		EVENT_CONTROL,
		EVENT_CONTROL_REPEAT
	}

	private final Type type;
	private final Statement statement;

	protected TimingControlStatement(Type type, Statement statement) {
		this.type = type;
		this.statement = statement;
	}

	public final Type getType() {
		return type;
	}

	/**
	 * @return the controlled statement, or <code>null</code>
	 */
	public final Statement getStatement() {
		return statement;
	}

	@Override
	public String toString() {
		return "TimingControl(" + type + ")";
	}
}
