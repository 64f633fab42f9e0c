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
 * A looping statement. The variants carry only the control parts their
 * loop kind has.
 */
public abstract class LoopStatement extends AstNode {

	/**
	 * Discriminant of loops.
	 */
	public enum Type {
		FOREVER,
		REPEAT,
		WHILE,
		FOR
	}

	private final Type type;
	private final Statement body;

	protected LoopStatement(Type type, Statement body) {
		this.type = type;
		this.body = body;
	}

	public final Type getType() {
		return type;
	}

	public final Statement getBody() {
		return body;
	}

	@Override
	public String toString() {
		return "Loop(" + type + ")";
	}
}
