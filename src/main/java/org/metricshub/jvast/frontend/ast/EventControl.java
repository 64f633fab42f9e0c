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
 * <code>@*</code> or <code>@(events)</code>.
 */
public final class EventControl extends AstNode {

	/**
	 * Discriminant of event controls.
	 */
	public enum Type {
		/** <code>@*</code>, implicit sensitivity; has no expression */
		ANY,
		/** an explicit event or event identifier */
		TRIGGERS
	}

	private final Type type;
	private final EventExpression expression;

	public EventControl(Type type, EventExpression expression) {
		this.type = type;
		this.expression = expression;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the events, <code>null</code> for {@link Type#ANY}
	 */
	public EventExpression getExpression() {
		return expression;
	}
}
