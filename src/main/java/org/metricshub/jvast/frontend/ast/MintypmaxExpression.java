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
 * A <code>min:typ:max</code> expression. When only a typical value is
 * written, {@link #getMin()} and {@link #getMax()} are <code>null</code>.
 */
public final class MintypmaxExpression extends Expression {

	private final Expression min;
	private final Expression typ;
	private final Expression max;

	public MintypmaxExpression(Expression min, Expression typ, Expression max) {
		super(false, null);
		this.min = min;
		this.typ = typ;
		this.max = max;
	}

	@Override
	public Type getType() {
		return Type.MINTYPMAX_EXPRESSION;
	}

	public Expression getMin() {
		return min;
	}

	public Expression getTyp() {
		return typ;
	}

	public Expression getMax() {
		return max;
	}

	/**
	 * @return whether only the typical value was given
	 */
	public boolean isTypicalOnly() {
		return min == null && max == null;
	}
}
