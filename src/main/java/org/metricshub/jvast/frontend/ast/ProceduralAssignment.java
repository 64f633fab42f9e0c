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
 * <code>lvalue = [timing] expression</code> or <code>lvalue &lt;= [timing] expression</code>.
 */
public final class ProceduralAssignment extends Assignment {

	private final boolean blocking;
	private final Lvalue lvalue;
	private final Expression expression;
	private final TimingControlStatement delayOrEvent;

	public ProceduralAssignment(boolean blocking, Lvalue lvalue, Expression expression, TimingControlStatement delayOrEvent) {
		this.blocking = blocking;
		this.lvalue = lvalue;
		this.expression = expression;
		this.delayOrEvent = delayOrEvent;
	}

	@Override
	public Type getType() {
		return blocking ? Type.BLOCKING : Type.NONBLOCKING;
	}

	public Lvalue getLvalue() {
		return lvalue;
	}

	public Expression getExpression() {
		return expression;
	}

	/**
	 * @return the intra-assignment delay or event control, or <code>null</code>
	 */
	public TimingControlStatement getDelayOrEvent() {
		return delayOrEvent;
	}
}
