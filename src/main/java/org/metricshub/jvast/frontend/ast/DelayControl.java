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
 * <code>#value</code> or <code>#(mintypmax)</code> delay control.
 */
public final class DelayControl extends AstNode {

	/**
	 * Discriminant of delay controls.
	 */
	public enum Type {
		VALUE,
		MINTYPMAX
	}

	private final Type type;
	private final DelayValue value;
	private final Expression mintypmax;

	private DelayControl(Type type, DelayValue value, Expression mintypmax) {
		this.type = type;
		this.value = value;
		this.mintypmax = mintypmax;
	}

	public static DelayControl ofValue(DelayValue value) {
		return new DelayControl(Type.VALUE, value, null);
	}

	public static DelayControl ofMintypmax(Expression mintypmax) {
		return new DelayControl(Type.MINTYPMAX, null, mintypmax);
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the delay value, only for {@link Type#VALUE}
	 */
	public DelayValue getValue() {
		return value;
	}

	/**
	 * @return the delay expression, only for {@link Type#MINTYPMAX}
	 */
	public Expression getMintypmax() {
		return mintypmax;
	}
}
