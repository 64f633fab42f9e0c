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
 * A single delay value: a number, a parameter or specparam name, or a
 * <code>min:typ:max</code> expression.
 */
public final class DelayValue extends AstNode {

	/**
	 * Discriminant of delay values; each accepts one kind of value node.
	 */
	public enum Type {
		PARAMETER(Identifier.class),
		SPECPARAM(Identifier.class),
		NUMBER(NumberLiteral.class),
		MINTYPMAX(MintypmaxExpression.class);

		private final Class<? extends AstNode> valueClass;

		Type(Class<? extends AstNode> valueClass) {
			this.valueClass = valueClass;
		}

		public boolean accepts(AstNode value) {
			return valueClass.isInstance(value);
		}

		public Class<? extends AstNode> getValueClass() {
			return valueClass;
		}
	}

	private final Type type;
	private final AstNode value;

	public DelayValue(Type type, AstNode value) {
		this.type = type;
		this.value = value;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the value, whose class is {@link Type#getValueClass()}
	 */
	public AstNode getValue() {
		return value;
	}

	/**
	 * @param expected the class {@link #getType()} accepts
	 * @param <T> the value class
	 * @return the value, cast to <code>expected</code>
	 */
	public <T extends AstNode> T getValue(Class<T> expected) {
		AstContractError.check(type.getValueClass() == expected, type + " delay does not hold a " + expected.getSimpleName());
		return expected.cast(value);
	}
}
