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
 * Kind and delay of a switch gate instantiation. Bidirectional pass switches
 * (<code>tran</code>, <code>rtran</code>) take a two value delay, every other
 * switch a three value delay.
 */
public final class SwitchGate extends AstNode {

	/**
	 * Discriminant of switch gates.
	 */
	public enum Type {
		CMOS(false),
		RCMOS(false),
		NMOS(false),
		PMOS(false),
		RNMOS(false),
		RPMOS(false),
		TRAN(true),
		RTRAN(true);

		private final boolean delay2;

		Type(boolean delay2) {
			this.delay2 = delay2;
		}

		/**
		 * @return whether this switch takes a {@link Delay2} rather than a {@link Delay3}
		 */
		public boolean takesDelay2() {
			return delay2;
		}
	}

	private final Type type;
	private final Delay delay;

	public SwitchGate(Type type, Delay delay) {
		this.type = type;
		this.delay = delay;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the delay, a {@link Delay2} or a {@link Delay3} depending on the
	 *         type, or <code>null</code>
	 */
	public Delay getDelay() {
		return delay;
	}

	public Delay2 getDelay2() {
		AstContractError.check(type.takesDelay2(), type + " switches have a delay3");
		return (Delay2) delay;
	}

	public Delay3 getDelay3() {
		AstContractError.check(!type.takesDelay2(), type + " switches have a delay2");
		return (Delay3) delay;
	}
}
