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
 * A primitive gate or switch instantiation module item. The tag selects
 * which collection of instances it wraps.
 */
public final class GateInstantiation extends AstNode {

	/**
	 * Discriminant of gate instantiations, with the collection class each wraps.
	 */
	public enum Type {
		CMOS(Switches.class),
		MOS(Switches.class),
		PASS(Switches.class),
		ENABLE(EnableGateInstances.class),
		N_OUTPUT(NOutputGateInstances.class),
		N_INPUT(NInputGateInstances.class),
		PASS_ENABLE(PassEnableSwitches.class),
		PULL_UP(PullGateInstances.class),
		PULL_DOWN(PullGateInstances.class);

		private final Class<? extends AstNode> gatesClass;

		Type(Class<? extends AstNode> gatesClass) {
			this.gatesClass = gatesClass;
		}

		public boolean accepts(AstNode gates) {
			return gatesClass.isInstance(gates);
		}

		public Class<? extends AstNode> getGatesClass() {
			return gatesClass;
		}
	}

	private final Type type;
	private final AstNode gates;

	public GateInstantiation(Type type, AstNode gates) {
		this.type = type;
		this.gates = gates;
	}

	public Type getType() {
		return type;
	}

	public AstNode getGates() {
		return gates;
	}

	/**
	 * @param expected the collection class of the tag
	 * @param <T> the collection class
	 * @return the wrapped instances cast to <code>expected</code>
	 */
	public <T extends AstNode> T getGates(Class<T> expected) {
		AstContractError.check(expected.isInstance(gates), type + " gates are not " + expected.getSimpleName());
		return expected.cast(gates);
	}

	@Override
	public String toString() {
		return "GateInstantiation(" + type + ")";
	}
}
