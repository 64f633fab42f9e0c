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

import org.metricshub.jvast.util.AstList;

/**
 * Switch instances sharing the same {@link SwitchGate} kind and delay.
 * Instances are {@link MosSwitchInstance}, {@link CmosSwitchInstance} or
 * {@link PassSwitchInstance} depending on the switch type.
 */
public final class Switches extends AstNode {

	private final SwitchGate type;
	private final AstList<AstNode> switches;

	public Switches(SwitchGate type, AstList<AstNode> switches) {
		this.type = type;
		this.switches = switches;
	}

	public SwitchGate getType() {
		return type;
	}

	public AstList<AstNode> getSwitches() {
		return switches;
	}
}
