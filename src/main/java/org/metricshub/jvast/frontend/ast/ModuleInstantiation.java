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
 * <code>adder #(8) a0 (...), a1 (...);</code>: instances of one module sharing
 * the same parameter overrides.
 */
public final class ModuleInstantiation extends AstNode {

	private final Identifier moduleIdentifier;
	private final AstList<PortConnection> moduleParameters;
	private final AstList<ModuleInstance> moduleInstances;

	public ModuleInstantiation(Identifier moduleIdentifier, AstList<PortConnection> moduleParameters, AstList<ModuleInstance> moduleInstances) {
		this.moduleIdentifier = moduleIdentifier;
		this.moduleParameters = moduleParameters;
		this.moduleInstances = moduleInstances;
	}

	public Identifier getModuleIdentifier() {
		return moduleIdentifier;
	}

	/**
	 * @return the parameter value assignments, or <code>null</code> when none is given
	 */
	public AstList<PortConnection> getModuleParameters() {
		return moduleParameters;
	}

	public AstList<ModuleInstance> getModuleInstances() {
		return moduleInstances;
	}
}
