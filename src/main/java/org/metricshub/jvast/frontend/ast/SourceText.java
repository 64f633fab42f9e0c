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
 * Root of the tree of one compilation unit: the module and primitive
 * declarations in source order.
 */
public final class SourceText extends AstNode {

	private final AstList<ModuleDeclaration> modules;
	private final AstList<UdpDeclaration> primitives;

	public SourceText(AstList<ModuleDeclaration> modules, AstList<UdpDeclaration> primitives) {
		this.modules = modules;
		this.primitives = primitives;
	}

	public AstList<ModuleDeclaration> getModules() {
		return modules;
	}

	public AstList<UdpDeclaration> getPrimitives() {
		return primitives;
	}

	/**
	 * @param name module name
	 * @return the first module declared with that name, or <code>null</code>
	 */
	public ModuleDeclaration findModule(String name) {
		for (ModuleDeclaration module : modules) {
			if (module != null && module.getIdentifier() != null && name.equals(module.getIdentifier().getName())) {
				return module;
			}
		}
		return null;
	}
}
