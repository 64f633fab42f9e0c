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
 * <code>module name #(params) (ports); items endmodule</code>
 */
public final class ModuleDeclaration extends AstNode {

	private final AttributeList attributes;
	private final Identifier identifier;
	private final AstList<ParameterDeclarations> parameters;
	private final AstList<PortDeclaration> ports;
	private final AstList<Statement> items;

	public ModuleDeclaration(
			AttributeList attributes,
			Identifier identifier,
			AstList<ParameterDeclarations> parameters,
			AstList<PortDeclaration> ports,
			AstList<Statement> items) {
		this.attributes = attributes;
		this.identifier = identifier;
		this.parameters = parameters;
		this.ports = ports;
		this.items = items;
	}

	public AttributeList getAttributes() {
		return attributes;
	}

	public Identifier getIdentifier() {
		return identifier;
	}

	public AstList<ParameterDeclarations> getParameters() {
		return parameters;
	}

	public AstList<PortDeclaration> getPorts() {
		return ports;
	}

	/**
	 * @return the module items, each wrapped in a {@link Statement}
	 */
	public AstList<Statement> getItems() {
		return items;
	}
}
