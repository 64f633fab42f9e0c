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
 * <code>primitive name (ports); ... table ... endtable endprimitive</code>
 */
public final class UdpDeclaration extends AstNode {

	private final AttributeList attributes;
	private final Identifier identifier;
	private final AstList<UdpPort> ports;
	private final UdpBody.Type bodyType;
	private final UdpInitialStatement initial;
	private final AstList<UdpEntry> bodyEntries;

	public UdpDeclaration(AttributeList attributes, Identifier identifier, AstList<UdpPort> ports, UdpBody body) {
		this.attributes = attributes;
		this.identifier = identifier;
		this.ports = ports;
		this.bodyType = body.getType();
		this.initial = body.getInitial();
		this.bodyEntries = body.getEntries();
	}

	public AttributeList getAttributes() {
		return attributes;
	}

	public Identifier getIdentifier() {
		return identifier;
	}

	public AstList<UdpPort> getPorts() {
		return ports;
	}

	public UdpBody.Type getBodyType() {
		return bodyType;
	}

	public UdpInitialStatement getInitial() {
		return initial;
	}

	public AstList<UdpEntry> getBodyEntries() {
		return bodyEntries;
	}
}
