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
 * The attributes attached to a construct, in source order.
 */
public final class AttributeList extends AstNode {

	private final AstList<Attribute> attributes;

	public AttributeList(AstList<Attribute> attributes) {
		this.attributes = attributes;
	}

	public AstList<Attribute> getAttributes() {
		return attributes;
	}

	/**
	 * @param name attribute name
	 * @return the first attribute with that name, or <code>null</code>
	 */
	public Attribute find(String name) {
		for (Attribute attribute : attributes) {
			if (attribute != null && attribute.getName() != null && attribute.getName().getName().equals(name)) {
				return attribute;
			}
		}
		return null;
	}
}
