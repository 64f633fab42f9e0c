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
 * <code>{a, b, c}</code>, or <code>{n{a, b}}</code> when a repeat count is present.
 * <p>
 * Items are kept in source order. They are expressions for expression
 * concatenations, and lvalues or identifiers for net and variable ones.
 */
public final class Concatenation extends AstNode {

	/**
	 * What is being concatenated.
	 */
	public enum Type {
		EXPRESSION,
		CONSTANT_EXPRESSION,
		NET,
		VARIABLE,
		MODULE_PATH
	}

	private final Type type;
	private Expression repeat;
	private final AstList<AstNode> items;

	public Concatenation(Type type, Expression repeat, AstList<AstNode> items) {
		this.type = type;
		this.repeat = repeat;
		this.items = items;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the replication count, or <code>null</code>
	 */
	public Expression getRepeat() {
		return repeat;
	}

	/**
	 * Sets the replication count while the concatenation is being built.
	 *
	 * @param repeat the replication count
	 */
	public void setRepeat(Expression repeat) {
		this.repeat = repeat;
	}

	public AstList<AstNode> getItems() {
		return items;
	}

	@Override
	public String toString() {
		return "Concatenation(" + type + ")";
	}
}
