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
 * <code>case</code>, <code>casex</code> or <code>casez</code> statement.
 * <p>
 * The first arm flagged as default is cached at construction time. Later
 * default arms stay in {@link #getCases()} but are not the default item.
 */
public final class CaseStatement extends AstNode {

	/**
	 * Discriminant of case statements.
	 */
	public enum Type {
		CASE,
		CASEX,
		CASEZ
	}

	private final Expression expression;
	private final AstList<CaseItem> cases;
	private final Type type;
	private final CaseItem defaultItem;
	private boolean function;

	public CaseStatement(Expression expression, AstList<CaseItem> cases, Type type, CaseItem defaultItem) {
		this.expression = expression;
		this.cases = cases;
		this.type = type;
		this.defaultItem = defaultItem;
	}

	public Expression getExpression() {
		return expression;
	}

	public AstList<CaseItem> getCases() {
		return cases;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the first default arm, or <code>null</code> if there is none
	 */
	public CaseItem getDefaultItem() {
		return defaultItem;
	}

	/**
	 * @return whether the statement appears in a function body
	 */
	public boolean isFunction() {
		return function;
	}

	public void setFunction(boolean function) {
		this.function = function;
	}
}
