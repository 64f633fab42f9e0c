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
 * An <code>if / else if / else</code> chain.
 * <p>
 * Branches are listed by priority: the first one whose condition holds is
 * the one taken. The final <code>else</code> body is <code>null</code> when
 * absent.
 */
public final class IfElse extends AstNode {

	private final AstList<ConditionalStatement> conditionalStatements;
	private final Statement elseStatement;

	public IfElse(AstList<ConditionalStatement> conditionalStatements, Statement elseStatement) {
		this.conditionalStatements = conditionalStatements;
		this.elseStatement = elseStatement;
	}

	public AstList<ConditionalStatement> getConditionalStatements() {
		return conditionalStatements;
	}

	public Statement getElseStatement() {
		return elseStatement;
	}
}
