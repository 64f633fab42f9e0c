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
 * <code>begin ... end</code> or <code>fork ... join</code>, optionally named,
 * with its local declarations.
 */
public final class StatementBlock extends AstNode {

	/**
	 * Discriminant of blocks.
	 */
	public enum Type {
		SEQUENTIAL,
		PARALLEL,
		FUNCTION_SEQUENTIAL
	}

	private final Type type;
	private final Identifier blockIdentifier;
	private final AstList<AstNode> declarations;
	private final AstList<Statement> statements;

	public StatementBlock(Type type, Identifier blockIdentifier, AstList<AstNode> declarations, AstList<Statement> statements) {
		this.type = type;
		this.blockIdentifier = blockIdentifier;
		this.declarations = declarations;
		this.statements = statements;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the block name, or <code>null</code> for an anonymous block
	 */
	public Identifier getBlockIdentifier() {
		return blockIdentifier;
	}

	public AstList<AstNode> getDeclarations() {
		return declarations;
	}

	public AstList<Statement> getStatements() {
		return statements;
	}
}
