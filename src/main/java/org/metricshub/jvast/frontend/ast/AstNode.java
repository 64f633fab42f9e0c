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

import org.metricshub.jvast.arena.ArenaBlock;
import org.metricshub.jvast.arena.AstArena;

/**
 * Base class of every node of the Verilog syntax tree.
 * <p>
 * A node owns the children stored in its own fields. The link to its parent
 * is not an ownership link: it is kept as the parent's ledger serial and
 * resolved through the arena on demand, so it stops resolving as soon as the
 * arena is released. It is meant for diagnostics and navigation only.
 * <p>
 * The concrete class of a node, and the tag it exposes, determine which
 * fields it has. There is no uniform child array.
 */
public abstract class AstNode extends ArenaBlock {

	private int parentSerial = -1;

	protected AstNode() {}

	/**
	 * @return the node that adopted this one, or <code>null</code> if there is
	 *         none, or if the arena was released
	 */
	public final AstNode getParent() {
		AstArena arena = getArena();
		if (arena == null || parentSerial < 0) {
			return null;
		}
		Object parent = arena.lookup(parentSerial);
		return parent instanceof AstNode ? (AstNode) parent : null;
	}

	/**
	 * Records <code>parent</code> as the (non-owning) parent of this node.
	 * Only nodes recorded by the same arena can be linked.
	 *
	 * @param parent the adopting node
	 */
	public final void setParent(AstNode parent) {
		if (parent == null || parent.getArena() == null || parent.getArena() != getArena()) {
			parentSerial = -1;
		} else {
			parentSerial = parent.getSerial();
		}
	}

	@Override
	protected void onDetach() {
		parentSerial = -1;
	}

	@Override
	public String toString() {
		return getClass().getName().replaceFirst(".*[$.]", "");
	}
}
