package org.metricshub.jvast.arena;

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

/**
 * Something granted by an {@link AstArena}.
 * <p>
 * A block knows the arena that recorded it and its serial number in the
 * arena ledger. Once the arena is released, the block is detached: it keeps
 * its own fields but can no longer resolve anything through the arena.
 * A detached block cannot be recorded again. Blocks created outside of any
 * arena are simply never attached.
 */
public abstract class ArenaBlock {

	private AstArena arena;
	private int serial = -1;
	private boolean released;

	final void attach(AstArena owner, int ledgerSerial) {
		if (arena != null) {
			throw new IllegalStateException(this + " is already recorded by an arena");
		}
		if (released) {
			throw new IllegalStateException(this + " was released and cannot be recorded again");
		}
		arena = owner;
		serial = ledgerSerial;
	}

	final void detach() {
		arena = null;
		released = true;
		onDetach();
	}

	/**
	 * Called once the recording arena has released this block. Subclasses
	 * drop whatever they resolve through the arena.
	 */
	protected void onDetach() {}

	/**
	 * @return the arena that recorded this block, or <code>null</code> when the
	 *         block was never recorded or has been released
	 */
	public final AstArena getArena() {
		return arena;
	}

	/**
	 * @return the ledger serial of this block, or <code>-1</code> when the block
	 *         was never recorded
	 */
	public final int getSerial() {
		return serial;
	}

	/**
	 * @return whether the arena that recorded this block has released it
	 */
	public final boolean isReleased() {
		return released;
	}
}
