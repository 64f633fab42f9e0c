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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.metricshub.jvast.util.AstLogger;
import org.metricshub.jvast.util.AstSettings;
import org.slf4j.Logger;

/**
 * Allocation ledger for everything built while parsing one compilation unit.
 * <p>
 * Every block granted by {@link #allocate(Supplier)} is recorded in
 * insertion order, so that the whole tree can be let go in a single
 * {@link #releaseAll()} call. After a release the arena is back to its
 * initial, empty state and can be used again; each release starts a new
 * generation.
 * <p>
 * An arena is not thread-safe. One builder thread owns it for the lifetime
 * of one compilation unit.
 */
public class AstArena {

	private static final Logger LOG = AstLogger.getLogger(AstArena.class);

	private final AstSettings settings;
	private final List<Object> ledger = new ArrayList<Object>();
	private int generation;

	/**
	 * Creates an arena with default settings.
	 */
	public AstArena() {
		this(new AstSettings());
	}

	/**
	 * @param settings limits and tracing options of this arena
	 */
	public AstArena(AstSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("settings must not be null");
		}
		this.settings = settings;
	}

	/**
	 * Constructs a new block and records it in the ledger.
	 * <p>
	 * If the block is an {@link ArenaBlock}, it is attached to this arena with
	 * its ledger serial.
	 *
	 * @param constructor creates the block; must not return <code>null</code>
	 * @param <T> type of the block
	 * @return the new block, already recorded
	 * @throws AstAllocationException when the configured limit is reached or
	 *         memory is exhausted while constructing the block
	 */
	public <T> T allocate(Supplier<T> constructor) {
		int maxBlocks = settings.getMaxBlocks();
		if (maxBlocks > 0 && ledger.size() >= maxBlocks) {
			LOG.error("Arena exhausted: {} blocks already allocated (limit {})", ledger.size(), maxBlocks);
			throw new AstAllocationException("Arena limit of " + maxBlocks + " blocks reached");
		}

		T block;
		try {
			block = constructor.get();
		} catch (OutOfMemoryError e) {
			LOG.error("Out of memory after {} blocks in generation {}", ledger.size(), generation);
			throw new AstAllocationException("Out of memory while allocating block #" + ledger.size(), e);
		}
		if (block == null) {
			throw new IllegalStateException("Block constructor returned null");
		}

		if (ledger.isEmpty()) {
			LOG.debug("Starting arena generation {}", generation);
		}
		int serial = ledger.size();
		if (block instanceof ArenaBlock) {
			((ArenaBlock) block).attach(this, serial);
		}
		ledger.add(block);
		if (settings.isTraceAllocations()) {
			LOG.trace("Allocated #{}: {}", serial, block);
		}
		return block;
	}

	/**
	 * Lets go of every block recorded so far and resets the ledger.
	 * <p>
	 * Does nothing if nothing was allocated. Blocks returned before this call
	 * are detached and must not be used as part of a live tree anymore.
	 */
	public void releaseAll() {
		if (ledger.isEmpty()) {
			return;
		}
		int count = ledger.size();
		for (Object block : ledger) {
			if (block instanceof ArenaBlock) {
				((ArenaBlock) block).detach();
			}
		}
		ledger.clear();
		LOG.debug("Released {} blocks of arena generation {}", count, generation);
		generation++;
	}

	/**
	 * Resolves a ledger serial back to its block.
	 *
	 * @param serial ledger serial, as returned by {@link ArenaBlock#getSerial()}
	 * @return the block, or <code>null</code> if the serial is not part of the
	 *         current ledger
	 */
	public Object lookup(int serial) {
		if (serial < 0 || serial >= ledger.size()) {
			return null;
		}
		return ledger.get(serial);
	}

	/**
	 * @param block any object
	 * @return whether the given block is recorded in the current ledger
	 */
	public boolean owns(Object block) {
		if (block instanceof ArenaBlock) {
			ArenaBlock arenaBlock = (ArenaBlock) block;
			return arenaBlock.getArena() == this && lookup(arenaBlock.getSerial()) == block;
		}
		for (Object recorded : ledger) {
			if (recorded == block) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the number of blocks in the current ledger
	 */
	public int size() {
		return ledger.size();
	}

	/**
	 * @return whether nothing was allocated since creation or the last release
	 */
	public boolean isEmpty() {
		return ledger.isEmpty();
	}

	/**
	 * @return the number of releases that emptied this arena so far
	 */
	public int generation() {
		return generation;
	}

	public AstSettings getSettings() {
		return settings;
	}
}
