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
 * <code>r 0 : ? : 0;</code>
 * <p>
 * A row prefixed by levels only holds {@link LevelSymbol} inputs; a row
 * prefixed by edges holds levels and edge symbols.
 */
public final class UdpSequentialEntry extends UdpEntry {

	/**
	 * What the input columns of the row contain.
	 */
	public enum Prefix {
		LEVELS,
		EDGES
	}

	private final Prefix prefix;
	private final AstList<UdpInputSymbol> inputs;
	private final LevelSymbol currentState;
	private final UdpNextState output;

	public UdpSequentialEntry(Prefix prefix, AstList<UdpInputSymbol> inputs, LevelSymbol currentState, UdpNextState output) {
		this.prefix = prefix;
		this.inputs = inputs;
		this.currentState = currentState;
		this.output = output;
	}

	public Prefix getPrefix() {
		return prefix;
	}

	/**
	 * @return the input columns, levels or edges depending on {@link #getPrefix()}
	 */
	public AstList<UdpInputSymbol> getInputs() {
		return inputs;
	}

	public LevelSymbol getCurrentState() {
		return currentState;
	}

	public UdpNextState getOutput() {
		return output;
	}

	@Override
	public boolean isSequential() {
		return true;
	}
}
