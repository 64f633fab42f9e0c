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
 * <code>(in =&gt; out) = delay;</code>
 */
public final class SimpleParallelPath extends PathDescription {

	private final Identifier inputTerminal;
	private final Identifier outputTerminal;

	public SimpleParallelPath(Identifier inputTerminal, Operator polarity, Identifier outputTerminal, AstList<Expression> delayValue) {
		super(polarity, delayValue);
		this.inputTerminal = inputTerminal;
		this.outputTerminal = outputTerminal;
	}

	public Identifier getInputTerminal() {
		return inputTerminal;
	}

	public Identifier getOutputTerminal() {
		return outputTerminal;
	}

	@Override
	public boolean isEdgeSensitive() {
		return false;
	}

	@Override
	public boolean isFull() {
		return false;
	}
}
