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
 * <code>(a, b *&gt; x, y) = delay;</code>
 */
public final class SimpleFullPath extends PathDescription {

	private final AstList<Identifier> inputTerminals;
	private final AstList<Identifier> outputTerminals;

	public SimpleFullPath(AstList<Identifier> inputTerminals, Operator polarity, AstList<Identifier> outputTerminals, AstList<Expression> delayValue) {
		super(polarity, delayValue);
		this.inputTerminals = inputTerminals;
		this.outputTerminals = outputTerminals;
	}

	public AstList<Identifier> getInputTerminals() {
		return inputTerminals;
	}

	public AstList<Identifier> getOutputTerminals() {
		return outputTerminals;
	}

	@Override
	public boolean isEdgeSensitive() {
		return false;
	}

	@Override
	public boolean isFull() {
		return true;
	}
}
