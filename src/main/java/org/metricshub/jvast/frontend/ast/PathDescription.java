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
 * Terminals, polarity and delay of a specify path. Subclasses add the
 * parallel (<code>=&gt;</code>) or full (<code>*&gt;</code>) terminal shape
 * and, for edge sensitive paths, the edge and data source.
 */
public abstract class PathDescription extends AstNode {

	private final Operator polarity;
	private final AstList<Expression> delayValue;

	protected PathDescription(Operator polarity, AstList<Expression> delayValue) {
		this.polarity = polarity;
		this.delayValue = delayValue;
	}

	/**
	 * @return {@link Operator#PLUS}, {@link Operator#MINUS} or {@link Operator#NONE}
	 */
	public final Operator getPolarity() {
		return polarity;
	}

	/**
	 * @return the list of path delay expressions
	 */
	public final AstList<Expression> getDelayValue() {
		return delayValue;
	}

	/**
	 * @return whether the path is edge sensitive
	 */
	public abstract boolean isEdgeSensitive();

	/**
	 * @return whether the path connects every input to every output
	 */
	public abstract boolean isFull();
}
