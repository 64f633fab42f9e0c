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

/**
 * Unary, binary and polarity operators of the expression grammar.
 */
public enum Operator {
	STAR("*"),
	PLUS("+"),
	MINUS("-"),
	ARITHMETIC_SHIFT_LEFT("<<<"),
	ARITHMETIC_SHIFT_RIGHT(">>>"),
	LOGICAL_SHIFT_LEFT("<<"),
	LOGICAL_SHIFT_RIGHT(">>"),
	DIVIDE("/"),
	POWER("**"),
	MODULO("%"),
	GREATER_EQUAL(">="),
	LESS_EQUAL("<="),
	GREATER(">"),
	LESS("<"),
	LOGICAL_NOT("!"),
	LOGICAL_AND("&&"),
	LOGICAL_OR("||"),
	CASE_EQUAL("==="),
	LOGICAL_EQUAL("=="),
	CASE_NOT_EQUAL("!=="),
	LOGICAL_NOT_EQUAL("!="),
	BITWISE_NOT("~"),
	BITWISE_AND("&"),
	BITWISE_OR("|"),
	BITWISE_XOR("^"),
	BITWISE_XNOR("~^"),
	BITWISE_NAND("~&"),
	BITWISE_NOR("~|"),
	TERNARY("?:"),
	/** no polarity, used by path declarations without a polarity operator */
	NONE("");

	private final String symbol;

	Operator(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the operator as written in Verilog source
	 */
	public String symbol() {
		return symbol;
	}
}
