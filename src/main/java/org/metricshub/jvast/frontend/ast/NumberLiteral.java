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
 * A numeric literal, kept as written: base, representation, optional size and
 * the digits themselves. No value is computed here.
 */
public final class NumberLiteral extends AstNode {

	/**
	 * Radix of a based literal.
	 */
	public enum Base {
		BINARY,
		OCTAL,
		DECIMAL,
		HEX
	}

	/**
	 * How the literal was written.
	 */
	public enum Representation {
		/** sized or unsized based literal such as <code>4'b10x1</code> */
		BITS,
		/** plain unsigned integer */
		INTEGER,
		/** real literal, with a fraction or an exponent */
		FLOAT
	}

	private final Base base;
	private final Representation representation;
	private final int width;
	private final boolean signed;
	private final String digits;

	/**
	 * @param base radix of the digits
	 * @param representation the literal form
	 * @param width declared size in bits, or <code>-1</code> when unsized
	 * @param signed whether the <code>s</code> modifier is present
	 * @param digits the digits as written, without size or base prefix
	 */
	public NumberLiteral(Base base, Representation representation, int width, boolean signed, String digits) {
		this.base = base;
		this.representation = representation;
		this.width = width;
		this.signed = signed;
		this.digits = digits;
	}

	public Base getBase() {
		return base;
	}

	public Representation getRepresentation() {
		return representation;
	}

	/**
	 * @return the declared width in bits, <code>-1</code> when unsized
	 */
	public int getWidth() {
		return width;
	}

	public boolean isSigned() {
		return signed;
	}

	public String getDigits() {
		return digits;
	}

	@Override
	public String toString() {
		return "NumberLiteral(" + (width >= 0 ? width : "") + base + ":" + digits + ")";
	}
}
