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
 * Net, variable, event and genvar declarations.
 * <p>
 * These declarations have many optional modifiers, so only the kind is set
 * at construction; the grammar actions fill in the rest as they reduce the
 * modifiers. Every reference starts <code>null</code>, every flag
 * <code>false</code> and the net type {@link NetType#NONE}. Children given
 * to the setters are adopted by the declaration.
 */
public final class TypeDeclaration extends AstNode {

	/**
	 * Discriminant of type declarations.
	 */
	public enum Type {
		NET,
		REG,
		EVENT,
		GENVAR,
		INTEGER,
		REAL,
		REALTIME,
		TIME
	}

	private final Type type;
	private AstList<Identifier> identifiers;
	private Delay3 delay;
	private DriveStrength driveStrength;
	private ChargeStrength chargeStrength;
	private Range range;
	private boolean vectored;
	private boolean scalared;
	private boolean signed;
	private NetType netType = NetType.NONE;

	public TypeDeclaration(Type type) {
		this.type = type;
	}

	public Type getType() {
		return type;
	}

	public AstList<Identifier> getIdentifiers() {
		return identifiers;
	}

	public void setIdentifiers(AstList<Identifier> identifiers) {
		this.identifiers = identifiers;
		if (identifiers != null) {
			for (Identifier identifier : identifiers) {
				adopt(identifier);
			}
		}
	}

	public Delay3 getDelay() {
		return delay;
	}

	public void setDelay(Delay3 delay) {
		this.delay = delay;
		adopt(delay);
	}

	public DriveStrength getDriveStrength() {
		return driveStrength;
	}

	public void setDriveStrength(DriveStrength driveStrength) {
		this.driveStrength = driveStrength;
		adopt(driveStrength);
	}

	public ChargeStrength getChargeStrength() {
		return chargeStrength;
	}

	public void setChargeStrength(ChargeStrength chargeStrength) {
		this.chargeStrength = chargeStrength;
	}

	public Range getRange() {
		return range;
	}

	public void setRange(Range range) {
		this.range = range;
		adopt(range);
	}

	public boolean isVectored() {
		return vectored;
	}

	public void setVectored(boolean vectored) {
		this.vectored = vectored;
	}

	public boolean isScalared() {
		return scalared;
	}

	public void setScalared(boolean scalared) {
		this.scalared = scalared;
	}

	public boolean isSigned() {
		return signed;
	}

	public void setSigned(boolean signed) {
		this.signed = signed;
	}

	public NetType getNetType() {
		return netType;
	}

	public void setNetType(NetType netType) {
		this.netType = netType;
	}

	private void adopt(AstNode child) {
		if (child != null) {
			child.setParent(this);
		}
	}
}
