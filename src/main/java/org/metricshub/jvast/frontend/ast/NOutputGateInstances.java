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

public final class NOutputGateInstances extends AstNode {

	/**
	 * Discriminant of n-output gates.
	 */
	public enum Type {
		BUF,
		NOT
	}

	private final Type type;
	private final Delay2 delay;
	private final DriveStrength driveStrength;
	private final AstList<NOutputGateInstance> instances;

	public NOutputGateInstances(Type type, Delay2 delay, DriveStrength driveStrength, AstList<NOutputGateInstance> instances) {
		this.type = type;
		this.delay = delay;
		this.driveStrength = driveStrength;
		this.instances = instances;
	}

	public Type getType() {
		return type;
	}

	public Delay2 getDelay() {
		return delay;
	}

	public DriveStrength getDriveStrength() {
		return driveStrength;
	}

	public AstList<NOutputGateInstance> getInstances() {
		return instances;
	}
}
