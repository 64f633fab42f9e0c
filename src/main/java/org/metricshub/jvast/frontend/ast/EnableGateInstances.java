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
 * Enable gates of the same type sharing delay and drive strength.
 */
public final class EnableGateInstances extends AstNode {

	/**
	 * Discriminant of enable gates.
	 */
	public enum Type {
		BUFIF0,
		BUFIF1,
		NOTIF0,
		NOTIF1
	}

	private final Type type;
	private final Delay3 delay;
	private final DriveStrength driveStrength;
	private final AstList<EnableGateInstance> instances;

	public EnableGateInstances(Type type, Delay3 delay, DriveStrength driveStrength, AstList<EnableGateInstance> instances) {
		this.type = type;
		this.delay = delay;
		this.driveStrength = driveStrength;
		this.instances = instances;
	}

	public Type getType() {
		return type;
	}

	public Delay3 getDelay() {
		return delay;
	}

	public DriveStrength getDriveStrength() {
		return driveStrength;
	}

	public AstList<EnableGateInstance> getInstances() {
		return instances;
	}
}
