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
 * Instances of one UDP sharing drive strength and delay.
 */
public final class UdpInstantiation extends AstNode {

	private final AstList<UdpInstance> instances;
	private final Identifier identifier;
	private final DriveStrength driveStrength;
	private final Delay2 delay;

	public UdpInstantiation(AstList<UdpInstance> instances, Identifier identifier, DriveStrength driveStrength, Delay2 delay) {
		this.instances = instances;
		this.identifier = identifier;
		this.driveStrength = driveStrength;
		this.delay = delay;
	}

	public AstList<UdpInstance> getInstances() {
		return instances;
	}

	/**
	 * @return the name of the instantiated primitive
	 */
	public Identifier getIdentifier() {
		return identifier;
	}

	public DriveStrength getDriveStrength() {
		return driveStrength;
	}

	public Delay2 getDelay() {
		return delay;
	}
}
