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
 * <code>assign [strength] [delay] a = x, b = y;</code>
 */
public final class ContinuousAssignment extends Assignment {

	private final AstList<SingleAssignment> assignments;
	private final DriveStrength driveStrength;
	private final Delay3 delay;

	public ContinuousAssignment(AstList<SingleAssignment> assignments, DriveStrength driveStrength, Delay3 delay) {
		this.assignments = assignments;
		this.driveStrength = driveStrength;
		this.delay = delay;
	}

	@Override
	public Type getType() {
		return Type.CONTINUOUS;
	}

	public AstList<SingleAssignment> getAssignments() {
		return assignments;
	}

	public DriveStrength getDriveStrength() {
		return driveStrength;
	}

	public Delay3 getDelay() {
		return delay;
	}
}
