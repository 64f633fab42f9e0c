package org.metricshub.jvast.util;

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
 * A simple container for the parameters of one tree construction session
 * (typically one compilation unit).
 * These values have defaults.
 * The defaults may be changed programmatically, or through system properties
 * with {@link #fromSystemProperties()}.
 */
public class AstSettings {

	/**
	 * System property overriding {@link #getMaxBlocks()}.
	 */
	public static final String MAX_BLOCKS_PROPERTY = "jvast.maxBlocks";

	/**
	 * System property overriding {@link #isTraceAllocations()}.
	 */
	public static final String TRACE_ALLOCATIONS_PROPERTY = "jvast.traceAllocations";

	/**
	 * Maximum number of blocks an arena may hold before an allocation
	 * is reported as exhausted.
	 * <code>0</code> (the default) means unlimited.
	 */
	private int maxBlocks = 0;

	/**
	 * Whether every allocation is logged at TRACE level;
	 * <code>false</code> by default.
	 */
	private boolean traceAllocations = false;

	/**
	 * Creates settings initialized from the {@value #MAX_BLOCKS_PROPERTY} and
	 * {@value #TRACE_ALLOCATIONS_PROPERTY} system properties. Missing
	 * properties keep their defaults.
	 *
	 * @return a new settings instance
	 * @throws IllegalArgumentException when {@value #MAX_BLOCKS_PROPERTY} is not a valid count
	 */
	public static AstSettings fromSystemProperties() {
		AstSettings settings = new AstSettings();
		String maxBlocks = System.getProperty(MAX_BLOCKS_PROPERTY);
		if (maxBlocks != null) {
			try {
				settings.setMaxBlocks(Integer.parseInt(maxBlocks.trim()));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(MAX_BLOCKS_PROPERTY + " must be an integer, got: " + maxBlocks, e);
			}
		}
		String trace = System.getProperty(TRACE_ALLOCATIONS_PROPERTY);
		if (trace != null) {
			settings.setTraceAllocations(Boolean.parseBoolean(trace.trim()));
		}
		return settings;
	}

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("maxBlocks = ").append(getMaxBlocks()).append(newLine);
		desc.append("traceAllocations = ").append(isTraceAllocations()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the maximum number of blocks per arena, <code>0</code> for unlimited
	 */
	public int getMaxBlocks() {
		return maxBlocks;
	}

	/**
	 * @param maxBlocks the maximum number of blocks per arena, <code>0</code> for unlimited
	 */
	public void setMaxBlocks(int maxBlocks) {
		if (maxBlocks < 0) {
			throw new IllegalArgumentException("maxBlocks must not be negative: " + maxBlocks);
		}
		this.maxBlocks = maxBlocks;
	}

	public boolean isTraceAllocations() {
		return traceAllocations;
	}

	public void setTraceAllocations(boolean traceAllocations) {
		this.traceAllocations = traceAllocations;
	}
}
