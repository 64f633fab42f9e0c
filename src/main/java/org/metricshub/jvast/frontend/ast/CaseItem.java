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
 * One arm of a case statement. A <code>default:</code> arm has no conditions.
 */
public final class CaseItem extends AstNode {

	private final AstList<Expression> conditions;
	private final Statement body;
	private final boolean isDefault;

	public CaseItem(AstList<Expression> conditions, Statement body, boolean isDefault) {
		this.conditions = conditions;
		this.body = body;
		this.isDefault = isDefault;
	}

	public AstList<Expression> getConditions() {
		return conditions;
	}

	public Statement getBody() {
		return body;
	}

	public boolean isDefault() {
		return isDefault;
	}
}
