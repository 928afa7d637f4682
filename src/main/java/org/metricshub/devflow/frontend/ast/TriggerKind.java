package org.metricshub.devflow.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DevFlow
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
 * Events that start a pipeline.
 */
public enum TriggerKind {
	PUSH("push", true),
	PULL_REQUEST("pull_request", true),
	SCHEDULE("schedule", true),
	MANUAL("manual", false);

	private final String keyword;
	private final boolean parameterizable;

	TriggerKind(String keyword, boolean parameterizable) {
		this.keyword = keyword;
		this.parameterizable = parameterizable;
	}

	/**
	 * @return the keyword this trigger is written with
	 */
	public String getKeyword() {
		return keyword;
	}

	/**
	 * @return whether the trigger accepts a parenthesized pattern list
	 */
	public boolean isParameterizable() {
		return parameterizable;
	}
}
