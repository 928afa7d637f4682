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

import org.metricshub.devflow.DevFlowException;

/**
 * A failure located in a DevFlow source: the source description, the line
 * and the text of the token the failure was detected on.
 */
public abstract class SourceException extends DevFlowException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final String nearText;

	protected SourceException(String msg, String sourceDescription, int lineNumber, String nearText) {
		super(lineNumber, msg);
		this.sourceDescription = sourceDescription;
		this.nearText = nearText;
	}

	/**
	 * @return the description of the source being read (usually a file name)
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return the text of the offending token
	 */
	public String getNearText() {
		return nearText;
	}

	/**
	 * Renders the two-line diagnostic reported to users:
	 * {@code Error at line <N>: <description>} followed by
	 * {@code Near: <offending token text>}.
	 *
	 * @return the diagnostic text, lines separated by {@code \n}
	 */
	public String getDiagnostic() {
		return "Error at line " + getLineNumber() + ": " + getMessage() + "\nNear: " + nearText;
	}
}
