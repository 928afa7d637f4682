package org.metricshub.devflow;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.devflow.frontend.ast.Pipeline;
import org.metricshub.devflow.frontend.ast.SourceException;

/**
 * Outcome of parsing one DevFlow document: either the complete list of
 * pipelines it declares, or the diagnostic of the first syntax error.
 * A failed parse never exposes a partial tree.
 */
public final class ParseResult {

	private final List<Pipeline> pipelines;
	private final String errorMessage;
	private final int lineNumber;

	private ParseResult(List<Pipeline> pipelines, String errorMessage, int lineNumber) {
		this.pipelines = pipelines;
		this.errorMessage = errorMessage;
		this.lineNumber = lineNumber;
	}

	/**
	 * @param pipelines the parsed pipelines, in declaration order
	 * @return a successful result
	 */
	public static ParseResult success(List<Pipeline> pipelines) {
		return new ParseResult(Collections.unmodifiableList(new ArrayList<Pipeline>(pipelines)), null, -1);
	}

	/**
	 * @param e the error that stopped the parse
	 * @return a failed result carrying the diagnostic of {@code e}
	 */
	public static ParseResult failure(SourceException e) {
		return new ParseResult(Collections.<Pipeline>emptyList(), e.getDiagnostic(), e.getLineNumber());
	}

	public boolean isSuccess() {
		return errorMessage == null;
	}

	/**
	 * @return the pipelines, empty when the parse failed
	 */
	public List<Pipeline> getPipelines() {
		return pipelines;
	}

	/**
	 * @return {@code Error at line <N>: <description>} and {@code Near: <token>} on two lines,
	 *         or {@code null} on success
	 */
	public String getErrorMessage() {
		return errorMessage;
	}

	/**
	 * @return the line of the error, or {@code -1} on success
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
