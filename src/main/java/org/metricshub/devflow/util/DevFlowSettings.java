package org.metricshub.devflow.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single DevFlow invocation.
 * These values have defaults, which may be changed through command line
 * arguments or when invoking DevFlow programmatically.
 */
public class DevFlowSettings {

	/**
	 * Where the pipeline summary is written.
	 * By default, this is {@link System#out}.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Where diagnostics are written.
	 * By default, this is {@link System#err}.
	 */
	private PrintStream errorStream = System.err;

	/**
	 * Whether to skip printing the summary of the parsed pipelines.
	 */
	private boolean quiet = false;

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setErrorStream(PrintStream pErrorStream) {
		errorStream = pErrorStream;
	}

	public boolean isQuiet() {
		return quiet;
	}

	public void setQuiet(boolean pQuiet) {
		quiet = pQuiet;
	}
}
