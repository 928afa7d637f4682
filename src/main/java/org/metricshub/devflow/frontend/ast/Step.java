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

import java.util.List;
import java.util.Objects;
import org.metricshub.devflow.frontend.AstNode;

/**
 * An atomic operation of a job.
 * <p>
 * The command is resolved when the step is built: the literal of a
 * {@code run("...")} step, the {@code command} argument of a {@code run}
 * step written with named arguments, {@code null} otherwise.
 */
public final class Step extends AstNode {

	private final StepKind kind;
	private final StepPayload payload;
	private final String command;

	public Step(int lineNumber, StepKind kind, StepPayload payload, String command) {
		super(lineNumber);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.payload = Objects.requireNonNull(payload, "payload");
		this.command = command;
	}

	public StepKind getKind() {
		return kind;
	}

	public StepPayload getPayload() {
		return payload;
	}

	/**
	 * @return the command to run, or {@code null} when there is none
	 */
	public String getCommand() {
		return command;
	}

	/**
	 * @return the named arguments, in declaration order
	 */
	public List<StepArg> getArgs() {
		return payload.getArguments();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Step)) {
			return false;
		}
		Step other = (Step) o;
		return kind == other.kind && payload.equals(other.payload) && Objects.equals(command, other.command);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, payload, command);
	}
}
