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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What was written between the parentheses of a step: either a single
 * literal command ({@code run("make")}) or a list of named arguments
 * ({@code deploy(target = "prod")}). The shape is decided once, when the
 * payload is parsed.
 */
public abstract class StepPayload {

	private StepPayload() {}

	/**
	 * @return the named arguments, empty for a literal payload
	 */
	public abstract List<StepArg> getArguments();

	/**
	 * A single string literal, only legal for {@code run} steps.
	 */
	public static final class Literal extends StepPayload {

		private final String command;

		public Literal(String command) {
			this.command = Objects.requireNonNull(command, "command");
		}

		public String getCommand() {
			return command;
		}

		@Override
		public List<StepArg> getArguments() {
			return Collections.emptyList();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Literal && command.equals(((Literal) o).command);
		}

		@Override
		public int hashCode() {
			return command.hashCode();
		}
	}

	/**
	 * A comma-separated list of {@code name = "value"} pairs, possibly empty.
	 */
	public static final class Arguments extends StepPayload {

		private final List<StepArg> arguments;

		public Arguments(List<StepArg> arguments) {
			this.arguments = Collections.unmodifiableList(new ArrayList<StepArg>(arguments));
		}

		@Override
		public List<StepArg> getArguments() {
			return arguments;
		}

		/**
		 * Looks up the value of the first argument with the specified name.
		 *
		 * @param name argument name
		 * @return the value, or {@code null} when no argument has this name
		 */
		public String valueOf(String name) {
			for (StepArg arg : arguments) {
				if (arg.getName().equals(name)) {
					return arg.getValue();
				}
			}
			return null;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Arguments && arguments.equals(((Arguments) o).arguments);
		}

		@Override
		public int hashCode() {
			return arguments.hashCode();
		}
	}
}
