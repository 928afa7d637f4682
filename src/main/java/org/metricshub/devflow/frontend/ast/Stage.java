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
import org.metricshub.devflow.frontend.AstNode;

/**
 * An ordered phase of a pipeline.
 */
public final class Stage extends AstNode {

	private final String name;
	private final List<Job> jobs;

	public Stage(int lineNumber, String name, List<Job> jobs) {
		super(lineNumber);
		this.name = Objects.requireNonNull(name, "name");
		this.jobs = Collections.unmodifiableList(new ArrayList<Job>(jobs));
	}

	public String getName() {
		return name;
	}

	public List<Job> getJobs() {
		return jobs;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Stage)) {
			return false;
		}
		Stage other = (Stage) o;
		return name.equals(other.name) && jobs.equals(other.jobs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, jobs);
	}
}
