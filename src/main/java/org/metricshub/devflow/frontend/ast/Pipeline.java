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
 * Top-level workflow definition. Several pipelines may be declared in one
 * document; they are kept in declaration order.
 */
public final class Pipeline extends AstNode {

	private final String name;
	private final List<Trigger> triggers;
	private final List<Stage> stages;
	private final List<Artifact> artifacts;

	public Pipeline(int lineNumber, String name, List<Trigger> triggers, List<Stage> stages,
			List<Artifact> artifacts) {
		super(lineNumber);
		this.name = Objects.requireNonNull(name, "name");
		this.triggers = Collections.unmodifiableList(new ArrayList<Trigger>(triggers));
		this.stages = Collections.unmodifiableList(new ArrayList<Stage>(stages));
		this.artifacts = Collections.unmodifiableList(new ArrayList<Artifact>(artifacts));
	}

	public String getName() {
		return name;
	}

	public List<Trigger> getTriggers() {
		return triggers;
	}

	public List<Stage> getStages() {
		return stages;
	}

	public List<Artifact> getArtifacts() {
		return artifacts;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Pipeline)) {
			return false;
		}
		Pipeline other = (Pipeline) o;
		return name.equals(other.name)
				&& triggers.equals(other.triggers)
				&& stages.equals(other.stages)
				&& artifacts.equals(other.artifacts);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, triggers, stages, artifacts);
	}
}
