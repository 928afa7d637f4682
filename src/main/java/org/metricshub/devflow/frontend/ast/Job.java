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
 * A unit of work within a stage.
 */
public final class Job extends AstNode {

	private final String name;
	private final String image;
	private final List<Service> services;
	private final List<Step> steps;
	private final List<Artifact> artifacts;
	private final List<MatrixAxis> matrix;

	public Job(int lineNumber, String name, String image, List<Service> services, List<Step> steps,
			List<Artifact> artifacts, List<MatrixAxis> matrix) {
		super(lineNumber);
		this.name = Objects.requireNonNull(name, "name");
		this.image = image;
		this.services = Collections.unmodifiableList(new ArrayList<Service>(services));
		this.steps = Collections.unmodifiableList(new ArrayList<Step>(steps));
		this.artifacts = Collections.unmodifiableList(new ArrayList<Artifact>(artifacts));
		this.matrix = Collections.unmodifiableList(new ArrayList<MatrixAxis>(matrix));
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the container image, or {@code null} when the job declares none
	 */
	public String getImage() {
		return image;
	}

	public List<Service> getServices() {
		return services;
	}

	public List<Step> getSteps() {
		return steps;
	}

	public List<Artifact> getArtifacts() {
		return artifacts;
	}

	public List<MatrixAxis> getMatrix() {
		return matrix;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Job)) {
			return false;
		}
		Job other = (Job) o;
		return name.equals(other.name)
				&& Objects.equals(image, other.image)
				&& services.equals(other.services)
				&& steps.equals(other.steps)
				&& artifacts.equals(other.artifacts)
				&& matrix.equals(other.matrix);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, image, services, steps, artifacts, matrix);
	}
}
