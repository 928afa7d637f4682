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
 * An auxiliary container a job depends on (a database, a cache...).
 * <p>
 * Ports are either both set or both {@code null}.
 */
public final class Service extends AstNode {

	private final String name;
	private final String image;
	private final String portHost;
	private final String portContainer;
	private final List<EnvVar> envVars;

	public Service(int lineNumber, String name, String image, String portHost, String portContainer,
			List<EnvVar> envVars) {
		super(lineNumber);
		if ((portHost == null) != (portContainer == null)) {
			throw new IllegalArgumentException("Service ports must be both set or both absent");
		}
		this.name = Objects.requireNonNull(name, "name");
		this.image = Objects.requireNonNull(image, "image");
		this.portHost = portHost;
		this.portContainer = portContainer;
		this.envVars = Collections.unmodifiableList(new ArrayList<EnvVar>(envVars));
	}

	public String getName() {
		return name;
	}

	public String getImage() {
		return image;
	}

	public String getPortHost() {
		return portHost;
	}

	public String getPortContainer() {
		return portContainer;
	}

	public boolean hasPort() {
		return portHost != null;
	}

	public List<EnvVar> getEnvVars() {
		return envVars;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Service)) {
			return false;
		}
		Service other = (Service) o;
		return name.equals(other.name)
				&& image.equals(other.image)
				&& Objects.equals(portHost, other.portHost)
				&& Objects.equals(portContainer, other.portContainer)
				&& envVars.equals(other.envVars);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, image, portHost, portContainer, envVars);
	}
}
