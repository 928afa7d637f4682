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
 * An event condition that starts a pipeline, optionally parameterized.
 * <p>
 * When several pattern literals are given, {@link #getPattern()} holds them
 * joined with commas ({@code push("main", "develop")} gives
 * {@code "main,develop"}) and {@link #getPatterns()} keeps the literals
 * themselves.
 */
public final class Trigger extends AstNode {

	private final TriggerKind kind;
	private final List<String> patterns;
	private final String pattern;

	public Trigger(int lineNumber, TriggerKind kind, List<String> patterns) {
		super(lineNumber);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.patterns = Collections.unmodifiableList(new ArrayList<String>(patterns));
		this.pattern = this.patterns.isEmpty() ? null : String.join(",", this.patterns);
	}

	public TriggerKind getKind() {
		return kind;
	}

	/**
	 * @return the comma-joined patterns, or {@code null} for an unparameterized trigger
	 */
	public String getPattern() {
		return pattern;
	}

	public List<String> getPatterns() {
		return patterns;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Trigger)) {
			return false;
		}
		Trigger other = (Trigger) o;
		return kind == other.kind && patterns.equals(other.patterns);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, patterns);
	}

	@Override
	public String toString() {
		return pattern == null ? kind.getKeyword() : kind.getKeyword() + "(" + pattern + ")";
	}
}
