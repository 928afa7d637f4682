package org.metricshub.devflow.frontend;

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
import org.metricshub.devflow.frontend.ast.Artifact;
import org.metricshub.devflow.frontend.ast.EnvVar;
import org.metricshub.devflow.frontend.ast.Job;
import org.metricshub.devflow.frontend.ast.MatrixAxis;
import org.metricshub.devflow.frontend.ast.Pipeline;
import org.metricshub.devflow.frontend.ast.Service;
import org.metricshub.devflow.frontend.ast.Stage;
import org.metricshub.devflow.frontend.ast.Step;
import org.metricshub.devflow.frontend.ast.StepArg;
import org.metricshub.devflow.frontend.ast.StepKind;
import org.metricshub.devflow.frontend.ast.StepPayload;
import org.metricshub.devflow.frontend.ast.Trigger;
import org.metricshub.devflow.frontend.ast.TriggerKind;

/**
 * Allocates the nodes of the syntax tree and links them into their lists.
 * <p>
 * {@link DevFlowParser} calls one of these methods each time it completes a
 * production. An instance holds the state of a single parse: the pipelines
 * completed so far, in declaration order. Lists only ever grow at their tail,
 * so the order of every list in the tree is the order of the source.
 */
public class AstBuilder {

	/** Name of the {@code run} argument that holds the command to run. */
	public static final String COMMAND_ARGUMENT = "command";

	private final List<Pipeline> pipelines = new ArrayList<Pipeline>();

	/**
	 * Starts a list with its first element. Used for the lists the grammar
	 * requires to be non-empty.
	 *
	 * @param first the first element
	 * @param <T> element type
	 * @return a new growable list
	 */
	public <T> List<T> list(T first) {
		List<T> list = new ArrayList<T>();
		list.add(first);
		return list;
	}

	/**
	 * Starts an empty list, for the lists the grammar allows to be empty.
	 *
	 * @param <T> element type
	 * @return a new growable list
	 */
	public <T> List<T> emptyList() {
		return new ArrayList<T>();
	}

	/**
	 * Appends an element at the tail of a list under construction.
	 *
	 * @param list the list
	 * @param element the element to link after the current tail
	 * @param <T> element type
	 * @return {@code list}
	 */
	public <T> List<T> append(List<T> list, T element) {
		list.add(element);
		return list;
	}

	// TRIGGERS

	/**
	 * Builds a trigger. Several patterns are merged into one comma-joined
	 * pattern; none leaves the pattern unset.
	 *
	 * @param lineNumber line of the trigger kind
	 * @param kind trigger kind
	 * @param patterns pattern literals, possibly empty
	 * @return the new trigger
	 */
	public Trigger trigger(int lineNumber, TriggerKind kind, List<String> patterns) {
		if (!kind.isParameterizable() && !patterns.isEmpty()) {
			throw new IllegalArgumentException(kind.getKeyword() + " trigger does not accept patterns");
		}
		return new Trigger(lineNumber, kind, patterns);
	}

	// ARTIFACTS

	/**
	 * Builds one artifact per path of an {@code artifact} statement.
	 *
	 * @param lineNumber line of the statement
	 * @param paths the declared paths
	 * @return the artifacts, in the order of {@code paths}
	 */
	public List<Artifact> artifacts(int lineNumber, List<String> paths) {
		List<Artifact> artifacts = new ArrayList<Artifact>(paths.size());
		for (String path : paths) {
			artifacts.add(new Artifact(lineNumber, path));
		}
		return artifacts;
	}

	// SERVICES

	public EnvVar envVar(int lineNumber, String name, String value) {
		return new EnvVar(lineNumber, name, value);
	}

	/**
	 * Builds a service.
	 *
	 * @param lineNumber line of the {@code service} keyword
	 * @param name service name
	 * @param image container image
	 * @param portHost host port, or {@code null}
	 * @param portContainer container port, {@code null} exactly when {@code portHost} is
	 * @param envVars environment variables
	 * @return the new service
	 */
	public Service service(int lineNumber, String name, String image, String portHost, String portContainer,
			List<EnvVar> envVars) {
		return new Service(lineNumber, name, image, portHost, portContainer, envVars);
	}

	// STEPS

	public StepArg stepArg(int lineNumber, String name, String value) {
		return new StepArg(lineNumber, name, value);
	}

	public StepPayload runLiteral(String command) {
		return new StepPayload.Literal(command);
	}

	public StepPayload namedArguments(List<StepArg> arguments) {
		return new StepPayload.Arguments(arguments);
	}

	public StepPayload emptyPayload() {
		return new StepPayload.Arguments(Collections.<StepArg>emptyList());
	}

	/**
	 * Builds a step and resolves its command from the payload: the literal
	 * for {@code run("...")}, the {@code command} argument for {@code run}
	 * with named arguments (none if it is missing), nothing for other kinds,
	 * which keep their arguments as they were written.
	 *
	 * @param lineNumber line of the {@code step} keyword
	 * @param kind step kind
	 * @param payload what was written between the parentheses
	 * @return the new step
	 */
	public Step step(int lineNumber, StepKind kind, StepPayload payload) {
		String command = null;
		if (payload instanceof StepPayload.Literal) {
			if (kind != StepKind.RUN) {
				throw new IllegalArgumentException("Only run steps accept a literal command");
			}
			command = ((StepPayload.Literal) payload).getCommand();
		} else if (kind == StepKind.RUN) {
			command = ((StepPayload.Arguments) payload).valueOf(COMMAND_ARGUMENT);
		}
		return new Step(lineNumber, kind, payload, command);
	}

	// MATRIX

	public MatrixAxis matrixAxis(int lineNumber, String name, List<String> values) {
		return new MatrixAxis(lineNumber, name, values);
	}

	// JOBS

	/**
	 * @return an empty job body, to be filled while the job is parsed
	 */
	public JobBody jobBody() {
		return new JobBody();
	}

	/**
	 * Merges a {@code matrix} declaration into a job body still under
	 * construction. The declaration may come before any other element of
	 * the body; axes of an earlier declaration stay ahead of those of a
	 * later one.
	 *
	 * @param body the job body being built
	 * @param axes the axes of the declaration
	 */
	public void hoistMatrix(JobBody body, List<MatrixAxis> axes) {
		body.matrix.addAll(axes);
	}

	public void addImage(JobBody body, String image) {
		body.image = image;
	}

	public void addService(JobBody body, Service service) {
		body.services.add(service);
	}

	public void addStep(JobBody body, Step step) {
		body.steps.add(step);
	}

	public void addArtifacts(JobBody body, List<Artifact> artifacts) {
		body.artifacts.addAll(artifacts);
	}

	public Job job(int lineNumber, String name, JobBody body) {
		return new Job(lineNumber, name, body.image, body.services, body.steps, body.artifacts, body.matrix);
	}

	// STAGES AND PIPELINES

	public Stage stage(int lineNumber, String name, List<Job> jobs) {
		return new Stage(lineNumber, name, jobs);
	}

	public Pipeline pipeline(int lineNumber, String name, List<Trigger> triggers, List<Stage> stages,
			List<Artifact> artifacts) {
		return new Pipeline(lineNumber, name, triggers, stages, artifacts);
	}

	/**
	 * Appends a completed pipeline to the program. Pipelines accumulate,
	 * a later one never replaces an earlier one.
	 *
	 * @param pipeline the completed pipeline
	 */
	public void addPipeline(Pipeline pipeline) {
		pipelines.add(pipeline);
	}

	/**
	 * @return the pipelines completed so far, in declaration order
	 */
	public List<Pipeline> pipelines() {
		return Collections.unmodifiableList(new ArrayList<Pipeline>(pipelines));
	}

	/**
	 * The elements of a job collected while its body is parsed.
	 */
	public static final class JobBody {

		private String image;
		private final List<Service> services = new ArrayList<Service>();
		private final List<Step> steps = new ArrayList<Step>();
		private final List<Artifact> artifacts = new ArrayList<Artifact>();
		private final List<MatrixAxis> matrix = new ArrayList<MatrixAxis>();

		private JobBody() {}

		public String getImage() {
			return image;
		}

		public List<MatrixAxis> getMatrix() {
			return Collections.unmodifiableList(matrix);
		}

		public List<Step> getSteps() {
			return Collections.unmodifiableList(steps);
		}
	}
}
