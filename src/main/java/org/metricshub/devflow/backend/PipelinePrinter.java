package org.metricshub.devflow.backend;

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

import java.io.PrintStream;
import java.util.Iterator;
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
import org.metricshub.devflow.frontend.ast.Trigger;

/**
 * Renders parsed pipelines as an indented, human-readable summary.
 * <p>
 * Every list is printed in the order it is stored, which is the order of
 * the source. Each nesting level is indented by two spaces.
 */
public class PipelinePrinter {

	private static final String INDENT = "  ";

	private final PrintStream out;

	/**
	 * <p>
	 * Constructor for PipelinePrinter.
	 * </p>
	 *
	 * @param out where the summary is written
	 */
	public PipelinePrinter(PrintStream out) {
		this.out = out;
	}

	/**
	 * Prints all the specified pipelines.
	 *
	 * @param pipelines parsed pipelines
	 */
	public void print(List<Pipeline> pipelines) {
		for (Pipeline pipeline : pipelines) {
			print(pipeline);
		}
	}

	/**
	 * Prints one pipeline and everything it contains.
	 *
	 * @param pipeline parsed pipeline
	 */
	public void print(Pipeline pipeline) {
		line(0, "Pipeline: " + pipeline.getName());
		if (!pipeline.getTriggers().isEmpty()) {
			line(1, "Triggers:");
			for (Trigger trigger : pipeline.getTriggers()) {
				line(2, "- " + formatTrigger(trigger));
			}
		}
		for (Stage stage : pipeline.getStages()) {
			line(1, "Stage: " + stage.getName());
			for (Job job : stage.getJobs()) {
				printJob(job);
			}
		}
		printArtifacts(1, pipeline.getArtifacts());
	}

	private void printJob(Job job) {
		line(2, "Job: " + job.getName());
		if (job.getImage() != null) {
			line(3, "Image: " + job.getImage());
		}
		if (!job.getMatrix().isEmpty()) {
			line(3, "Matrix:");
			for (MatrixAxis axis : job.getMatrix()) {
				line(4, axis.getName() + ": [" + String.join(", ", axis.getValues()) + "]");
			}
		}
		if (!job.getServices().isEmpty()) {
			line(3, "Services:");
			for (Service service : job.getServices()) {
				StringBuilder sb = new StringBuilder("- ")
						.append(service.getName())
						.append(" (")
						.append(service.getImage())
						.append(')');
				if (service.hasPort()) {
					sb.append(" port ").append(service.getPortHost()).append(':').append(service.getPortContainer());
				}
				line(4, sb.toString());
				for (EnvVar envVar : service.getEnvVars()) {
					line(5, "env " + envVar.getName() + "=" + envVar.getValue());
				}
			}
		}
		line(3, "Steps:");
		for (Step step : job.getSteps()) {
			line(4, "- " + formatStep(step));
		}
		printArtifacts(3, job.getArtifacts());
	}

	private void printArtifacts(int level, List<Artifact> artifacts) {
		if (artifacts.isEmpty()) {
			return;
		}
		line(level, "Artifacts:");
		for (Artifact artifact : artifacts) {
			line(level + 1, "- " + artifact.getPath());
		}
	}

	static String formatTrigger(Trigger trigger) {
		if (trigger.getPattern() == null) {
			return trigger.getKind().getKeyword();
		}
		return trigger.getKind().getKeyword() + " (" + trigger.getPattern() + ")";
	}

	static String formatStep(Step step) {
		StringBuilder sb = new StringBuilder(step.getKind().getKeyword());
		if (step.getKind() == StepKind.RUN && step.getCommand() != null) {
			sb.append(": ").append(step.getCommand());
		}
		List<StepArg> args = step.getArgs();
		if (!args.isEmpty()) {
			sb.append(" (");
			Iterator<StepArg> it = args.iterator();
			while (it.hasNext()) {
				StepArg arg = it.next();
				sb.append(arg.getName()).append('=').append(arg.getValue());
				if (it.hasNext()) {
					sb.append(", ");
				}
			}
			sb.append(')');
		}
		return sb.toString();
	}

	private void line(int level, String text) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < level; i++) {
			sb.append(INDENT);
		}
		out.println(sb.append(text));
	}
}
