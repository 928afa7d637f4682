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

import java.io.IOException;
import java.util.List;
import org.metricshub.devflow.frontend.AstBuilder.JobBody;
import org.metricshub.devflow.frontend.ast.Artifact;
import org.metricshub.devflow.frontend.ast.EnvVar;
import org.metricshub.devflow.frontend.ast.Job;
import org.metricshub.devflow.frontend.ast.MatrixAxis;
import org.metricshub.devflow.frontend.ast.ParserException;
import org.metricshub.devflow.frontend.ast.Pipeline;
import org.metricshub.devflow.frontend.ast.Service;
import org.metricshub.devflow.frontend.ast.Stage;
import org.metricshub.devflow.frontend.ast.Step;
import org.metricshub.devflow.frontend.ast.StepArg;
import org.metricshub.devflow.frontend.ast.StepKind;
import org.metricshub.devflow.frontend.ast.StepPayload;
import org.metricshub.devflow.frontend.ast.Trigger;
import org.metricshub.devflow.frontend.ast.TriggerKind;
import org.metricshub.devflow.util.DevFlowLogger;
import org.metricshub.devflow.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts a DevFlow document into its syntax tree.
 * <p>
 * Each production of the grammar is a method named after it. When a
 * production completes, the corresponding {@link AstBuilder} operation
 * builds the node or merges it into the list under construction. Lists the
 * language requires to be non-empty (stages, jobs, steps) are parsed as
 * "one, then zero or more", so an empty one is a syntax error rather than
 * an empty list.
 * <p>
 * Parsing stops on the first token that cannot extend the current
 * production, with a {@link ParserException}. There is no recovery.
 * <p>
 * An instance is not thread-safe, but may be reused for successive parses.
 */
public class DevFlowParser {

	private static final Logger LOG = DevFlowLogger.getLogger(DevFlowParser.class);

	private DevFlowLexer lexer;
	private AstBuilder builder;
	private Token token;

	/**
	 * Parse the document streamed by the specified source. Build and return
	 * the pipelines it declares.
	 *
	 * @param source the document to parse
	 * @return the pipelines, in declaration order
	 * @throws java.io.IOException upon an IO error
	 * @throws ParserException on the first syntax error
	 * @throws org.metricshub.devflow.frontend.ast.LexerException on an invalid character or unterminated string
	 */
	public List<Pipeline> parse(ScriptSource source) throws IOException {
		return parse(source, new AstBuilder());
	}

	/**
	 * Parse the document streamed by the specified source, appending the
	 * pipelines it declares to those already held by {@code astBuilder}.
	 *
	 * @param source the document to parse
	 * @param astBuilder the builder that receives the nodes
	 * @return every pipeline held by {@code astBuilder}, in declaration order
	 * @throws java.io.IOException upon an IO error
	 */
	public List<Pipeline> parse(ScriptSource source, AstBuilder astBuilder) throws IOException {
		if (source == null) {
			throw new IOException("No source supplied");
		}
		this.builder = astBuilder;
		this.lexer = new DevFlowLexer(source);
		try {
			lexer();
			PROGRAM();
			return builder.pipelines();
		} finally {
			this.lexer = null;
			this.builder = null;
		}
	}

	private void lexer() throws IOException {
		token = lexer.nextToken();
	}

	private void lexer(Token expectedToken) throws IOException {
		if (token != expectedToken) {
			throw parserException("Expecting " + expectedToken.getDisplay() + " but found " + token.getDisplay());
		}
		lexer();
	}

	private boolean optToken(Token optionalToken) throws IOException {
		if (token == optionalToken) {
			lexer();
			return true;
		}
		return false;
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : PIPELINE [PIPELINE ...] EOF
	// Pipelines reach the builder only once the whole input has parsed
	void PROGRAM() throws IOException {
		List<Pipeline> program = builder.emptyList();
		do {
			Pipeline pipeline = PIPELINE();
			builder.append(program, pipeline);
			LOG.debug("Parsed pipeline '{}' with {} stage(s)", pipeline.getName(), pipeline.getStages().size());
		} while (token != Token.EOF);
		for (Pipeline pipeline : program) {
			builder.addPipeline(pipeline);
		}
	}

	// PIPELINE : pipeline NAME { [TRIGGERS] STAGE [STAGE ...] [ARTIFACT_STATEMENT ...] }
	Pipeline PIPELINE() throws IOException {
		int line = lexer.getLineNumber();
		lexer(Token.KW_PIPELINE);
		String name = NAME();
		lexer(Token.OPEN_BRACE);
		List<Trigger> triggers = token == Token.KW_ON ? TRIGGERS() : builder.<Trigger>emptyList();
		List<Stage> stages = builder.list(STAGE());
		while (token == Token.KW_STAGE) {
			builder.append(stages, STAGE());
		}
		List<Artifact> artifacts = builder.emptyList();
		while (token == Token.KW_ARTIFACT) {
			for (Artifact artifact : ARTIFACT_STATEMENT()) {
				builder.append(artifacts, artifact);
			}
		}
		if (token != Token.CLOSE_BRACE) {
			throw parserException("Expecting 'stage', 'artifact' or '}' but found " + token.getDisplay());
		}
		lexer();
		return builder.pipeline(line, name, triggers, stages, artifacts);
	}

	// TRIGGERS : on TRIGGER [, TRIGGER ...] [;]
	List<Trigger> TRIGGERS() throws IOException {
		lexer(Token.KW_ON);
		List<Trigger> triggers = builder.list(TRIGGER());
		while (optToken(Token.COMMA)) {
			builder.append(triggers, TRIGGER());
		}
		optToken(Token.SEMICOLON);
		return triggers;
	}

	// TRIGGER : manual | (push|pull_request|schedule) [ ( STRING_LIST ) ]
	Trigger TRIGGER() throws IOException {
		int line = lexer.getLineNumber();
		TriggerKind kind;
		switch (token) {
		case KW_PUSH:
			kind = TriggerKind.PUSH;
			break;
		case KW_PULL_REQUEST:
			kind = TriggerKind.PULL_REQUEST;
			break;
		case KW_SCHEDULE:
			kind = TriggerKind.SCHEDULE;
			break;
		case KW_MANUAL:
			kind = TriggerKind.MANUAL;
			break;
		default:
			throw parserException(
					"Expecting a trigger (push, pull_request, schedule, manual) but found " + token.getDisplay());
		}
		lexer();
		List<String> patterns = builder.emptyList();
		if (token == Token.OPEN_PAREN) {
			if (!kind.isParameterizable()) {
				throw parserException(kind.getKeyword() + " trigger does not accept parameters");
			}
			lexer();
			patterns = STRING_LIST();
			lexer(Token.CLOSE_PAREN);
		}
		return builder.trigger(line, kind, patterns);
	}

	// STAGE : stage NAME { JOB [JOB ...] }
	Stage STAGE() throws IOException {
		int line = lexer.getLineNumber();
		lexer(Token.KW_STAGE);
		String name = NAME();
		lexer(Token.OPEN_BRACE);
		List<Job> jobs = builder.list(JOB());
		while (token == Token.KW_JOB) {
			builder.append(jobs, JOB());
		}
		lexer(Token.CLOSE_BRACE);
		return builder.stage(line, name, jobs);
	}

	// JOB : job NAME { JOB_BODY }
	Job JOB() throws IOException {
		int line = lexer.getLineNumber();
		lexer(Token.KW_JOB);
		String name = NAME();
		lexer(Token.OPEN_BRACE);
		JobBody body = JOB_BODY();
		if (token != Token.CLOSE_BRACE) {
			throw parserException("Unexpected " + token.getDisplay() + " in the body of job " + name);
		}
		lexer();
		return builder.job(line, name, body);
	}

	// JOB_BODY : [IMAGE] [SERVICE ...] STEP [STEP ...] [ARTIFACT_STATEMENT ...]
	// with a MATRIX allowed before any of these elements
	JobBody JOB_BODY() throws IOException {
		JobBody body = builder.jobBody();
		optMatrix(body);
		if (token == Token.KW_IMAGE) {
			builder.addImage(body, IMAGE());
			optMatrix(body);
		}
		while (token == Token.KW_SERVICE) {
			builder.addService(body, SERVICE());
			optMatrix(body);
		}
		if (token != Token.KW_STEP) {
			throw parserException("Expecting at least one 'step' but found " + token.getDisplay());
		}
		do {
			builder.addStep(body, STEP());
			optMatrix(body);
		} while (token == Token.KW_STEP);
		while (token == Token.KW_ARTIFACT) {
			builder.addArtifacts(body, ARTIFACT_STATEMENT());
			optMatrix(body);
		}
		return body;
	}

	private void optMatrix(JobBody body) throws IOException {
		while (token == Token.KW_MATRIX) {
			builder.hoistMatrix(body, MATRIX());
		}
	}

	// IMAGE : image STRING [;]
	String IMAGE() throws IOException {
		lexer(Token.KW_IMAGE);
		String image = STRING();
		optToken(Token.SEMICOLON);
		return image;
	}

	// SERVICE : service NAME { IMAGE [port NUMBER : NUMBER [;]] [ENV ...] }
	Service SERVICE() throws IOException {
		int line = lexer.getLineNumber();
		lexer(Token.KW_SERVICE);
		String name = NAME();
		lexer(Token.OPEN_BRACE);
		String image = IMAGE();
		String portHost = null;
		String portContainer = null;
		if (optToken(Token.KW_PORT)) {
			portHost = NUMBER();
			lexer(Token.COLON);
			portContainer = NUMBER();
			optToken(Token.SEMICOLON);
		}
		List<EnvVar> envVars = builder.emptyList();
		while (token == Token.KW_ENV) {
			builder.append(envVars, ENV());
		}
		lexer(Token.CLOSE_BRACE);
		return builder.service(line, name, image, portHost, portContainer, envVars);
	}

	// ENV : env NAME = STRING [;]
	EnvVar ENV() throws IOException {
		int line = lexer.getLineNumber();
		lexer(Token.KW_ENV);
		String name = NAME();
		lexer(Token.EQUALS);
		String value = STRING();
		optToken(Token.SEMICOLON);
		return builder.envVar(line, name, value);
	}

	// STEP : step (run|checkout|deploy|notify) ( [STEP_PAYLOAD] ) [;]
	Step STEP() throws IOException {
		int line = lexer.getLineNumber();
		lexer(Token.KW_STEP);
		StepKind kind;
		switch (token) {
		case KW_RUN:
			kind = StepKind.RUN;
			break;
		case KW_CHECKOUT:
			kind = StepKind.CHECKOUT;
			break;
		case KW_DEPLOY:
			kind = StepKind.DEPLOY;
			break;
		case KW_NOTIFY:
			kind = StepKind.NOTIFY;
			break;
		default:
			throw parserException(
					"Expecting a step kind (run, checkout, deploy, notify) but found " + token.getDisplay());
		}
		lexer();
		lexer(Token.OPEN_PAREN);
		StepPayload payload = STEP_PAYLOAD(kind);
		lexer(Token.CLOSE_PAREN);
		optToken(Token.SEMICOLON);
		return builder.step(line, kind, payload);
	}

	// STEP_PAYLOAD : STRING | NAMED_ARGUMENT [, NAMED_ARGUMENT ...] | <empty>
	// The shape is decided on the first token: a string literal is a command,
	// anything else starts a named argument list.
	StepPayload STEP_PAYLOAD(StepKind kind) throws IOException {
		if (kind == StepKind.CHECKOUT) {
			if (token != Token.CLOSE_PAREN) {
				throw parserException("checkout does not accept arguments");
			}
			return builder.emptyPayload();
		}
		if (token == Token.STRING) {
			if (kind != StepKind.RUN) {
				throw parserException(kind.getKeyword() + " expects named arguments, only run accepts a command string");
			}
			return builder.runLiteral(STRING());
		}
		if (token == Token.CLOSE_PAREN) {
			if (kind == StepKind.RUN) {
				throw parserException("run expects a command string or named arguments");
			}
			return builder.emptyPayload();
		}
		List<StepArg> arguments = builder.list(NAMED_ARGUMENT());
		while (optToken(Token.COMMA)) {
			builder.append(arguments, NAMED_ARGUMENT());
		}
		return builder.namedArguments(arguments);
	}

	// NAMED_ARGUMENT : (IDENTIFIER|keyword) = STRING
	StepArg NAMED_ARGUMENT() throws IOException {
		int line = lexer.getLineNumber();
		if (token != Token.IDENTIFIER && !token.isKeyword()) {
			throw parserException("Expecting an argument name but found " + token.getDisplay());
		}
		String name = lexer.getText();
		lexer();
		lexer(Token.EQUALS);
		String value = STRING();
		return builder.stepArg(line, name, value);
	}

	// MATRIX : matrix [ AXIS [, AXIS ...] ] [;]
	List<MatrixAxis> MATRIX() throws IOException {
		lexer(Token.KW_MATRIX);
		lexer(Token.OPEN_BRACKET);
		List<MatrixAxis> axes = builder.list(AXIS());
		while (optToken(Token.COMMA)) {
			builder.append(axes, AXIS());
		}
		lexer(Token.CLOSE_BRACKET);
		optToken(Token.SEMICOLON);
		return axes;
	}

	// AXIS : NAME : [ STRING_LIST ]
	MatrixAxis AXIS() throws IOException {
		int line = lexer.getLineNumber();
		String name = NAME();
		lexer(Token.COLON);
		lexer(Token.OPEN_BRACKET);
		List<String> values = STRING_LIST();
		lexer(Token.CLOSE_BRACKET);
		return builder.matrixAxis(line, name, values);
	}

	// ARTIFACT_STATEMENT : artifact STRING_LIST ;
	List<Artifact> ARTIFACT_STATEMENT() throws IOException {
		int line = lexer.getLineNumber();
		lexer(Token.KW_ARTIFACT);
		List<String> paths = STRING_LIST();
		lexer(Token.SEMICOLON);
		return builder.artifacts(line, paths);
	}

	// STRING_LIST : STRING [, STRING ...]
	List<String> STRING_LIST() throws IOException {
		List<String> values = builder.list(STRING());
		while (optToken(Token.COMMA)) {
			builder.append(values, STRING());
		}
		return values;
	}

	// NAME : IDENTIFIER | STRING | keyword
	String NAME() throws IOException {
		String name;
		if (token == Token.STRING) {
			name = lexer.getStringValue();
		} else if (token == Token.IDENTIFIER || token.isKeyword()) {
			name = lexer.getText();
		} else {
			throw parserException("Expecting a name but found " + token.getDisplay());
		}
		lexer();
		return name;
	}

	String STRING() throws IOException {
		if (token != Token.STRING) {
			throw parserException("Expecting " + Token.STRING.getDisplay() + " but found " + token.getDisplay());
		}
		String value = lexer.getStringValue();
		lexer();
		return value;
	}

	String NUMBER() throws IOException {
		if (token != Token.NUMBER) {
			throw parserException("Expecting " + Token.NUMBER.getDisplay() + " but found " + token.getDisplay());
		}
		String value = lexer.getText();
		lexer();
		return value;
	}

	// CHECKSTYLE.ON: MethodName

	private ParserException parserException(String msg) {
		String near = lexer.getText();
		return new ParserException(
				msg,
				lexer.getSourceDescription(),
				lexer.getLineNumber(),
				near.isEmpty() ? token.getDisplay() : near);
	}
}
