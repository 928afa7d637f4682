package org.metricshub.devflow;

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
import java.io.PrintStream;
import java.io.StringReader;
import java.util.List;
import org.metricshub.devflow.backend.PipelinePrinter;
import org.metricshub.devflow.frontend.DevFlowParser;
import org.metricshub.devflow.frontend.ast.Pipeline;
import org.metricshub.devflow.frontend.ast.SourceException;
import org.metricshub.devflow.util.DevFlowLogger;
import org.metricshub.devflow.util.ScriptFileSource;
import org.metricshub.devflow.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and rendering of DevFlow documents, when
 * DevFlow is used as a library.
 * <p>
 * Each call parses one document with a fresh parser, so that no state is
 * shared between two parses. Syntax errors are reported in the returned
 * {@link ParseResult}; only I/O failures are thrown.
 */
public class DevFlow {

	private static final Logger LOG = DevFlowLogger.getLogger(DevFlow.class);

	/**
	 * Parses the specified document.
	 *
	 * @param source document to parse
	 * @return the pipelines, or the diagnostic of the first error
	 * @throws IOException if the document cannot be read
	 */
	public ParseResult parse(ScriptSource source) throws IOException {
		try {
			List<Pipeline> pipelines = new DevFlowParser().parse(source);
			LOG.debug("{}: {} pipeline(s) parsed", source.getDescription(), pipelines.size());
			return ParseResult.success(pipelines);
		} catch (SourceException e) {
			LOG.debug("{}: parse failed at line {}", source.getDescription(), e.getLineNumber());
			return ParseResult.failure(e);
		}
	}

	/**
	 * Parses the specified document text.
	 *
	 * @param script DevFlow text
	 * @return the pipelines, or the diagnostic of the first error
	 * @throws IOException upon an IO error
	 */
	public ParseResult parse(String script) throws IOException {
		return parse(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, new StringReader(script)));
	}

	/**
	 * Parses the specified file.
	 *
	 * @param filePath path of the document
	 * @return the pipelines, or the diagnostic of the first error
	 * @throws IOException if the file cannot be opened or read
	 */
	public ParseResult parseFile(String filePath) throws IOException {
		try (ScriptFileSource source = new ScriptFileSource(filePath)) {
			return parse(source);
		}
	}

	/**
	 * Writes the summary of the specified pipelines.
	 *
	 * @param pipelines pipelines to render
	 * @param out destination of the summary
	 */
	public void print(List<Pipeline> pipelines, PrintStream out) {
		new PipelinePrinter(out).print(pipelines);
	}
}
