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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.metricshub.devflow.util.DevFlowLogger;
import org.metricshub.devflow.util.DevFlowSettings;
import org.slf4j.Logger;

/**
 * Command-line interface for DevFlow.
 * <p>
 * Parses the file named by the single positional argument, prints the
 * summary of its pipelines and exits with {@code 0}, or exits with
 * {@code 1} when the file cannot be opened, the arguments are invalid, or
 * the document contains a syntax error.
 */
public final class Cli {

	private static final Logger LOG = DevFlowLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "devflow.jar";
		}
		JAR_NAME = myName;
	}

	/** Exit code of a successful run. */
	public static final int EXIT_SUCCESS = 0;

	/** Exit code when the input cannot be read or parsed. */
	public static final int EXIT_FAILURE = 1;

	private final DevFlowSettings settings = new DevFlowSettings();

	private String inputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param out stream where the summary is written
	 * @param err stream where error messages are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		settings.setOutputStream(out);
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link DevFlowSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public DevFlowSettings getSettings() {
		return settings;
	}

	/**
	 * @return the file to parse, or {@code null} when only usage was requested
	 */
	public String getInputFile() {
		return inputFile;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			throw new IllegalArgumentException("Input file not provided.");
		}

		for (int argIdx = 0; argIdx < args.length; argIdx++) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.equals("-h") || arg.equals("-?") || arg.equals("--help")) {
				// -h/-? : display usage information and exit
				if (args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else if (arg.equals("-q") || arg.equals("--quiet")) {
				// -q/--quiet : only report success or failure
				settings.setQuiet(true);
			} else if (arg.charAt(0) == '-' && arg.length() > 1) {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			} else if (inputFile != null) {
				throw new IllegalArgumentException("Only one input file is accepted, got " + inputFile + " and " + arg);
			} else {
				inputFile = arg;
			}
		}

		if (inputFile == null) {
			throw new IllegalArgumentException("Input file not provided.");
		}
	}

	/**
	 * Parses the input file and prints its summary, based on the previously
	 * parsed arguments.
	 *
	 * @return the process exit code
	 */
	public int run() {
		if (printUsage) {
			usage(settings.getOutputStream());
			return EXIT_SUCCESS;
		}
		PrintStream err = settings.getErrorStream();
		ParseResult result;
		try {
			result = new DevFlow().parseFile(inputFile);
		} catch (IOException e) {
			LOG.debug("Cannot read {}", inputFile, e);
			err.println("Error: cannot open file " + inputFile + ": " + e.getMessage());
			return EXIT_FAILURE;
		}
		if (!result.isSuccess()) {
			err.println(result.getErrorMessage());
			return EXIT_FAILURE;
		}
		if (!settings.isQuiet()) {
			new DevFlow().print(result.getPipelines(), settings.getOutputStream());
		}
		LOG.debug("{}: {} pipeline(s) parsed successfully", inputFile, result.getPipelines().size());
		return EXIT_SUCCESS;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("java -jar " + JAR_NAME + " [-q|--quiet] input_filename");
		dest.println();
		dest.println(" -q, --quiet = Do not print the pipeline summary, only report errors.");
		dest.println(" -h or -? = This help screen.");
		dest.println();
		dest.println("Exit code is 0 when every pipeline of the file parses, 1 otherwise.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns
	 * the exit code.
	 *
	 * @param args command-line arguments
	 * @param out stream for the summary
	 * @param err stream for diagnostic messages
	 * @return the exit code
	 */
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		Cli cli = new Cli(out, err);
		try {
			cli.parse(args);
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments: " + e.getMessage());
			usage(err);
			return EXIT_FAILURE;
		}
		return cli.run();
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		System.exit(execute(args, System.out, System.err));
	}
}
