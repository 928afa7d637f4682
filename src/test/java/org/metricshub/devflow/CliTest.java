package org.metricshub.devflow;

import static org.junit.Assert.*;
import static org.metricshub.devflow.DevFlowTestSupport.examplePath;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Test;

public class CliTest {

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private int execute(String... args) throws Exception {
		PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8.name());
		PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8.name());
		return Cli.execute(args, outStream, errStream);
	}

	private String out() throws Exception {
		return out.toString(StandardCharsets.UTF_8.name());
	}

	private String err() throws Exception {
		return err.toString(StandardCharsets.UTF_8.name());
	}

	@Test
	public void testValidFile() throws Exception {
		assertEquals(Cli.EXIT_SUCCESS, execute(examplePath("full_cicd_pipeline.devflow")));
		assertTrue(out().contains("Pipeline: full-cicd"));
		assertTrue(out().contains("Pipeline: nightly"));
		assertEquals("", err());
	}

	@Test
	public void testQuiet() throws Exception {
		assertEquals(Cli.EXIT_SUCCESS, execute("-q", examplePath("simple_pipeline.devflow")));
		assertEquals("", out());
	}

	@Test
	public void testSyntaxError() throws Exception {
		File file = File.createTempFile("devflow", ".devflow");
		file.deleteOnExit();
		Files.write(file.toPath(), "pipeline p {\n  stage s {\n  }\n}\n".getBytes(StandardCharsets.UTF_8));
		assertEquals(Cli.EXIT_FAILURE, execute(file.getAbsolutePath()));
		assertTrue(err().startsWith("Error at line 3: "));
		assertTrue(err().contains("Near: }"));
		assertEquals("No summary on failure", "", out());
	}

	@Test
	public void testMissingFile() throws Exception {
		Path tempDir = Files.createTempDirectory("devflow-test");
		tempDir.toFile().deleteOnExit();
		File missing = tempDir.resolve("missing.devflow").toFile();
		assertEquals(Cli.EXIT_FAILURE, execute(missing.getAbsolutePath()));
		assertTrue(err().contains("cannot open file"));
	}

	@Test
	public void testInvalidArguments() throws Exception {
		assertEquals(Cli.EXIT_FAILURE, execute());
		assertEquals(Cli.EXIT_FAILURE, execute("--bogus", "x.devflow"));
		assertEquals(Cli.EXIT_FAILURE, execute("a.devflow", "b.devflow"));
		assertTrue(err().contains("Usage:"));
	}

	@Test
	public void testUsage() throws Exception {
		assertEquals(Cli.EXIT_SUCCESS, execute("-h"));
		assertTrue(out().startsWith("Usage:"));
	}

	@Test
	public void testParseArguments() {
		Cli cli = new Cli();
		cli.parse(new String[] { "--quiet", "pipeline.devflow" });
		assertTrue(cli.getSettings().isQuiet());
		assertEquals("pipeline.devflow", cli.getInputFile());
	}
}
