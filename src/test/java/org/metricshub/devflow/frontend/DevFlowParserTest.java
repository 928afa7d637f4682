package org.metricshub.devflow.frontend;

import static org.junit.Assert.*;
import static org.metricshub.devflow.DevFlowTestSupport.inJob;
import static org.metricshub.devflow.DevFlowTestSupport.parse;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.devflow.frontend.ast.Artifact;
import org.metricshub.devflow.frontend.ast.Job;
import org.metricshub.devflow.frontend.ast.MatrixAxis;
import org.metricshub.devflow.frontend.ast.ParserException;
import org.metricshub.devflow.frontend.ast.Pipeline;
import org.metricshub.devflow.frontend.ast.Service;
import org.metricshub.devflow.frontend.ast.Stage;
import org.metricshub.devflow.frontend.ast.Step;
import org.metricshub.devflow.frontend.ast.StepKind;
import org.metricshub.devflow.frontend.ast.StepPayload;
import org.metricshub.devflow.frontend.ast.Trigger;
import org.metricshub.devflow.frontend.ast.TriggerKind;
import org.metricshub.devflow.util.ScriptSource;

public class DevFlowParserTest {

	private static Job singleJob(String jobBody) throws Exception {
		List<Pipeline> pipelines = parse(inJob(jobBody));
		assertEquals(1, pipelines.size());
		return pipelines.get(0).getStages().get(0).getJobs().get(0);
	}

	private static ParserException parseError(String script) {
		return assertThrows(ParserException.class, () -> parse(script));
	}

	@Test
	public void testMinimalPipeline() throws Exception {
		List<Pipeline> pipelines = parse("pipeline ci { stage build { job compile { step run(\"make\") } } }");
		assertEquals(1, pipelines.size());
		Pipeline pipeline = pipelines.get(0);
		assertEquals("ci", pipeline.getName());
		assertTrue(pipeline.getTriggers().isEmpty());
		assertTrue(pipeline.getArtifacts().isEmpty());
		Stage stage = pipeline.getStages().get(0);
		assertEquals("build", stage.getName());
		Job job = stage.getJobs().get(0);
		assertEquals("compile", job.getName());
		assertNull("No image declared", job.getImage());
		assertTrue(job.getServices().isEmpty());
		assertTrue(job.getArtifacts().isEmpty());
		assertTrue(job.getMatrix().isEmpty());
		Step step = job.getSteps().get(0);
		assertEquals(StepKind.RUN, step.getKind());
		assertEquals("make", step.getCommand());
	}

	@Test
	public void testMultiplePipelinesAccumulateInOrder() throws Exception {
		List<Pipeline> pipelines = parse(
				"pipeline first { stage s { job j { step checkout() } } }\n"
						+ "pipeline second { stage s { job j { step checkout() } } }\n"
						+ "pipeline third { stage s { job j { step checkout() } } }\n");
		assertEquals(3, pipelines.size());
		assertEquals("first", pipelines.get(0).getName());
		assertEquals("second", pipelines.get(1).getName());
		assertEquals("third", pipelines.get(2).getName());
	}

	@Test
	public void testDeterminism() throws Exception {
		String script = "pipeline ci {\n on push(\"main\", \"dev\"), manual\n"
				+ " stage a { job x { matrix [os: [\"linux\", \"mac\"]] image \"alpine\"\n"
				+ "  service db { image \"pg\" port 1:2 env A = \"1\" }\n"
				+ "  step run(command = \"go\") step deploy(to = \"prod\") artifact \"out\"; } }\n"
				+ " artifact \"report\";\n}\n";
		assertEquals("Same text must give the same tree", parse(script), parse(script));
	}

	@Test
	public void testTriggers() throws Exception {
		List<Trigger> triggers = parse(
				"pipeline p {\n"
						+ " on push(\"main\", \"develop\"), pull_request(\"main\"), schedule(\"0 0 * * *\"), manual, push;\n"
						+ " stage s { job j { step checkout() } }\n"
						+ "}").get(0).getTriggers();
		assertEquals(5, triggers.size());

		assertEquals(TriggerKind.PUSH, triggers.get(0).getKind());
		assertEquals("Patterns are merged with commas", "main,develop", triggers.get(0).getPattern());
		assertEquals(Arrays.asList("main", "develop"), triggers.get(0).getPatterns());

		assertEquals(TriggerKind.PULL_REQUEST, triggers.get(1).getKind());
		assertEquals("main", triggers.get(1).getPattern());

		assertEquals(TriggerKind.SCHEDULE, triggers.get(2).getKind());
		assertEquals("0 0 * * *", triggers.get(2).getPattern());

		assertEquals(TriggerKind.MANUAL, triggers.get(3).getKind());
		assertNull(triggers.get(3).getPattern());

		assertEquals(TriggerKind.PUSH, triggers.get(4).getKind());
		assertNull("Unparameterized trigger has no pattern", triggers.get(4).getPattern());
		assertTrue(triggers.get(4).getPatterns().isEmpty());
	}

	@Test
	public void testManualTriggerRejectsParameters() {
		ParserException e = parseError("pipeline p { on manual(\"x\") stage s { job j { step checkout() } } }");
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testTriggerRequiresPattern() {
		parseError("pipeline p { on push() stage s { job j { step checkout() } } }");
	}

	@Test
	public void testArtifactStatementGivesOneArtifactPerPath() throws Exception {
		Job job = singleJob("step checkout()\nartifact \"a\", \"b\", \"c\";");
		List<Artifact> artifacts = job.getArtifacts();
		assertEquals(3, artifacts.size());
		assertEquals("a", artifacts.get(0).getPath());
		assertEquals("b", artifacts.get(1).getPath());
		assertEquals("c", artifacts.get(2).getPath());
	}

	@Test
	public void testArtifactStatementsAccumulate() throws Exception {
		Pipeline pipeline = parse(
				"pipeline p { stage s { job j { step checkout() } }\n"
						+ " artifact \"x\";\n artifact \"y\", \"z\";\n}").get(0);
		assertEquals(3, pipeline.getArtifacts().size());
		assertEquals("x", pipeline.getArtifacts().get(0).getPath());
		assertEquals("z", pipeline.getArtifacts().get(2).getPath());
	}

	@Test
	public void testArtifactRequiresSemicolon() {
		parseError(inJob("step checkout()\nartifact \"a\""));
	}

	@Test
	public void testArtifactsMustFollowStages() {
		parseError(
				"pipeline p { stage s { job j { step checkout() } }\n"
						+ " artifact \"x\";\n stage t { job k { step checkout() } }\n}");
	}

	@Test
	public void testMatrixPositionDoesNotMatter() throws Exception {
		String matrix = "matrix [os: [\"linux\", \"windows\"], jdk: [\"11\", \"17\"]]";
		String rest = "image \"maven\"\nservice db { image \"pg\" }\nstep checkout()\nstep run(\"mvn\")";

		List<MatrixAxis> first = singleJob(matrix + "\n" + rest).getMatrix();
		List<MatrixAxis> afterImage = singleJob(
				"image \"maven\"\n" + matrix + "\nservice db { image \"pg\" }\nstep checkout()\nstep run(\"mvn\")")
				.getMatrix();
		List<MatrixAxis> last = singleJob(rest + "\n" + matrix).getMatrix();

		assertEquals(2, first.size());
		assertEquals("os", first.get(0).getName());
		assertEquals(Arrays.asList("linux", "windows"), first.get(0).getValues());
		assertEquals("jdk", first.get(1).getName());
		assertEquals(Arrays.asList("11", "17"), first.get(1).getValues());
		assertEquals(first, afterImage);
		assertEquals(first, last);
	}

	@Test
	public void testSeveralMatrixDeclarationsKeepOrder() throws Exception {
		Job job = singleJob("matrix [a: [\"1\"]]\nstep checkout()\nmatrix [b: [\"2\"]];");
		assertEquals(2, job.getMatrix().size());
		assertEquals("a", job.getMatrix().get(0).getName());
		assertEquals("b", job.getMatrix().get(1).getName());
	}

	@Test
	public void testServiceWithoutPort() throws Exception {
		Service service = singleJob("service cache { image \"redis\" }\nstep checkout()").getServices().get(0);
		assertEquals("cache", service.getName());
		assertEquals("redis", service.getImage());
		assertFalse(service.hasPort());
		assertNull(service.getPortHost());
		assertNull(service.getPortContainer());
		assertTrue(service.getEnvVars().isEmpty());
	}

	@Test
	public void testServiceWithPortAndEnv() throws Exception {
		Service service = singleJob(
				"service db {\n image \"postgres\"\n port 5432:5432;\n env USER = \"ci\";\n env PASSWORD = \"s3cret\"\n}\n"
						+ "step checkout()").getServices().get(0);
		assertEquals("5432", service.getPortHost());
		assertEquals("5432", service.getPortContainer());
		assertEquals(2, service.getEnvVars().size());
		assertEquals("USER", service.getEnvVars().get(0).getName());
		assertEquals("ci", service.getEnvVars().get(0).getValue());
		assertEquals("PASSWORD", service.getEnvVars().get(1).getName());
		assertEquals("s3cret", service.getEnvVars().get(1).getValue());
	}

	@Test
	public void testPartialPortIsRejected() {
		parseError(inJob("service db { image \"pg\" port 5432 }\nstep checkout()"));
	}

	@Test
	public void testServiceRequiresImage() {
		parseError(inJob("service db { port 1:2 }\nstep checkout()"));
	}

	@Test
	public void testStepKinds() throws Exception {
		List<Step> steps = singleJob(
				"step checkout();\n"
						+ "step run(\"make test\")\n"
						+ "step run(shell = \"bash\", command = \"./build.sh\")\n"
						+ "step run(shell = \"bash\")\n"
						+ "step deploy(target = \"prod\", region = \"eu\")\n"
						+ "step notify()").getSteps();
		assertEquals(6, steps.size());

		assertEquals(StepKind.CHECKOUT, steps.get(0).getKind());
		assertNull(steps.get(0).getCommand());
		assertTrue(steps.get(0).getArgs().isEmpty());

		assertEquals("make test", steps.get(1).getCommand());
		assertTrue(steps.get(1).getPayload() instanceof StepPayload.Literal);

		assertEquals("command argument becomes the command", "./build.sh", steps.get(2).getCommand());
		assertTrue(steps.get(2).getPayload() instanceof StepPayload.Arguments);

		assertNull("run without command argument has no command", steps.get(3).getCommand());
		assertEquals(1, steps.get(3).getArgs().size());

		Step deploy = steps.get(4);
		assertEquals(StepKind.DEPLOY, deploy.getKind());
		assertNull(deploy.getCommand());
		assertEquals(2, deploy.getArgs().size());
		assertEquals("target", deploy.getArgs().get(0).getName());
		assertEquals("prod", deploy.getArgs().get(0).getValue());
		assertEquals("region", deploy.getArgs().get(1).getName());
		assertEquals("eu", deploy.getArgs().get(1).getValue());

		assertEquals(StepKind.NOTIFY, steps.get(5).getKind());
		assertEquals(Collections.emptyList(), steps.get(5).getArgs());
	}

	@Test
	public void testStepPayloadErrors() {
		ParserException checkout = parseError(inJob("step checkout(\"x\")"));
		assertEquals("\"x\"", checkout.getNearText());
		parseError(inJob("step deploy(\"prod\")"));
		parseError(inJob("step run()"));
		parseError(inJob("step run(\"a\", \"b\")"));
		parseError(inJob("step run(command)"));
		parseError(inJob("step cache(key = \"x\")"));
	}

	@Test
	public void testKeywordsAreAcceptedAsNames() throws Exception {
		Pipeline pipeline = parse(
				"pipeline \"my pipeline\" {\n stage deploy {\n  job image {\n"
						+ "   service cache { image \"redis\" env port = \"6379\" }\n"
						+ "   step deploy(image = \"app\", env = \"prod\")\n  }\n }\n}").get(0);
		assertEquals("my pipeline", pipeline.getName());
		assertEquals("deploy", pipeline.getStages().get(0).getName());
		Job job = pipeline.getStages().get(0).getJobs().get(0);
		assertEquals("image", job.getName());
		assertEquals("cache", job.getServices().get(0).getName());
		assertEquals("port", job.getServices().get(0).getEnvVars().get(0).getName());
		assertEquals("image", job.getSteps().get(0).getArgs().get(0).getName());
	}

	@Test
	public void testListsKeepDeclarationOrder() throws Exception {
		Pipeline pipeline = parse(
				"pipeline p {\n"
						+ " stage one { job a { step run(\"1\") step run(\"2\") step run(\"3\") } job b { step checkout() } }\n"
						+ " stage two { job c { step checkout() } }\n"
						+ " stage three { job d { step checkout() } }\n"
						+ "}").get(0);
		assertEquals("one", pipeline.getStages().get(0).getName());
		assertEquals("two", pipeline.getStages().get(1).getName());
		assertEquals("three", pipeline.getStages().get(2).getName());
		Stage one = pipeline.getStages().get(0);
		assertEquals("a", one.getJobs().get(0).getName());
		assertEquals("b", one.getJobs().get(1).getName());
		List<Step> steps = one.getJobs().get(0).getSteps();
		assertEquals("1", steps.get(0).getCommand());
		assertEquals("2", steps.get(1).getCommand());
		assertEquals("3", steps.get(2).getCommand());
	}

	@Test
	public void testEmptyStageIsRejected() {
		ParserException e = parseError("pipeline p {\n stage s {\n }\n}");
		assertEquals(3, e.getLineNumber());
		assertEquals("}", e.getNearText());
	}

	@Test
	public void testJobWithoutStepsIsRejected() {
		parseError(inJob("image \"alpine\""));
		parseError(inJob("matrix [os: [\"linux\"]]"));
		parseError(inJob(""));
	}

	@Test
	public void testPipelineWithoutStageIsRejected() {
		parseError("pipeline p { on push }");
	}

	@Test
	public void testElementsOutOfOrderAreRejected() {
		parseError(inJob("step checkout()\nimage \"alpine\""));
		parseError(inJob("step checkout()\nservice db { image \"pg\" }"));
		parseError(inJob("artifact \"a\";\nstep checkout()"));
	}

	@Test
	public void testReservedWordsAreNotStatements() {
		parseError(inJob("step checkout()\nif"));
		parseError(inJob("cache \"x\"\nstep checkout()"));
	}

	@Test
	public void testUnclosedBraceReportsLastConsumedLine() {
		ParserException e = parseError("pipeline p {\n stage s {\n  job j {\n   step run(\"x\")\n\n\n");
		assertEquals("Line of the last consumed token", 4, e.getLineNumber());
		assertEquals("end of file", e.getNearText());
		assertEquals("test", e.getSourceDescription());
	}

	@Test
	public void testEmptyInputIsRejected() {
		parseError("");
		parseError("# only a comment\n");
	}

	@Test
	public void testFirstErrorStopsParsing() {
		ParserException e = parseError(
				"pipeline ok { stage s { job j { step checkout() } } }\n"
						+ "pipeline broken { stage s { job j { step checkout( } } }\n"
						+ "pipeline never { }\n");
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testBuilderAccumulatesAcrossParses() throws Exception {
		AstBuilder builder = new AstBuilder();
		DevFlowParser parser = new DevFlowParser();
		parser.parse(new ScriptSource("a", new StringReader("pipeline a { stage s { job j { step checkout() } } }")), builder);
		List<Pipeline> all = parser
				.parse(new ScriptSource("b", new StringReader("pipeline b { stage s { job j { step checkout() } } }")), builder);
		assertEquals(2, all.size());
		assertEquals("a", all.get(0).getName());
		assertEquals("b", all.get(1).getName());
	}

	@Test
	public void testFailedParseLeavesBuilderUntouched() throws Exception {
		AstBuilder builder = new AstBuilder();
		DevFlowParser parser = new DevFlowParser();
		String broken = "pipeline a { stage s { job j { step checkout() } } }\npipeline broken { stage s { } }";
		assertThrows(ParserException.class, () -> parser.parse(new ScriptSource("broken", new StringReader(broken)), builder));
		assertTrue(builder.pipelines().isEmpty());

		List<Pipeline> all = parser
				.parse(new ScriptSource("c", new StringReader("pipeline c { stage s { job j { step checkout() } } }")), builder);
		assertEquals(1, all.size());
		assertEquals("c", all.get(0).getName());
	}

	@Test
	public void testNodeLineNumbers() throws Exception {
		Pipeline pipeline = parse("\npipeline p {\n stage s {\n  job j {\n   step checkout()\n  }\n }\n}").get(0);
		assertEquals(2, pipeline.getLineNumber());
		assertEquals(3, pipeline.getStages().get(0).getLineNumber());
		assertEquals(4, pipeline.getStages().get(0).getJobs().get(0).getLineNumber());
		assertEquals(5, pipeline.getStages().get(0).getJobs().get(0).getSteps().get(0).getLineNumber());
	}
}
