package com.olo.unit.runner.cli;

import com.olo.unit.core.path.TestPath;
import com.olo.unit.runner.OloUnitConfig;
import com.olo.unit.runner.RunnerOptions;
import com.olo.unit.runner.fixtures.Modules;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OloUnitCommandTest {

    @TempDir
    Path tempDir;

    private record CliResult(int exitCode, String out, String err) {
    }

    private static CliResult run(String... args) {
        return run(new ByteArrayInputStream(new byte[0]), args);
    }

    private static CliResult run(InputStream in, String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int exitCode = OloUnitCommand.execute(OloUnitConfig.builder().build(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                in, args);
        return new CliResult(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private static RunnerOptions parse(String... args) {
        OloUnitCommand command = new OloUnitCommand(OloUnitConfig.builder().xmlEncoding("UTF-8").build(),
                System.out, System.err, System.in);
        new CommandLine(command).parseArgs(args);
        return command.toOptions();
    }

    @Test
    void noArguments_printsUsageAndExitsWithUsageCode() {
        CliResult result = run();

        assertEquals(OloUnitCommand.EXIT_USAGE, result.exitCode());
        assertTrue(result.out().contains("Usage: olo-unit"));
    }

    @Test
    void unknownOption_exitsWithUsageCode() {
        CliResult result = run("--frobnicate", "tests.jar");

        assertEquals(OloUnitCommand.EXIT_USAGE, result.exitCode());
        assertTrue(result.err().contains("--frobnicate"));
    }

    @Test
    void twoTestPaths_exitWithUsageCode() {
        CliResult result = run("tests.jar", ":A", ":B");

        assertEquals(OloUnitCommand.EXIT_USAGE, result.exitCode());
        assertTrue(result.err().contains("Only one test path"));
    }

    @Test
    void unsupportedXmlEncoding_exitsWithUsageCodeBeforeRunning() throws IOException {
        CliResult result = run("-b", "-x", "-e", "NO-SUCH-CHARSET", Modules.sample(tempDir).toString());

        assertEquals(OloUnitCommand.EXIT_USAGE, result.exitCode());
        assertTrue(result.err().contains("Unsupported XML encoding: NO-SUCH-CHARSET"), result.err());
        assertFalse(result.out().contains("adds : OK"));
    }

    @Test
    void missingPlugin_exitsWithFailureCode() {
        CliResult result = run("-n", tempDir.resolve("missing.jar").toString());

        assertEquals(OloUnitCommand.EXIT_FAILURE, result.exitCode());
        assertTrue(result.err().contains("Failed to load test plug-in:"));
        assertTrue(result.err().contains("MODULE_NOT_FOUND"));
    }

    @Test
    void greenRun_exitsWithSuccessCode() throws IOException {
        CliResult result = run("-t", "-o", Modules.sample(tempDir) + "=green");

        assertEquals(OloUnitCommand.EXIT_SUCCESS, result.exitCode(), result.err());
        assertTrue(result.out().contains("OK (2)"));
    }

    @Test
    void failingRun_exitsWithFailureCode() throws IOException {
        CliResult result = run("-b", "-c", Modules.sample(tempDir).toString());

        assertEquals(OloUnitCommand.EXIT_FAILURE, result.exitCode());
        assertTrue(result.out().contains("asserts : assertion"));
        assertTrue(result.err().contains("Failures !!!"));
    }

    @Test
    void unresolvedTestPath_exitsWithFailureCode() throws IOException {
        CliResult result = run("-n", Modules.sample(tempDir) + "=green", ":Sample/Nothing");

        assertEquals(OloUnitCommand.EXIT_FAILURE, result.exitCode());
        assertTrue(result.err().contains("Failed to resolve test path: Sample/Nothing"));
    }

    @Test
    void xmlToFile_withClockerParameters() throws IOException {
        Path report = tempDir.resolve("report.xml");

        CliResult result = run("-n", "-x", report.toString(), "-s", "style.xsl",
                Modules.clocker(tempDir) + "=flat", Modules.sample(tempDir) + "=green");

        assertEquals(OloUnitCommand.EXIT_SUCCESS, result.exitCode(), result.err());
        String xml = Files.readString(report, StandardCharsets.ISO_8859_1);
        assertTrue(xml.contains("encoding=\"ISO-8859-1\""));
        assertTrue(xml.contains("style.xsl"));
        assertTrue(xml.contains("<Time>"));
    }

    @Test
    void waitOption_promptsAndReadsALine() throws IOException {
        CliResult result = run(new ByteArrayInputStream("\n".getBytes(StandardCharsets.UTF_8)),
                "-n", "-w", Modules.sample(tempDir) + "=green");

        assertEquals(OloUnitCommand.EXIT_SUCCESS, result.exitCode());
        assertTrue(result.out().contains("Please press <RETURN> to exit"));
    }

    @Test
    void toOptions_mapsFlagsAndArguments() {
        RunnerOptions options = parse("-c", "-t", "-b", "-o", "-x", "-e", "UTF-16", "a.jar=x y", "b.jar", ":Suite/test");

        assertTrue(options.useCompilerOutputter());
        assertTrue(options.useTextOutputter());
        assertTrue(options.useXmlOutputter());
        assertEquals("", options.getXmlFileName());
        assertEquals("UTF-16", options.getEncoding());
        assertEquals(RunnerOptions.Progress.BRIEF, options.getProgress());
        assertTrue(options.useStdout());
        assertEquals(2, options.getPlugins().size());
        assertEquals("x y", options.getPlugins().get(0).parameters().value());
        assertEquals(Path.of("b.jar"), options.getPlugins().get(1).module());
        assertEquals(TestPath.of("Suite", "test"), options.getTestPath());
    }

    @Test
    void toOptions_defaultsFromConfig() {
        RunnerOptions options = parse("-n", "a.jar");

        assertEquals("UTF-8", options.getEncoding());
        assertEquals(RunnerOptions.Progress.NONE, options.getProgress());
        assertTrue(options.getTestPath().isEmpty());
        assertFalse(options.useXmlOutputter());
    }
}
