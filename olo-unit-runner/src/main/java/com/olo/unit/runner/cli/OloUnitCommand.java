package com.olo.unit.runner.cli;

import com.olo.unit.core.path.TestPath;
import com.olo.unit.plugin.PluginLoadException;
import com.olo.unit.runner.OloUnitConfig;
import com.olo.unit.runner.PluginArgument;
import com.olo.unit.runner.PluginTestRunner;
import com.olo.unit.runner.RunnerOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line driver: {@code olo-unit [options] plugin[=parameters]... [:testPath]}.
 * <p>
 * Exit code 0 when every selected test passed; 1 when a test failed, a plug-in could not be loaded or
 * the test path did not resolve; 2 when the command line is malformed or empty.
 */
@Command(
        name = "olo-unit",
        mixinStandardHelpOptions = true,
        version = "olo-unit 1.0.0",
        description = "Loads test plug-ins and runs the tests they register.",
        footer = {
                "",
                "Examples:",
                "  olo-unit -b -x tests.xml -c simple-plugin.jar more-tests.jar",
                "      brief progress, XML report in tests.xml, compiler style report",
                "  olo-unit clocker.jar=flat -n more-tests.jar :MoreTests/Parser",
                "      passes \"flat\" to the clocker plug-in, no progress, runs one suite"
        }
)
public class OloUnitCommand implements Callable<Integer> {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--compiler"}, description = "Use the compiler style outputter.")
    private boolean compiler;

    @Option(names = {"-x", "--xml"}, arity = "0..1", fallbackValue = "", paramLabel = "filename",
            description = "Use the XML outputter; without a file name the report goes to the report stream.")
    private String xmlFile;

    @Option(names = {"-s", "--xsl"}, paramLabel = "stylesheet",
            description = "Style sheet referenced by the XML report (default: $OLO_UNIT_XSL).")
    private String styleSheet;

    @Option(names = {"-e", "--encoding"}, paramLabel = "encoding",
            description = "XML report encoding (default: $OLO_UNIT_XML_ENCODING, else ISO-8859-1).")
    private String encoding;

    @Option(names = {"-b", "--brief-progress"}, description = "One line per test instead of dots.")
    private boolean briefProgress;

    @Option(names = {"-n", "--no-progress"}, description = "Show no test progress.")
    private boolean noProgress;

    @Option(names = {"-t", "--text"}, description = "Use the text outputter.")
    private boolean text;

    @Option(names = {"-o", "--cout"}, description = "Write reports to stdout instead of stderr.")
    private boolean cout;

    @Option(names = {"-w", "--wait"}, description = "Wait for RETURN before exiting.")
    private boolean waitBeforeExit;

    @Option(names = {"-d", "--plugins-dir"}, paramLabel = "directory",
            description = "Load every *.jar of this directory first (default: $OLO_UNIT_PLUGINS_DIR).")
    private Path pluginsDirectory;

    @Parameters(paramLabel = "plugin[=parameters] | :testPath",
            description = "Plug-in modules to load, in order, and at most one test path prefixed with ':'.")
    private List<String> arguments = new ArrayList<>();

    private final OloUnitConfig config;
    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;

    public OloUnitCommand(OloUnitConfig config, PrintStream out, PrintStream err, InputStream in) {
        this.config = config;
        this.out = out;
        this.err = err;
        this.in = in;
    }

    @Override
    public Integer call() {
        RunnerOptions options = toOptions();
        boolean wasSuccessful = false;
        try {
            wasSuccessful = new PluginTestRunner(out, err).runTests(options);
        } catch (PluginLoadException e) {
            err.println("Failed to load test plug-in:");
            err.println(e.getMessage());
        } catch (UncheckedIOException e) {
            err.println(e.getMessage());
        }
        if (options.waitBeforeExit()) {
            waitForReturn();
        }
        return wasSuccessful ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    RunnerOptions toOptions() {
        RunnerOptions.Builder builder = RunnerOptions.builder(config)
                .compilerOutputter(compiler)
                .textOutputter(text)
                .xmlOutputter(xmlFile != null)
                .xmlFileName(xmlFile)
                .progress(briefProgress ? RunnerOptions.Progress.BRIEF
                        : noProgress ? RunnerOptions.Progress.NONE : RunnerOptions.Progress.TEXT)
                .useStdout(cout)
                .waitBeforeExit(waitBeforeExit);
        if (styleSheet != null) {
            builder.xmlStyleSheet(styleSheet);
        }
        if (encoding != null) {
            builder.encoding(encoding);
        }
        if (pluginsDirectory != null) {
            builder.pluginsDirectory(pluginsDirectory);
        }
        TestPath testPath = null;
        for (String argument : arguments) {
            if (argument.startsWith(":")) {
                if (testPath != null) {
                    throw new ParameterException(spec.commandLine(), "Only one test path can be specified: " + argument);
                }
                testPath = TestPath.parse(argument.substring(1));
            } else {
                try {
                    builder.addPlugin(PluginArgument.parse(argument));
                } catch (IllegalArgumentException e) {
                    throw new ParameterException(spec.commandLine(), e.getMessage(), e);
                }
            }
        }
        RunnerOptions options = builder.testPath(testPath).build();
        if (options.useXmlOutputter()) {
            checkEncoding(options.getEncoding());
        }
        return options;
    }

    // Rejected before any plug-in is loaded, not after the run when the XML report is written.
    private void checkEncoding(String encoding) {
        try {
            Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Unsupported XML encoding: " + encoding, e);
        }
    }

    private void waitForReturn() {
        out.println("Please press <RETURN> to exit");
        out.flush();
        try {
            new BufferedReader(new InputStreamReader(in, Charset.defaultCharset())).readLine();
        } catch (IOException e) {
            err.println("Failed to read from stdin: " + e.getMessage());
        }
    }

    /** Parses {@code args}, runs and returns the exit code. No arguments at all print the usage. */
    public static int execute(OloUnitConfig config, PrintStream out, PrintStream err, InputStream in, String... args) {
        CommandLine commandLine = new CommandLine(new OloUnitCommand(config, out, err, in))
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true));
        if (args.length == 0) {
            commandLine.usage(out);
            return EXIT_USAGE;
        }
        return commandLine.execute(args);
    }

    public static void main(String[] args) {
        System.exit(execute(OloUnitConfig.fromEnvironment(), System.out, System.err, System.in, args));
    }
}
