package com.olo.unit.runner;

import com.olo.unit.core.path.TestPathNotFoundException;
import com.olo.unit.core.registry.TestFactoryRegistry;
import com.olo.unit.core.result.TestResult;
import com.olo.unit.core.result.TestResultCollector;
import com.olo.unit.plugin.PluginManager;
import com.olo.unit.report.CompilerOutputter;
import com.olo.unit.report.TextOutputter;
import com.olo.unit.report.xml.XmlOutputter;
import com.olo.unit.runner.listener.BriefTestProgressListener;
import com.olo.unit.runner.listener.TextTestProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads test plug-ins, runs the tests they registered and writes the reports.
 * <p>
 * Everything that holds objects from a plug-in module (the run controller with the plug-in listeners,
 * the outputters with the plug-in hooks) lives inside the try-with-resources block of the
 * {@link PluginManager}, and is released before the modules are unloaded.
 * <p>
 * Progress goes to the output stream; reports go to the error stream unless
 * {@link RunnerOptions#useStdout()}.
 */
public class PluginTestRunner {

    private static final Logger log = LoggerFactory.getLogger(PluginTestRunner.class);

    private final PrintStream out;
    private final PrintStream err;

    public PluginTestRunner(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    /**
     * Runs the tests {@code options} select.
     *
     * @return true if every selected test passed; false if a test failed or the test path did not resolve
     * @throws com.olo.unit.plugin.PluginLoadException if a plug-in module cannot be loaded
     * @throws UncheckedIOException                    if the XML report file cannot be written
     */
    public boolean runTests(RunnerOptions options) {
        Objects.requireNonNull(options, "options");
        TestFactoryRegistry registry = new TestFactoryRegistry();
        boolean wasSuccessful = false;
        try (PluginManager plugins = new PluginManager(registry)) {
            TestResult controller = new TestResult();
            TestResultCollector result = new TestResultCollector();
            controller.addListener(result);
            PrintStream stream = options.useStdout() ? out : err;

            switch (options.getProgress()) {
                case BRIEF -> controller.addListener(new BriefTestProgressListener(out));
                case TEXT -> controller.addListener(new TextTestProgressListener(out));
                case NONE -> { }
            }

            options.getPluginsDirectory().ifPresent(plugins::loadAll);
            for (PluginArgument plugin : options.getPlugins()) {
                plugins.load(plugin.module(), plugin.parameters());
            }

            plugins.addListener(controller);
            try {
                TestRunner runner = new TestRunner();
                runner.addTest(registry.makeTest());
                runner.run(controller, options.getTestPath());
                wasSuccessful = result.wasSuccessful();
            } catch (TestPathNotFoundException e) {
                err.println("Failed to resolve test path: " + options.getTestPath());
                log.debug("Test path resolution failed", e);
            } finally {
                plugins.removeListener(controller);
            }

            if (options.useCompilerOutputter()) {
                new CompilerOutputter(result, stream).write();
            }
            if (options.useTextOutputter()) {
                new TextOutputter(result, stream).write();
            }
            if (options.useXmlOutputter()) {
                writeXml(plugins, result, stream, options);
            }
            log.info("Ran {} test(s) from {} plug-in module(s): {} failure(s)",
                    result.runTests(), plugins.size(), result.testFailuresTotal());
        }
        return wasSuccessful;
    }

    private static void writeXml(PluginManager plugins, TestResultCollector result, PrintStream stream,
                                 RunnerOptions options) {
        String fileName = options.getXmlFileName();
        if (fileName.isEmpty()) {
            writeXml(plugins, new XmlOutputter(result, stream, options.getEncoding()), options);
            return;
        }
        try (OutputStream file = Files.newOutputStream(Path.of(fileName))) {
            writeXml(plugins, new XmlOutputter(result, file, options.getEncoding()), options);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write XML report " + fileName + ": " + e.getMessage(), e);
        }
    }

    private static void writeXml(PluginManager plugins, XmlOutputter outputter, RunnerOptions options) {
        outputter.setStyleSheet(options.getXmlStyleSheet());
        plugins.addXmlOutputterHooks(outputter);
        try {
            outputter.write();
        } finally {
            plugins.removeXmlOutputterHooks(outputter);
        }
    }
}
