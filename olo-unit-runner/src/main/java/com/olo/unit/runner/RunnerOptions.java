package com.olo.unit.runner;

import com.olo.unit.core.path.TestPath;
import com.olo.unit.report.xml.XmlOutputter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What {@link PluginTestRunner} should load, run and report. Immutable; see {@link #builder()}.
 */
public final class RunnerOptions {

    /** Progress shown while tests run. */
    public enum Progress {
        /** {@code .} per test. */
        TEXT,
        /** One line per test. */
        BRIEF,
        NONE
    }

    private final boolean compilerOutputter;
    private final boolean textOutputter;
    private final boolean xmlOutputter;
    private final String xmlFileName;
    private final String xmlStyleSheet;
    private final String encoding;
    private final Progress progress;
    private final boolean useStdout;
    private final boolean waitBeforeExit;
    private final Path pluginsDirectory;
    private final List<PluginArgument> plugins;
    private final TestPath testPath;

    private RunnerOptions(Builder b) {
        this.compilerOutputter = b.compilerOutputter;
        this.textOutputter = b.textOutputter;
        this.xmlOutputter = b.xmlOutputter;
        this.xmlFileName = b.xmlFileName;
        this.xmlStyleSheet = b.xmlStyleSheet;
        this.encoding = b.encoding;
        this.progress = b.progress;
        this.useStdout = b.useStdout;
        this.waitBeforeExit = b.waitBeforeExit;
        this.pluginsDirectory = b.pluginsDirectory;
        this.plugins = List.copyOf(b.plugins);
        this.testPath = b.testPath;
    }

    public boolean useCompilerOutputter() {
        return compilerOutputter;
    }

    public boolean useTextOutputter() {
        return textOutputter;
    }

    public boolean useXmlOutputter() {
        return xmlOutputter;
    }

    /** XML report file; empty to write the report to the output stream. */
    public String getXmlFileName() {
        return xmlFileName;
    }

    public String getXmlStyleSheet() {
        return xmlStyleSheet;
    }

    public String getEncoding() {
        return encoding;
    }

    public Progress getProgress() {
        return progress;
    }

    /** Reports go to stdout instead of stderr. */
    public boolean useStdout() {
        return useStdout;
    }

    public boolean waitBeforeExit() {
        return waitBeforeExit;
    }

    public Optional<Path> getPluginsDirectory() {
        return Optional.ofNullable(pluginsDirectory);
    }

    /** Plug-ins in load order. */
    public List<PluginArgument> getPlugins() {
        return plugins;
    }

    public TestPath getTestPath() {
        return testPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with the defaults of {@code config}. */
    public static Builder builder(OloUnitConfig config) {
        return new Builder()
                .encoding(config.getXmlEncoding())
                .xmlStyleSheet(config.getXmlStyleSheet())
                .pluginsDirectory(config.getPluginsDirectory().orElse(null));
    }

    public static final class Builder {
        private boolean compilerOutputter;
        private boolean textOutputter;
        private boolean xmlOutputter;
        private String xmlFileName = "";
        private String xmlStyleSheet = "";
        private String encoding = XmlOutputter.DEFAULT_ENCODING;
        private Progress progress = Progress.TEXT;
        private boolean useStdout;
        private boolean waitBeforeExit;
        private Path pluginsDirectory;
        private final List<PluginArgument> plugins = new ArrayList<>();
        private TestPath testPath = TestPath.empty();

        public Builder compilerOutputter(boolean compilerOutputter) {
            this.compilerOutputter = compilerOutputter;
            return this;
        }

        public Builder textOutputter(boolean textOutputter) {
            this.textOutputter = textOutputter;
            return this;
        }

        public Builder xmlOutputter(boolean xmlOutputter) {
            this.xmlOutputter = xmlOutputter;
            return this;
        }

        public Builder xmlFileName(String xmlFileName) {
            this.xmlFileName = xmlFileName != null ? xmlFileName : "";
            return this;
        }

        public Builder xmlStyleSheet(String xmlStyleSheet) {
            this.xmlStyleSheet = xmlStyleSheet != null ? xmlStyleSheet : "";
            return this;
        }

        public Builder encoding(String encoding) {
            this.encoding = encoding != null && !encoding.isBlank() ? encoding : XmlOutputter.DEFAULT_ENCODING;
            return this;
        }

        public Builder progress(Progress progress) {
            this.progress = Objects.requireNonNull(progress, "progress");
            return this;
        }

        public Builder useStdout(boolean useStdout) {
            this.useStdout = useStdout;
            return this;
        }

        public Builder waitBeforeExit(boolean waitBeforeExit) {
            this.waitBeforeExit = waitBeforeExit;
            return this;
        }

        public Builder pluginsDirectory(Path pluginsDirectory) {
            this.pluginsDirectory = pluginsDirectory;
            return this;
        }

        public Builder addPlugin(PluginArgument plugin) {
            plugins.add(Objects.requireNonNull(plugin, "plugin"));
            return this;
        }

        public Builder testPath(TestPath testPath) {
            this.testPath = testPath != null ? testPath : TestPath.empty();
            return this;
        }

        public RunnerOptions build() {
            return new RunnerOptions(this);
        }
    }
}
