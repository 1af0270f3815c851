package com.olo.unit.runner;

import com.olo.unit.report.xml.XmlOutputter;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runner defaults loaded from environment variables. Command line options override them.
 * <p>
 * OLO_UNIT_PLUGINS_DIR: directory whose {@code *.jar} plug-in modules are loaded before the ones named
 * on the command line (unset: none). OLO_UNIT_XML_ENCODING: XML report encoding (default
 * ISO-8859-1). OLO_UNIT_XSL: style sheet referenced by the XML report (default none).
 */
public final class OloUnitConfig {

    private static final String ENV_PLUGINS_DIR = "OLO_UNIT_PLUGINS_DIR";
    private static final String ENV_XML_ENCODING = "OLO_UNIT_XML_ENCODING";
    private static final String ENV_XSL = "OLO_UNIT_XSL";

    private static final String DEFAULT_XML_ENCODING = XmlOutputter.DEFAULT_ENCODING;
    private static final String DEFAULT_XSL = "";

    private final Path pluginsDirectory;
    private final String xmlEncoding;
    private final String xmlStyleSheet;

    private OloUnitConfig(Builder b) {
        this.pluginsDirectory = b.pluginsDirectory;
        this.xmlEncoding = b.xmlEncoding;
        this.xmlStyleSheet = b.xmlStyleSheet;
    }

    public Optional<Path> getPluginsDirectory() {
        return Optional.ofNullable(pluginsDirectory);
    }

    public String getXmlEncoding() {
        return xmlEncoding;
    }

    /** Empty when the report references no style sheet. */
    public String getXmlStyleSheet() {
        return xmlStyleSheet;
    }

    public static OloUnitConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static OloUnitConfig fromEnvironment(Function<String, String> env) {
        String dir = getEnv(env, ENV_PLUGINS_DIR, null);
        return builder()
                .pluginsDirectory(dir != null ? Path.of(dir) : null)
                .xmlEncoding(getEnv(env, ENV_XML_ENCODING, DEFAULT_XML_ENCODING))
                .xmlStyleSheet(getEnv(env, ENV_XSL, DEFAULT_XSL))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private Path pluginsDirectory;
        private String xmlEncoding = DEFAULT_XML_ENCODING;
        private String xmlStyleSheet = DEFAULT_XSL;

        public Builder pluginsDirectory(Path pluginsDirectory) {
            this.pluginsDirectory = pluginsDirectory;
            return this;
        }

        public Builder xmlEncoding(String xmlEncoding) {
            this.xmlEncoding = xmlEncoding != null ? xmlEncoding : DEFAULT_XML_ENCODING;
            return this;
        }

        public Builder xmlStyleSheet(String xmlStyleSheet) {
            this.xmlStyleSheet = xmlStyleSheet != null ? xmlStyleSheet : DEFAULT_XSL;
            return this;
        }

        public OloUnitConfig build() {
            return new OloUnitConfig(this);
        }
    }
}
