package com.olo.unit.report.xml;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.olo.unit.core.Test;
import com.olo.unit.core.result.TestFailure;
import com.olo.unit.core.result.TestResultCollector;
import com.olo.unit.report.Outputter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * XML report of a finished run, serialized with Jackson XML. Tests get 1-based ids in run order; a test
 * with several failures is reported once, with its first failure.
 * <p>
 * The document starts with an XML declaration in the configured encoding (default
 * {@value #DEFAULT_ENCODING}) and, when a style sheet is set, an {@code xml-stylesheet} processing
 * instruction. Registered {@link XmlOutputterHook}s are called while the document is built.
 */
public class XmlOutputter implements Outputter {

    public static final String DEFAULT_ENCODING = "ISO-8859-1";

    private static final Logger log = LoggerFactory.getLogger(XmlOutputter.class);

    // Declaration is written by hand; the caller owns the stream.
    private static final ObjectWriter WRITER = XmlMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .build()
            .writer();

    private final TestResultCollector result;
    private final OutputStream stream;
    private final String encoding;
    private final List<XmlOutputterHook> hooks = new ArrayList<>();
    private String styleSheet = "";

    public XmlOutputter(TestResultCollector result, OutputStream stream) {
        this(result, stream, DEFAULT_ENCODING);
    }

    /**
     * @throws IllegalArgumentException if {@code encoding} is not a supported charset
     */
    public XmlOutputter(TestResultCollector result, OutputStream stream, String encoding) {
        this.result = Objects.requireNonNull(result, "result");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.encoding = encoding == null || encoding.isBlank() ? DEFAULT_ENCODING : encoding.trim();
        Charset.forName(this.encoding);
    }

    /** Style sheet referenced from the document; empty for none. */
    public void setStyleSheet(String styleSheet) {
        this.styleSheet = styleSheet != null ? styleSheet : "";
    }

    public String getStyleSheet() {
        return styleSheet;
    }

    public String getEncoding() {
        return encoding;
    }

    public void addHook(XmlOutputterHook hook) {
        hooks.add(Objects.requireNonNull(hook, "hook"));
    }

    /** Removes a hook. Returns false if it was not registered. */
    public boolean removeHook(XmlOutputterHook hook) {
        for (int i = 0; i < hooks.size(); i++) {
            if (hooks.get(i) == hook) {
                hooks.remove(i);
                return true;
            }
        }
        return false;
    }

    public List<XmlOutputterHook> getHooks() {
        return Collections.unmodifiableList(hooks);
    }

    @Override
    public void write() {
        TestRunDocument document = buildDocument();
        Writer writer = new OutputStreamWriter(stream, Charset.forName(encoding));
        try {
            writer.write("<?xml version=\"1.0\" encoding=\"" + encoding + "\"?>\n");
            if (!styleSheet.isEmpty()) {
                writer.write("<?xml-stylesheet type=\"text/xsl\" href=\""
                        + styleSheet.replace("&", "&amp;").replace("\"", "&quot;") + "\"?>\n");
            }
            WRITER.writeValue(writer, document);
            writer.write("\n");
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write XML report: " + e.getMessage(), e);
        }
        log.debug("Wrote XML report: {} test(s), {} failure(s), encoding {}",
                result.runTests(), result.testFailuresTotal(), encoding);
    }

    /** Builds the report model, calling the hooks along the way. */
    public TestRunDocument buildDocument() {
        TestRunDocument document = new TestRunDocument();
        hooks.forEach(h -> h.beginDocument(document));
        addTests(document);
        StatisticsElement statistics = new StatisticsElement(result);
        document.setStatistics(statistics);
        hooks.forEach(h -> h.statisticsAdded(document, statistics));
        hooks.forEach(h -> h.endDocument(document));
        return document;
    }

    private void addTests(TestRunDocument document) {
        Map<Test, TestFailure> firstFailureByTest = new IdentityHashMap<>();
        for (TestFailure failure : result.getFailures()) {
            firstFailureByTest.putIfAbsent(failure.failedTest(), failure);
        }
        List<Test> tests = result.getTests();
        for (int i = 0; i < tests.size(); i++) {
            Test test = tests.get(i);
            int id = i + 1;
            TestFailure failure = firstFailureByTest.get(test);
            if (failure != null) {
                FailedTestElement element = new FailedTestElement(id, failure);
                document.addFailedTest(element);
                hooks.forEach(h -> h.failTestAdded(document, element, test, failure));
            } else {
                SuccessfulTestElement element = new SuccessfulTestElement(id, test.getName());
                document.addSuccessfulTest(element);
                hooks.forEach(h -> h.successfulTestAdded(document, element, test));
            }
        }
    }
}
