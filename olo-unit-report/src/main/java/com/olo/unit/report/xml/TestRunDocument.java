package com.olo.unit.report.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of the XML report:
 * <pre>
 * &lt;TestRun&gt;
 *   &lt;FailedTests&gt;&lt;FailedTest id="2"&gt;...&lt;/FailedTest&gt;&lt;/FailedTests&gt;
 *   &lt;SuccessfulTests&gt;&lt;Test id="1"&gt;...&lt;/Test&gt;&lt;/SuccessfulTests&gt;
 *   &lt;Statistics&gt;...&lt;/Statistics&gt;
 * &lt;/TestRun&gt;
 * </pre>
 */
@JacksonXmlRootElement(localName = "TestRun")
public final class TestRunDocument extends ExtensibleElement {

    @JacksonXmlElementWrapper(localName = "FailedTests")
    @JacksonXmlProperty(localName = "FailedTest")
    private final List<FailedTestElement> failedTests = new ArrayList<>();

    @JacksonXmlElementWrapper(localName = "SuccessfulTests")
    @JacksonXmlProperty(localName = "Test")
    private final List<SuccessfulTestElement> successfulTests = new ArrayList<>();

    @JacksonXmlProperty(localName = "Statistics")
    private StatisticsElement statistics;

    void addFailedTest(FailedTestElement element) {
        failedTests.add(element);
    }

    void addSuccessfulTest(SuccessfulTestElement element) {
        successfulTests.add(element);
    }

    void setStatistics(StatisticsElement statistics) {
        this.statistics = statistics;
    }

    public List<FailedTestElement> getFailedTests() {
        return Collections.unmodifiableList(failedTests);
    }

    public List<SuccessfulTestElement> getSuccessfulTests() {
        return Collections.unmodifiableList(successfulTests);
    }

    /** Null until the statistics were added. */
    public StatisticsElement getStatistics() {
        return statistics;
    }
}
