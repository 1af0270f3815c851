package com.olo.unit.report.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.olo.unit.core.result.TestResultCollector;

/** {@code <Statistics>}: run, failure total, error and failure counts. */
public final class StatisticsElement extends ExtensibleElement {

    @JacksonXmlProperty(localName = "Tests")
    private final int tests;

    @JacksonXmlProperty(localName = "FailuresTotal")
    private final int failuresTotal;

    @JacksonXmlProperty(localName = "Errors")
    private final int errors;

    @JacksonXmlProperty(localName = "Failures")
    private final int failures;

    StatisticsElement(TestResultCollector result) {
        this.tests = result.runTests();
        this.failuresTotal = result.testFailuresTotal();
        this.errors = result.testErrors();
        this.failures = result.testFailures();
    }

    public int getTests() {
        return tests;
    }

    public int getFailuresTotal() {
        return failuresTotal;
    }

    public int getErrors() {
        return errors;
    }

    public int getFailures() {
        return failures;
    }
}
