package com.olo.unit.report;

import com.olo.unit.core.result.SourceLine;
import com.olo.unit.core.result.TestFailure;
import com.olo.unit.core.result.TestResultCollector;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Report in the style of compiler diagnostics ({@code File.java:12: Assertion}), so IDEs and editors
 * can jump to the failing line.
 * <p>
 * The location format accepts {@code %p} (file path), {@code %f} (file name) and {@code %l} (line);
 * default {@value #DEFAULT_LOCATION_FORMAT}.
 */
public class CompilerOutputter implements Outputter {

    public static final String DEFAULT_LOCATION_FORMAT = "%p:%l: ";

    private final TestResultCollector result;
    private final PrintStream stream;
    private String locationFormat = DEFAULT_LOCATION_FORMAT;

    public CompilerOutputter(TestResultCollector result, PrintStream stream) {
        this.result = Objects.requireNonNull(result, "result");
        this.stream = Objects.requireNonNull(stream, "stream");
    }

    public void setLocationFormat(String locationFormat) {
        this.locationFormat = Objects.requireNonNull(locationFormat, "locationFormat");
    }

    public String getLocationFormat() {
        return locationFormat;
    }

    @Override
    public void write() {
        if (result.wasSuccessful()) {
            stream.println("OK (" + result.runTests() + ")");
        } else {
            for (TestFailure failure : result.getFailures()) {
                printFailureDetail(failure);
            }
            stream.println("Failures !!!");
            stream.println("Run: " + result.runTests()
                    + "   Failure total: " + result.testFailuresTotal()
                    + "   Failures: " + result.testFailures()
                    + "   Errors: " + result.testErrors());
        }
        stream.flush();
    }

    protected void printFailureDetail(TestFailure failure) {
        stream.println(formatLocation(failure.getSourceLine()) + failure.getFailureType());
        stream.println("Test name: " + failure.failedTest().getName());
        stream.println(failure.getMessage());
    }

    String formatLocation(SourceLine line) {
        if (!line.isValid()) {
            return "##Failure Location unknown##: ";
        }
        return locationFormat
                .replace("%p", line.fileName())
                .replace("%f", line.fileName())
                .replace("%l", Integer.toString(line.lineNumber()));
    }
}
