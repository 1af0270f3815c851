package com.olo.unit.report;

import com.olo.unit.core.result.SourceLine;
import com.olo.unit.core.result.TestFailure;
import com.olo.unit.core.result.TestResultCollector;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Plain text report: {@code OK (n)} when the run succeeded, otherwise a summary line followed by one
 * numbered block per failure.
 */
public class TextOutputter implements Outputter {

    private final TestResultCollector result;
    private final PrintStream stream;

    public TextOutputter(TestResultCollector result, PrintStream stream) {
        this.result = Objects.requireNonNull(result, "result");
        this.stream = Objects.requireNonNull(stream, "stream");
    }

    @Override
    public void write() {
        printHeader();
        stream.println();
        printFailures();
        stream.println();
        stream.flush();
    }

    protected void printHeader() {
        if (result.wasSuccessful()) {
            stream.println();
            stream.println("OK (" + result.runTests() + ")");
        } else {
            stream.println();
            stream.println("!!!FAILURES!!!");
            printStatistics();
        }
    }

    protected void printStatistics() {
        stream.println("Test Results:");
        stream.println("Run:  " + result.runTests()
                + "   Failures: " + result.testFailures()
                + "   Errors: " + result.testErrors());
    }

    protected void printFailures() {
        List<TestFailure> failures = result.getFailures();
        for (int i = 0; i < failures.size(); i++) {
            printFailure(failures.get(i), i + 1);
        }
    }

    protected void printFailure(TestFailure failure, int failureNumber) {
        StringBuilder sb = new StringBuilder();
        sb.append(failureNumber).append(") test: ").append(failure.failedTest().getName());
        sb.append(failure.isError() ? " (E)" : " (F)");
        SourceLine line = failure.getSourceLine();
        if (line.isValid()) {
            sb.append(" line: ").append(line.lineNumber()).append(' ').append(line.fileName());
        }
        stream.println(sb);
        if (failure.isError()) {
            stream.println("uncaught exception of type " + failure.thrownException().getClass().getName());
        } else {
            stream.println("assertion failed");
        }
        stream.println("- " + failure.getMessage());
        stream.println();
    }
}
