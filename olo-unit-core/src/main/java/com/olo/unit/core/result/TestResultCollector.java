package com.olo.unit.core.result;

import com.olo.unit.core.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Built-in listener that records the outcome of a run: every started test and every reported failure,
 * both in the order they were reported. The run was successful if and only if no failure was recorded.
 * <p>
 * After the run the collector is the read-only snapshot consumed by the outputters.
 */
public class TestResultCollector implements TestListener {

    private final List<Test> tests = new ArrayList<>();
    private final List<TestFailure> failures = new ArrayList<>();
    private int errorCount;

    @Override
    public void startTest(Test test) {
        tests.add(test);
    }

    @Override
    public void addFailure(TestFailure failure) {
        failures.add(failure);
        if (failure.isError()) {
            errorCount++;
        }
    }

    /** Forgets everything recorded so far. */
    public void reset() {
        tests.clear();
        failures.clear();
        errorCount = 0;
    }

    public boolean wasSuccessful() {
        return failures.isEmpty();
    }

    /** Number of tests started. */
    public int runTests() {
        return tests.size();
    }

    /** Number of unexpected faults ({@link TestFailure#isError()}). */
    public int testErrors() {
        return errorCount;
    }

    /** Number of assertion violations. */
    public int testFailures() {
        return failures.size() - errorCount;
    }

    public int testFailuresTotal() {
        return failures.size();
    }

    /** Started tests in start order. Unmodifiable. */
    public List<Test> getTests() {
        return Collections.unmodifiableList(tests);
    }

    /** Failures in report order. Unmodifiable. */
    public List<TestFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}
