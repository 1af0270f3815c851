package com.olo.unit.runner;

import com.olo.unit.core.Test;
import com.olo.unit.core.TestSuite;
import com.olo.unit.core.path.TestPath;
import com.olo.unit.core.path.TestPathResolver;
import com.olo.unit.core.registry.TestFactoryRegistry;
import com.olo.unit.core.result.TestResult;

import java.util.List;
import java.util.Objects;

/**
 * Runs a test, or the part of it a {@link TestPath} addresses. Tests are collected in a root suite;
 * when exactly one test was added, paths resolve against that test directly, so the usual
 * {@code runner.addTest(registry.makeTest())} takes paths relative to the registry suite.
 */
public class TestRunner {

    private final TestSuite suite = new TestSuite(TestFactoryRegistry.DEFAULT_NAME);

    public void addTest(Test test) {
        suite.addTest(test);
    }

    /** Test that paths are resolved against. */
    public Test getRoot() {
        List<Test> tests = suite.getTests();
        return tests.size() == 1 ? tests.get(0) : suite;
    }

    /** Runs everything. */
    public void run(TestResult controller) {
        run(controller, TestPath.empty());
    }

    /**
     * Resolves {@code path} and runs the addressed test.
     *
     * @throws com.olo.unit.core.path.TestPathNotFoundException if the path does not resolve; no
     *                                                          event was emitted then
     */
    public void run(TestResult controller, TestPath path) {
        Objects.requireNonNull(controller, "controller");
        Test test = TestPathResolver.resolve(getRoot(), path);
        controller.runTest(test);
    }
}
