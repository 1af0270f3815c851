package com.olo.unit.core;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds a suite of {@link TestCaller}s sharing one fixture type. Each caller is named
 * {@code suiteName + "." + methodName}.
 *
 * <pre>{@code
 * TestSuite suite = new TestSuiteBuilder<>("MathTest", MathTest::new)
 *         .addTestCaller("addition", MathTest::addition)
 *         .addTestCaller("division", MathTest::division)
 *         .build();
 * }</pre>
 *
 * @param <F> fixture type
 */
public final class TestSuiteBuilder<F extends TestFixture> {

    private final TestSuite suite;
    private final Supplier<? extends F> fixtureFactory;

    public TestSuiteBuilder(String suiteName, Supplier<? extends F> fixtureFactory) {
        this(new TestSuite(suiteName), fixtureFactory);
    }

    /** Adds callers to an existing suite. */
    public TestSuiteBuilder(TestSuite suite, Supplier<? extends F> fixtureFactory) {
        this.suite = Objects.requireNonNull(suite, "suite");
        this.fixtureFactory = Objects.requireNonNull(fixtureFactory, "fixtureFactory");
    }

    public TestSuiteBuilder<F> addTestCaller(String methodName, TestCaller.TestMethod<? super F> method) {
        suite.addTest(new TestCaller<F>(suite.getName() + "." + methodName, fixtureFactory, method));
        return this;
    }

    public TestSuiteBuilder<F> addTest(Test test) {
        suite.addTest(test);
        return this;
    }

    public TestSuite build() {
        return suite;
    }
}
