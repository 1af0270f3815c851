package com.olo.unit.core;

import com.olo.unit.core.result.TestResult;

import java.util.Objects;

/**
 * Leaf of the test tree: one executable unit with optional set-up and tear-down.
 * <p>
 * Run order: {@code startTest}, {@link #setUp()}, {@link #runTest()} (only when set-up completed),
 * {@link #tearDown()}, {@code endTest}. Each step runs under {@link TestResult#protect}, so a single
 * run may report more than one failure (e.g. the body and the tear-down both fail).
 */
public abstract class TestCase implements Test, TestFixture {

    private final String name;
    TestSuite owner;

    protected TestCase(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Leaf whose body is the given lambda; no set-up or tear-down.
     *
     * @param name test name (path segment)
     * @param body test body; throw {@link AssertionError} for an assertion violation
     */
    public static TestCase of(String name, Protectable body) {
        Objects.requireNonNull(body, "body");
        return new TestCase(name) {
            @Override
            protected void runTest() throws Exception {
                body.run();
            }
        };
    }

    @Override
    public void run(TestResult controller) {
        if (controller.shouldStop()) {
            return;
        }
        controller.startTest(this);
        if (controller.protect(this, this::setUp)) {
            controller.protect(this, this::runTest);
        }
        controller.protect(this, this::tearDown);
        controller.endTest(this);
    }

    /** Test body. Default does nothing. */
    protected void runTest() throws Exception {
    }

    @Override
    public final int countTestCases() {
        return 1;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public String toString() {
        return describe();
    }
}
