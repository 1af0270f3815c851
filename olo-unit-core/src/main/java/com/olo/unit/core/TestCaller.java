package com.olo.unit.core;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Leaf that runs one test method against a fixture. A fresh fixture is created for every run, set up,
 * handed to the method, then torn down and dropped.
 *
 * @param <F> fixture type
 */
public final class TestCaller<F extends TestFixture> extends TestCase {

    /** Test method of a fixture. */
    @FunctionalInterface
    public interface TestMethod<F> {
        void invoke(F fixture) throws Exception;
    }

    private final Supplier<? extends F> fixtureFactory;
    private final TestMethod<? super F> method;
    private F fixture;

    public TestCaller(String name, Supplier<? extends F> fixtureFactory, TestMethod<? super F> method) {
        super(name);
        this.fixtureFactory = Objects.requireNonNull(fixtureFactory, "fixtureFactory");
        this.method = Objects.requireNonNull(method, "method");
    }

    @Override
    public void setUp() throws Exception {
        fixture = Objects.requireNonNull(fixtureFactory.get(), "fixtureFactory returned null");
        fixture.setUp();
    }

    @Override
    protected void runTest() throws Exception {
        method.invoke(fixture);
    }

    @Override
    public void tearDown() throws Exception {
        if (fixture == null) {
            return;
        }
        try {
            fixture.tearDown();
        } finally {
            fixture = null;
        }
    }
}
