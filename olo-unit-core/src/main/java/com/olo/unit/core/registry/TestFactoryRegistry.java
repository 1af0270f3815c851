package com.olo.unit.core.registry;

import com.olo.unit.core.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Registry of the test factories available to a run. Constructed once per process run and passed to
 * whoever enumerates or extends it (the runner, the plugin manager); there is no global instance.
 * {@link #makeTest()} builds the root suite of the run from the factories in registration order.
 */
public final class TestFactoryRegistry {

    public static final String DEFAULT_NAME = "All Tests";

    private static final Logger log = LoggerFactory.getLogger(TestFactoryRegistry.class);

    private final String name;
    private final List<TestFactory> factories = new ArrayList<>();

    public TestFactoryRegistry() {
        this(DEFAULT_NAME);
    }

    public TestFactoryRegistry(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    /**
     * Registers a factory after all previously registered ones.
     *
     * @throws IllegalArgumentException if the factory is already registered
     */
    public void registerFactory(TestFactory factory) {
        Objects.requireNonNull(factory, "factory");
        if (contains(factory)) {
            throw new IllegalArgumentException("Test factory already registered in " + name + ": " + factory);
        }
        factories.add(factory);
        log.debug("Registered test factory {} in {}", factory, name);
    }

    /** Removes a factory. Returns false if it was not registered. */
    public boolean unregisterFactory(TestFactory factory) {
        for (int i = 0; i < factories.size(); i++) {
            if (factories.get(i) == factory) {
                factories.remove(i);
                log.debug("Unregistered test factory {} from {}", factory, name);
                return true;
            }
        }
        return false;
    }

    public boolean contains(TestFactory factory) {
        for (TestFactory f : factories) {
            if (f == factory) return true;
        }
        return false;
    }

    /** Factories in registration order. Unmodifiable snapshot. */
    public List<TestFactory> getFactories() {
        return Collections.unmodifiableList(new ArrayList<>(factories));
    }

    /** Builds a new suite named after this registry holding one test per factory. */
    public TestSuite makeTest() {
        TestSuite suite = new TestSuite(name);
        addTestToSuite(suite);
        return suite;
    }

    /** Adds one freshly made test per factory to {@code suite}, in registration order. */
    public void addTestToSuite(TestSuite suite) {
        Objects.requireNonNull(suite, "suite");
        for (TestFactory factory : factories) {
            suite.addTest(factory.makeTest());
        }
    }
}
