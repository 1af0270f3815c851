package com.olo.unit.core.registry;

import com.olo.unit.core.Test;

/**
 * Source of tests registered with a {@link TestFactoryRegistry}. Each call builds a fresh tree that
 * the caller owns.
 */
@FunctionalInterface
public interface TestFactory {

    Test makeTest();
}
