package com.olo.unit.core;

/**
 * Per-test environment: {@link #setUp()} before the body, {@link #tearDown()} after it, whether or not
 * the body succeeded.
 */
public interface TestFixture {

    default void setUp() throws Exception {
    }

    default void tearDown() throws Exception {
    }
}
