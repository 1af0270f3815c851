package com.olo.unit.core;

/**
 * Piece of test code run under {@link com.olo.unit.core.result.TestResult#protect}, which catches and
 * classifies whatever it throws.
 */
@FunctionalInterface
public interface Protectable {

    void run() throws Exception;
}
