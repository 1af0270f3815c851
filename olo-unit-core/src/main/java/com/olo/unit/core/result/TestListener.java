package com.olo.unit.core.result;

import com.olo.unit.core.Test;

/**
 * Observer of one run. Registered with a {@link TestResult}; every event is delivered to all listeners
 * in registration order. Implement only the callbacks you need.
 * <p>
 * Listeners are observers: they must not mutate the test tree. The only control a listener has over
 * the run is {@link TestResult#stop()}. A listener that throws is logged and skipped by the controller.
 */
public interface TestListener {

    /** Called before a leaf's set-up. */
    default void startTest(Test test) {
    }

    /** Called once per captured assertion violation or unexpected fault, between start and end of a leaf. */
    default void addFailure(TestFailure failure) {
    }

    /** Called after a leaf's tear-down, whether it passed or failed. */
    default void endTest(Test test) {
    }

    /** Called when a composite is entered, before any child runs. */
    default void startSuite(Test suite) {
    }

    /** Called after a composite's last child ran (or the run was stopped). */
    default void endSuite(Test suite) {
    }

    /** Called once before the top-level test of {@link TestResult#runTest(Test)} runs. */
    default void startTestRun(Test test, TestResult controller) {
    }

    /** Called once after the top-level test of {@link TestResult#runTest(Test)} ran. */
    default void endTestRun(Test test, TestResult controller) {
    }
}
