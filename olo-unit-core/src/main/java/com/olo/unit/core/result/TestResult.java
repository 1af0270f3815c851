package com.olo.unit.core.result;

import com.olo.unit.core.Protectable;
import com.olo.unit.core.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Controller of one run: broadcasts lifecycle events to the registered {@link TestListener}s and
 * holds the cooperative stop flag.
 * <p>
 * Listeners are notified in registration order for every event. The listener list is fixed while
 * {@link #runTest(Test)} is in progress; {@link #addListener} and {@link #removeListener} throw
 * {@link IllegalStateException} in that window. Listeners are not owned: their lifetime is the caller's.
 * <p>
 * {@link #protect(Test, Protectable)} is the single place where test code is executed and where what it
 * throws is classified into a {@link TestFailure}.
 * <p>
 * Single-threaded: the listener list and stop flag belong to the thread driving the run.
 */
public class TestResult {

    private static final Logger log = LoggerFactory.getLogger(TestResult.class);

    private final List<TestListener> listeners = new ArrayList<>();
    private boolean stop;
    private boolean running;

    /**
     * Registers a listener; it is notified after all previously registered ones.
     *
     * @throws IllegalArgumentException if already registered
     * @throws IllegalStateException    if a run is in progress
     */
    public void addListener(TestListener listener) {
        Objects.requireNonNull(listener, "listener");
        checkNotRunning("add");
        for (TestListener l : listeners) {
            if (l == listener) {
                throw new IllegalArgumentException("Listener already registered: " + listener);
            }
        }
        listeners.add(listener);
    }

    /**
     * Unregisters a listener. Returns false if it was not registered.
     *
     * @throws IllegalStateException if a run is in progress
     */
    public boolean removeListener(TestListener listener) {
        checkNotRunning("remove");
        for (int i = 0; i < listeners.size(); i++) {
            if (listeners.get(i) == listener) {
                listeners.remove(i);
                return true;
            }
        }
        return false;
    }

    /** Registered listeners in notification order. Unmodifiable. */
    public List<TestListener> getListeners() {
        return Collections.unmodifiableList(listeners);
    }

    /** Clears the stop flag. Listeners stay registered. */
    public void reset() {
        stop = false;
    }

    /** True once {@link #stop()} was called; no further test or suite is started. */
    public boolean shouldStop() {
        return stop;
    }

    /** Requests a cooperative stop. A running leaf completes its own bookkeeping first. */
    public void stop() {
        stop = true;
    }

    /** True while {@link #runTest(Test)} is in progress. */
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs {@code test} as the top-level test of this run: {@code startTestRun}, the test, {@code endTestRun}.
     */
    public void runTest(Test test) {
        Objects.requireNonNull(test, "test");
        if (running) {
            throw new IllegalStateException("A run is already in progress");
        }
        log.debug("Starting run of {} ({} test case(s))", test.getName(), test.countTestCases());
        running = true;
        try {
            broadcast("startTestRun", l -> l.startTestRun(test, this));
            test.run(this);
            broadcast("endTestRun", l -> l.endTestRun(test, this));
        } finally {
            running = false;
        }
        log.debug("Finished run of {} (stopped={})", test.getName(), stop);
    }

    /**
     * Runs {@code body} on behalf of {@code test} and reports what it throws: an {@link AssertionError}
     * as a failure, any other exception or non-VM error as an error. {@link VirtualMachineError}s are rethrown.
     *
     * @return true if the body completed without throwing
     */
    public boolean protect(Test test, Protectable body) {
        try {
            body.run();
            return true;
        } catch (AssertionError e) {
            addFailure(test, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            addError(test, e);
        }
        return false;
    }

    public void startTest(Test test) {
        broadcast("startTest", l -> l.startTest(test));
    }

    public void endTest(Test test) {
        broadcast("endTest", l -> l.endTest(test));
    }

    public void startSuite(Test suite) {
        broadcast("startSuite", l -> l.startSuite(suite));
    }

    public void endSuite(Test suite) {
        broadcast("endSuite", l -> l.endSuite(suite));
    }

    /** Reports an assertion violation of {@code test}. */
    public void addFailure(Test test, Throwable thrown) {
        addFailure(new TestFailure(test, thrown, false));
    }

    /** Reports an unexpected fault of {@code test}. */
    public void addError(Test test, Throwable thrown) {
        addFailure(new TestFailure(test, thrown, true));
    }

    public void addFailure(TestFailure failure) {
        Objects.requireNonNull(failure, "failure");
        broadcast("addFailure", l -> l.addFailure(failure));
    }

    // Iterates a copy: outside runTest a listener may register another one mid-event.
    private void broadcast(String event, ListenerCall call) {
        for (TestListener listener : List.copyOf(listeners)) {
            try {
                call.notify(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} (continuing): {}", listener, event, e.getMessage(), e);
            }
        }
    }

    private void checkNotRunning(String action) {
        if (running) {
            throw new IllegalStateException("Cannot " + action + " a listener while a run is in progress");
        }
    }

    @FunctionalInterface
    private interface ListenerCall {
        void notify(TestListener listener);
    }
}
