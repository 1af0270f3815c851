package com.olo.unit.plugin.clocker;

import com.olo.unit.core.Test;
import com.olo.unit.core.result.TestListener;
import com.olo.unit.core.result.TestResult;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.LongSupplier;

/**
 * Measures the wall-clock time of every test, and of every suite unless {@code flat}. Times are in
 * milliseconds and reset at the start of each run.
 */
public class TestTimer implements TestListener {

    private final boolean flat;
    private final LongSupplier nanoClock;
    private final Map<Test, Long> started = new IdentityHashMap<>();
    private final Map<Test, Double> testTimes = new IdentityHashMap<>();
    // Suites do not override equals, so this keys by identity in endSuite order.
    private final Map<Test, Double> suiteTimes = new LinkedHashMap<>();

    public TestTimer(boolean flat) {
        this(flat, System::nanoTime);
    }

    TestTimer(boolean flat, LongSupplier nanoClock) {
        this.flat = flat;
        this.nanoClock = nanoClock;
    }

    @Override
    public void startTestRun(Test test, TestResult controller) {
        started.clear();
        testTimes.clear();
        suiteTimes.clear();
    }

    @Override
    public void startTest(Test test) {
        started.put(test, nanoClock.getAsLong());
    }

    @Override
    public void endTest(Test test) {
        stop(test, testTimes);
    }

    @Override
    public void startSuite(Test suite) {
        if (!flat) {
            started.put(suite, nanoClock.getAsLong());
        }
    }

    @Override
    public void endSuite(Test suite) {
        if (!flat) {
            stop(suite, suiteTimes);
        }
    }

    private void stop(Test test, Map<Test, Double> times) {
        Long start = started.remove(test);
        if (start != null) {
            times.put(test, (nanoClock.getAsLong() - start) / 1_000_000.0);
        }
    }

    public boolean isFlat() {
        return flat;
    }

    public OptionalDouble getTestTime(Test test) {
        Double time = testTimes.get(test);
        return time != null ? OptionalDouble.of(time) : OptionalDouble.empty();
    }

    /** Always empty in flat mode. */
    public OptionalDouble getSuiteTime(Test suite) {
        Double time = suiteTimes.get(suite);
        return time != null ? OptionalDouble.of(time) : OptionalDouble.empty();
    }

    /** Suite times of the last run, in the order the suites ended. Empty in flat mode. */
    public Map<Test, Double> getSuiteTimes() {
        return Collections.unmodifiableMap(suiteTimes);
    }

    /** Sum of all test times of the last run. */
    public double getTotalTestTime() {
        double total = 0;
        for (double time : testTimes.values()) {
            total += time;
        }
        return total;
    }
}
