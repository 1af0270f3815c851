package com.olo.unit.runner.listener;

import com.olo.unit.core.Test;
import com.olo.unit.core.result.TestFailure;
import com.olo.unit.core.result.TestListener;

import java.io.PrintStream;
import java.util.Objects;

/** Prints one line per test: {@code name : OK}, {@code name : assertion} or {@code name : error}. */
public class BriefTestProgressListener implements TestListener {

    private final PrintStream out;
    private boolean lastTestFailed;

    public BriefTestProgressListener(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void startTest(Test test) {
        out.print(test.getName());
        out.flush();
        lastTestFailed = false;
    }

    @Override
    public void addFailure(TestFailure failure) {
        // first failure of a test only
        if (!lastTestFailed) {
            out.print(" : " + (failure.isError() ? "error" : "assertion"));
            lastTestFailed = true;
        }
    }

    @Override
    public void endTest(Test test) {
        if (!lastTestFailed) {
            out.print(" : OK");
        }
        out.println();
        out.flush();
    }
}
