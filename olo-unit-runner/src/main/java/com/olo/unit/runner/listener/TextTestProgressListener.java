package com.olo.unit.runner.listener;

import com.olo.unit.core.Test;
import com.olo.unit.core.result.TestFailure;
import com.olo.unit.core.result.TestListener;
import com.olo.unit.core.result.TestResult;

import java.io.PrintStream;
import java.util.Objects;

/** Prints {@code .} per test and {@code F} or {@code E} per failure; ends the line when the run ends. */
public class TextTestProgressListener implements TestListener {

    private final PrintStream out;

    public TextTestProgressListener(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void startTest(Test test) {
        out.print(".");
        out.flush();
    }

    @Override
    public void addFailure(TestFailure failure) {
        out.print(failure.isError() ? "E" : "F");
        out.flush();
    }

    @Override
    public void endTestRun(Test test, TestResult controller) {
        out.println();
        out.println();
        out.flush();
    }
}
