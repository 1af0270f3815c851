package com.olo.unit.core.result;

import com.olo.unit.core.Test;

import java.util.Objects;

/**
 * One captured failure of a leaf. Holds a non-owning reference to the failed test (the tree outlives
 * the report) and the thrown fault.
 * <p>
 * {@code isError == false}: an assertion violation ({@link AssertionError}).
 * {@code isError == true}: an unexpected fault that escaped from outside the assertion machinery.
 */
public final class TestFailure {

    private final Test failedTest;
    private final Throwable thrownException;
    private final boolean error;
    private final SourceLine sourceLine;

    public TestFailure(Test failedTest, Throwable thrownException, boolean isError) {
        this.failedTest = Objects.requireNonNull(failedTest, "failedTest");
        this.thrownException = Objects.requireNonNull(thrownException, "thrownException");
        this.error = isError;
        this.sourceLine = SourceLine.of(thrownException);
    }

    public Test failedTest() {
        return failedTest;
    }

    public Throwable thrownException() {
        return thrownException;
    }

    public boolean isError() {
        return error;
    }

    /** Where the fault was raised in test code; {@link SourceLine#UNKNOWN} if not determinable. */
    public SourceLine getSourceLine() {
        return sourceLine;
    }

    /** Fault message; the exception class name when the fault carries no message. */
    public String getMessage() {
        String message = thrownException.getMessage();
        if (message == null || message.isBlank()) {
            return thrownException.getClass().getName();
        }
        return message;
    }

    /** {@code "Assertion"} or {@code "Error"}, as used by the outputters. */
    public String getFailureType() {
        return error ? "Error" : "Assertion";
    }

    @Override
    public String toString() {
        return failedTest.getName() + ": " + getFailureType() + ": " + getMessage();
    }
}
