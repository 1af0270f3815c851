package com.olo.unit.runner.listener;

import com.olo.unit.core.TestCase;
import com.olo.unit.core.TestSuite;
import com.olo.unit.core.result.TestResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BriefTestProgressListenerTest {

    @Test
    void printsOneLinePerTestWithOutcome() {
        TestSuite suite = new TestSuite("Suite");
        suite.addTest(TestCase.of("passes", () -> { }));
        suite.addTest(TestCase.of("fails", () -> {
            throw new AssertionError("no");
        }));
        suite.addTest(TestCase.of("crashes", () -> {
            throw new IllegalStateException("boom");
        }));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TestResult controller = new TestResult();
        controller.addListener(new BriefTestProgressListener(new PrintStream(out, true, StandardCharsets.UTF_8)));

        controller.runTest(suite);

        String[] lines = out.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals("passes : OK", lines[0]);
        assertEquals("fails : assertion", lines[1]);
        assertEquals("crashes : error", lines[2]);
    }

    @Test
    void reportsOnlyFirstFailureOfATest() {
        com.olo.unit.core.Test twice = new TestCase("twice") {
            @Override
            protected void runTest() {
                throw new AssertionError("first");
            }

            @Override
            public void tearDown() {
                throw new IllegalStateException("second");
            }
        };
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TestResult controller = new TestResult();
        controller.addListener(new BriefTestProgressListener(new PrintStream(out, true, StandardCharsets.UTF_8)));

        controller.runTest(twice);

        assertEquals("twice : assertion", out.toString(StandardCharsets.UTF_8).trim());
    }
}
