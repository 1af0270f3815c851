package com.olo.unit.report;

import com.olo.unit.core.result.TestResultCollector;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextOutputterTest {

    private static String render(TestResultCollector collector) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new TextOutputter(collector, new PrintStream(out, true, StandardCharsets.UTF_8)).write();
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void write_successPrintsOkWithCount() {
        String text = render(ReportFixtures.run(ReportFixtures.passingSuite()));

        assertTrue(text.contains("OK (2)"));
        assertFalse(text.contains("FAILURES"));
    }

    @Test
    void write_failuresPrintSummaryAndNumberedDetails() {
        TestResultCollector collector = ReportFixtures.run(ReportFixtures.mixedSuite());

        String text = render(collector);

        assertTrue(text.contains("!!!FAILURES!!!"));
        assertTrue(text.contains("Run:  4   Failures: 1   Errors: 1"));
        assertTrue(text.contains("1) test: fails (F) line: "));
        assertTrue(text.contains("ReportFixtures.java"));
        assertTrue(text.contains("- expected <1> but was <2>"));
        assertTrue(text.contains("2) test: crashes (E)"));
        assertTrue(text.contains("uncaught exception of type java.lang.IllegalStateException"));
        assertTrue(text.indexOf("1) test: fails") < text.indexOf("2) test: crashes"));
    }

    @Test
    void write_doesNotChangeCollector() {
        TestResultCollector collector = ReportFixtures.run(ReportFixtures.mixedSuite());

        render(collector);
        render(collector);

        assertEquals(4, collector.runTests());
        assertEquals(2, collector.testFailuresTotal());
    }
}
