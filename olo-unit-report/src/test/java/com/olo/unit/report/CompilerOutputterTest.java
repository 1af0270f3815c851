package com.olo.unit.report;

import com.olo.unit.core.result.SourceLine;
import com.olo.unit.core.result.TestResultCollector;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompilerOutputterTest {

    @Test
    void write_successPrintsOk() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new CompilerOutputter(ReportFixtures.run(ReportFixtures.passingSuite()),
                new PrintStream(out, true, StandardCharsets.UTF_8)).write();

        assertEquals("OK (2)", out.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void write_failuresUseCompilerStyleLocations() {
        TestResultCollector collector = ReportFixtures.run(ReportFixtures.mixedSuite());
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        new CompilerOutputter(collector, new PrintStream(out, true, StandardCharsets.UTF_8)).write();

        String text = out.toString(StandardCharsets.UTF_8);
        int line = collector.getFailures().get(0).getSourceLine().lineNumber();
        assertTrue(text.contains("ReportFixtures.java:" + line + ": Assertion"));
        assertTrue(text.contains("Test name: fails"));
        assertTrue(text.contains(": Error\nTest name: crashes") || text.contains(": Error\r\nTest name: crashes"));
        assertTrue(text.contains("Failures !!!"));
        assertTrue(text.contains("Run: 4   Failure total: 2   Failures: 1   Errors: 1"));
    }

    @Test
    void formatLocation_appliesCustomFormatAndHandlesUnknown() {
        CompilerOutputter outputter = new CompilerOutputter(new TestResultCollector(), System.out);
        outputter.setLocationFormat("%f(%l) : ");

        assertEquals("Foo.java(12) : ", outputter.formatLocation(new SourceLine("Foo.java", 12)));
        assertEquals("##Failure Location unknown##: ", outputter.formatLocation(SourceLine.UNKNOWN));
    }
}
