package com.olo.unit.core.path;

import com.olo.unit.core.EventRecorder;
import com.olo.unit.core.TestCase;
import com.olo.unit.core.TestSuite;
import com.olo.unit.core.result.TestResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestPathResolverTest {

    private TestSuite root;
    private TestSuite math;
    private TestSuite algebra;
    private TestCase addition;

    @BeforeEach
    void setUp() {
        root = new TestSuite("All Tests");
        math = new TestSuite("Math");
        algebra = new TestSuite("Algebra");
        addition = TestCase.of("addition", () -> { });
        math.addTest(addition);
        math.addTest(algebra);
        algebra.addTest(TestCase.of("solve", () -> { }));
        root.addTest(math);
        root.addTest(new TestSuite("Strings"));
    }

    @Test
    void resolve_emptyPathIsRoot() {
        assertSame(root, TestPathResolver.resolve(root, TestPath.empty()));
        assertSame(root, TestPathResolver.resolve(root, TestPath.parse("/")));
    }

    @Test
    void resolve_descendsThroughDirectChildren() {
        assertSame(math, TestPathResolver.resolve(root, TestPath.of("Math")));
        assertSame(algebra, TestPathResolver.resolve(root, TestPath.of("Math", "Algebra")));
        assertSame(addition, TestPathResolver.resolve(root, TestPath.parse("Math/addition")));
    }

    @Test
    void resolve_matchesNamesExactly() {
        TestPathNotFoundException e = assertThrows(TestPathNotFoundException.class,
                () -> TestPathResolver.resolve(root, TestPath.of("math")));
        assertEquals(0, e.getSegmentIndex());
        assertEquals("math", e.getSegment());
    }

    @Test
    void resolve_missingFirstSegmentFailsWithoutEvents() {
        EventRecorder recorder = new EventRecorder();
        TestResult controller = new TestResult();
        controller.addListener(recorder);

        TestPathNotFoundException e = assertThrows(TestPathNotFoundException.class,
                () -> controller.runTest(TestPathResolver.resolve(root, TestPath.of("Foo", "Bar"))));

        assertEquals(TestPath.of("Foo", "Bar"), e.getPath());
        assertEquals(0, e.getSegmentIndex());
        assertTrue(recorder.events().isEmpty());
    }

    @Test
    void resolve_cannotDescendBelowLeaf() {
        TestPathNotFoundException e = assertThrows(TestPathNotFoundException.class,
                () -> TestPathResolver.resolve(root, TestPath.of("Math", "addition", "more")));
        assertEquals(2, e.getSegmentIndex());
    }

    @Test
    void resolve_missingNestedSegmentReportsItsIndex() {
        TestPathNotFoundException e = assertThrows(TestPathNotFoundException.class,
                () -> TestPathResolver.resolve(root, TestPath.of("Math", "Geometry")));
        assertEquals(1, e.getSegmentIndex());
        assertTrue(e.getMessage().contains("Geometry"));
    }

    @Test
    void runningResolvedSubtreeNeverEntersAncestors() {
        EventRecorder recorder = new EventRecorder();
        TestResult controller = new TestResult();
        controller.addListener(recorder);

        controller.runTest(TestPathResolver.resolve(root, TestPath.of("Math", "Algebra")));

        assertEquals(List.of(
                "startTestRun(Algebra)", "startSuite(Algebra)",
                "startTest(solve)", "endTest(solve)",
                "endSuite(Algebra)", "endTestRun(Algebra)"), recorder.events());
    }
}
