package com.olo.unit.core;

import com.olo.unit.core.result.TestResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestSuiteTest {

    private static TestCase leaf(String name) {
        return TestCase.of(name, () -> { });
    }

    @Test
    void countTestCases_sumsLeavesAcrossNestedSuites() {
        TestSuite root = new TestSuite("root");
        TestSuite a = new TestSuite("a");
        TestSuite b = new TestSuite("b");
        a.addTest(leaf("a1"));
        a.addTest(leaf("a2"));
        b.addTest(new TestSuite("empty"));
        b.addTest(leaf("b1"));
        root.addTest(a);
        root.addTest(b);
        root.addTest(leaf("r1"));

        assertEquals(4, root.countTestCases());
        assertEquals(2, a.countTestCases());
        assertEquals(0, new TestSuite("none").countTestCases());
    }

    @Test
    void countTestCases_handlesVeryDeepTrees() {
        TestSuite root = new TestSuite("level0");
        TestSuite current = root;
        for (int i = 1; i <= 50_000; i++) {
            TestSuite next = new TestSuite("level" + i);
            current.addTest(leaf("leaf" + i));
            current.addTest(next);
            current = next;
        }

        assertEquals(50_000, root.countTestCases());
    }

    @Test
    void describe_prefixesSuiteName() {
        assertEquals("suite Math", new TestSuite("Math").describe());
        assertEquals("Math", new TestSuite("Math").getName());
        assertEquals("addition", leaf("addition").describe());
    }

    @Test
    void addTest_keepsInsertionOrder() {
        TestSuite suite = new TestSuite("s");
        TestCase c = leaf("c");
        TestCase a = leaf("a");
        TestCase b = leaf("b");
        suite.addTest(c);
        suite.addTest(a);
        suite.addTest(b);

        assertEquals(List.of(c, a, b), suite.getTests());
        assertEquals(suite.getTests(), suite.getChildTests());
    }

    @Test
    void addTest_rejectsSelfDuplicatesAndCycles() {
        TestSuite root = new TestSuite("root");
        TestSuite child = new TestSuite("child");
        TestSuite grandChild = new TestSuite("grandChild");
        root.addTest(child);
        child.addTest(grandChild);

        assertThrows(IllegalArgumentException.class, () -> root.addTest(null));
        assertThrows(IllegalArgumentException.class, () -> root.addTest(root));
        assertThrows(IllegalArgumentException.class, () -> root.addTest(child));
        assertThrows(IllegalArgumentException.class, () -> grandChild.addTest(root));
        assertThrows(IllegalArgumentException.class, () -> grandChild.addTest(child));
        assertEquals(1, root.getTests().size());
        assertTrue(grandChild.getTests().isEmpty());
    }

    @Test
    void addTest_rejectsNodeOwnedByAnotherSuite() {
        TestSuite root = new TestSuite("root");
        TestSuite a = new TestSuite("a");
        TestSuite b = new TestSuite("b");
        root.addTest(a);
        root.addTest(b);
        TestCase shared = leaf("shared");
        a.addTest(shared);

        assertThrows(IllegalArgumentException.class, () -> b.addTest(shared));
        assertThrows(IllegalArgumentException.class, () -> new TestSuite("other").addTest(a));
        assertEquals(1, root.countTestCases());

        EventRecorder recorder = new EventRecorder();
        TestResult controller = new TestResult();
        controller.addListener(recorder);
        root.run(controller);
        assertEquals(1, recorder.events().stream().filter("startTest(shared)"::equals).count());
    }

    @Test
    void deleteContents_givesChildrenUpForReuse() {
        TestSuite first = new TestSuite("first");
        TestCase leaf = leaf("x");
        first.addTest(leaf);

        first.deleteContents();
        TestSuite second = new TestSuite("second");
        second.addTest(leaf);

        assertSame(leaf, second.getTests().get(0));
    }

    @Test
    void deleteContents_releasesWholeSubtreeAndIsIdempotent() {
        TestSuite root = new TestSuite("root");
        TestSuite child = new TestSuite("child");
        child.addTest(leaf("x"));
        root.addTest(child);
        root.addTest(leaf("y"));

        root.deleteContents();

        assertTrue(root.getTests().isEmpty());
        assertTrue(child.getTests().isEmpty());
        assertEquals(0, root.countTestCases());

        root.deleteContents();
        assertTrue(root.getTests().isEmpty());
    }

    @Test
    void run_emptySuiteEmitsOnlySuiteEvents() {
        EventRecorder recorder = new EventRecorder();
        TestResult controller = new TestResult();
        controller.addListener(recorder);

        new TestSuite("empty").run(controller);

        assertEquals(List.of("startSuite(empty)", "endSuite(empty)"), recorder.events());
    }

    @Test
    void run_suiteEnteredAfterStopEmitsNothing() {
        EventRecorder recorder = new EventRecorder();
        TestResult controller = new TestResult();
        controller.addListener(recorder);
        TestSuite suite = new TestSuite("s");
        suite.addTest(leaf("a"));
        controller.stop();

        suite.run(controller);

        assertTrue(recorder.events().isEmpty());
    }

    @Test
    void getTests_isUnmodifiable() {
        TestSuite suite = new TestSuite("s");
        TestCase a = leaf("a");
        suite.addTest(a);

        assertThrows(UnsupportedOperationException.class, () -> suite.getTests().clear());
        assertSame(a, suite.getTests().get(0));
    }
}
