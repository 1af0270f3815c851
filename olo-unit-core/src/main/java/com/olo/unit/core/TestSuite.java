package com.olo.unit.core;

import com.olo.unit.core.result.TestResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Composite node: an ordered group of child tests it exclusively owns. Insertion order is run order
 * and path-resolution order.
 * <p>
 * The tree is acyclic by construction: {@link #addTest(Test)} rejects any child whose subtree already
 * contains this suite, and any {@link TestCase} or suite that another suite already owns.
 * {@link #deleteContents()} gives the children up again.
 */
public class TestSuite implements Test {

    private final String name;
    private final List<Test> tests = new ArrayList<>();
    private TestSuite owner;

    public TestSuite(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Adds a child and takes ownership of it.
     *
     * @throws IllegalArgumentException if the child is null, this suite, owned by a suite already
     *                                  (this one or another), or an ancestor of this suite
     */
    public void addTest(Test test) {
        if (test == null) {
            throw new IllegalArgumentException("test must not be null");
        }
        if (test == this) {
            throw new IllegalArgumentException("Suite cannot contain itself: " + name);
        }
        TestSuite currentOwner = ownerOf(test);
        if (currentOwner != null) {
            throw new IllegalArgumentException("Test " + test.getName() + " is already owned by suite " + currentOwner.name);
        }
        for (Test existing : tests) {
            if (existing == test) {
                throw new IllegalArgumentException("Test already owned by suite " + name + ": " + test.getName());
            }
        }
        if (contains(test, this)) {
            throw new IllegalArgumentException("Adding " + test.getName() + " to suite " + name + " would create a cycle");
        }
        tests.add(test);
        setOwner(test, this);
    }

    /** Children in insertion order. Unmodifiable view. */
    public List<Test> getTests() {
        return Collections.unmodifiableList(tests);
    }

    @Override
    public List<Test> getChildTests() {
        return getTests();
    }

    /**
     * Releases every owned child exactly once, depth-first (child suites are emptied before being dropped).
     * Calling it on an empty suite does nothing.
     */
    public void deleteContents() {
        for (Test test : tests) {
            if (test instanceof TestSuite) {
                ((TestSuite) test).deleteContents();
            }
            setOwner(test, null);
        }
        tests.clear();
    }

    @Override
    public void run(TestResult controller) {
        if (controller.shouldStop()) {
            return;
        }
        controller.startSuite(this);
        for (Test test : tests) {
            if (controller.shouldStop()) {
                break;
            }
            test.run(controller);
        }
        controller.endSuite(this);
    }

    @Override
    public int countTestCases() {
        // Iterative so arbitrarily deep trees do not exhaust the stack.
        int count = 0;
        Deque<Test> pending = new ArrayDeque<>(tests);
        while (!pending.isEmpty()) {
            Test test = pending.pop();
            if (test instanceof TestSuite) {
                pending.addAll(((TestSuite) test).tests);
            } else {
                count += test.countTestCases();
            }
        }
        return count;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String describe() {
        return "suite " + name;
    }

    @Override
    public String toString() {
        return describe();
    }

    // Only the built-in node types record their owner; other Test implementations get the per-suite check.
    private static TestSuite ownerOf(Test test) {
        if (test instanceof TestSuite) {
            return ((TestSuite) test).owner;
        }
        if (test instanceof TestCase) {
            return ((TestCase) test).owner;
        }
        return null;
    }

    private static void setOwner(Test test, TestSuite owner) {
        if (test instanceof TestSuite) {
            ((TestSuite) test).owner = owner;
        } else if (test instanceof TestCase) {
            ((TestCase) test).owner = owner;
        }
    }

    /** True if {@code target} is {@code root} or reachable from it. */
    private static boolean contains(Test root, Test target) {
        Deque<Test> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Test test = pending.pop();
            if (test == target) {
                return true;
            }
            for (Test child : test.getChildTests()) {
                pending.push(child);
            }
        }
        return false;
    }
}
