package com.olo.unit.core.path;

import com.olo.unit.core.Test;
import com.olo.unit.core.TestCase;

import java.util.List;
import java.util.Objects;

/**
 * Resolves a {@link TestPath} against a root node. Matching is exact and case-sensitive against the
 * names of direct children; when siblings share a name, the first in insertion order wins.
 * Resolution is side-effect free: no listener sees anything.
 */
public final class TestPathResolver {

    private TestPathResolver() {
    }

    /**
     * Returns the node addressed by {@code path}, or {@code root} for the empty path.
     *
     * @throws TestPathNotFoundException if a segment has no matching child, or a non-terminal segment
     *                                   addresses a leaf
     */
    public static Test resolve(Test root, TestPath path) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(path, "path");
        Test current = root;
        List<String> segments = path.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            if (current instanceof TestCase) {
                throw new TestPathNotFoundException(path, i, "'" + current.getName() + "' is a test case, not a suite");
            }
            Test match = findChild(current.getChildTests(), segments.get(i));
            if (match == null) {
                throw new TestPathNotFoundException(path, i, "no child of '" + current.getName() + "' has that name");
            }
            current = match;
        }
        return current;
    }

    private static Test findChild(List<Test> children, String name) {
        for (Test child : children) {
            if (name.equals(child.getName())) {
                return child;
            }
        }
        return null;
    }
}
