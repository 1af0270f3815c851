package com.olo.unit.core.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Address of a node in the test tree: the names to descend through from the root, in order.
 * The empty path denotes the root itself.
 */
public final class TestPath {

    public static final String SEPARATOR = "/";

    private static final TestPath EMPTY = new TestPath(List.of());

    private final List<String> segments;

    private TestPath(List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    public static TestPath empty() {
        return EMPTY;
    }

    /**
     * Path from explicit segments. Segments are used verbatim.
     *
     * @throws IllegalArgumentException if a segment is null or empty
     */
    public static TestPath of(String... segments) {
        Objects.requireNonNull(segments, "segments");
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                throw new IllegalArgumentException("Test path segment must be non-empty");
            }
        }
        return segments.length == 0 ? EMPTY : new TestPath(List.of(segments));
    }

    /**
     * Parses {@code "Suite/Nested/test"}. Empty segments are ignored, so {@code null}, {@code ""} and
     * {@code "/"} are the empty path and a leading slash is optional.
     */
    public static TestPath parse(String path) {
        if (path == null || path.isEmpty()) {
            return EMPTY;
        }
        List<String> out = new ArrayList<>();
        for (String segment : path.split(SEPARATOR, -1)) {
            if (!segment.isEmpty()) {
                out.add(segment);
            }
        }
        return out.isEmpty() ? EMPTY : new TestPath(out);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /** Segments in descent order. Unmodifiable. */
    public List<String> getSegments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return segments.equals(((TestPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
