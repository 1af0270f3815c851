package com.olo.unit.core.path;

/**
 * Thrown by {@link TestPathResolver#resolve} when a path does not address a node of the tree: a segment
 * matches no child, or the path tries to descend below a leaf. Carries the path and the index of the
 * segment that could not be resolved.
 */
public final class TestPathNotFoundException extends IllegalArgumentException {

    private final transient TestPath path;
    private final int segmentIndex;

    public TestPathNotFoundException(TestPath path, int segmentIndex, String reason) {
        super(String.format("Test path not found: '%s' (segment %d '%s': %s)",
                path, segmentIndex, path.getSegments().get(segmentIndex), reason));
        this.path = path;
        this.segmentIndex = segmentIndex;
    }

    public TestPath getPath() {
        return path;
    }

    /** 0-based index of the unresolved segment. */
    public int getSegmentIndex() {
        return segmentIndex;
    }

    public String getSegment() {
        return path.getSegments().get(segmentIndex);
    }
}
