package com.olo.unit.core.result;

/**
 * Source location a failure was raised from. {@link #UNKNOWN} when no frame qualifies.
 *
 * @param fileName source file name (e.g. {@code MathTest.java}); empty when unknown
 * @param lineNumber 1-based line number; -1 when unknown
 */
public record SourceLine(String fileName, int lineNumber) {

    public static final SourceLine UNKNOWN = new SourceLine("", -1);

    private static final String[] SKIPPED_PREFIXES = {
            "java.", "javax.", "jdk.", "sun.", "org.junit.", "org.opentest4j."
    };

    public SourceLine {
        fileName = fileName != null ? fileName : "";
    }

    public boolean isValid() {
        return !fileName.isEmpty() && lineNumber > 0;
    }

    /**
     * Location of the first stack frame of {@code thrown} outside the JDK and JUnit assertion classes,
     * i.e. the test code that raised it.
     */
    public static SourceLine of(Throwable thrown) {
        if (thrown == null) return UNKNOWN;
        for (StackTraceElement frame : thrown.getStackTrace()) {
            if (isSkipped(frame.getClassName())) continue;
            if (frame.getFileName() == null || frame.getLineNumber() <= 0) return UNKNOWN;
            return new SourceLine(frame.getFileName(), frame.getLineNumber());
        }
        return UNKNOWN;
    }

    private static boolean isSkipped(String className) {
        for (String prefix : SKIPPED_PREFIXES) {
            if (className.startsWith(prefix)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return isValid() ? fileName + ":" + lineNumber : "<unknown>";
    }
}
