package com.olo.unit.report;

/**
 * Renders a finished run. Outputters read the {@link com.olo.unit.core.result.TestResultCollector}
 * snapshot only after the run completed and never modify it, so several may render the same run.
 */
public interface Outputter {

    /**
     * Writes the report to the outputter's destination.
     *
     * @throws java.io.UncheckedIOException if the destination cannot be written
     */
    void write();
}
