package com.liteunit.core.model;

/**
 * Totals of one harness run.
 */
public record RunSummary(
    String runId,
    ExecutionMode mode,
    int passed,
    int total,
    long durationMs
) {

    public int failed() {
        return total - passed;
    }

    public boolean allPassed() {
        return passed == total;
    }

    /**
     * The closing line printed by the harness.
     */
    public String line() {
        return "passed " + passed + "/" + total;
    }
}
