package com.liteunit.core.model;

/**
 * Result of executing one test case.
 *
 * @param testCase  the case that ran
 * @param status    pass/fail classification
 * @param message   the human-readable result report
 * @param output    string form of the target's output (null when it never returned)
 * @param error     what the target or matcher threw (nullable)
 * @param elapsedMs wall-clock time spent in the target and matcher
 */
public record Outcome(
    TestCase testCase,
    OutcomeStatus status,
    String message,
    String output,
    Throwable error,
    long elapsedMs
) {

    public boolean passed() {
        return status.isPass();
    }
}
