package com.liteunit.core.model;

/**
 * Classification of a single executed test case.
 */
public enum OutcomeStatus {
    PASSED,
    MISMATCHED,  // target returned, matcher rejected the output
    ERRORED,     // target or matcher threw
    TIMED_OUT;

    public boolean isPass() {
        return this == PASSED;
    }
}
