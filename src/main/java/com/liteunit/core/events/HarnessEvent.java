package com.liteunit.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a harness run executes.
 *
 * @param eventType one of {@code run.started}, {@code test.passed}, {@code test.failed}, {@code run.completed}
 * @param runId     the run this event belongs to
 * @param testName  {@code name(args)} of the test this event relates to (null for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record HarnessEvent(
    String eventType,
    String runId,
    String testName,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String RUN_STARTED = "run.started";
    public static final String TEST_PASSED = "test.passed";
    public static final String TEST_FAILED = "test.failed";
    public static final String RUN_COMPLETED = "run.completed";
}
