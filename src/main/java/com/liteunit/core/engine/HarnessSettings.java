package com.liteunit.core.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for a {@link UnitTest} run.
 *
 * @param workerCount   workers for async runs; zero or less means {@link #defaultWorkerCount()}
 * @param pollTimeout   bounded-receive window of the aggregator
 * @param progressEvery print {@code Current count: n} every this many passes
 * @param termination   aggregator termination policy
 * @param testTimeout   per-test time limit; zero disables it
 */
public record HarnessSettings(
    int workerCount,
    Duration pollTimeout,
    int progressEvery,
    TerminationPolicy termination,
    Duration testTimeout
) {

    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);
    public static final int DEFAULT_PROGRESS_EVERY = 100;
    public static final Duration DEFAULT_TEST_TIMEOUT = Duration.ofSeconds(30);

    public HarnessSettings {
        Objects.requireNonNull(pollTimeout, "pollTimeout");
        Objects.requireNonNull(termination, "termination");
        Objects.requireNonNull(testTimeout, "testTimeout");
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be positive: " + pollTimeout);
        }
        if (progressEvery < 1) {
            throw new IllegalArgumentException("progressEvery must be at least 1: " + progressEvery);
        }
        if (testTimeout.isNegative()) {
            throw new IllegalArgumentException("testTimeout must not be negative: " + testTimeout);
        }
    }

    public static HarnessSettings defaults() {
        return new HarnessSettings(0, DEFAULT_POLL_TIMEOUT, DEFAULT_PROGRESS_EVERY,
                TerminationPolicy.SENTINEL, DEFAULT_TEST_TIMEOUT);
    }

    /**
     * Available processors minus two (one for the aggregator, one for the caller), at least one.
     */
    public static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 2);
    }

    public int effectiveWorkerCount() {
        return workerCount > 0 ? workerCount : defaultWorkerCount();
    }

    public boolean testTimeoutEnabled() {
        return !testTimeout.isZero();
    }

    public HarnessSettings withWorkerCount(int workerCount) {
        return new HarnessSettings(workerCount, pollTimeout, progressEvery, termination, testTimeout);
    }

    public HarnessSettings withPollTimeout(Duration pollTimeout) {
        return new HarnessSettings(workerCount, pollTimeout, progressEvery, termination, testTimeout);
    }

    public HarnessSettings withProgressEvery(int progressEvery) {
        return new HarnessSettings(workerCount, pollTimeout, progressEvery, termination, testTimeout);
    }

    public HarnessSettings withTermination(TerminationPolicy termination) {
        return new HarnessSettings(workerCount, pollTimeout, progressEvery, termination, testTimeout);
    }

    public HarnessSettings withTestTimeout(Duration testTimeout) {
        return new HarnessSettings(workerCount, pollTimeout, progressEvery, termination, testTimeout);
    }
}
