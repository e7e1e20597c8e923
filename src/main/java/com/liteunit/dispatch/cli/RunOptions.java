package com.liteunit.dispatch.cli;

import com.liteunit.core.engine.HarnessSettings;
import com.liteunit.core.engine.TerminationPolicy;
import picocli.CommandLine.Option;

import java.time.Duration;

/**
 * Execution options shared by the run and demo commands. Unset options keep the
 * configured defaults.
 */
public class RunOptions {

    @Option(names = {"--async", "-a"}, description = "Run on a worker pool instead of the calling thread")
    boolean async;

    @Option(names = {"--workers", "-w"}, description = "Worker count for async runs (default: processors - 2, at least 1)")
    Integer workers;

    @Option(names = "--poll-timeout", description = "Aggregator receive window in seconds")
    Integer pollTimeoutSeconds;

    @Option(names = "--progress-every", description = "Print a progress line every N passes")
    Integer progressEvery;

    @Option(names = "--termination", description = "Aggregator termination policy: ${COMPLETION-CANDIDATES}")
    TerminationPolicy termination;

    @Option(names = "--test-timeout", description = "Per-test time limit in seconds, 0 for none")
    Integer testTimeoutSeconds;

    public boolean async() {
        return async;
    }

    public HarnessSettings applyTo(HarnessSettings base) {
        HarnessSettings settings = base;
        if (workers != null) {
            settings = settings.withWorkerCount(workers);
        }
        if (pollTimeoutSeconds != null) {
            settings = settings.withPollTimeout(Duration.ofSeconds(pollTimeoutSeconds));
        }
        if (progressEvery != null) {
            settings = settings.withProgressEvery(progressEvery);
        }
        if (termination != null) {
            settings = settings.withTermination(termination);
        }
        if (testTimeoutSeconds != null) {
            settings = settings.withTestTimeout(Duration.ofSeconds(testTimeoutSeconds));
        }
        return settings;
    }
}
