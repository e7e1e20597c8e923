package com.liteunit.core.metrics;

import com.liteunit.core.model.ExecutionMode;
import com.liteunit.core.model.OutcomeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for harness runs.
 */
@Service
public class LiteUnitMetrics {

    private final MeterRegistry registry;

    public LiteUnitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTestOutcome(OutcomeStatus status, long ms) {
        Counter.builder("liteunit.test.outcomes")
                .tag("status", status.name())
                .register(registry)
                .increment();
        Timer.builder("liteunit.test.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a finished run.
     *
     * @param mode   sync or async
     * @param passed tests that passed
     * @param total  tests that ran
     * @param ms     wall-clock duration of the run
     */
    public void recordRun(ExecutionMode mode, int passed, int total, long ms) {
        Counter.builder("liteunit.runs.total")
                .tag("mode", mode.name())
                .register(registry)
                .increment();
        Timer.builder("liteunit.run.duration")
                .tag("mode", mode.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("liteunit.run.failed_tests")
                .description("Failed tests per run")
                .register(registry)
                .record(total - passed);
    }

    public void recordWorkerPool(int workerCount) {
        DistributionSummary.builder("liteunit.run.workers")
                .description("Workers per async run")
                .register(registry)
                .record(workerCount);
    }
}
