package com.liteunit.core.engine;

import com.liteunit.core.events.EventBus;
import com.liteunit.core.events.HarnessEvent;
import com.liteunit.core.metrics.LiteUnitMetrics;
import com.liteunit.core.model.Outcome;

import java.io.PrintStream;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns consumed outcomes into console lines, pass counts, events and metrics.
 * Only one thread at a time may consume through a reporter: the synchronous loop,
 * the aggregator, or (after the aggregator finished) the harness's final drain.
 */
class ResultReporter {

    private final String runId;
    private final PrintStream out;
    private final AtomicInteger passCounter;
    private final int progressEvery;
    private final boolean blankLineAfterResult;
    private final EventBus eventBus;
    private final LiteUnitMetrics metrics;

    /**
     * @param progressEvery         progress line interval; zero disables progress lines
     * @param blankLineAfterResult  separate result blocks with an empty line
     */
    ResultReporter(String runId, PrintStream out, AtomicInteger passCounter, int progressEvery,
                   boolean blankLineAfterResult, EventBus eventBus, LiteUnitMetrics metrics) {
        this.runId = runId;
        this.out = out;
        this.passCounter = passCounter;
        this.progressEvery = progressEvery;
        this.blankLineAfterResult = blankLineAfterResult;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    void report(Outcome outcome) {
        if (outcome.passed()) {
            pass(outcome);
        } else {
            failure(outcome);
        }
    }

    void failure(Outcome outcome) {
        print(outcome.message());
        record(outcome, HarnessEvent.TEST_FAILED);
    }

    void pass(Outcome outcome) {
        print(outcome.message());
        int count = passCounter.incrementAndGet();
        if (progressEvery > 0 && count % progressEvery == 0) {
            out.println("Current count: " + count);
        }
        record(outcome, HarnessEvent.TEST_PASSED);
    }

    private void print(String message) {
        if (message == null || message.isBlank()) {
            return;
        }
        out.println(message);
        if (blankLineAfterResult) {
            out.println();
        }
    }

    private void record(Outcome outcome, String eventType) {
        if (metrics != null) {
            metrics.recordTestOutcome(outcome.status(), outcome.elapsedMs());
        }
        if (eventBus != null) {
            eventBus.publish(new HarnessEvent(eventType, runId, outcome.testCase().describe(),
                    Map.of("status", outcome.status().name(),
                           "elapsedMs", outcome.elapsedMs()),
                    Instant.now()));
        }
    }
}
