package com.liteunit.core.engine;

import com.liteunit.core.engine.ResultChannel.Delivery;
import com.liteunit.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sole consumer of a run's result channels. Prints reports in arrival order, keeps the
 * pass counter and progress lines (through {@link ResultReporter}), and decides when to
 * stop according to its {@link TerminationPolicy}.
 * <p>
 * Receive timeouts are ordinary control flow. The aggregator never throws; an interrupt
 * ends it early with the interrupt flag restored, and the harness's final drain picks up
 * whatever is left in the channels.
 */
public class ResultAggregator implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final String runId;
    private final ResultChannels channels;
    private final ResultReporter reporter;
    private final AtomicBoolean allWorkersJoined;
    private final Duration pollTimeout;
    private final int workerCount;
    private final TerminationPolicy policy;

    ResultAggregator(String runId, ResultChannels channels, ResultReporter reporter,
                     AtomicBoolean allWorkersJoined, Duration pollTimeout, int workerCount,
                     TerminationPolicy policy) {
        this.runId = runId;
        this.channels = channels;
        this.reporter = reporter;
        this.allWorkersJoined = allWorkersJoined;
        this.pollTimeout = pollTimeout;
        this.workerCount = workerCount;
        this.policy = policy;
    }

    @Override
    public void run() {
        MdcContext.setWorker(runId, "aggregator");
        try {
            switch (policy) {
                case SENTINEL -> runUntilAllStreamsEnd();
                case TIMEOUT -> runUntilQuiet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Aggregator for run {} interrupted; remaining results go to the final drain", runId);
        } catch (RuntimeException e) {
            log.error("Aggregator for run {} stopped on unexpected error: {}", runId, e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stops once every worker's end-of-stream marker has arrived on both channels.
     */
    private void runUntilAllStreamsEnd() throws InterruptedException {
        int failureStreamsEnded = 0;
        int passStreamsEnded = 0;
        while (failureStreamsEnded < workerCount || passStreamsEnded < workerCount) {
            if (!channels.awaitArrival(pollTimeout)) {
                if (allWorkersJoined.get() && channels.isEmpty()) {
                    log.warn("All workers joined but only {}/{} failure and {}/{} pass streams ended",
                            failureStreamsEnded, workerCount, passStreamsEnded, workerCount);
                    return;
                }
                continue;
            }
            Delivery delivery = channels.failures().pollNow();
            if (delivery != null) {
                if (delivery.endOfStream()) {
                    failureStreamsEnded++;
                } else {
                    reporter.failure(delivery.outcome());
                }
                continue;
            }
            delivery = channels.passes().pollNow();
            if (delivery == null) {
                continue;
            }
            if (delivery.endOfStream()) {
                passStreamsEnded++;
            } else {
                reporter.pass(delivery.outcome());
            }
        }
        log.debug("All {} worker stream(s) ended", workerCount);
    }

    /**
     * Alternates one bounded receive per channel and returns as soon as either times out,
     * even if workers are still running. Best effort only: results that arrive later are
     * left for the harness's final drain.
     */
    private void runUntilQuiet() throws InterruptedException {
        while (!allWorkersJoined.get()) {
            Delivery failure = channels.failures().poll(pollTimeout);
            if (failure != null && !failure.endOfStream()) {
                reporter.failure(failure.outcome());
            }
            Delivery pass = channels.passes().poll(pollTimeout);
            if (pass != null && !pass.endOfStream()) {
                reporter.pass(pass.outcome());
            }
            if (failure == null || pass == null) {
                log.debug("No result within {}; aggregator stopping", pollTimeout);
                return;
            }
        }
    }
}
