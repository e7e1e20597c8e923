package com.liteunit.core.engine;

import com.liteunit.core.model.Outcome;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * The failure and pass channels of one run, sharing an arrival semaphore.
 * Passing outcomes go to {@link #passes()}, everything else to {@link #failures()}.
 */
public class ResultChannels {

    private final Semaphore arrivals = new Semaphore(0);
    private final ResultChannel failures = new ResultChannel("failures", arrivals);
    private final ResultChannel passes = new ResultChannel("passes", arrivals);

    public ResultChannel failures() {
        return failures;
    }

    public ResultChannel passes() {
        return passes;
    }

    public void publish(Outcome outcome) {
        (outcome.passed() ? passes : failures).publish(outcome);
    }

    /**
     * Sends one end-of-stream marker on each channel.
     */
    public void endOfStream() {
        failures.endOfStream();
        passes.endOfStream();
    }

    /**
     * Waits for one enqueue on either channel. Each successful call accounts for exactly
     * one delivery, so after it returns true at least one unconsumed delivery is queued,
     * provided a single consumer pairs every call with one non-blocking receive.
     */
    public boolean awaitArrival(Duration timeout) throws InterruptedException {
        return arrivals.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isEmpty() {
        return failures.isEmpty() && passes.isEmpty();
    }
}
