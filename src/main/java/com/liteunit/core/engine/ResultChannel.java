package com.liteunit.core.engine;

import com.liteunit.core.model.Outcome;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * FIFO stream of result reports. Many workers publish, one aggregator consumes.
 * Besides outcomes the stream carries end-of-stream markers, one per finishing worker.
 * Every enqueue also releases one permit on the arrival semaphore shared with the
 * sibling channel, so a consumer can wait on both channels at once.
 */
public class ResultChannel {

    /**
     * One item taken off the channel: an outcome, or an end-of-stream marker when
     * {@code outcome} is null.
     */
    public record Delivery(Outcome outcome) {

        public boolean endOfStream() {
            return outcome == null;
        }
    }

    private static final Delivery END_OF_STREAM = new Delivery(null);

    private final String name;
    private final LinkedBlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
    private final Semaphore arrivals;

    ResultChannel(String name, Semaphore arrivals) {
        this.name = name;
        this.arrivals = arrivals;
    }

    public String name() {
        return name;
    }

    public void publish(Outcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null on channel " + name);
        }
        deliveries.add(new Delivery(outcome));
        arrivals.release();
    }

    public void endOfStream() {
        deliveries.add(END_OF_STREAM);
        arrivals.release();
    }

    /**
     * Bounded receive.
     *
     * @return the next delivery, or null when nothing arrived within {@code timeout}
     */
    public Delivery poll(Duration timeout) throws InterruptedException {
        return deliveries.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Non-blocking receive; null when the channel is empty.
     */
    public Delivery pollNow() {
        return deliveries.poll();
    }

    public boolean isEmpty() {
        return deliveries.isEmpty();
    }
}
