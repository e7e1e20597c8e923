package com.liteunit.core.engine;

import com.liteunit.core.model.TestCase;

import java.util.concurrent.LinkedBlockingQueue;

/**
 * FIFO queue of test cases shared by the harness (producer) and all workers (consumers).
 * Unbounded. Every pop is atomic: it hands out exactly one not-yet-delivered case or reports empty.
 */
public class WorkQueue {

    private final LinkedBlockingQueue<TestCase> cases = new LinkedBlockingQueue<>();

    public void put(TestCase testCase) {
        cases.add(testCase);
    }

    public boolean isEmpty() {
        return cases.isEmpty();
    }

    /**
     * Non-blocking pop.
     *
     * @return the next case, or null when the queue is empty
     */
    public TestCase poll() {
        return cases.poll();
    }
}
