package com.liteunit.core.engine;

import com.liteunit.core.logging.MdcContext;
import com.liteunit.core.model.Outcome;
import com.liteunit.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls test cases off the shared queue until it finds the queue empty, executes each one
 * and publishes the outcome: passes to the pass channel, everything else to the failure channel.
 * <p>
 * The emptiness check and the pop are separate steps, so a worker may see items and then
 * pop nothing. That only ends this worker early; it can never deliver a case twice, because
 * the pop is atomic. The harness fills the queue before any worker starts, so an empty
 * observation is final.
 * <p>
 * On exit the worker always sends one end-of-stream marker on each result channel.
 */
public class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String runId;
    private final String name;
    private final WorkQueue queue;
    private final TestCaseRunner runner;
    private final ResultChannels results;

    private int executed;

    public Worker(String runId, String name, WorkQueue queue, TestCaseRunner runner, ResultChannels results) {
        this.runId = runId;
        this.name = name;
        this.queue = queue;
        this.runner = runner;
        this.results = results;
    }

    @Override
    public void run() {
        MdcContext.setWorker(runId, name);
        log.debug("Worker {} started", name);
        try {
            while (!queue.isEmpty()) {
                TestCase testCase = queue.poll();
                if (testCase == null) {
                    break;
                }
                MdcContext.setTest(testCase.describe());
                Outcome outcome = runner.execute(testCase);
                results.publish(outcome);
                executed++;
                MdcContext.clearTest();
            }
        } finally {
            results.endOfStream();
            log.debug("Worker {} finished after {} test(s)", name, executed);
            MdcContext.clear();
        }
    }

    /**
     * Cases this worker has executed; read it after the worker finished.
     */
    public int executed() {
        return executed;
    }

    public String name() {
        return name;
    }
}
