package com.liteunit.core.engine;

import com.liteunit.core.model.Outcome;
import com.liteunit.core.model.OutcomeStatus;
import com.liteunit.core.model.TestCase;
import com.liteunit.core.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes single test cases and classifies the result.
 * <p>
 * {@link #execute(TestCase)} is the error boundary around user code: whatever the target
 * or the matcher throws becomes a failed {@link Outcome}, a {@link StackOverflowError} included.
 * Only {@link OutOfMemoryError} and {@link InternalError} pass through. With a positive test
 * timeout each case runs on a separate invocation thread and is abandoned (interrupted)
 * once the limit passes.
 * <p>
 * Safe for use by several workers at once.
 */
public class TestCaseRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TestCaseRunner.class);

    private final Duration testTimeout;
    private final ExecutorService invoker;

    /**
     * Runs every case on the calling thread with no time limit.
     */
    public TestCaseRunner() {
        this(Duration.ZERO);
    }

    public TestCaseRunner(Duration testTimeout) {
        this.testTimeout = testTimeout;
        this.invoker = testTimeout.isZero()
                ? null
                : Executors.newCachedThreadPool(new NamedThreadFactory("liteunit-invoke"));
    }

    public Outcome execute(TestCase testCase) {
        String call = testCase.describe();
        long start = System.nanoTime();
        log.debug("Executing {}", call);
        try {
            Evaluation evaluation = invoker == null ? evaluate(testCase) : evaluateWithTimeout(testCase);
            long elapsedMs = elapsedMs(start);
            if (evaluation.matched()) {
                return new Outcome(testCase, OutcomeStatus.PASSED,
                        "Passed: " + call + "->" + evaluation.output(),
                        evaluation.output(), null, elapsedMs);
            }
            return new Outcome(testCase, OutcomeStatus.MISMATCHED,
                    "Failed: " + call + "->" + evaluation.output() + " is not evaluated from expected"
                            + System.lineSeparator() + "  expected one of: " + testCase.expected(),
                    evaluation.output(), null, elapsedMs);
        } catch (TimeLimitExceeded e) {
            log.debug("{} exceeded the {} limit", call, testTimeout);
            return new Outcome(testCase, OutcomeStatus.TIMED_OUT,
                    "Failed: " + call + " timed out after " + formatDuration(testTimeout),
                    null, e, elapsedMs(start));
        } catch (OutOfMemoryError | InternalError e) {
            throw e;
        } catch (Throwable t) {
            log.debug("{} raised {}", call, t.toString());
            return new Outcome(testCase, OutcomeStatus.ERRORED, errorMessage(testCase, t),
                    null, t, elapsedMs(start));
        } finally {
            // interrupt status left behind by an inline target must not reach the next case
            if (invoker == null && Thread.interrupted()) {
                log.debug("Cleared interrupt status left by {}", call);
            }
        }
    }

    @Override
    public void close() {
        if (invoker != null) {
            invoker.shutdownNow();
        }
    }

    private static Evaluation evaluate(TestCase testCase) throws Exception {
        Object output = testCase.target().invoke(testCase.arguments().toArray());
        boolean matched = testCase.matcher().matches(output, testCase.expected());
        return new Evaluation(Values.render(output), matched);
    }

    private Evaluation evaluateWithTimeout(TestCase testCase) throws Throwable {
        Future<Evaluation> future = invoker.submit(() -> evaluate(testCase));
        try {
            return future.get(testTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeLimitExceeded(e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            throw e.getCause() != null ? e.getCause() : e;
        }
    }

    private static String errorMessage(TestCase testCase, Throwable t) {
        var trace = new StringWriter();
        t.printStackTrace(new PrintWriter(trace));
        return "Failed: " + testCase + " raised " + t.getClass().getName()
                + (t.getMessage() != null ? ": " + t.getMessage() : "")
                + System.lineSeparator() + trace.toString().stripTrailing();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public static String formatDuration(Duration duration) {
        long ms = duration.toMillis();
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private record Evaluation(String output, boolean matched) {}

    /**
     * Raised only by the runner itself, so a target that throws {@link TimeoutException}
     * is reported as an error rather than a timeout.
     */
    private static final class TimeLimitExceeded extends Exception {
        TimeLimitExceeded(TimeoutException cause) {
            super(cause);
        }
    }
}
