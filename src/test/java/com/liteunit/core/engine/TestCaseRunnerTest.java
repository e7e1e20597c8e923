package com.liteunit.core.engine;

import com.liteunit.core.model.ExpectationMatcher;
import com.liteunit.core.model.OutcomeStatus;
import com.liteunit.core.model.TestCase;
import com.liteunit.core.model.TestTarget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TestCaseRunner}.
 */
class TestCaseRunnerTest {

    private static final TestTarget CONSTANT_TWO = TestTarget.named("f", arguments -> {
        if (arguments[0] instanceof String) {
            throw new IllegalArgumentException("strings not accepted");
        }
        return 2;
    });

    private static final TestTarget DEEP = TestTarget.named("deep", arguments -> recurse(0));

    private static final TestTarget THROWS_INTERRUPTED = TestTarget.named("throwsInterrupted", arguments -> {
        throw new InterruptedException("boom");
    });

    private static final TestTarget SLEEPER = TestTarget.named("sleeper", arguments -> {
        Thread.sleep(1);
        return "ok";
    });

    private TestCaseRunner runner;

    private static int recurse(int depth) {
        return recurse(depth + 1) + 1;
    }

    @BeforeEach
    void setUp() {
        runner = new TestCaseRunner();
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Nested
    @DisplayName("classification")
    class ClassificationTests {

        @Test
        @DisplayName("output in the expected set passes")
        void passes() {
            var outcome = runner.execute(TestCase.lazyInit(CONSTANT_TWO, Set.of("2"), 2));

            assertEquals(OutcomeStatus.PASSED, outcome.status());
            assertTrue(outcome.passed());
            assertEquals("Passed: f(2)->2", outcome.message());
            assertEquals("2", outcome.output());
            assertNull(outcome.error());
        }

        @Test
        @DisplayName("output outside the expected set is a mismatch")
        void mismatch() {
            var outcome = runner.execute(TestCase.lazyInit(CONSTANT_TWO, Set.of("1"), 1));

            assertEquals(OutcomeStatus.MISMATCHED, outcome.status());
            assertFalse(outcome.passed());
            assertTrue(outcome.message().startsWith("Failed: f(1)->2 is not evaluated from expected"));
            assertTrue(outcome.message().contains("expected one of: [1]"));
        }

        @Test
        @DisplayName("a throwing target is reported with name, arguments and exception")
        void targetThrows() {
            var outcome = runner.execute(TestCase.lazyInit(CONSTANT_TWO, Set.of("2"), "2"));

            assertEquals(OutcomeStatus.ERRORED, outcome.status());
            assertInstanceOf(IllegalArgumentException.class, outcome.error());
            assertTrue(outcome.message().startsWith("Failed: TestCase[f(2) expecting [2]] raised "
                    + "java.lang.IllegalArgumentException: strings not accepted"));
            assertTrue(outcome.message().contains("at "), "message should carry the stack trace");
        }

        @Test
        @DisplayName("a throwing matcher is a failure, not a crash")
        void matcherThrows() {
            ExpectationMatcher broken = (actual, expected) -> {
                throw new IllegalStateException("matcher broke");
            };
            var testCase = new TestCase(CONSTANT_TWO, List.of(3), Set.of("2"), broken, null);

            var outcome = runner.execute(testCase);

            assertEquals(OutcomeStatus.ERRORED, outcome.status());
            assertTrue(outcome.message().contains("matcher broke"));
        }

        @Test
        @DisplayName("null output is compared by its string form")
        void nullOutput() {
            var outcome = runner.execute(TestCase.lazyInit(arguments -> null, Set.of("null")));
            assertEquals(OutcomeStatus.PASSED, outcome.status());
            assertEquals("Passed: <lambda>()->null", outcome.message());
        }

        @Test
        @DisplayName("running the same case twice gives the same result")
        void idempotent() {
            var testCase = TestCase.lazyInit(CONSTANT_TWO, Set.of("1"), 1);
            var first = runner.execute(testCase);
            var second = runner.execute(testCase);

            assertEquals(first.status(), second.status());
            assertEquals(first.message(), second.message());
        }
    }

    @Nested
    @DisplayName("error boundary")
    class ErrorBoundaryTests {

        @Test
        @DisplayName("unbounded recursion is reported as an error and the runner keeps going")
        void stackOverflowIsError() {
            var outcome = runner.execute(TestCase.lazyInit(DEEP, Set.of("1")));

            assertEquals(OutcomeStatus.ERRORED, outcome.status());
            assertInstanceOf(StackOverflowError.class, outcome.error());
            assertTrue(outcome.message().startsWith("Failed: TestCase[deep() expecting [1]] raised "
                    + "java.lang.StackOverflowError"));

            assertEquals(OutcomeStatus.PASSED, runner.execute(TestCase.lazyInit(CONSTANT_TWO, Set.of("2"), 1)).status());
        }

        @Test
        @DisplayName("unbounded recursion on an invocation thread is reported as an error")
        void stackOverflowWithTimeoutIsError() {
            try (var limited = new TestCaseRunner(Duration.ofSeconds(10))) {
                var outcome = limited.execute(TestCase.lazyInit(DEEP, Set.of("1")));
                assertEquals(OutcomeStatus.ERRORED, outcome.status());
                assertInstanceOf(StackOverflowError.class, outcome.error());
            }
        }

        @Test
        @DisplayName("a target throwing InterruptedException does not leave the thread interrupted")
        void interruptedTargetDoesNotLeak() {
            var failed = runner.execute(TestCase.lazyInit(THROWS_INTERRUPTED, Set.of("x")));

            assertEquals(OutcomeStatus.ERRORED, failed.status());
            assertInstanceOf(InterruptedException.class, failed.error());
            assertFalse(Thread.currentThread().isInterrupted());

            var next = runner.execute(TestCase.lazyInit(SLEEPER, Set.of("ok")));
            assertEquals(OutcomeStatus.PASSED, next.status());
        }

        @Test
        @DisplayName("interrupt status set by a target is cleared before the next case")
        void interruptStatusCleared() {
            TestTarget selfInterrupting = TestTarget.named("selfInterrupting", arguments -> {
                Thread.currentThread().interrupt();
                return "done";
            });

            assertEquals(OutcomeStatus.PASSED,
                    runner.execute(TestCase.lazyInit(selfInterrupting, Set.of("done"))).status());
            assertFalse(Thread.currentThread().isInterrupted());
            assertEquals(OutcomeStatus.PASSED, runner.execute(TestCase.lazyInit(SLEEPER, Set.of("ok"))).status());
        }
    }

    @Nested
    @DisplayName("test timeout")
    class TimeoutTests {

        @Test
        @DisplayName("a target that overruns the limit is abandoned")
        void overrunTimesOut() {
            try (var limited = new TestCaseRunner(Duration.ofMillis(100))) {
                TestTarget sleeper = TestTarget.named("sleeper", arguments -> {
                    Thread.sleep(5_000);
                    return 0;
                });

                var outcome = limited.execute(TestCase.lazyInit(sleeper, Set.of("0")));

                assertEquals(OutcomeStatus.TIMED_OUT, outcome.status());
                assertEquals("Failed: sleeper() timed out after 100ms", outcome.message());
                assertTrue(outcome.elapsedMs() < 5_000);
            }
        }

        @Test
        @DisplayName("a fast target passes under a limit")
        void fastTargetPasses() {
            try (var limited = new TestCaseRunner(Duration.ofSeconds(5))) {
                var outcome = limited.execute(TestCase.lazyInit(CONSTANT_TWO, Set.of("2"), 7));
                assertEquals(OutcomeStatus.PASSED, outcome.status());
            }
        }

        @Test
        @DisplayName("a TimeoutException thrown by the target is an error")
        void targetTimeoutExceptionIsError() {
            try (var limited = new TestCaseRunner(Duration.ofSeconds(5))) {
                TestTarget target = TestTarget.named("remote", arguments -> {
                    throw new TimeoutException("upstream slow");
                });

                var outcome = limited.execute(TestCase.lazyInit(target, Set.of("x")));

                assertEquals(OutcomeStatus.ERRORED, outcome.status());
                assertInstanceOf(TimeoutException.class, outcome.error());
            }
        }
    }

    @Test
    @DisplayName("formatDuration picks a readable unit")
    void formatDuration() {
        assertEquals("250ms", TestCaseRunner.formatDuration(Duration.ofMillis(250)));
        assertEquals("30s", TestCaseRunner.formatDuration(Duration.ofSeconds(30)));
        assertEquals("2m 5s", TestCaseRunner.formatDuration(Duration.ofSeconds(125)));
    }
}
