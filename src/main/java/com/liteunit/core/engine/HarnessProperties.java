package com.liteunit.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "liteunit")
public class HarnessProperties {

    private Harness harness = new Harness();

    // -- Harness accessors (delegate to nested) --
    public int getWorkerCount() { return harness.workerCount; }
    public int getPollTimeoutSeconds() { return harness.pollTimeoutSeconds; }
    public int getProgressEvery() { return harness.progressEvery; }
    public TerminationPolicy getTermination() { return harness.termination; }
    public int getTestTimeoutSeconds() { return harness.testTimeoutSeconds; }

    /**
     * Settings for new {@link UnitTest} instances. A zero worker count resolves to
     * {@link HarnessSettings#defaultWorkerCount()} when the run starts.
     */
    public HarnessSettings toSettings() {
        return new HarnessSettings(
                harness.workerCount,
                Duration.ofSeconds(harness.pollTimeoutSeconds),
                harness.progressEvery,
                harness.termination,
                Duration.ofSeconds(harness.testTimeoutSeconds));
    }

    public Harness getHarness() { return harness; }
    public void setHarness(Harness harness) { this.harness = harness; }

    public static class Harness {
        private int workerCount = 0;
        private int pollTimeoutSeconds = 1;
        private int progressEvery = 100;
        private TerminationPolicy termination = TerminationPolicy.SENTINEL;
        private int testTimeoutSeconds = 30;

        public int getWorkerCount() { return workerCount; }
        public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }
        public int getPollTimeoutSeconds() { return pollTimeoutSeconds; }
        public void setPollTimeoutSeconds(int pollTimeoutSeconds) { this.pollTimeoutSeconds = pollTimeoutSeconds; }
        public int getProgressEvery() { return progressEvery; }
        public void setProgressEvery(int progressEvery) { this.progressEvery = progressEvery; }
        public TerminationPolicy getTermination() { return termination; }
        public void setTermination(TerminationPolicy termination) { this.termination = termination; }
        public int getTestTimeoutSeconds() { return testTimeoutSeconds; }
        public void setTestTimeoutSeconds(int testTimeoutSeconds) { this.testTimeoutSeconds = testTimeoutSeconds; }
    }
}
