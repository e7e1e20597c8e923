package com.liteunit.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing LiteUnit-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setWorker(String runId, String worker) {
        MDC.put("runId", runId);
        MDC.put("worker", worker);
    }

    public static void setTest(String testName) {
        MDC.put("testName", testName);
    }

    public static void clearTest() {
        MDC.remove("testName");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("worker");
        MDC.remove("testName");
    }
}
