package com.liteunit.core.engine;

/**
 * How the {@link ResultAggregator} decides that no more results will arrive.
 */
public enum TerminationPolicy {

    /**
     * Stop after every worker has sent its end-of-stream marker on both channels. Exact.
     */
    SENTINEL,

    /**
     * Stop as soon as a bounded receive on either channel times out. Best effort: a quiet
     * window does not prove the workers are done, so the harness's final drain picks up
     * whatever arrives afterwards.
     */
    TIMEOUT
}
