package com.liteunit.core.engine;

/**
 * Thrown when the thread driving an async run is interrupted while waiting for workers
 * or the aggregator. The interrupt flag is restored before this is thrown.
 */
public class HarnessInterruptedException extends RuntimeException {
    public HarnessInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
