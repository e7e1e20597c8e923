package com.liteunit.core.model;

/**
 * How a harness run was executed.
 */
public enum ExecutionMode {
    SYNC,
    ASYNC
}
