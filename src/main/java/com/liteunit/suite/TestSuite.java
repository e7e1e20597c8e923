package com.liteunit.suite;

import com.liteunit.core.engine.UnitTest;

/**
 * A user-supplied group of tests, loadable by class name through {@link SuiteLoader}.
 * Implementations need a public no-arg constructor.
 */
public interface TestSuite {

    void register(UnitTest unitTest);
}
