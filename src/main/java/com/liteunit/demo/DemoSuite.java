package com.liteunit.demo;

import com.liteunit.core.engine.UnitTest;
import com.liteunit.suite.TestSuite;

/**
 * Built-in demonstration: a mix of passing tests, a mismatch and two targets that throw.
 * Expected result: {@code passed 3/6}.
 */
public class DemoSuite implements TestSuite {

    public static final int EXPECTED_PASSES = 3;
    public static final int EXPECTED_TOTAL = 6;

    @Override
    public void register(UnitTest unitTest) {
        unitTest.addTest(DemoTargets.CONSTANT_TWO, "2", 5);
        unitTest.addTest(DemoTargets.CONSTANT_TWO, "2", "2");  // throws for strings
        unitTest.addTest(DemoTargets.CONSTANT_TWO, 1, 1);      // "2" is not "1"

        unitTest.addTest(DemoTargets.JOIN, DemoTargets.join(12, 34), 12, 34);
        unitTest.addTest(DemoTargets.DIVIDE, "2.5", 5, 2);
        unitTest.addTest(DemoTargets.DIVIDE, "inf", 1, 0);     // division by zero
    }
}
