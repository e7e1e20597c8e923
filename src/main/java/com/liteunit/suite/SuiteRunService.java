package com.liteunit.suite;

import com.liteunit.core.engine.HarnessSettings;
import com.liteunit.core.engine.UnitTest;
import com.liteunit.core.engine.UnitTestFactory;
import com.liteunit.core.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.util.List;

/**
 * Registers a set of suites into one fresh harness and runs it.
 */
@Service
public class SuiteRunService {

    private static final Logger log = LoggerFactory.getLogger(SuiteRunService.class);

    private final UnitTestFactory unitTestFactory;

    public SuiteRunService(UnitTestFactory unitTestFactory) {
        this.unitTestFactory = unitTestFactory;
    }

    public RunSummary run(List<TestSuite> suites, HarnessSettings settings, boolean async) {
        return run(suites, settings, async, System.out);
    }

    public RunSummary run(List<TestSuite> suites, HarnessSettings settings, boolean async, PrintStream out) {
        UnitTest unitTest = unitTestFactory.newUnitTest(settings, out);
        for (TestSuite suite : suites) {
            int before = unitTest.total();
            suite.register(unitTest);
            log.debug("Suite {} registered {} test(s)", suite.getClass().getName(), unitTest.total() - before);
        }
        return async ? unitTest.executeAsync() : unitTest.execute();
    }
}
