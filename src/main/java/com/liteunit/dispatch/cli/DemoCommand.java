package com.liteunit.dispatch.cli;

import com.liteunit.core.engine.HarnessSettings;
import com.liteunit.core.engine.UnitTestFactory;
import com.liteunit.core.model.ExecutionMode;
import com.liteunit.core.model.RunSummary;
import com.liteunit.demo.DemoSuite;
import com.liteunit.suite.SuiteRunService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;

/**
 * CLI command: liteunit demo
 * <p>
 * Runs the built-in {@link DemoSuite}: three passes, one mismatch and two targets that throw.
 */
@Command(name = "demo", mixinStandardHelpOptions = true, description = "Run the built-in demonstration suite")
@Component
public class DemoCommand implements Runnable {

    @Mixin
    private RunOptions options = new RunOptions();

    private final SuiteRunService suiteRunService;
    private final UnitTestFactory unitTestFactory;

    public DemoCommand(SuiteRunService suiteRunService, UnitTestFactory unitTestFactory) {
        this.suiteRunService = suiteRunService;
        this.unitTestFactory = unitTestFactory;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        HarnessSettings settings;
        try {
            settings = options.applyTo(unitTestFactory.defaultSettings());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid option: " + e.getMessage());
            return;
        }

        ConsoleOutput.settings(options.async() ? ExecutionMode.ASYNC : ExecutionMode.SYNC, settings);
        RunSummary summary = suiteRunService.run(List.of(new DemoSuite()), settings, options.async());
        ConsoleOutput.summary(summary);
        if (summary.passed() == DemoSuite.EXPECTED_PASSES && summary.total() == DemoSuite.EXPECTED_TOTAL) {
            ConsoleOutput.success("Demo behaved as expected.");
        } else {
            ConsoleOutput.error("Demo expected " + DemoSuite.EXPECTED_PASSES + "/" + DemoSuite.EXPECTED_TOTAL
                    + " but got " + summary.passed() + "/" + summary.total());
        }
    }
}
