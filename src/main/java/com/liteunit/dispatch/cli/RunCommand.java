package com.liteunit.dispatch.cli;

import com.liteunit.core.engine.HarnessSettings;
import com.liteunit.core.engine.UnitTestFactory;
import com.liteunit.core.model.ExecutionMode;
import com.liteunit.core.model.RunSummary;
import com.liteunit.suite.SuiteLoader;
import com.liteunit.suite.SuiteRunService;
import com.liteunit.suite.TestSuite;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: liteunit run &lt;suiteClass&gt;...
 * <p>
 * Loads each named {@code TestSuite} class, registers all of them into one harness and
 * runs it. Suites that cannot be loaded are reported and skipped.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one or more test suites")
@Component
public class RunCommand implements Runnable {

    @Parameters(arity = "1..*", paramLabel = "SUITE", description = "Fully qualified TestSuite class names")
    private List<String> suiteClasses;

    @Mixin
    private RunOptions options = new RunOptions();

    private final SuiteLoader suiteLoader;
    private final SuiteRunService suiteRunService;
    private final UnitTestFactory unitTestFactory;

    public RunCommand(SuiteLoader suiteLoader, SuiteRunService suiteRunService, UnitTestFactory unitTestFactory) {
        this.suiteLoader = suiteLoader;
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

        var suites = new ArrayList<TestSuite>();
        for (String className : suiteClasses) {
            var suite = suiteLoader.tryImport(className);
            ConsoleOutput.suite(className, suite.isPresent());
            suite.ifPresent(suites::add);
        }
        if (suites.isEmpty()) {
            ConsoleOutput.error("No suites could be loaded.");
            return;
        }

        ConsoleOutput.settings(options.async() ? ExecutionMode.ASYNC : ExecutionMode.SYNC, settings);
        RunSummary summary = suiteRunService.run(suites, settings, options.async());
        ConsoleOutput.summary(summary);
    }
}
