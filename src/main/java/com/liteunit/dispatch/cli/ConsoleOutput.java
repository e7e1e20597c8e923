package com.liteunit.dispatch.cli;

import com.liteunit.core.engine.HarnessSettings;
import com.liteunit.core.engine.TestCaseRunner;
import com.liteunit.core.model.ExecutionMode;
import com.liteunit.core.model.RunSummary;
import picocli.CommandLine;

import java.time.Duration;

/**
 * ANSI-colored terminal output utilities for the LiteUnit CLI.
 * Result lines of a run are printed by the harness itself, uncolored.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LITEUNIT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LITEUNIT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void suite(String className, boolean loaded) {
        String status = loaded ? "@|fg(green) loaded|@" : "@|fg(red) skipped|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SUITE]|@ " + status + " " + className));
    }

    public static void settings(ExecutionMode mode, HarnessSettings settings) {
        if (mode == ExecutionMode.SYNC) {
            info("Mode: sync" + (settings.testTimeoutEnabled()
                    ? " | test timeout " + settings.testTimeout().toSeconds() + "s" : ""));
            return;
        }
        info(String.format("Mode: async | workers %s | poll %ss | progress every %d | termination %s%s",
                settings.workerCount() > 0 ? settings.workerCount() : "auto",
                settings.pollTimeout().toSeconds(),
                settings.progressEvery(),
                settings.termination(),
                settings.testTimeoutEnabled() ? " | test timeout " + settings.testTimeout().toSeconds() + "s" : ""));
    }

    public static void summary(RunSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + summary.runId() + "|@ (" + summary.mode().name().toLowerCase() + ")"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tests: @|fg(green) " + summary.passed() + " passed|@, "
                        + (summary.failed() > 0 ? "@|fg(red) " + summary.failed() + " failed|@" : "0 failed")));
        System.out.println("  Duration: " + TestCaseRunner.formatDuration(Duration.ofMillis(summary.durationMs())));
    }
}
