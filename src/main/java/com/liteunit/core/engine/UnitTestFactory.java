package com.liteunit.core.engine;

import com.liteunit.core.events.EventBus;
import com.liteunit.core.metrics.LiteUnitMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.PrintStream;

/**
 * Builds {@link UnitTest} instances wired to the application's configuration,
 * event bus and metrics. Every call returns a fresh, single-use harness.
 */
@Service
public class UnitTestFactory {

    private final HarnessProperties properties;
    private final EventBus eventBus;
    private final LiteUnitMetrics metrics;

    @Autowired
    public UnitTestFactory(HarnessProperties properties, EventBus eventBus,
                           @Autowired(required = false) LiteUnitMetrics metrics) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public UnitTest newUnitTest() {
        return newUnitTest(properties.toSettings(), System.out);
    }

    public UnitTest newUnitTest(HarnessSettings settings, PrintStream out) {
        return new UnitTest(settings, out, eventBus, metrics);
    }

    public HarnessSettings defaultSettings() {
        return properties.toSettings();
    }
}
