package com.liteunit.suite;

import com.liteunit.core.engine.HarnessSettings;
import com.liteunit.core.engine.UnitTest;
import com.liteunit.core.engine.UnitTestFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SuiteRunServiceTest {

    private UnitTestFactory factory;
    private SuiteRunService service;
    private HarnessSettings settings;
    private ByteArrayOutputStream captured;

    @BeforeEach
    void setUp() {
        factory = mock(UnitTestFactory.class);
        service = new SuiteRunService(factory);
        settings = HarnessSettings.defaults().withTestTimeout(Duration.ZERO);
        captured = new ByteArrayOutputStream();
    }

    private PrintStream out() {
        return new PrintStream(captured, true);
    }

    @Test
    @DisplayName("registers every suite into one harness and runs it synchronously")
    void runsSync() {
        PrintStream out = out();
        when(factory.newUnitTest(eq(settings), any(PrintStream.class)))
                .thenAnswer(inv -> new UnitTest(settings, out, null, null));

        var summary = service.run(List.of(new SampleSuite(), new SampleSuite()), settings, false, out);

        assertEquals(4, summary.total());
        assertEquals(2, summary.passed());
        assertTrue(captured.toString().contains("passed 2/4"));
        verify(factory).newUnitTest(eq(settings), any(PrintStream.class));
    }

    @Test
    @DisplayName("async flag runs on the worker pool")
    void runsAsync() {
        PrintStream out = out();
        var async = settings.withWorkerCount(2);
        when(factory.newUnitTest(eq(async), any(PrintStream.class)))
                .thenAnswer(inv -> new UnitTest(async, out, null, null));

        var summary = service.run(List.of(new SampleSuite()), async, true, out);

        assertEquals(1, summary.passed());
        assertTrue(captured.toString().startsWith("Executing with 2 processors."));
    }
}
