package com.liteunit.demo;

import com.liteunit.core.engine.HarnessSettings;
import com.liteunit.core.engine.UnitTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class DemoSuiteTest {

    @Test
    @DisplayName("demo suite passes three of six")
    void demoResult() {
        var captured = new ByteArrayOutputStream();
        var unitTest = new UnitTest(HarnessSettings.defaults(), new PrintStream(captured, true), null, null);
        new DemoSuite().register(unitTest);

        var summary = unitTest.execute();

        assertEquals(DemoSuite.EXPECTED_PASSES, summary.passed());
        assertEquals(DemoSuite.EXPECTED_TOTAL, summary.total());
        assertTrue(captured.toString().contains("Passed: join(12, 34)->12_;_34"));
        assertTrue(captured.toString().contains("Passed: divide(5, 2)->2.5"));
    }

    @Test
    @DisplayName("divide is exact and rejects a zero divisor")
    void divide() {
        assertEquals(new BigDecimal("2.5"), DemoTargets.divide(5, 2));
        assertThrows(ArithmeticException.class, () -> DemoTargets.divide(1, 0));
    }

    @Test
    @DisplayName("constantTwo rejects strings")
    void constantTwoRejectsStrings() throws Exception {
        assertEquals(2, DemoTargets.CONSTANT_TWO.invoke(7));
        assertThrows(IllegalArgumentException.class, () -> DemoTargets.CONSTANT_TWO.invoke("2"));
    }
}
