package com.liteunit.demo;

import com.liteunit.core.model.TestTarget;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Targets used by {@link DemoSuite}.
 */
public final class DemoTargets {

    private DemoTargets() {
        // utility class
    }

    /** Returns 2 for any number and rejects strings. */
    public static final TestTarget CONSTANT_TWO = TestTarget.named("constantTwo", arguments -> {
        if (arguments.length != 1) {
            throw new IllegalArgumentException("constantTwo takes 1 argument but " + arguments.length + " were given");
        }
        if (arguments[0] instanceof String) {
            throw new IllegalArgumentException("constantTwo does not accept strings: \"" + arguments[0] + "\"");
        }
        return 2;
    });

    public static final TestTarget JOIN = TestTarget.binary("join", DemoTargets::join);

    public static final TestTarget DIVIDE = TestTarget.<Number, Number>binary("divide", DemoTargets::divide);

    public static String join(Object first, Object second) {
        return first + "_;_" + second;
    }

    public static BigDecimal divide(Number dividend, Number divisor) {
        return new BigDecimal(dividend.toString())
                .divide(new BigDecimal(divisor.toString()), MathContext.DECIMAL64);
    }
}
