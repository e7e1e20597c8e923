package com.liteunit.core.model;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The callable under test. Targets always receive their arguments as one positional
 * sequence, so single-argument and multi-argument functions share the same shape.
 * <p>
 * A target carries the name shown in result messages. Plain lambdas have no usable
 * name and report {@code <lambda>}; use {@link #named(String, TestTarget)} or the
 * {@code unary}/{@code binary} adapters to give one.
 */
@FunctionalInterface
public interface TestTarget {

    String ANONYMOUS = "<lambda>";

    Object invoke(Object... arguments) throws Exception;

    default String name() {
        return ANONYMOUS;
    }

    static TestTarget named(String name, TestTarget target) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        return new TestTarget() {
            @Override
            public Object invoke(Object... arguments) throws Exception {
                return target.invoke(arguments);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    /**
     * Adapts a one-argument function. An argument of the wrong type surfaces as a
     * {@link ClassCastException} when the target runs, which the runner reports as a failure.
     */
    @SuppressWarnings("unchecked")
    static <A> TestTarget unary(String name, Function<A, ?> function) {
        Objects.requireNonNull(function, "function");
        return named(name, arguments -> {
            requireArity(name, 1, arguments);
            return function.apply((A) arguments[0]);
        });
    }

    @SuppressWarnings("unchecked")
    static <A, B> TestTarget binary(String name, BiFunction<A, B, ?> function) {
        Objects.requireNonNull(function, "function");
        return named(name, arguments -> {
            requireArity(name, 2, arguments);
            return function.apply((A) arguments[0], (B) arguments[1]);
        });
    }

    private static void requireArity(String name, int expected, Object[] arguments) {
        int actual = arguments == null ? 0 : arguments.length;
        if (actual != expected) {
            throw new IllegalArgumentException(
                    name + " takes " + expected + " argument" + (expected != 1 ? "s" : "")
                            + " but " + actual + " were given");
        }
    }
}
