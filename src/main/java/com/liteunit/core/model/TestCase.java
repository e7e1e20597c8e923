package com.liteunit.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One unit test: a target, the arguments to call it with, the acceptable outputs and
 * the matcher that compares them. Construction only captures references; nothing runs
 * until a runner executes the case.
 *
 * @param target      the callable under test
 * @param arguments   positional arguments, unmodifiable, nulls allowed
 * @param expected    acceptable string forms of the output, unmodifiable
 * @param matcher     compares the output against {@code expected}
 * @param displayName name used in result messages
 */
public record TestCase(
    TestTarget target,
    List<Object> arguments,
    Set<String> expected,
    ExpectationMatcher matcher,
    String displayName
) {

    public TestCase {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(matcher, "matcher");
        arguments = arguments == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(arguments));
        expected = expected == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(expected));
        displayName = displayName == null || displayName.isBlank() ? target.name() : displayName;
    }

    /**
     * Builds a case with the default string-membership matcher and the target's own name.
     */
    public static TestCase lazyInit(TestTarget target, Set<String> expected, Object... arguments) {
        return new TestCase(target, argumentList(arguments), expected,
                ExpectationMatcher.stringMembership(), null);
    }

    public static Set<TestCase> multiInit(TestTarget target, ExpectationMatcher matcher,
                                          Map<List<Object>, ?> argumentsToExpected) {
        return multiInit(target, matcher, argumentsToExpected, null, false);
    }

    /**
     * Fans a mapping of argument lists to expectations out into one case per pair.
     * <p>
     * With {@code expandEachExpected} an iterable (or array) expectation yields one case
     * per element, each accepting that single value. An expectation that is not iterable
     * is kept as one scalar case.
     *
     * @param displayName name for every produced case, or null for the target's name
     */
    public static Set<TestCase> multiInit(TestTarget target, ExpectationMatcher matcher,
                                          Map<List<Object>, ?> argumentsToExpected,
                                          String displayName, boolean expandEachExpected) {
        var cases = new LinkedHashSet<TestCase>();
        for (var entry : argumentsToExpected.entrySet()) {
            List<Object> elements = expandEachExpected ? Values.elementsOf(entry.getValue()) : null;
            if (elements == null) {
                cases.add(new TestCase(target, entry.getKey(),
                        Set.of(Values.render(entry.getValue())), matcher, displayName));
                continue;
            }
            for (Object element : elements) {
                cases.add(new TestCase(target, entry.getKey(),
                        Set.of(Values.render(element)), matcher, displayName));
            }
        }
        return cases;
    }

    /**
     * {@code name(args)}, the form used in every result message.
     */
    public String describe() {
        return displayName + "(" + Values.renderArguments(arguments) + ")";
    }

    @Override
    public String toString() {
        return "TestCase[" + describe() + " expecting " + expected + "]";
    }

    private static List<Object> argumentList(Object[] arguments) {
        if (arguments == null) {
            // a single null passed to the varargs slot
            return Collections.singletonList(null);
        }
        return Arrays.asList(arguments);
    }
}
