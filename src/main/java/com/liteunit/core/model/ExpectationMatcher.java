package com.liteunit.core.model;

import java.util.Set;

/**
 * Decides whether a target's output satisfies a test's expectations.
 * Matchers may throw; the runner reports that the same way as a failing target.
 */
@FunctionalInterface
public interface ExpectationMatcher {

    boolean matches(Object actual, Set<String> expected) throws Exception;

    /**
     * The default: the output's string form is one of the acceptable values.
     */
    static ExpectationMatcher stringMembership() {
        return (actual, expected) -> expected.contains(Values.render(actual));
    }

    /**
     * Exactly one acceptable value, equal to the output's string form.
     */
    static ExpectationMatcher stringEquals() {
        return (actual, expected) -> expected.size() == 1
                && expected.iterator().next().equals(Values.render(actual));
    }
}
