package com.liteunit.core.model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * String forms used when comparing outputs and rendering messages.
 */
public final class Values {

    private Values() {
        // utility class
    }

    /**
     * String form of a value. Arrays render element-wise; everything else uses {@link String#valueOf}.
     */
    public static String render(Object value) {
        if (value != null && value.getClass().isArray()) {
            if (value instanceof Object[] objects) {
                return Arrays.deepToString(objects);
            }
            // primitive arrays
            return Arrays.deepToString(new Object[]{value}).replaceFirst("^\\[", "").replaceFirst("]$", "");
        }
        return String.valueOf(value);
    }

    public static String renderArguments(List<Object> arguments) {
        return arguments.stream().map(Values::render).collect(Collectors.joining(", "));
    }

    /**
     * Normalizes an expectation into the set of acceptable string forms. A collection
     * contributes each element; any other value, null included, contributes itself.
     */
    public static Set<String> expectedSet(Object expected) {
        var set = new LinkedHashSet<String>();
        if (expected instanceof Collection<?> collection) {
            for (Object element : collection) {
                set.add(render(element));
            }
        } else {
            set.add(render(expected));
        }
        return Collections.unmodifiableSet(set);
    }

    /**
     * Returns the elements of an iterable or array, or null when the value is neither.
     */
    static List<Object> elementsOf(Object value) {
        if (value instanceof Iterable<?> iterable) {
            var elements = new ArrayList<Object>();
            iterable.forEach(elements::add);
            return elements;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            var elements = new ArrayList<Object>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return elements;
        }
        return null;
    }
}
