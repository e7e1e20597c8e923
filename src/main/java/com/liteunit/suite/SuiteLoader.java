package com.liteunit.suite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.Optional;

/**
 * Loads {@link TestSuite} implementations by fully qualified class name. Failures never
 * propagate: they are printed and reported as an empty result, so a checker can load
 * what is there and skip what is not.
 */
@Component
public class SuiteLoader {

    private static final Logger log = LoggerFactory.getLogger(SuiteLoader.class);

    private final PrintStream out;

    public SuiteLoader() {
        this(System.out);
    }

    public SuiteLoader(PrintStream out) {
        this.out = out;
    }

    /**
     * Loads, checks and instantiates the named suite.
     *
     * @param className fully qualified name of a {@link TestSuite} implementation
     * @return the suite, or empty after printing {@code Could not import "<name>". Error: ...}
     */
    public Optional<TestSuite> tryImport(String className) {
        try {
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            Class<?> type = Class.forName(className, true,
                    loader != null ? loader : SuiteLoader.class.getClassLoader());
            if (!TestSuite.class.isAssignableFrom(type)) {
                throw new ClassCastException(type.getName() + " does not implement " + TestSuite.class.getName());
            }
            TestSuite suite = (TestSuite) type.getDeclaredConstructor().newInstance();
            log.debug("Loaded suite {}", className);
            return Optional.of(suite);
        } catch (InvocationTargetException e) {
            return failed(className, e.getCause() != null ? e.getCause() : e);
        } catch (ReflectiveOperationException | LinkageError | RuntimeException e) {
            return failed(className, e);
        }
    }

    private Optional<TestSuite> failed(String className, Throwable error) {
        log.warn("Could not import {}: {}", className, error.toString());
        out.println("Could not import \"" + className + "\". Error: "
                + error.getClass().getSimpleName() + "; " + error.getMessage());
        return Optional.empty();
    }
}
