package jerrinot.info.unitengine.runner.filter;

import jerrinot.info.unitengine.framework.Test;
import jerrinot.info.unitengine.framework.TestSuite;

/**
 * Decides which children of a suite are iterated.
 */
@FunctionalInterface
public interface TestFilter {

    /**
     * @param test  a direct child of {@code suite}
     * @param suite the suite being iterated
     */
    boolean accept(Test test, TestSuite suite);

    default TestFilter and(TestFilter other) {
        return (test, suite) -> accept(test, suite) && other.accept(test, suite);
    }
}
