package jerrinot.info.unitengine.runner;

import jerrinot.info.unitengine.framework.Test;
import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.framework.TestResult;
import jerrinot.info.unitengine.framework.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves test classes into runnable tests.
 */
public abstract class BaseTestRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BaseTestRunner.class);

    private final TestSuiteLoader loader;

    protected BaseTestRunner(TestSuiteLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public TestSuiteLoader getLoader() { return loader; }

    /**
     * Test for the named class: what its static {@code suite()} method returns, or a suite of its test methods.
     * Reports through {@link #runFailed(String)} and returns {@code null} when the class cannot be loaded.
     */
    public Test getTest(String suiteClassName) {
        Class<?> testClass;
        try {
            testClass = loader.load(suiteClassName);
        } catch (ClassNotFoundException | LinkageError e) {
            runFailed("Class not found \"" + suiteClassName + "\"");
            return null;
        }
        Test suite = TestSuite.invokeSuiteMethod(testClass);
        return suite != null ? suite : new TestSuite(testClass);
    }

    /**
     * Suite of every concrete test class of a discovery mapping, in mapping order.
     *
     * @param discovered fully qualified class name to source location
     */
    public Test getTest(String suiteName, Map<String, String> discovered) {
        TestSuite suite = new TestSuite(suiteName);
        for (Map.Entry<String, String> e : discovered.entrySet()) {
            Class<?> testClass;
            try {
                testClass = loader.load(e.getKey());
            } catch (ClassNotFoundException | LinkageError ex) {
                runFailed("Class not found \"" + e.getKey() + "\" (" + e.getValue() + ")");
                return null;
            }
            if (!isRunnable(testClass)) {
                LOG.debug("Skipping {} from {}, not a concrete test class", e.getKey(), e.getValue());
                continue;
            }
            suite.addTestSuite(testClass);
        }
        return suite;
    }

    static boolean isRunnable(Class<?> testClass) {
        if (Modifier.isAbstract(testClass.getModifiers()) || testClass.isInterface()) {
            return false;
        }
        return TestCase.class.isAssignableFrom(testClass) || hasSuiteMethod(testClass);
    }

    private static boolean hasSuiteMethod(Class<?> testClass) {
        try {
            return Test.class.isAssignableFrom(testClass.getMethod(TestSuite.SUITE_METHOD_NAME).getReturnType());
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    protected TestResult createTestResult() {
        return new TestResult();
    }

    /**
     * Reports a problem that prevents the run.
     */
    protected abstract void runFailed(String message);
}
