package jerrinot.info.unitengine.framework;

import java.time.Duration;

/**
 * Observer notified by {@link TestResult} about the progress of a run.
 */
public interface TestListener {

    default void addError(Test test, Throwable t, Duration time) {
    }

    default void addFailure(Test test, AssertionError e, Duration time) {
    }

    default void addIncompleteTest(Test test, Throwable t, Duration time) {
    }

    default void addRiskyTest(Test test, Throwable t, Duration time) {
    }

    default void addSkippedTest(Test test, Throwable t, Duration time) {
    }

    default void startTestSuite(TestSuite suite) {
    }

    default void endTestSuite(TestSuite suite) {
    }

    default void startTest(Test test) {
    }

    default void endTest(Test test, Duration time) {
    }
}
