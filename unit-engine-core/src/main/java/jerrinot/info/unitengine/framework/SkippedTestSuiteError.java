package jerrinot.info.unitengine.framework;

/**
 * Raised from suite set-up to record every child of the suite as a failure without running it.
 */
public class SkippedTestSuiteError extends AssertionFailedError {

    public SkippedTestSuiteError(String message) {
        super(message);
    }
}
