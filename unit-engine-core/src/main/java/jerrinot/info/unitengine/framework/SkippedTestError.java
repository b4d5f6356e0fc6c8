package jerrinot.info.unitengine.framework;

public class SkippedTestError extends AssertionFailedError {

    public SkippedTestError(String message) {
        super(message);
    }
}
