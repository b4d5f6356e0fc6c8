package jerrinot.info.unitengine.framework;

public class RiskyTestError extends AssertionFailedError {

    public RiskyTestError(String message) {
        super(message);
    }
}
