package jerrinot.info.unitengine.framework;

public class IncompleteTestError extends AssertionFailedError {

    public IncompleteTestError(String message) {
        super(message);
    }
}
