package jerrinot.info.unitengine.framework;

/**
 * The test printed output while the runner disallows it.
 */
public class OutputError extends AssertionFailedError {

    public OutputError(String message) {
        super(message);
    }
}
