package jerrinot.info.unitengine.framework;

/**
 * A constraint or mock expectation that was not met.
 */
public class ExpectationFailedException extends AssertionFailedError {

    public ExpectationFailedException(String message) {
        super(message);
    }

    public ExpectationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
