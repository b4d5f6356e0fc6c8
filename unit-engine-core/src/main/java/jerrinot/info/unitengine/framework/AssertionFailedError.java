package jerrinot.info.unitengine.framework;

/**
 * Thrown when an assertion does not hold. Subtypes carry the skip, incomplete and risky outcomes.
 */
public class AssertionFailedError extends AssertionError {

    public AssertionFailedError() {
        super("");
    }

    public AssertionFailedError(String message) {
        super(message == null ? "" : message);
    }

    public AssertionFailedError(String message, Throwable cause) {
        super(message == null ? "" : message, cause);
    }
}
