package jerrinot.info.unitengine.framework;

/**
 * Raised for engine misuse and invalid test metadata. Never classified as an assertion outcome.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
