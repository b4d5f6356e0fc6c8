package jerrinot.info.unitengine.framework;

/**
 * Stands in for a test that could not be created. Running it fails with the recorded message.
 */
public class WarningTestCase extends TestCase {

    private final String message;

    public WarningTestCase(String message) {
        super("Warning");
        this.message = message;
    }

    public String getMessage() { return message; }

    @Override
    protected Object runTest() {
        fail(message);
        return null;
    }

    @Override
    public String toString() {
        return "Warning";
    }
}
