package jerrinot.info.unitengine.framework;

import jerrinot.info.unitengine.dependency.DependencyResolver;

/**
 * Stands in for a test that cannot be created because it is not finished.
 */
public class IncompleteTestCase extends TestCase {

    private final String className;
    private final String message;

    public IncompleteTestCase(String className, String methodName, String message) {
        super(methodName);
        this.className = className;
        this.message = message;
    }

    public String getMessage() { return message; }

    @Override
    protected Object runTest() {
        markTestIncomplete(message);
        return null;
    }

    @Override
    public String toString() {
        return className + DependencyResolver.QUALIFIER + getName();
    }
}
