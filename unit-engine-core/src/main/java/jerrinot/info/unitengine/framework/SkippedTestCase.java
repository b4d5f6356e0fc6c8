package jerrinot.info.unitengine.framework;

import jerrinot.info.unitengine.dependency.DependencyResolver;

/**
 * Stands in for a test that is skipped before it could be created.
 */
public class SkippedTestCase extends TestCase {

    private final String className;
    private final String message;

    public SkippedTestCase(String className, String methodName, String message) {
        super(methodName);
        this.className = className;
        this.message = message;
    }

    public String getMessage() { return message; }

    @Override
    protected Object runTest() {
        markTestSkipped(message);
        return null;
    }

    @Override
    public String toString() {
        return className + DependencyResolver.QUALIFIER + getName();
    }
}
