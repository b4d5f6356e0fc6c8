package jerrinot.info.unitengine.runner;

import java.util.Objects;

/**
 * Loads and initializes test classes through a class loader.
 */
public class StandardTestSuiteLoader implements TestSuiteLoader {

    private final ClassLoader classLoader;

    public StandardTestSuiteLoader() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public StandardTestSuiteLoader(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    @Override
    public Class<?> load(String className) throws ClassNotFoundException {
        return Class.forName(className, true, classLoader);
    }
}
