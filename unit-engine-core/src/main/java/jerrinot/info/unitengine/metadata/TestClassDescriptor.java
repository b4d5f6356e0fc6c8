package jerrinot.info.unitengine.metadata;

import jerrinot.info.unitengine.framework.TestSize;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the engine reads from a test class, built once per class.
 */
public final class TestClassDescriptor {

    private final Class<?> testClass;
    private final List<String> groups;
    private final List<String> dependencies;
    private final TestSize size;
    private final Boolean errorHandler;
    private final HookMethods hooks;
    private final List<TestMethodDescriptor> testMethods;
    private final Map<String, TestMethodDescriptor> byName = new LinkedHashMap<>();

    TestClassDescriptor(Class<?> testClass, List<String> groups, List<String> dependencies, TestSize size,
                        Boolean errorHandler, HookMethods hooks, List<TestMethodDescriptor> testMethods) {
        this.testClass = Objects.requireNonNull(testClass, "testClass");
        this.groups = List.copyOf(groups);
        this.dependencies = List.copyOf(dependencies);
        this.size = Objects.requireNonNull(size, "size");
        this.errorHandler = errorHandler;
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.testMethods = List.copyOf(testMethods);
        for (TestMethodDescriptor m : this.testMethods) {
            byName.putIfAbsent(m.getName(), m);
        }
    }

    public Class<?> getTestClass() { return testClass; }
    public List<String> getGroups() { return groups; }
    public List<String> getDependencies() { return dependencies; }
    public TestSize getSize() { return size; }
    public Boolean getErrorHandler() { return errorHandler; }
    public HookMethods getHooks() { return hooks; }
    public List<TestMethodDescriptor> getTestMethods() { return testMethods; }

    /**
     * Test method with the given name, or {@code null}.
     */
    public TestMethodDescriptor getTestMethod(String name) {
        return byName.get(name);
    }

    @Override
    public String toString() {
        return "TestClassDescriptor{" + testClass.getName() + ", tests=" + testMethods.size() + ", " + hooks + "}";
    }
}
