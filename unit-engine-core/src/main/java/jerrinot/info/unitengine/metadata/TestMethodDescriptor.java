package jerrinot.info.unitengine.metadata;

import jerrinot.info.unitengine.framework.TestSize;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

public final class TestMethodDescriptor {

    private final Method method;
    private final List<String> groups;
    private final List<String> dependencies;
    private final String dataProvider;
    private final TestSize size;
    private final boolean todo;
    private final Boolean errorHandler;

    TestMethodDescriptor(Method method, List<String> groups, List<String> dependencies,
                         String dataProvider, TestSize size, boolean todo, Boolean errorHandler) {
        this.method = Objects.requireNonNull(method, "method");
        this.groups = List.copyOf(groups);
        this.dependencies = List.copyOf(dependencies);
        this.dataProvider = dataProvider;
        this.size = Objects.requireNonNull(size, "size");
        this.todo = todo;
        this.errorHandler = errorHandler;
    }

    public Method getMethod() { return method; }
    public String getName() { return method.getName(); }
    public List<String> getGroups() { return groups; }
    public List<String> getDependencies() { return dependencies; }
    public String getDataProvider() { return dataProvider; }
    public boolean hasDataProvider() { return dataProvider != null; }
    public TestSize getSize() { return size; }
    public boolean isTodo() { return todo; }

    /**
     * Per-method override of error conversion, or {@code null} when the runner setting applies.
     */
    public Boolean getErrorHandler() { return errorHandler; }

    @Override
    public String toString() {
        return getName() + "{groups=" + groups + ", depends=" + dependencies + ", size=" + size + "}";
    }
}
