package jerrinot.info.unitengine.framework;

import java.util.Objects;

/**
 * The value a passed test returned and its size, kept for dependent tests.
 */
public final class PassedTest {

    private final Object result;
    private final TestSize size;

    public PassedTest(Object result, TestSize size) {
        this.result = result;
        this.size = Objects.requireNonNull(size, "size");
    }

    public Object getResult() { return result; }
    public TestSize getSize() { return size; }

    @Override
    public String toString() {
        return "PassedTest{result=" + result + ", size=" + size + "}";
    }
}
