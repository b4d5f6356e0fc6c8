package jerrinot.info.unitengine.metadata;

import java.lang.reflect.Method;
import java.util.List;

/**
 * Fixture hooks of one test class, each list in execution order.
 */
public final class HookMethods {

    public static final HookMethods NONE = new HookMethods(List.of(), List.of(), List.of(), List.of());

    private final List<Method> beforeClass;
    private final List<Method> before;
    private final List<Method> after;
    private final List<Method> afterClass;

    public HookMethods(List<Method> beforeClass, List<Method> before, List<Method> after, List<Method> afterClass) {
        this.beforeClass = List.copyOf(beforeClass);
        this.before = List.copyOf(before);
        this.after = List.copyOf(after);
        this.afterClass = List.copyOf(afterClass);
    }

    public List<Method> getBeforeClass() { return beforeClass; }
    public List<Method> getBefore() { return before; }
    public List<Method> getAfter() { return after; }
    public List<Method> getAfterClass() { return afterClass; }

    @Override
    public String toString() {
        return "HookMethods{beforeClass=" + beforeClass.size() + ", before=" + before.size()
                + ", after=" + after.size() + ", afterClass=" + afterClass.size() + "}";
    }
}
