package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.EngineException;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

public final class Count implements Constraint<Object> {

    private final int expected;

    public Count(int expected) {
        this.expected = expected;
    }

    @Override
    public boolean matches(Object other) {
        return sizeOf(other) == expected;
    }

    @Override
    public String failureDescription(Object other) {
        return "actual size " + sizeOf(other) + " matches expected size " + expected;
    }

    @Override
    public String toString() {
        return "count matches " + expected;
    }

    static int sizeOf(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).size();
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length();
        }
        if (value != null && value.getClass().isArray()) {
            return Array.getLength(value);
        }
        throw new EngineException("Cannot count " + (value == null ? "null" : value.getClass().getName()));
    }
}
