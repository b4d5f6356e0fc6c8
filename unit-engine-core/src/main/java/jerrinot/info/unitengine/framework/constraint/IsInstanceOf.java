package jerrinot.info.unitengine.framework.constraint;

import java.util.Objects;

public final class IsInstanceOf implements Constraint<Object> {

    private final Class<?> type;

    public IsInstanceOf(Class<?> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public boolean matches(Object other) {
        return type.isInstance(other);
    }

    @Override
    public String toString() {
        return "is an instance of " + type.getName();
    }
}
