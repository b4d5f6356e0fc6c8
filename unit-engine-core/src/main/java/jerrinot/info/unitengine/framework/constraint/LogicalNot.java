package jerrinot.info.unitengine.framework.constraint;

import java.util.Objects;

public final class LogicalNot<T> implements Constraint<T> {

    private final Constraint<T> constraint;

    public LogicalNot(Constraint<T> constraint) {
        this.constraint = Objects.requireNonNull(constraint, "constraint");
    }

    @Override
    public boolean matches(T other) {
        return !constraint.matches(other);
    }

    @Override
    public String toString() {
        String inner = constraint.toString();
        if (inner.startsWith("is ")) {
            return "is not " + inner.substring(3);
        }
        if (inner.startsWith("contains ")) {
            return "does not contain " + inner.substring(9);
        }
        if (inner.startsWith("matches ")) {
            return "does not match " + inner.substring(8);
        }
        return "not( " + inner + " )";
    }
}
