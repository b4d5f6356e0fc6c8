package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.Exporter;

public final class IsIdentical implements Constraint<Object> {

    private final Object expected;

    public IsIdentical(Object expected) {
        this.expected = expected;
    }

    @Override
    public boolean matches(Object other) {
        if (expected instanceof Boolean) {
            return expected.equals(other);
        }
        return expected == other;
    }

    @Override
    public String toString() {
        if (expected == null) {
            return "is null";
        }
        if (expected instanceof Boolean) {
            return "is " + expected;
        }
        return "is identical to " + Exporter.export(expected);
    }
}
