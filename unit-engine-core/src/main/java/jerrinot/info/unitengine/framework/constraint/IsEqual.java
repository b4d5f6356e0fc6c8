package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.Exporter;

import java.util.Objects;

public final class IsEqual implements Constraint<Object> {

    private final Object expected;
    private final double delta;

    public IsEqual(Object expected) {
        this(expected, 0.0);
    }

    public IsEqual(Object expected, double delta) {
        this.expected = expected;
        this.delta = delta;
    }

    @Override
    public boolean matches(Object other) {
        if (expected instanceof Number && other instanceof Number && isFloating(expected, other)) {
            double difference = Math.abs(((Number) expected).doubleValue() - ((Number) other).doubleValue());
            return difference <= delta;
        }
        if (expected instanceof Number && other instanceof Number) {
            return ((Number) expected).longValue() == ((Number) other).longValue();
        }
        return Objects.deepEquals(expected, other);
    }

    private static boolean isFloating(Object a, Object b) {
        return a instanceof Double || a instanceof Float || b instanceof Double || b instanceof Float;
    }

    @Override
    public String toString() {
        String description = "is equal to " + Exporter.export(expected);
        return delta != 0.0 ? description + " with delta <" + delta + ">" : description;
    }
}
