package jerrinot.info.unitengine.framework.constraint;

import java.util.Objects;

/**
 * The exception message contains the expected text. An empty expectation requires an empty message.
 */
public final class ExceptionMessage implements Constraint<Throwable> {

    private final String expected;

    public ExceptionMessage(String expected) {
        this.expected = Objects.requireNonNull(expected, "expected");
    }

    @Override
    public boolean matches(Throwable other) {
        String message = messageOf(other);
        if (expected.isEmpty()) {
            return message.isEmpty();
        }
        return message.contains(expected);
    }

    @Override
    public String failureDescription(Throwable other) {
        if (expected.isEmpty()) {
            return "exception message is empty but is '" + messageOf(other) + "'";
        }
        return "exception message '" + messageOf(other) + "' contains '" + expected + "'";
    }

    @Override
    public String toString() {
        return expected.isEmpty() ? "exception message is empty" : "exception message contains '" + expected + "'";
    }

    static String messageOf(Throwable t) {
        return t == null || t.getMessage() == null ? "" : t.getMessage();
    }
}
