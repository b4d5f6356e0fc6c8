package jerrinot.info.unitengine.framework.constraint;

import java.util.Objects;

public final class ExceptionConstraint implements Constraint<Throwable> {

    private final Class<? extends Throwable> expected;

    public ExceptionConstraint(Class<? extends Throwable> expected) {
        this.expected = Objects.requireNonNull(expected, "expected");
    }

    @Override
    public boolean matches(Throwable other) {
        return expected.isInstance(other);
    }

    @Override
    public String failureDescription(Throwable other) {
        if (other == null) {
            return "exception of type \"" + expected.getName() + "\" is thrown";
        }
        String message = other.getMessage();
        return "exception of type \"" + other.getClass().getName() + "\" matches expected exception \""
                + expected.getName() + "\""
                + (message == null || message.isEmpty() ? "" : ". Message was: \"" + message + "\"");
    }

    @Override
    public String toString() {
        return "exception of type \"" + expected.getName() + "\"";
    }
}
