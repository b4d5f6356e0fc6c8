package jerrinot.info.unitengine.framework;

import java.util.Objects;

/**
 * Carries a {@link java.lang.Error} raised by test code so it can be reported as an ordinary error.
 */
public class ExceptionWrapper extends EngineException {

    private final String className;

    public ExceptionWrapper(Throwable wrapped) {
        super(Objects.requireNonNull(wrapped, "wrapped").getMessage() == null ? "" : wrapped.getMessage(), wrapped);
        this.className = wrapped.getClass().getName();
    }

    public String getClassName() { return className; }

    public Throwable getWrapped() { return getCause(); }

    @Override
    public String toString() {
        String message = getMessage();
        return message.isEmpty() ? className : className + ": " + message;
    }
}
