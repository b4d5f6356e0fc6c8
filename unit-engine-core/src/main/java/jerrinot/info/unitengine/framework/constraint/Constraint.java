package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.Exporter;

/**
 * A check evaluated by {@link jerrinot.info.unitengine.framework.Assert#assertThat}.
 * {@link #toString()} describes the expectation, for example {@code is equal to 5}.
 */
public interface Constraint<T> {

    boolean matches(T other);

    /**
     * Text placed after "Failed asserting that " when the value does not match.
     */
    default String failureDescription(T other) {
        return Exporter.export(other) + " " + this;
    }
}
