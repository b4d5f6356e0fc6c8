package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.CodedException;

import java.sql.SQLException;

public final class ExceptionCode implements Constraint<Throwable> {

    private final int expected;

    public ExceptionCode(int expected) {
        this.expected = expected;
    }

    @Override
    public boolean matches(Throwable other) {
        Integer code = codeOf(other);
        return code != null && code == expected;
    }

    @Override
    public String failureDescription(Throwable other) {
        Integer code = codeOf(other);
        return (code == null ? "<no code>" : code.toString()) + " is equal to expected exception code " + expected;
    }

    @Override
    public String toString() {
        return "exception code is " + expected;
    }

    /**
     * Numeric code carried by the exception, or {@code null} when it has none.
     */
    public static Integer codeOf(Throwable t) {
        if (t instanceof CodedException) {
            return ((CodedException) t).getCode();
        }
        if (t instanceof SQLException) {
            return ((SQLException) t).getErrorCode();
        }
        return null;
    }
}
