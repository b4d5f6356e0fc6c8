package jerrinot.info.unitengine.framework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * A test together with the fault it raised and the bucket the fault was classified into.
 */
public final class TestFailure {

    private final TestStatus status;
    private final Test failedTest;
    private final Throwable thrownException;
    private final String testName;

    public TestFailure(TestStatus status, Test failedTest, Throwable thrownException) {
        this.status = Objects.requireNonNull(status, "status");
        this.failedTest = Objects.requireNonNull(failedTest, "failedTest");
        this.thrownException = Objects.requireNonNull(thrownException, "thrownException");
        this.testName = failedTest.toString();
    }

    public TestStatus getStatus() { return status; }
    public Test failedTest() { return failedTest; }
    public Throwable thrownException() { return thrownException; }
    public String getTestName() { return testName; }
    public boolean isFailure() { return status == TestStatus.FAILURE; }

    public String exceptionMessage() {
        String message = thrownException.getMessage();
        if (thrownException instanceof AssertionError || thrownException instanceof ExceptionWrapper) {
            return message == null ? "" : message;
        }
        return message == null || message.isEmpty()
                ? thrownException.getClass().getName()
                : thrownException.getClass().getName() + ": " + message;
    }

    public String getStackTrace() {
        StringWriter writer = new StringWriter();
        Throwable t = thrownException instanceof ExceptionWrapper
                ? ((ExceptionWrapper) thrownException).getWrapped()
                : thrownException;
        t.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    @Override
    public String toString() {
        return status + " " + testName + ": " + exceptionMessage();
    }
}
