package jerrinot.info.unitengine.framework;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestFailureTest {

    private final WarningTestCase test = new WarningTestCase("warning");

    @Test
    void assertionMessagesAreShownAsIs() {
        TestFailure failure = new TestFailure(TestStatus.FAILURE, test,
                new ExpectationFailedException("Failed asserting that false is true."));

        assertTrue(failure.isFailure());
        assertEquals("Warning", failure.getTestName());
        assertEquals("Failed asserting that false is true.", failure.exceptionMessage());
        assertEquals("FAILURE Warning: Failed asserting that false is true.", failure.toString());
    }

    @Test
    void errorsArePrefixedWithTheExceptionClass() {
        TestFailure error = new TestFailure(TestStatus.ERROR, test, new IllegalStateException("boom"));

        assertFalse(error.isFailure());
        assertEquals("java.lang.IllegalStateException: boom", error.exceptionMessage());
        assertEquals("java.lang.NullPointerException",
                new TestFailure(TestStatus.ERROR, test, new NullPointerException()).exceptionMessage());
    }

    @Test
    void wrappedErrorShowsItsOwnStackTrace() {
        Error cause = new Error("inner");
        TestFailure error = new TestFailure(TestStatus.ERROR, test, new ExceptionWrapper(cause));

        assertEquals("inner", error.exceptionMessage());
        assertTrue(error.getStackTrace().startsWith("java.lang.Error: inner"));
    }

    @Test
    void requiresAllParts() {
        assertThrows(NullPointerException.class, () -> new TestFailure(null, test, new Error()));
        assertThrows(NullPointerException.class, () -> new TestFailure(TestStatus.ERROR, null, new Error()));
        assertThrows(NullPointerException.class, () -> new TestFailure(TestStatus.ERROR, test, null));
    }
}
