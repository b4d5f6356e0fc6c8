package jerrinot.info.unitengine.framework;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestStatusTest {

    @Test
    void riskyWinsOverEverything() {
        assertEquals(TestStatus.RISKY, TestStatus.of(new RiskyTestError("r")));
        assertEquals(TestStatus.RISKY, TestStatus.of(new OutputError("o")));
    }

    @Test
    void signalsAreClassifiedBeforeFailures() {
        assertEquals(TestStatus.INCOMPLETE, TestStatus.of(new IncompleteTestError("i")));
        assertEquals(TestStatus.SKIPPED, TestStatus.of(new SkippedTestError("s")));
        assertEquals(TestStatus.FAILURE, TestStatus.of(new ExpectationFailedException("f")));
        assertEquals(TestStatus.FAILURE, TestStatus.of(new SkippedTestSuiteError("suite")));
        assertEquals(TestStatus.FAILURE, TestStatus.of(new AssertionError("plain")));
    }

    @Test
    void everythingElseIsAnError() {
        assertEquals(TestStatus.ERROR, TestStatus.of(new IllegalStateException()));
        assertEquals(TestStatus.ERROR, TestStatus.of(new EngineException("engine")));
        assertEquals(TestStatus.ERROR, TestStatus.of(new ExceptionWrapper(new OutOfMemoryError("oom"))));
    }

    @Test
    void onlyFailuresAndErrorsAreTerminal() {
        assertTrue(TestStatus.FAILURE.isTerminalFailure());
        assertTrue(TestStatus.ERROR.isTerminalFailure());
        assertFalse(TestStatus.SKIPPED.isTerminalFailure());
        assertFalse(TestStatus.RISKY.isTerminalFailure());
        assertFalse(TestStatus.PASSED.isTerminalFailure());
    }

    @Test
    void sizeComparisonNeedsBothSizesKnown() {
        assertTrue(TestSize.LARGE.isLargerThan(TestSize.SMALL));
        assertFalse(TestSize.SMALL.isLargerThan(TestSize.LARGE));
        assertFalse(TestSize.MEDIUM.isLargerThan(TestSize.MEDIUM));
        assertFalse(TestSize.LARGE.isLargerThan(TestSize.UNKNOWN));
        assertFalse(TestSize.UNKNOWN.isLargerThan(TestSize.SMALL));
    }
}
