package jerrinot.info.unitengine.framework;

public enum TestStatus {
    PASSED,
    SKIPPED,
    INCOMPLETE,
    FAILURE,
    ERROR,
    RISKY;

    /**
     * Classifies a raised fault. Risky wins over incomplete, incomplete over skipped,
     * skipped over an assertion failure; everything else is an error.
     */
    public static TestStatus of(Throwable t) {
        if (t instanceof RiskyTestError || t instanceof OutputError) {
            return RISKY;
        }
        if (t instanceof IncompleteTestError) {
            return INCOMPLETE;
        }
        if (t instanceof SkippedTestError) {
            return SKIPPED;
        }
        if (t instanceof AssertionError) {
            return FAILURE;
        }
        return ERROR;
    }

    public boolean isTerminalFailure() {
        return this == FAILURE || this == ERROR;
    }
}
