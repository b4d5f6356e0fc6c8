package jerrinot.info.unitengine.framework;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a {@link TestResult}.
 */
public final class TestSummary {

    public static final TestSummary EMPTY = new TestSummary(0, 0, 0, 0, 0, 0, 0, Duration.ZERO, List.of());

    private final int run;
    private final int passed;
    private final int failures;
    private final int errors;
    private final int skipped;
    private final int incomplete;
    private final int risky;
    private final int assertions;
    private final Duration time;
    private final List<TestFailure> failureDetails;

    public TestSummary(int run, int failures, int errors, int skipped, int incomplete, int risky,
                       int assertions, Duration time, List<TestFailure> failureDetails) {
        this(run, Math.max(0, run - failures - errors - skipped - incomplete - risky), failures, errors, skipped,
                incomplete, risky, assertions, time, failureDetails);
    }

    /**
     * @param passed tests that ended without a fault, counted separately because errors raised by suite hooks
     *               belong to no single test
     */
    public TestSummary(int run, int passed, int failures, int errors, int skipped, int incomplete, int risky,
                       int assertions, Duration time, List<TestFailure> failureDetails) {
        this.run = run;
        this.passed = passed;
        this.failures = failures;
        this.errors = errors;
        this.skipped = skipped;
        this.incomplete = incomplete;
        this.risky = risky;
        this.assertions = assertions;
        this.time = Objects.requireNonNull(time, "time");
        this.failureDetails = List.copyOf(failureDetails);
    }

    public int getRun() { return run; }
    public int getFailures() { return failures; }
    public int getErrors() { return errors; }
    public int getSkipped() { return skipped; }
    public int getIncomplete() { return incomplete; }
    public int getRisky() { return risky; }
    public int getAssertions() { return assertions; }
    public Duration getTime() { return time; }
    public int getPassed() { return passed; }
    public boolean hasFailures() { return failures > 0 || errors > 0; }
    public List<TestFailure> getFailureDetails() { return failureDetails; }

    @Override
    public String toString() {
        return "TestSummary{run=" + run + ", passed=" + getPassed()
                + ", failures=" + failures + ", errors=" + errors
                + ", skipped=" + skipped + ", incomplete=" + incomplete
                + ", risky=" + risky + "}";
    }
}
