package jerrinot.info.unitengine.runner;

import jerrinot.info.unitengine.framework.Test;
import jerrinot.info.unitengine.framework.TestFailure;
import jerrinot.info.unitengine.framework.TestListener;
import jerrinot.info.unitengine.framework.TestResult;
import jerrinot.info.unitengine.framework.TestSummary;

import java.io.Flushable;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Prints one progress character per test and a summary at the end of the run.
 */
public class ResultPrinter implements TestListener, Flushable {

    private static final int MAX_FAILURE_DETAILS = 10;
    private static final int MAX_COLUMN = 60;

    private final PrintStream out;
    private final boolean verbose;
    private int column;
    private boolean lastTestFailed;

    public ResultPrinter(PrintStream out) {
        this(out, false);
    }

    public ResultPrinter(PrintStream out, boolean verbose) {
        this.out = Objects.requireNonNull(out, "out");
        this.verbose = verbose;
    }

    @Override
    public void addError(Test test, Throwable t, Duration time) {
        writeProgress('E');
    }

    @Override
    public void addFailure(Test test, AssertionError e, Duration time) {
        writeProgress('F');
    }

    @Override
    public void addIncompleteTest(Test test, Throwable t, Duration time) {
        writeProgress('I');
    }

    @Override
    public void addRiskyTest(Test test, Throwable t, Duration time) {
        writeProgress('R');
    }

    @Override
    public void addSkippedTest(Test test, Throwable t, Duration time) {
        writeProgress('S');
    }

    @Override
    public void startTest(Test test) {
        lastTestFailed = false;
    }

    @Override
    public void endTest(Test test, Duration time) {
        if (!lastTestFailed) {
            writeProgress('.');
        }
        lastTestFailed = false;
    }

    private synchronized void writeProgress(char progress) {
        if (progress != '.') {
            lastTestFailed = true;
        }
        out.print(progress);
        if (++column == MAX_COLUMN) {
            out.println();
            column = 0;
        }
    }

    /**
     * Prints the summary as one block so parallel runs do not interleave it.
     */
    public void printResult(TestResult result) {
        TestSummary summary = result.summary();
        StringBuilder sb = new StringBuilder();
        if (column > 0) {
            sb.append('\n');
            column = 0;
        }
        sb.append("\nTime: ").append(formatTime(summary.getTime())).append('\n');
        sb.append("TESTS run=").append(summary.getRun())
                .append(" passed=").append(summary.getPassed())
                .append(" failures=").append(summary.getFailures())
                .append(" errors=").append(summary.getErrors())
                .append(" skipped=").append(summary.getSkipped())
                .append(" incomplete=").append(summary.getIncomplete())
                .append(" risky=").append(summary.getRisky())
                .append(" assertions=").append(summary.getAssertions())
                .append(" time=").append(formatTime(summary.getTime()));

        List<TestFailure> details = summary.getFailureDetails();
        int shown = Math.min(details.size(), MAX_FAILURE_DETAILS);
        for (int i = 0; i < shown; i++) {
            appendDetail(sb, details.get(i), details.get(i).isFailure() ? "FAIL " : "ERROR ");
        }
        if (details.size() > MAX_FAILURE_DETAILS) {
            int remaining = details.size() - MAX_FAILURE_DETAILS;
            sb.append("\nTRUNCATED ").append(remaining)
                    .append(remaining == 1 ? " more failure not shown" : " more failures not shown");
        }
        if (verbose) {
            for (TestFailure f : result.risky()) {
                appendDetail(sb, f, "RISKY ");
            }
            for (TestFailure f : result.notImplemented()) {
                appendDetail(sb, f, "INCOMPLETE ");
            }
            for (TestFailure f : result.skipped()) {
                appendDetail(sb, f, "SKIPPED ");
            }
        }

        sb.append('\n').append(summary.hasFailures() ? "FAILURES!" : "OK");
        out.println(sb);
    }

    private static void appendDetail(StringBuilder sb, TestFailure f, String prefix) {
        sb.append('\n').append(prefix).append(f.getTestName());
        String message = f.exceptionMessage();
        if (!message.isEmpty()) {
            for (String line : message.split("\\r?\\n")) {
                sb.append("\n  ").append(line);
            }
        }
    }

    static String formatTime(Duration time) {
        return String.format(Locale.ROOT, "%.3fs", time.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void flush() {
        out.flush();
    }
}
