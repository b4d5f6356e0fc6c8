package jerrinot.info.unitengine.framework;

import jerrinot.info.unitengine.dependency.DependencyResolver;
import jerrinot.info.unitengine.logging.TestLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Flushable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Collects the outcome of a run and notifies listeners. One instance is shared by every test of a run.
 */
public class TestResult {

    private static final Logger LOG = LoggerFactory.getLogger(TestResult.class);

    private final Map<String, PassedTest> passed = new LinkedHashMap<>();
    private final List<TestFailure> errors = new ArrayList<>();
    private final List<TestFailure> failures = new ArrayList<>();
    private final List<TestFailure> notImplemented = new ArrayList<>();
    private final List<TestFailure> risky = new ArrayList<>();
    private final List<TestFailure> skipped = new ArrayList<>();
    private final List<TestListener> listeners = new ArrayList<>();

    private int runTests;
    private int passedTests;
    private int numAssertions;
    private Duration time = Duration.ZERO;
    private TestSuite topTestSuite;

    private boolean convertErrorsToExceptions = true;
    private volatile boolean stop;
    private boolean stopOnError;
    private boolean stopOnFailure;
    private boolean stopOnRisky;
    private boolean stopOnIncomplete;
    private boolean stopOnSkipped;
    private boolean beStrictAboutTestsThatDoNotTestAnything;
    private boolean beStrictAboutOutputDuringTests;
    private boolean beStrictAboutTodoAnnotatedTests;
    private boolean lastTestFailed;

    public synchronized void addListener(TestListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public synchronized void removeListener(TestListener listener) {
        listeners.remove(listener);
    }

    /**
     * Flushes every listener that buffers its output.
     */
    public synchronized void flushListeners() {
        for (TestListener listener : listeners) {
            if (listener instanceof Flushable) {
                try {
                    ((Flushable) listener).flush();
                } catch (IOException e) {
                    LOG.warn("Failed to flush listener {}", listener, e);
                }
            }
        }
    }

    /**
     * Records a fault raised outside an assertion. Skip, incomplete and risky signals go to their own buckets.
     */
    public synchronized void addError(Test test, Throwable t, Duration time) {
        TestStatus status = TestStatus.of(t);
        switch (status) {
            case RISKY:
                risky.add(new TestFailure(status, test, t));
                notify(listener -> listener.addRiskyTest(test, t, time));
                if (stopOnRisky) {
                    stop();
                }
                break;
            case INCOMPLETE:
                notImplemented.add(new TestFailure(status, test, t));
                notify(listener -> listener.addIncompleteTest(test, t, time));
                if (stopOnIncomplete) {
                    stop();
                }
                break;
            case SKIPPED:
                skipped.add(new TestFailure(status, test, t));
                notify(listener -> listener.addSkippedTest(test, t, time));
                if (stopOnSkipped) {
                    stop();
                }
                break;
            default:
                errors.add(new TestFailure(TestStatus.ERROR, test, t));
                notify(listener -> listener.addError(test, t, time));
                if (stopOnError || stopOnFailure) {
                    stop();
                }
        }
        lastTestFailed = true;
        this.time = this.time.plus(time);
    }

    public synchronized void addFailure(Test test, AssertionError e, Duration time) {
        TestStatus status = TestStatus.of(e);
        switch (status) {
            case RISKY:
                risky.add(new TestFailure(status, test, e));
                notify(listener -> listener.addRiskyTest(test, e, time));
                if (stopOnRisky) {
                    stop();
                }
                break;
            case INCOMPLETE:
                notImplemented.add(new TestFailure(status, test, e));
                notify(listener -> listener.addIncompleteTest(test, e, time));
                if (stopOnIncomplete) {
                    stop();
                }
                break;
            case SKIPPED:
                skipped.add(new TestFailure(status, test, e));
                notify(listener -> listener.addSkippedTest(test, e, time));
                if (stopOnSkipped) {
                    stop();
                }
                break;
            default:
                failures.add(new TestFailure(TestStatus.FAILURE, test, e));
                notify(listener -> listener.addFailure(test, e, time));
                if (stopOnFailure) {
                    stop();
                }
        }
        lastTestFailed = true;
        this.time = this.time.plus(time);
    }

    public synchronized void startTestSuite(TestSuite suite) {
        if (topTestSuite == null) {
            topTestSuite = suite;
        }
        notify(listener -> listener.startTestSuite(suite));
    }

    public synchronized void endTestSuite(TestSuite suite) {
        notify(listener -> listener.endTestSuite(suite));
    }

    public synchronized void startTest(Test test) {
        lastTestFailed = false;
        runTests += test.count();
        notify(listener -> listener.startTest(test));
    }

    /**
     * Notifies listeners and, when the test did not fail, remembers it for the tests that depend on it.
     */
    public synchronized void endTest(Test test, Duration time) {
        notify(listener -> listener.endTest(test, time));
        if (!lastTestFailed) {
            passedTests += test.count();
        }
        if (!lastTestFailed && test instanceof TestCase) {
            TestCase testCase = (TestCase) test;
            passed.put(testCase.getClass().getName() + DependencyResolver.QUALIFIER + testCase.getName(),
                    new PassedTest(testCase.getResult(), testCase.getSize()));
            this.time = this.time.plus(time);
        }
    }

    /**
     * Runs a test case and records its outcome.
     */
    public void run(TestCase test) {
        Assert.resetCount();
        startTest(test);

        boolean error = false;
        boolean failure = false;
        Throwable fault = null;

        long start = System.nanoTime();
        try (TestLogContext ignored = TestLogContext.of(test)) {
            test.runBare();
        } catch (AssertionError e) {
            failure = true;
            fault = e;
        } catch (EngineException e) {
            error = true;
            fault = e;
        } catch (Error e) {
            if (!convertErrorsToExceptions || isFatal(e)) {
                throw e;
            }
            error = true;
            fault = new ExceptionWrapper(e);
        } catch (Throwable t) {
            error = true;
            fault = t;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        test.addToAssertionCount(Assert.getCount());
        synchronized (this) {
            numAssertions += test.getNumAssertions();
        }

        if (error) {
            addError(test, fault, elapsed);
        } else if (failure) {
            addFailure(test, (AssertionError) fault, elapsed);
        } else if (beStrictAboutTestsThatDoNotTestAnything && test.getNumAssertions() == 0) {
            addFailure(test, new RiskyTestError("This test did not perform any assertions"), elapsed);
        } else if (beStrictAboutOutputDuringTests && test.hasOutput()) {
            addFailure(test, new OutputError(String.format("This test printed output: %s", test.getActualOutput())),
                    elapsed);
        } else if (beStrictAboutTodoAnnotatedTests && test.isTodo()) {
            addFailure(test, new RiskyTestError("Test method is annotated with @todo"), elapsed);
        }
        LOG.debug("{} finished in {} ms: {}", test, elapsed.toMillis(),
                fault == null ? TestStatus.PASSED : TestStatus.of(fault));

        endTest(test, elapsed);
    }

    private static boolean isFatal(Error e) {
        return e instanceof VirtualMachineError || e instanceof LinkageError;
    }

    private void notify(Consumer<TestListener> callback) {
        for (TestListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Listener {} failed", listener, e);
            }
        }
    }

    public synchronized int count() { return runTests; }

    public synchronized boolean shouldStop() { return stop; }

    public void stop() {
        stop = true;
    }

    public synchronized boolean wasSuccessful() {
        return errors.isEmpty() && failures.isEmpty();
    }

    public synchronized boolean allHarmless() {
        return wasSuccessful() && risky.isEmpty() && notImplemented.isEmpty() && skipped.isEmpty();
    }

    public synchronized boolean allCompletelyImplemented() {
        return notImplemented.isEmpty();
    }

    /**
     * Passed tests keyed by qualified name, data-set suffix included.
     */
    public synchronized Map<String, PassedTest> passed() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(passed));
    }

    public synchronized List<TestFailure> errors() { return List.copyOf(errors); }
    public synchronized List<TestFailure> failures() { return List.copyOf(failures); }
    public synchronized List<TestFailure> notImplemented() { return List.copyOf(notImplemented); }
    public synchronized List<TestFailure> risky() { return List.copyOf(risky); }
    public synchronized List<TestFailure> skipped() { return List.copyOf(skipped); }

    public synchronized int errorCount() { return errors.size(); }
    public synchronized int failureCount() { return failures.size(); }
    public synchronized int notImplementedCount() { return notImplemented.size(); }
    public synchronized int riskyCount() { return risky.size(); }
    public synchronized int skippedCount() { return skipped.size(); }
    public synchronized int passedCount() { return passed.size(); }
    public synchronized int getNumAssertions() { return numAssertions; }
    public synchronized Duration time() { return time; }
    public synchronized TestSuite topTestSuite() { return topTestSuite; }

    public synchronized TestSummary summary() {
        List<TestFailure> details = new ArrayList<>(errors);
        details.addAll(failures);
        return new TestSummary(runTests, passedTests, failures.size(), errors.size(), skipped.size(),
                notImplemented.size(), risky.size(), numAssertions, time, details);
    }

    public synchronized boolean getConvertErrorsToExceptions() { return convertErrorsToExceptions; }

    public synchronized void convertErrorsToExceptions(boolean flag) {
        this.convertErrorsToExceptions = flag;
    }

    public synchronized void stopOnError(boolean flag) {
        this.stopOnError = flag;
    }

    public synchronized void stopOnFailure(boolean flag) {
        this.stopOnFailure = flag;
    }

    public synchronized void stopOnRisky(boolean flag) {
        this.stopOnRisky = flag;
    }

    public synchronized void stopOnIncomplete(boolean flag) {
        this.stopOnIncomplete = flag;
    }

    public synchronized void stopOnSkipped(boolean flag) {
        this.stopOnSkipped = flag;
    }

    public synchronized void beStrictAboutTestsThatDoNotTestAnything(boolean flag) {
        this.beStrictAboutTestsThatDoNotTestAnything = flag;
    }

    public synchronized boolean isStrictAboutTestsThatDoNotTestAnything() {
        return beStrictAboutTestsThatDoNotTestAnything;
    }

    public synchronized void beStrictAboutOutputDuringTests(boolean flag) {
        this.beStrictAboutOutputDuringTests = flag;
    }

    public synchronized boolean isStrictAboutOutputDuringTests() {
        return beStrictAboutOutputDuringTests;
    }

    public synchronized void beStrictAboutTodoAnnotatedTests(boolean flag) {
        this.beStrictAboutTodoAnnotatedTests = flag;
    }

    public synchronized boolean isStrictAboutTodoAnnotatedTests() {
        return beStrictAboutTodoAnnotatedTests;
    }
}
