package jerrinot.info.unitengine.runner;

import jerrinot.info.unitengine.framework.EngineException;
import jerrinot.info.unitengine.framework.Test;
import jerrinot.info.unitengine.framework.TestListener;
import jerrinot.info.unitengine.framework.TestResult;
import jerrinot.info.unitengine.framework.TestSuite;
import jerrinot.info.unitengine.runner.filter.GroupExcludeFilter;
import jerrinot.info.unitengine.runner.filter.GroupIncludeFilter;
import jerrinot.info.unitengine.runner.filter.NameFilter;
import jerrinot.info.unitengine.runner.filter.TestFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs tests with a {@link ResultPrinter} attached and maps the outcome to an exit code.
 */
public class TestRunner extends BaseTestRunner {

    private static final Logger LOG = LoggerFactory.getLogger(TestRunner.class);

    public static final int SUCCESS_EXIT = 0;
    public static final int FAILURE_EXIT = 1;
    public static final int EXCEPTION_EXIT = 2;

    private final PrintStream out;

    public TestRunner(PrintStream out) {
        this(out, new StandardTestSuiteLoader());
    }

    public TestRunner(PrintStream out, TestSuiteLoader loader) {
        super(loader);
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Runs the named test classes as one suite.
     *
     * @return {@link #SUCCESS_EXIT}, {@link #FAILURE_EXIT} or {@link #EXCEPTION_EXIT}
     */
    public int start(List<String> testClassNames, RunnerArguments arguments) {
        try {
            TestSuite suite = new TestSuite();
            for (String className : testClassNames) {
                Test test = getTest(className);
                if (test == null) {
                    return EXCEPTION_EXIT;
                }
                suite.addTest(test);
            }
            return exitCode(doRun(suite, arguments));
        } catch (EngineException e) {
            runFailed(e.getMessage());
            return EXCEPTION_EXIT;
        }
    }

    /**
     * Runs every test class of a discovery mapping.
     *
     * @param discovered fully qualified class name to source location
     */
    public int start(String suiteName, Map<String, String> discovered, RunnerArguments arguments) {
        try {
            Test test = getTest(suiteName, discovered);
            if (test == null) {
                return EXCEPTION_EXIT;
            }
            return exitCode(doRun(test, arguments));
        } catch (EngineException e) {
            runFailed(e.getMessage());
            return EXCEPTION_EXIT;
        }
    }

    static int exitCode(TestResult result) {
        return result.wasSuccessful() ? SUCCESS_EXIT : FAILURE_EXIT;
    }

    public TestResult doRun(Test test, RunnerArguments arguments) {
        if (test instanceof TestSuite) {
            TestSuite suite = (TestSuite) test;
            processSuiteFilters(suite, arguments);
            if (arguments.getBackupSystemProperties() != null) {
                suite.setBackupSystemProperties(arguments.getBackupSystemProperties());
            }
            if (arguments.getDisallowChangesToGlobalState() != null) {
                suite.setDisallowChangesToGlobalState(arguments.getDisallowChangesToGlobalState());
            }
        }
        if (arguments.getRepeat() > 1) {
            test = new RepeatedTest(test, arguments.getRepeat());
        }

        TestResult result = createTestResult();
        result.convertErrorsToExceptions(arguments.isConvertErrorsToExceptions());
        result.stopOnError(arguments.isStopOnError());
        result.stopOnFailure(arguments.isStopOnFailure());
        result.stopOnIncomplete(arguments.isStopOnIncomplete());
        result.stopOnRisky(arguments.isStopOnRisky());
        result.stopOnSkipped(arguments.isStopOnSkipped());
        result.beStrictAboutTestsThatDoNotTestAnything(arguments.isReportUselessTests());
        result.beStrictAboutOutputDuringTests(arguments.isDisallowTestOutput());
        result.beStrictAboutTodoAnnotatedTests(arguments.isDisallowTodoAnnotatedTests());

        for (TestListener listener : arguments.getListeners()) {
            result.addListener(listener);
        }
        ResultPrinter printer = new ResultPrinter(out, arguments.isVerbose());
        result.addListener(printer);

        LOG.debug("Running {} tests with {}", test.count(), arguments);
        test.run(result);
        result.flushListeners();
        printer.printResult(result);
        return result;
    }

    private static void processSuiteFilters(TestSuite suite, RunnerArguments arguments) {
        TestFilter filter = null;
        if (!arguments.getExcludeGroups().isEmpty()) {
            filter = new GroupExcludeFilter(arguments.getExcludeGroups());
        }
        if (!arguments.getGroups().isEmpty()) {
            filter = and(filter, new GroupIncludeFilter(arguments.getGroups()));
        }
        if (arguments.getFilter() != null) {
            filter = and(filter, new NameFilter(arguments.getFilter()));
        }
        if (filter != null) {
            suite.injectFilter(filter);
        }
    }

    private static TestFilter and(TestFilter first, TestFilter second) {
        return first == null ? second : first.and(second);
    }

    @Override
    protected void runFailed(String message) {
        LOG.error(message);
        out.println(message);
    }
}
