package jerrinot.info.unitengine.framework;

/**
 * Anything that can be run against a {@link TestResult}: a single test case, a suite or a decorator.
 */
public interface Test {

    /**
     * Number of test cases this test will run.
     */
    int count();

    void run(TestResult result);
}
