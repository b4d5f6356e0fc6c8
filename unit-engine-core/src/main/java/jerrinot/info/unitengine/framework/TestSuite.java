package jerrinot.info.unitengine.framework;

import jerrinot.info.unitengine.dataprovider.DataProviderExpander;
import jerrinot.info.unitengine.dependency.DependencyResolver;
import jerrinot.info.unitengine.metadata.HookMethods;
import jerrinot.info.unitengine.metadata.MetadataExtractor;
import jerrinot.info.unitengine.metadata.TestMethodDescriptor;
import jerrinot.info.unitengine.runner.filter.TestFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered composite of tests. Children run in the order they were added.
 * <p>
 * A suite built from a class holds one test per test method, or a {@link DataProviderTestSuite} for methods
 * with a data provider, and runs the class hooks around them.
 */
public class TestSuite implements Test, Iterable<Test> {

    private static final Logger LOG = LoggerFactory.getLogger(TestSuite.class);

    public static final String DEFAULT_GROUP = "default";
    public static final String SUITE_METHOD_NAME = "suite";

    private String name = "";
    private final List<Test> tests = new ArrayList<>();
    private Map<String, List<Test>> groups = new LinkedHashMap<>();
    private Class<?> theClass;
    private boolean testCase;
    private Boolean backupSystemProperties;
    private Boolean disallowChangesToGlobalState;
    private TestFilter filter;
    private int numTests = -1;

    public TestSuite() {
    }

    public TestSuite(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public TestSuite(Class<?> theClass) {
        this(theClass, theClass.getName());
    }

    /**
     * Suite of every test method of the class.
     *
     * @throws EngineException when the class does not extend {@link TestCase}
     */
    public TestSuite(Class<?> theClass, String name) {
        if (!TestCase.class.isAssignableFrom(theClass) || theClass == TestCase.class) {
            throw new EngineException("Class \"" + theClass.getName() + "\" does not extend "
                    + TestCase.class.getName() + ".");
        }
        this.name = name;
        this.theClass = theClass;

        if (Modifier.isAbstract(theClass.getModifiers())) {
            addTest(warning(String.format("Cannot instantiate abstract class \"%s\".", name)));
            return;
        }

        List<TestMethodDescriptor> methods;
        try {
            methods = MetadataExtractor.describe(theClass).getTestMethods();
        } catch (EngineException e) {
            addTest(warning(e.getMessage()));
            return;
        }
        for (TestMethodDescriptor method : methods) {
            addTestMethod(theClass, method.getName());
        }
        if (tests.isEmpty()) {
            addTest(warning(String.format("No tests found in class \"%s\".", name)));
        }
        this.testCase = true;
    }

    @Override
    public String toString() {
        return name;
    }

    public String getName() { return name; }

    public void setName(String name) {
        this.name = name;
    }

    public Class<?> getTestClass() { return theClass; }

    /**
     * True when this suite represents a test class, so its class hooks apply.
     */
    public boolean isTestCaseClass() { return testCase; }

    public void addTest(Test test) {
        addTest(test, List.of());
    }

    /**
     * Adds a test under the given groups. A nested suite added without groups brings its own.
     */
    public void addTest(Test test, List<String> groups) {
        Objects.requireNonNull(test, "test");
        tests.add(test);
        numTests = -1;

        List<String> effective = groups;
        if (test instanceof TestSuite && effective.isEmpty()) {
            effective = ((TestSuite) test).getGroups();
        }
        if (effective.isEmpty()) {
            effective = List.of(DEFAULT_GROUP);
        }
        for (String group : effective) {
            this.groups.computeIfAbsent(group, g -> new ArrayList<>()).add(test);
        }
    }

    /**
     * Adds the suite of a test class, built by its static {@code suite()} method when it has one.
     */
    public void addTestSuite(Class<?> testClass) {
        Test suite = invokeSuiteMethod(testClass);
        addTest(suite != null ? suite : new TestSuite(testClass));
    }

    /**
     * Result of the class's {@code public static Test suite()} method, or {@code null} when it has none.
     */
    public static Test invokeSuiteMethod(Class<?> testClass) {
        Method suiteMethod;
        try {
            suiteMethod = testClass.getMethod(SUITE_METHOD_NAME);
        } catch (NoSuchMethodException e) {
            return null;
        }
        if (!Test.class.isAssignableFrom(suiteMethod.getReturnType())) {
            return null;
        }
        if (!Modifier.isStatic(suiteMethod.getModifiers())) {
            throw new EngineException("suite() method must be static.");
        }
        try {
            suiteMethod.setAccessible(true);
            return (Test) suiteMethod.invoke(null);
        } catch (InvocationTargetException e) {
            throw new EngineException("suite() method of " + testClass.getName() + " failed", e.getCause());
        } catch (IllegalAccessException e) {
            throw new EngineException("suite() method of " + testClass.getName() + " is not accessible", e);
        }
    }

    protected void addTestMethod(Class<?> theClass, String methodName) {
        Test test = createTest(theClass, methodName);
        List<String> dependencies = MetadataExtractor.getDependencies(theClass, methodName);
        if (test instanceof TestCase && !(test instanceof WarningTestCase)) {
            ((TestCase) test).setDependencies(dependencies);
        } else if (test instanceof DataProviderTestSuite) {
            ((DataProviderTestSuite) test).setDependencies(dependencies);
        }
        addTest(test, MetadataExtractor.getGroups(theClass, methodName));
    }

    /**
     * Creates the test for one test method: a plain test case, a suite of its data sets, or a placeholder
     * reporting why neither could be created.
     */
    public static Test createTest(Class<?> theClass, String methodName) {
        String className = theClass.getName();
        Map<Object, List<Object>> data;
        try {
            data = DataProviderExpander.getProvidedData(theClass, methodName);
        } catch (IncompleteTestError e) {
            return new IncompleteTestCase(className, methodName,
                    String.format("Test for %s::%s marked incomplete by data provider", className, methodName)
                            + appendMessage(e));
        } catch (SkippedTestError e) {
            return new SkippedTestCase(className, methodName,
                    String.format("Test for %s::%s skipped by data provider", className, methodName)
                            + appendMessage(e));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            LOG.debug("Data provider of {}::{} failed", className, methodName, t);
            return warning(String.format("The data provider specified for %s::%s is invalid.", className, methodName)
                    + appendMessage(t));
        }

        try {
            if (data == null) {
                TestCase test = instantiate(theClass);
                test.setName(methodName);
                return test;
            }
            String suiteName = className + DependencyResolver.QUALIFIER + methodName;
            if (data.isEmpty()) {
                return new SkippedTestCase(className, methodName,
                        String.format("No tests found in suite \"%s\".", suiteName));
            }
            DataProviderTestSuite suite = new DataProviderTestSuite(suiteName);
            List<String> groups = MetadataExtractor.getGroups(theClass, methodName);
            for (Map.Entry<Object, List<Object>> row : data.entrySet()) {
                TestCase test = instantiate(theClass);
                test.setName(methodName);
                test.setDataSet(row.getValue(), row.getKey());
                suite.addTest(test, groups);
            }
            return suite;
        } catch (ReflectiveOperationException e) {
            Throwable cause = e instanceof InvocationTargetException ? e.getCause() : e;
            return warning(String.format("Cannot instantiate class \"%s\".", className) + appendMessage(cause));
        }
    }

    private static TestCase instantiate(Class<?> theClass) throws ReflectiveOperationException {
        Constructor<?> constructor = theClass.getDeclaredConstructor();
        constructor.setAccessible(true);
        return (TestCase) constructor.newInstance();
    }

    private static String appendMessage(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isEmpty() ? "" : "\n" + message;
    }

    protected static WarningTestCase warning(String message) {
        return new WarningTestCase(message);
    }

    /**
     * Number of test cases, after filtering. Cached until the suite changes.
     */
    @Override
    public int count() {
        if (numTests == -1) {
            int total = 0;
            for (Test test : this) {
                total += test.count();
            }
            numTests = total;
        }
        return numTests;
    }

    @Override
    public void run(TestResult result) {
        if (count() == 0) {
            return;
        }
        LOG.debug("Running suite {} ({} tests)", name, count());
        result.startTestSuite(this);

        HookMethods hooks = testCase ? MetadataExtractor.getHookMethods(theClass) : HookMethods.NONE;
        try {
            setUp();
            invokeStatic(hooks.getBeforeClass());
        } catch (SkippedTestSuiteError e) {
            for (Test test : leafTests()) {
                result.startTest(test);
                result.addFailure(test, e, Duration.ZERO);
                result.endTest(test, Duration.ZERO);
            }
            finish(result);
            return;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            for (Test test : leafTests()) {
                result.startTest(test);
                result.addError(test, t, Duration.ZERO);
                result.endTest(test, Duration.ZERO);
            }
            finish(result);
            return;
        }

        for (Test test : this) {
            if (result.shouldStop()) {
                break;
            }
            if (test instanceof TestCase) {
                propagateFlags((TestCase) test);
            } else if (test instanceof TestSuite) {
                propagateFlags((TestSuite) test);
            }
            test.run(result);
        }

        try {
            invokeStatic(hooks.getAfterClass());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            LOG.warn("After-class hook of {} failed", name, t);
            result.addError(this, t, Duration.ZERO);
        }
        finish(result);
    }

    private void finish(TestResult result) {
        try {
            tearDown();
        } catch (Exception e) {
            LOG.warn("Tear-down of suite {} failed", name, e);
            result.addError(this, e, Duration.ZERO);
        }
        result.endTestSuite(this);
    }

    private void propagateFlags(TestCase test) {
        if (backupSystemProperties != null) {
            test.setBackupSystemProperties(backupSystemProperties);
        }
        if (disallowChangesToGlobalState != null) {
            test.setDisallowChangesToGlobalState(disallowChangesToGlobalState);
        }
    }

    private void propagateFlags(TestSuite suite) {
        if (backupSystemProperties != null) {
            suite.setBackupSystemProperties(backupSystemProperties);
        }
        if (disallowChangesToGlobalState != null) {
            suite.setDisallowChangesToGlobalState(disallowChangesToGlobalState);
        }
    }

    private static void invokeStatic(List<Method> hooks) throws Throwable {
        for (Method hook : hooks) {
            try {
                hook.invoke(null);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
        }
    }

    /**
     * Test cases reached through this suite and its nested suites, after filtering.
     */
    List<Test> leafTests() {
        List<Test> leaves = new ArrayList<>();
        for (Test test : this) {
            if (test instanceof TestSuite) {
                leaves.addAll(((TestSuite) test).leafTests());
            } else {
                leaves.add(test);
            }
        }
        return leaves;
    }

    /**
     * Iterates the children that pass the injected filter.
     */
    @Override
    public Iterator<Test> iterator() {
        if (filter == null) {
            return Collections.unmodifiableList(tests).iterator();
        }
        List<Test> accepted = new ArrayList<>();
        for (Test test : tests) {
            if (filter.accept(test, this)) {
                accepted.add(test);
            }
        }
        return accepted.iterator();
    }

    /**
     * Filters the children of this suite and of every nested suite.
     */
    public void injectFilter(TestFilter filter) {
        this.filter = filter;
        this.numTests = -1;
        for (Test test : tests) {
            if (test instanceof TestSuite) {
                ((TestSuite) test).injectFilter(filter);
            }
        }
    }

    /**
     * Unfiltered children in insertion order.
     */
    public List<Test> tests() {
        return Collections.unmodifiableList(tests);
    }

    public void setTests(List<Test> tests) {
        this.tests.clear();
        this.tests.addAll(tests);
        this.numTests = -1;
    }

    /**
     * Child at the given position, or {@code null}.
     */
    public Test testAt(int index) {
        return index >= 0 && index < tests.size() ? tests.get(index) : null;
    }

    public List<String> getGroups() {
        return List.copyOf(groups.keySet());
    }

    public Map<String, List<Test>> getGroupDetails() {
        return Collections.unmodifiableMap(groups);
    }

    public void setGroupDetails(Map<String, List<Test>> groups) {
        this.groups = new LinkedHashMap<>(groups);
    }

    public void setBackupSystemProperties(boolean backupSystemProperties) {
        if (this.backupSystemProperties == null) {
            this.backupSystemProperties = backupSystemProperties;
        }
    }

    public void setDisallowChangesToGlobalState(boolean disallowChangesToGlobalState) {
        if (this.disallowChangesToGlobalState == null) {
            this.disallowChangesToGlobalState = disallowChangesToGlobalState;
        }
    }

    /**
     * Called from {@link #setUp()} to skip every test of the suite.
     */
    public void markTestSuiteSkipped(String message) {
        throw new SkippedTestSuiteError(message);
    }

    protected void setUp() throws Exception {
    }

    protected void tearDown() throws Exception {
    }
}
