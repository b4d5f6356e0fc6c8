package jerrinot.info.unitengine.framework;

import jerrinot.info.unitengine.dependency.DependencyResolver;
import jerrinot.info.unitengine.dependency.Resolution;
import jerrinot.info.unitengine.framework.constraint.ExceptionCode;
import jerrinot.info.unitengine.framework.constraint.ExceptionConstraint;
import jerrinot.info.unitengine.framework.constraint.ExceptionMessage;
import jerrinot.info.unitengine.framework.constraint.ExceptionMessageRegularExpression;
import jerrinot.info.unitengine.metadata.HookMethods;
import jerrinot.info.unitengine.metadata.MetadataExtractor;
import org.mockito.Mockito;
import org.mockito.verification.VerificationMode;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A single test: one test method of a subclass, optionally bound to one data set.
 * <p>
 * Subclasses need a public no-argument constructor. Test methods are public instance methods whose name
 * starts with {@code test}; they receive the data-set values followed by the values returned by the tests
 * they depend on.
 */
public abstract class TestCase extends Assert implements Test {

    private String name;
    private List<Object> data = List.of();
    private Object dataName = "";
    private List<String> dependencies = List.of();
    private Map<String, Object> dependencyInput = new LinkedHashMap<>();
    private Boolean backupSystemProperties;
    private Boolean disallowChangesToGlobalState;
    private boolean inIsolation;
    private Boolean useErrorHandler;

    private Class<? extends Throwable> expectedException;
    private String expectedExceptionMessage;
    private String expectedExceptionMessageRegExp;
    private Integer expectedExceptionCode;

    private int numAssertions;
    private TestStatus status;
    private String statusMessage = "";
    private Object testResult;
    private TestResult result;

    private String output = "";
    private String outputExpectedRegex;
    private String outputExpectedString;
    private UnaryOperator<String> outputCallback;
    private final OutputBuffer outputBuffer = new OutputBuffer();

    private final ScopedSettings settings = new ScopedSettings();
    private Map<String, String> systemPropertiesSnapshot;
    private final List<MockExpectation<?>> mockExpectations = new ArrayList<>();

    protected TestCase() {
    }

    protected TestCase(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return getClass().getName() + DependencyResolver.QUALIFIER + getName(false) + getDataSetAsString(true);
    }

    @Override
    public int count() {
        return 1;
    }

    public String getName() {
        return getName(true);
    }

    public String getName(boolean withDataSet) {
        if (name == null) {
            return "";
        }
        return withDataSet ? name + getDataSetAsString(false) : name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * {@code " with data set #0 (1, 2)"} or {@code " with data set "label""}, empty without data.
     */
    public String getDataSetAsString(boolean includeData) {
        if (data.isEmpty() && "".equals(dataName)) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (dataName instanceof Integer) {
            sb.append(" with data set #").append(dataName);
        } else {
            sb.append(" with data set \"").append(dataName).append('"');
        }
        if (includeData) {
            sb.append(" (");
            for (int i = 0; i < data.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(Exporter.shortenedExport(data.get(i)));
            }
            sb.append(')');
        }
        return sb.toString();
    }

    void setDataSet(List<Object> data, Object dataName) {
        this.data = Collections.unmodifiableList(new ArrayList<>(data));
        this.dataName = Objects.requireNonNull(dataName, "dataName");
    }

    public List<Object> getData() { return data; }

    public boolean usesDataProvider() {
        return !data.isEmpty() || !"".equals(dataName);
    }

    @Override
    public void run(TestResult result) {
        this.result = Objects.requireNonNull(result, "result");
        try {
            if (!handleDependencies()) {
                return;
            }
            if (useErrorHandler == null) {
                useErrorHandler = MetadataExtractor.getErrorHandlerSettings(getClass(), getName(false));
            }
            if (useErrorHandler != null) {
                boolean previous = result.getConvertErrorsToExceptions();
                result.convertErrorsToExceptions(useErrorHandler);
                try {
                    result.run(this);
                } finally {
                    result.convertErrorsToExceptions(previous);
                }
            } else {
                result.run(this);
            }
        } finally {
            this.result = null;
        }
    }

    /**
     * Runs the fixture and the test body, classifies the outcome and rethrows the fault that decided it.
     */
    public void runBare() throws Throwable {
        numAssertions = 0;
        snapshotGlobalState();
        HookMethods hooks = MetadataExtractor.getHookMethods(getClass());

        Throwable fault = null;
        outputBuffer.start();
        try {
            fault = runFixtureAndBody(hooks);
        } finally {
            try {
                output = outputBuffer.stop(outputCallback);
            } catch (RiskyTestError e) {
                if (fault == null) {
                    fault = recordOutcome(e);
                }
            }
        }

        settings.restore();
        Throwable globalStateFault = restoreGlobalState();
        if (fault == null && globalStateFault != null) {
            fault = recordOutcome(globalStateFault);
        }

        if (fault == null) {
            try {
                checkOutputExpectation();
            } catch (Throwable t) {
                fault = recordOutcome(t);
            }
        }

        if (fault != null) {
            onNotSuccessfulTest(fault);
        }
    }

    private Throwable runFixtureAndBody(HookMethods hooks) {
        Throwable fault = null;
        try {
            if (inIsolation) {
                invokeHooks(hooks.getBeforeClass(), null);
            }
            setUp();
            invokeHooks(hooks.getBefore(), this);
            assertPreConditions();
            testResult = runTest();
            verifyMockObjects();
            assertPostConditions();
            status = TestStatus.PASSED;
        } catch (Throwable t) {
            fault = recordOutcome(t);
        }
        mockExpectations.clear();

        try {
            tearDown();
            invokeHooks(hooks.getAfter(), this);
            if (inIsolation) {
                invokeHooks(hooks.getAfterClass(), null);
            }
        } catch (Throwable t) {
            if (fault == null) {
                fault = recordOutcome(t);
            }
        }
        return fault;
    }

    private Throwable recordOutcome(Throwable t) {
        status = TestStatus.of(t);
        statusMessage = t.getMessage() == null ? "" : t.getMessage();
        return t;
    }

    /**
     * Called with the fault that decided a non-passing outcome. Rethrows it by default.
     */
    protected void onNotSuccessfulTest(Throwable t) throws Throwable {
        throw t;
    }

    /**
     * Invokes the test method. Returns what the method returned, which dependent tests receive.
     */
    protected Object runTest() throws Throwable {
        if (name == null) {
            throw new EngineException("TestCase name must not be null");
        }
        List<Object> arguments = new ArrayList<>(data);
        arguments.addAll(dependencyInput.values());

        Method method = findTestMethod(arguments.size());
        if (method == null) {
            fail(String.format("test method not exist %s::%s.", getClass().getName(), name));
        }

        Object returned;
        try {
            returned = method.invoke(this, arguments.subList(0, method.getParameterCount()).toArray());
        } catch (InvocationTargetException e) {
            Throwable thrown = e.getCause();
            if (!shouldCheckException(thrown)) {
                throw thrown;
            }
            checkExpectedException(thrown);
            return null;
        }

        if (hasExpectedException()) {
            Class<? extends Throwable> expected = expectedException != null ? expectedException : Throwable.class;
            assertThat(null, new ExceptionConstraint(expected));
        }
        return returned;
    }

    private Method findTestMethod(int argumentCount) {
        Method best = null;
        for (Method candidate : getClass().getMethods()) {
            if (!candidate.getName().equals(name) || candidate.getParameterCount() > argumentCount) {
                continue;
            }
            if (best == null || candidate.getParameterCount() > best.getParameterCount()) {
                best = candidate;
            }
        }
        if (best != null) {
            best.setAccessible(true);
        }
        return best;
    }

    private boolean shouldCheckException(Throwable thrown) {
        if (thrown instanceof SkippedTestError || !hasExpectedException()) {
            return false;
        }
        if (expectedException != null && isEngineFault(expectedException)) {
            return true;
        }
        return !(thrown instanceof EngineException || thrown instanceof AssertionError);
    }

    private static boolean isEngineFault(Class<? extends Throwable> type) {
        return EngineException.class.isAssignableFrom(type) || AssertionError.class.isAssignableFrom(type);
    }

    private void checkExpectedException(Throwable thrown) {
        if (expectedException != null) {
            assertThat(thrown, new ExceptionConstraint(expectedException));
        }
        if (expectedExceptionMessage != null && !expectedExceptionMessage.isEmpty()) {
            assertThat(thrown, new ExceptionMessage(expectedExceptionMessage));
        }
        if (expectedExceptionMessageRegExp != null && !expectedExceptionMessageRegExp.isEmpty()) {
            assertThat(thrown, new ExceptionMessageRegularExpression(expectedExceptionMessageRegExp));
        }
        if (expectedExceptionCode != null) {
            assertThat(thrown, new ExceptionCode(expectedExceptionCode));
        }
    }

    private boolean hasExpectedException() {
        return expectedException != null
                || (expectedExceptionMessage != null && !expectedExceptionMessage.isEmpty())
                || (expectedExceptionMessageRegExp != null && !expectedExceptionMessageRegExp.isEmpty())
                || expectedExceptionCode != null;
    }

    private boolean handleDependencies() {
        if (dependencies.isEmpty() || inIsolation) {
            return true;
        }
        Resolution resolution = DependencyResolver.resolve(getClass().getName(), dependencies, getSize(),
                result.passed());
        if (!resolution.isSatisfied()) {
            status = TestStatus.SKIPPED;
            statusMessage = resolution.getReason();
            result.startTest(this);
            result.addError(this, new SkippedTestError(resolution.getReason()), Duration.ZERO);
            result.endTest(this, Duration.ZERO);
            return false;
        }
        dependencyInput = new LinkedHashMap<>(resolution.getInputs());
        return true;
    }

    private static void invokeHooks(List<Method> hooks, Object target) throws Throwable {
        for (Method hook : hooks) {
            try {
                hook.invoke(target);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
        }
    }

    private void checkOutputExpectation() {
        if (outputExpectedRegex != null) {
            assertMatchesRegularExpression(outputExpectedRegex, output);
        } else if (outputExpectedString != null) {
            assertEquals(outputExpectedString, output);
        }
    }

    private void snapshotGlobalState() {
        systemPropertiesSnapshot = null;
        if (Boolean.TRUE.equals(backupSystemProperties) || Boolean.TRUE.equals(disallowChangesToGlobalState)) {
            systemPropertiesSnapshot = copyOf(System.getProperties());
        }
    }

    private Throwable restoreGlobalState() {
        if (systemPropertiesSnapshot == null) {
            return null;
        }
        Throwable fault = null;
        Map<String, String> current = copyOf(System.getProperties());
        if (Boolean.TRUE.equals(disallowChangesToGlobalState) && !current.equals(systemPropertiesSnapshot)) {
            TreeSet<String> changed = new TreeSet<>();
            for (String key : current.keySet()) {
                if (!Objects.equals(current.get(key), systemPropertiesSnapshot.get(key))) {
                    changed.add(key);
                }
            }
            for (String key : systemPropertiesSnapshot.keySet()) {
                if (!current.containsKey(key)) {
                    changed.add(key);
                }
            }
            fault = new RiskyTestError("This test modified global state but was not expected to do so\n"
                    + "Changed system properties: " + String.join(", ", changed));
        }
        if (Boolean.TRUE.equals(backupSystemProperties)) {
            for (String key : current.keySet()) {
                if (!systemPropertiesSnapshot.containsKey(key)) {
                    System.clearProperty(key);
                }
            }
            systemPropertiesSnapshot.forEach(System::setProperty);
        }
        systemPropertiesSnapshot = null;
        return fault;
    }

    private static Map<String, String> copyOf(Properties properties) {
        Map<String, String> copy = new LinkedHashMap<>();
        for (String key : properties.stringPropertyNames()) {
            copy.put(key, properties.getProperty(key));
        }
        return copy;
    }

    protected void setUp() throws Exception {
    }

    protected void tearDown() throws Exception {
    }

    protected void assertPreConditions() {
    }

    protected void assertPostConditions() {
    }

    // exception expectations

    public void expectException(Class<? extends Throwable> exception) {
        this.expectedException = exception;
    }

    public void expectExceptionMessage(String message) {
        this.expectedExceptionMessage = message;
    }

    public void expectExceptionMessageMatches(String regularExpression) {
        this.expectedExceptionMessageRegExp = regularExpression;
    }

    public void expectExceptionCode(int code) {
        this.expectedExceptionCode = code;
    }

    public void setExpectedException(Class<? extends Throwable> exception, String message, Integer code) {
        this.expectedException = exception;
        this.expectedExceptionMessage = message;
        this.expectedExceptionCode = code;
    }

    public Class<? extends Throwable> getExpectedException() { return expectedException; }

    // output expectations

    public void expectOutputRegex(String expectedRegex) {
        if (outputExpectedString != null) {
            throw new EngineException("An output string is already expected");
        }
        this.outputExpectedRegex = expectedRegex;
    }

    public void expectOutputString(String expectedString) {
        if (outputExpectedRegex != null) {
            throw new EngineException("An output pattern is already expected");
        }
        this.outputExpectedString = expectedString;
    }

    public boolean hasExpectationOnOutput() {
        return outputExpectedString != null || outputExpectedRegex != null;
    }

    public void setOutputCallback(UnaryOperator<String> callback) {
        this.outputCallback = Objects.requireNonNull(callback, "callback");
    }

    public String getActualOutput() { return output; }

    /**
     * True when the test printed something nobody expected.
     */
    public boolean hasOutput() {
        return !output.isEmpty() && !hasExpectationOnOutput();
    }

    /**
     * Opens a nested output level. Every level opened must be closed with {@link #closeOutputBuffer()}.
     */
    protected void openOutputBuffer() {
        outputBuffer.push();
    }

    protected String closeOutputBuffer() {
        return outputBuffer.pop();
    }

    int getOutputLevel() {
        return outputBuffer.getLevel();
    }

    // scoped settings

    /**
     * Sets a system property for the duration of this test.
     */
    protected void setSystemProperty(String key, String value) {
        settings.setSystemProperty(key, value);
    }

    protected void setLocale(Locale locale) {
        settings.setLocale(locale);
    }

    protected void setLocale(Locale.Category category, Locale locale) {
        settings.setLocale(category, locale);
    }

    // mocks

    protected <T> T getMock(Class<T> type) {
        return Mockito.mock(type);
    }

    /**
     * Mock whose concrete methods run for real; abstract methods are stubbed.
     */
    protected <T> T getMockForAbstractClass(Class<T> type, Object... constructorArguments) {
        return Mockito.mock(type, Mockito.withSettings()
                .useConstructor(constructorArguments)
                .defaultAnswer(Mockito.CALLS_REAL_METHODS));
    }

    /**
     * Registers a call the mock must receive, verified after the test body returns.
     * Each registered expectation counts as one assertion.
     */
    protected <T> void expects(T mock, VerificationMode mode, Consumer<? super T> invocation) {
        mockExpectations.add(new MockExpectation<>(mock, mode, invocation));
    }

    protected void verifyMockObjects() {
        for (MockExpectation<?> expectation : mockExpectations) {
            numAssertions++;
            expectation.verify();
        }
    }

    public static VerificationMode once() {
        return Mockito.times(1);
    }

    public static VerificationMode never() {
        return Mockito.never();
    }

    public static VerificationMode exactly(int count) {
        return Mockito.times(count);
    }

    public static VerificationMode atLeastOnce() {
        return Mockito.atLeastOnce();
    }

    public static VerificationMode atLeast(int count) {
        return Mockito.atLeast(count);
    }

    public static VerificationMode atMost(int count) {
        return Mockito.atMost(count);
    }

    public static VerificationMode anyNumberOfTimes() {
        return Mockito.atLeast(0);
    }

    // state

    public int getNumAssertions() { return numAssertions; }

    public void addToAssertionCount(int count) {
        numAssertions += count;
    }

    /**
     * Outcome of the last run, or {@code null} before the test has run.
     */
    public TestStatus getStatus() { return status; }

    public String getStatusMessage() { return statusMessage; }

    public boolean hasFailed() {
        return status != null && status.isTerminalFailure();
    }

    /**
     * Value returned by the test method in the last run.
     */
    public Object getResult() { return testResult; }

    public void setResult(Object testResult) {
        this.testResult = testResult;
    }

    public TestResult getTestResultObject() { return result; }

    public void setTestResultObject(TestResult result) {
        this.result = result;
    }

    public List<String> getDependencies() { return dependencies; }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = List.copyOf(dependencies);
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    public Map<String, Object> getDependencyInput() { return dependencyInput; }

    public void setDependencyInput(Map<String, Object> dependencyInput) {
        this.dependencyInput = new LinkedHashMap<>(dependencyInput);
    }

    /**
     * Has no effect once set, so an outer suite cannot override what an inner one decided.
     */
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

    public void setInIsolation(boolean inIsolation) {
        this.inIsolation = inIsolation;
    }

    public boolean isInIsolation() { return inIsolation; }

    public void setUseErrorHandler(boolean useErrorHandler) {
        this.useErrorHandler = useErrorHandler;
    }

    public TestSize getSize() {
        return MetadataExtractor.getSize(getClass(), getName(false));
    }

    public List<String> getGroups() {
        return MetadataExtractor.getGroups(getClass(), getName(false));
    }

    public boolean isTodo() {
        return MetadataExtractor.isTodo(getClass(), getName(false));
    }
}
