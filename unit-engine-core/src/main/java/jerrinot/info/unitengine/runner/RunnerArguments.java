package jerrinot.info.unitengine.runner;

import jerrinot.info.unitengine.framework.EngineException;
import jerrinot.info.unitengine.framework.TestListener;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Settings for one run of {@link TestRunner}. Built with {@link #builder()} or read from {@code unitengine.*}
 * system properties, falling back to {@code UNITENGINE_*} environment variables.
 */
public final class RunnerArguments {

    static final String PREFIX = "unitengine.";

    private final String filter;
    private final List<String> groups;
    private final List<String> excludeGroups;
    private final boolean stopOnError;
    private final boolean stopOnFailure;
    private final boolean stopOnIncomplete;
    private final boolean stopOnRisky;
    private final boolean stopOnSkipped;
    private final int repeat;
    private final boolean convertErrorsToExceptions;
    private final boolean reportUselessTests;
    private final boolean disallowTestOutput;
    private final boolean disallowTodoAnnotatedTests;
    private final Boolean backupSystemProperties;
    private final Boolean disallowChangesToGlobalState;
    private final boolean verbose;
    private final List<TestListener> listeners;

    private RunnerArguments(Builder b) {
        this.filter = b.filter;
        this.groups = List.copyOf(b.groups);
        this.excludeGroups = List.copyOf(b.excludeGroups);
        this.stopOnError = b.stopOnError;
        this.stopOnFailure = b.stopOnFailure;
        this.stopOnIncomplete = b.stopOnIncomplete;
        this.stopOnRisky = b.stopOnRisky;
        this.stopOnSkipped = b.stopOnSkipped;
        this.repeat = b.repeat;
        this.convertErrorsToExceptions = b.convertErrorsToExceptions;
        this.reportUselessTests = b.reportUselessTests;
        this.disallowTestOutput = b.disallowTestOutput;
        this.disallowTodoAnnotatedTests = b.disallowTodoAnnotatedTests;
        this.backupSystemProperties = b.backupSystemProperties;
        this.disallowChangesToGlobalState = b.disallowChangesToGlobalState;
        this.verbose = b.verbose;
        this.listeners = List.copyOf(b.listeners);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RunnerArguments defaults() {
        return builder().build();
    }

    public static RunnerArguments fromSystemProperties() {
        return fromProperties(System.getProperties(), System.getenv());
    }

    /**
     * @throws EngineException when a value cannot be parsed
     */
    public static RunnerArguments fromProperties(Properties properties, Map<String, String> environment) {
        Builder b = builder();
        String filter = resolve(properties, environment, "filter");
        if (filter != null && !filter.isBlank()) {
            b.filter(filter.trim());
        }
        b.groups(parseList(resolve(properties, environment, "groups")));
        b.excludeGroups(parseList(resolve(properties, environment, "excludeGroups")));
        b.stopOnError(parseFlag(properties, environment, "stopOnError", false));
        b.stopOnFailure(parseFlag(properties, environment, "stopOnFailure", false));
        b.stopOnIncomplete(parseFlag(properties, environment, "stopOnIncomplete", false));
        b.stopOnRisky(parseFlag(properties, environment, "stopOnRisky", false));
        b.stopOnSkipped(parseFlag(properties, environment, "stopOnSkipped", false));
        b.convertErrorsToExceptions(parseFlag(properties, environment, "convertErrorsToExceptions", true));
        b.reportUselessTests(parseFlag(properties, environment, "reportUselessTests", false));
        b.disallowTestOutput(parseFlag(properties, environment, "disallowTestOutput", false));
        b.disallowTodoAnnotatedTests(parseFlag(properties, environment, "disallowTodoAnnotatedTests", false));
        b.verbose(parseFlag(properties, environment, "verbose", false));
        String backup = resolve(properties, environment, "backupSystemProperties");
        if (backup != null) {
            b.backupSystemProperties(parseFlag(backup, "backupSystemProperties"));
        }
        String disallow = resolve(properties, environment, "disallowChangesToGlobalState");
        if (disallow != null) {
            b.disallowChangesToGlobalState(parseFlag(disallow, "disallowChangesToGlobalState"));
        }
        String repeat = resolve(properties, environment, "repeat");
        if (repeat != null && !repeat.isBlank()) {
            try {
                b.repeat(Integer.parseInt(repeat.trim()));
            } catch (NumberFormatException e) {
                throw new EngineException("Invalid value '" + repeat + "' for " + PREFIX + "repeat", e);
            }
        }
        return b.build();
    }

    static String resolve(Properties properties, Map<String, String> environment, String name) {
        String propertyValue = properties.getProperty(PREFIX + name);
        if (propertyValue != null) {
            return propertyValue;
        }
        return environment.get(environmentName(name));
    }

    /**
     * {@code stopOnFailure} becomes {@code UNITENGINE_STOP_ON_FAILURE}.
     */
    static String environmentName(String name) {
        return "UNITENGINE_" + name.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }

    private static boolean parseFlag(Properties properties, Map<String, String> environment, String name,
                                     boolean defaultValue) {
        String raw = resolve(properties, environment, name);
        return raw == null ? defaultValue : parseFlag(raw, name);
    }

    static boolean parseFlag(String rawValue, String name) {
        String value = rawValue.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()
                || "true".equals(value)
                || "1".equals(value)
                || "yes".equals(value)
                || "on".equals(value)) {
            return true;
        }
        if ("false".equals(value)
                || "0".equals(value)
                || "no".equals(value)
                || "off".equals(value)) {
            return false;
        }
        throw new EngineException("Invalid value '" + rawValue + "' for " + PREFIX + name);
    }

    static List<String> parseList(String rawValue) {
        if (rawValue == null) {
            return List.of();
        }
        return Arrays.stream(rawValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public String getFilter() { return filter; }
    public List<String> getGroups() { return groups; }
    public List<String> getExcludeGroups() { return excludeGroups; }
    public boolean isStopOnError() { return stopOnError; }
    public boolean isStopOnFailure() { return stopOnFailure; }
    public boolean isStopOnIncomplete() { return stopOnIncomplete; }
    public boolean isStopOnRisky() { return stopOnRisky; }
    public boolean isStopOnSkipped() { return stopOnSkipped; }
    public int getRepeat() { return repeat; }
    public boolean isConvertErrorsToExceptions() { return convertErrorsToExceptions; }
    public boolean isReportUselessTests() { return reportUselessTests; }
    public boolean isDisallowTestOutput() { return disallowTestOutput; }
    public boolean isDisallowTodoAnnotatedTests() { return disallowTodoAnnotatedTests; }
    public Boolean getBackupSystemProperties() { return backupSystemProperties; }
    public Boolean getDisallowChangesToGlobalState() { return disallowChangesToGlobalState; }
    public boolean isVerbose() { return verbose; }
    public List<TestListener> getListeners() { return listeners; }

    @Override
    public String toString() {
        return "RunnerArguments{filter=" + filter + ", groups=" + groups + ", excludeGroups=" + excludeGroups
                + ", repeat=" + repeat + ", stopOnError=" + stopOnError + ", stopOnFailure=" + stopOnFailure + "}";
    }

    public static final class Builder {
        private String filter;
        private List<String> groups = List.of();
        private List<String> excludeGroups = List.of();
        private boolean stopOnError;
        private boolean stopOnFailure;
        private boolean stopOnIncomplete;
        private boolean stopOnRisky;
        private boolean stopOnSkipped;
        private int repeat;
        private boolean convertErrorsToExceptions = true;
        private boolean reportUselessTests;
        private boolean disallowTestOutput;
        private boolean disallowTodoAnnotatedTests;
        private Boolean backupSystemProperties;
        private Boolean disallowChangesToGlobalState;
        private boolean verbose;
        private final List<TestListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder filter(String filter) {
            this.filter = filter;
            return this;
        }

        public Builder groups(List<String> groups) {
            this.groups = List.copyOf(groups);
            return this;
        }

        public Builder excludeGroups(List<String> excludeGroups) {
            this.excludeGroups = List.copyOf(excludeGroups);
            return this;
        }

        public Builder stopOnError(boolean stopOnError) {
            this.stopOnError = stopOnError;
            return this;
        }

        public Builder stopOnFailure(boolean stopOnFailure) {
            this.stopOnFailure = stopOnFailure;
            return this;
        }

        public Builder stopOnIncomplete(boolean stopOnIncomplete) {
            this.stopOnIncomplete = stopOnIncomplete;
            return this;
        }

        public Builder stopOnRisky(boolean stopOnRisky) {
            this.stopOnRisky = stopOnRisky;
            return this;
        }

        public Builder stopOnSkipped(boolean stopOnSkipped) {
            this.stopOnSkipped = stopOnSkipped;
            return this;
        }

        public Builder repeat(int repeat) {
            if (repeat < 0) {
                throw new EngineException("Repeat count must not be negative: " + repeat);
            }
            this.repeat = repeat;
            return this;
        }

        public Builder convertErrorsToExceptions(boolean convertErrorsToExceptions) {
            this.convertErrorsToExceptions = convertErrorsToExceptions;
            return this;
        }

        public Builder reportUselessTests(boolean reportUselessTests) {
            this.reportUselessTests = reportUselessTests;
            return this;
        }

        public Builder disallowTestOutput(boolean disallowTestOutput) {
            this.disallowTestOutput = disallowTestOutput;
            return this;
        }

        public Builder disallowTodoAnnotatedTests(boolean disallowTodoAnnotatedTests) {
            this.disallowTodoAnnotatedTests = disallowTodoAnnotatedTests;
            return this;
        }

        public Builder backupSystemProperties(boolean backupSystemProperties) {
            this.backupSystemProperties = backupSystemProperties;
            return this;
        }

        public Builder disallowChangesToGlobalState(boolean disallowChangesToGlobalState) {
            this.disallowChangesToGlobalState = disallowChangesToGlobalState;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder addListener(TestListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public RunnerArguments build() {
            return new RunnerArguments(this);
        }
    }
}
