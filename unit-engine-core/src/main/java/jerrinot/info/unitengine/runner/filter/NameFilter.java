package jerrinot.info.unitengine.runner.filter;

import jerrinot.info.unitengine.framework.Test;
import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.framework.TestSuite;
import jerrinot.info.unitengine.framework.WarningTestCase;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Keeps test cases whose {@code Class::method with data set ...} name matches a pattern. Suites always pass,
 * their own children are filtered when they are iterated.
 * <p>
 * Besides a regular expression the filter accepts {@code method#3}, {@code method#1-4} and
 * {@code method@label} to select data sets.
 */
public final class NameFilter implements TestFilter {

    private static final Pattern DATA_SET_RANGE = Pattern.compile("^(.*?)#(\\d+)(?:-(\\d+))?$");
    private static final Pattern DATA_SET_NAME = Pattern.compile("^(.*?)@(.+)$");

    private static final String INDEX_GROUP = "dataSetIndex";

    private final Pattern pattern;
    private final Integer rangeStart;
    private final Integer rangeEnd;

    public NameFilter(String filter) {
        String expression = filter;
        Integer start = null;
        Integer end = null;
        Matcher range = DATA_SET_RANGE.matcher(filter);
        Matcher named = DATA_SET_NAME.matcher(filter);
        if (range.matches()) {
            start = Integer.valueOf(range.group(2));
            end = range.group(3) != null ? Integer.valueOf(range.group(3)) : start;
            expression = "(?:" + quoteIfInvalid(range.group(1)) + ")" + Pattern.quote(" with data set #")
                    + "(?<" + INDEX_GROUP + ">\\d+)";
        } else if (named.matches()) {
            expression = "(?:" + quoteIfInvalid(named.group(1)) + ")"
                    + Pattern.quote(" with data set \"" + named.group(2) + "\"");
        } else {
            expression = quoteIfInvalid(expression);
        }
        this.pattern = Pattern.compile(expression);
        this.rangeStart = start;
        this.rangeEnd = end;
    }

    private static String quoteIfInvalid(String expression) {
        try {
            Pattern.compile(expression);
            return expression;
        } catch (PatternSyntaxException e) {
            return Pattern.quote(expression);
        }
    }

    @Override
    public boolean accept(Test test, TestSuite suite) {
        if (test instanceof TestSuite) {
            return true;
        }
        String name;
        if (test instanceof WarningTestCase) {
            name = ((WarningTestCase) test).getMessage();
        } else if (test instanceof TestCase) {
            TestCase testCase = (TestCase) test;
            name = testCase.getClass().getName() + "::" + testCase.getName();
        } else {
            name = test.toString();
        }
        Matcher matcher = pattern.matcher(name);
        if (!matcher.find()) {
            return false;
        }
        if (rangeStart == null) {
            return true;
        }
        String index = matcher.group(INDEX_GROUP);
        if (index == null) {
            return false;
        }
        int value = Integer.parseInt(index);
        return value >= rangeStart && value <= rangeEnd;
    }

    @Override
    public String toString() {
        return "NameFilter{" + pattern.pattern() + "}";
    }
}
