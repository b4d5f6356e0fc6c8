package jerrinot.info.unitengine.framework;

import jerrinot.info.unitengine.framework.constraint.Constraint;
import jerrinot.info.unitengine.framework.constraint.Count;
import jerrinot.info.unitengine.framework.constraint.IsEmpty;
import jerrinot.info.unitengine.framework.constraint.IsEqual;
import jerrinot.info.unitengine.framework.constraint.IsIdentical;
import jerrinot.info.unitengine.framework.constraint.IsInstanceOf;
import jerrinot.info.unitengine.framework.constraint.LogicalNot;
import jerrinot.info.unitengine.framework.constraint.RegularExpression;
import jerrinot.info.unitengine.framework.constraint.StringContains;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assertions counted per test. {@link TestResult} resets the counter before each test and reads it after.
 */
public abstract class Assert {

    private static final AtomicInteger COUNT = new AtomicInteger();

    protected Assert() {
    }

    public static <T> void assertThat(T value, Constraint<? super T> constraint) {
        assertThat(value, constraint, "");
    }

    public static <T> void assertThat(T value, Constraint<? super T> constraint, String message) {
        COUNT.incrementAndGet();
        if (!constraint.matches(value)) {
            String prefix = message == null || message.isEmpty() ? "" : message + "\n";
            throw new ExpectationFailedException(prefix + "Failed asserting that "
                    + constraint.failureDescription(value) + ".");
        }
    }

    public static void assertTrue(boolean condition) {
        assertTrue(condition, "");
    }

    public static void assertTrue(boolean condition, String message) {
        assertThat(condition, new IsIdentical(true), message);
    }

    public static void assertFalse(boolean condition) {
        assertFalse(condition, "");
    }

    public static void assertFalse(boolean condition, String message) {
        assertThat(condition, new IsIdentical(false), message);
    }

    public static void assertEquals(Object expected, Object actual) {
        assertEquals(expected, actual, "");
    }

    public static void assertEquals(Object expected, Object actual, String message) {
        assertThat(actual, new IsEqual(expected), message);
    }

    public static void assertEquals(double expected, double actual, double delta) {
        assertThat(actual, new IsEqual(expected, delta), "");
    }

    public static void assertNotEquals(Object expected, Object actual) {
        assertThat(actual, new LogicalNot<>(new IsEqual(expected)), "");
    }

    public static void assertSame(Object expected, Object actual) {
        assertThat(actual, new IsIdentical(expected), "");
    }

    public static void assertNotSame(Object expected, Object actual) {
        assertThat(actual, new LogicalNot<>(new IsIdentical(expected)), "");
    }

    public static void assertNull(Object actual) {
        assertThat(actual, new IsIdentical(null), "");
    }

    public static void assertNotNull(Object actual) {
        assertThat(actual, new LogicalNot<>(new IsIdentical(null)), "");
    }

    public static void assertInstanceOf(Class<?> expected, Object actual) {
        assertThat(actual, new IsInstanceOf(expected), "");
    }

    public static void assertEmpty(Object actual) {
        assertThat(actual, new IsEmpty(), "");
    }

    public static void assertNotEmpty(Object actual) {
        assertThat(actual, new LogicalNot<>(new IsEmpty()), "");
    }

    public static void assertCount(int expected, Object haystack) {
        assertThat(haystack, new Count(expected), "");
    }

    public static void assertContains(Object needle, Object haystack) {
        assertThat(haystack, new StringContains(needle), "");
    }

    public static void assertMatchesRegularExpression(String regex, String actual) {
        assertThat(actual, new RegularExpression(regex), "");
    }

    public static void fail() {
        fail("");
    }

    public static void fail(String message) {
        throw new AssertionFailedError(message);
    }

    public static void markTestIncomplete(String message) {
        throw new IncompleteTestError(message);
    }

    public static void markTestSkipped(String message) {
        throw new SkippedTestError(message);
    }

    public static int getCount() {
        return COUNT.get();
    }

    public static void resetCount() {
        COUNT.set(0);
    }
}
