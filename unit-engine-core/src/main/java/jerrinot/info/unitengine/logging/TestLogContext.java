package jerrinot.info.unitengine.logging;

import org.slf4j.MDC;

/**
 * Puts the running test into the SLF4J MDC under {@value #TEST_KEY} and restores the previous value on close.
 */
public final class TestLogContext implements AutoCloseable {

    public static final String TEST_KEY = "unitengine.test";

    private final String previous;

    private TestLogContext(String test) {
        this.previous = MDC.get(TEST_KEY);
        MDC.put(TEST_KEY, test);
    }

    public static TestLogContext of(Object test) {
        return new TestLogContext(String.valueOf(test));
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.remove(TEST_KEY);
        } else {
            MDC.put(TEST_KEY, previous);
        }
    }
}
