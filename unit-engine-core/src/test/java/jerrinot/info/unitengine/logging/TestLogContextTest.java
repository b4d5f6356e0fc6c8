package jerrinot.info.unitengine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class TestLogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void putsAndRemovesTheTestName() {
        try (TestLogContext ignored = TestLogContext.of("a.B::testC")) {
            assertEquals("a.B::testC", MDC.get(TestLogContext.TEST_KEY));
        }
        assertNull(MDC.get(TestLogContext.TEST_KEY));
    }

    @Test
    void restoresTheOuterValue() {
        try (TestLogContext outer = TestLogContext.of("outer")) {
            try (TestLogContext inner = TestLogContext.of("inner")) {
                assertEquals("inner", MDC.get(TestLogContext.TEST_KEY));
            }
            assertEquals("outer", MDC.get(TestLogContext.TEST_KEY));
        }
    }
}
