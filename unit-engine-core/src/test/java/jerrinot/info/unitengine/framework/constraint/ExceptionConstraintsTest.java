package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.CodedException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionConstraintsTest {

    static class Coded extends RuntimeException implements CodedException {
        @Override
        public int getCode() { return 7; }
    }

    @Test
    void typeMatchesSubclasses() {
        ExceptionConstraint constraint = new ExceptionConstraint(RuntimeException.class);

        assertTrue(constraint.matches(new IllegalStateException()));
        assertFalse(constraint.matches(new Exception()));
        assertFalse(constraint.matches(null));
        assertEquals("exception of type \"java.lang.Exception\" matches expected exception "
                        + "\"java.lang.RuntimeException\". Message was: \"oops\"",
                constraint.failureDescription(new Exception("oops")));
    }

    @Test
    void emptyExpectedMessageRequiresEmptyMessage() {
        ExceptionMessage empty = new ExceptionMessage("");

        assertTrue(empty.matches(new RuntimeException()));
        assertFalse(empty.matches(new RuntimeException("text")));
        assertEquals("exception message is empty but is 'text'",
                empty.failureDescription(new RuntimeException("text")));
    }

    @Test
    void messagePatternSearchesTheMessage() {
        ExceptionMessageRegularExpression pattern = new ExceptionMessageRegularExpression("\\d+ items");

        assertTrue(pattern.matches(new RuntimeException("found 12 items here")));
        assertFalse(pattern.matches(new RuntimeException("no items")));
    }

    @Test
    void codesComeFromCodedAndSqlExceptions() {
        assertEquals(7, ExceptionCode.codeOf(new Coded()));
        assertEquals(1205, ExceptionCode.codeOf(new SQLException("deadlock", "40001", 1205)));
        assertNull(ExceptionCode.codeOf(new RuntimeException()));
        assertFalse(new ExceptionCode(0).matches(new RuntimeException()));
        assertEquals("<no code> is equal to expected exception code 0",
                new ExceptionCode(0).failureDescription(new RuntimeException()));
    }
}
