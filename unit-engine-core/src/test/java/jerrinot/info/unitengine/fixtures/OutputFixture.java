package jerrinot.info.unitengine.fixtures;

import jerrinot.info.unitengine.framework.TestCase;

public class OutputFixture extends TestCase {

    public void testExpectedString() {
        expectOutputString("foo");
        System.out.print("foo");
    }

    public void testExpectedStringMismatch() {
        expectOutputString("foo");
        System.out.print("bar");
    }

    public void testExpectedRegex() {
        expectOutputRegex("^f.o$");
        System.out.print("foo");
    }

    public void testCallback() {
        setOutputCallback(String::toUpperCase);
        expectOutputString("FOO");
        System.out.print("foo");
    }

    public void testNestedLevel() {
        openOutputBuffer();
        System.out.print("inner");
        String inner = closeOutputBuffer();
        assertEquals("inner", inner);
        System.out.print("outer");
    }

    public void testLeavesLevelOpen() {
        openOutputBuffer();
        assertTrue(true);
    }

    public void testReplacesSystemOut() {
        System.setOut(new java.io.PrintStream(new java.io.ByteArrayOutputStream()));
        assertTrue(true);
    }

    public void testMismatchAfterFailure() {
        expectOutputString("foo");
        fail("body failed first");
    }
}
