package jerrinot.info.unitengine.fixtures;

import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.metadata.AfterClass;

public class AfterClassFailureFixture extends TestCase {

    @AfterClass
    public static void disconnect() {
        throw new IllegalStateException("cannot disconnect");
    }

    public void testOne() {
        assertTrue(true);
    }

    public void testTwo() {
        assertTrue(true);
    }
}
