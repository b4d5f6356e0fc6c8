package jerrinot.info.unitengine.fixtures;

import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.metadata.BeforeClass;

public class BeforeClassFailureFixture extends TestCase {

    public static int bodyCalls;

    @BeforeClass
    public static void connect() {
        throw new IllegalStateException("cannot connect");
    }

    public void testOne() {
        bodyCalls++;
    }

    public void testTwo() {
        bodyCalls++;
    }
}
