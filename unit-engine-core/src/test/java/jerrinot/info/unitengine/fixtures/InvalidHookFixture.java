package jerrinot.info.unitengine.fixtures;

import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.metadata.BeforeClass;

public class InvalidHookFixture extends TestCase {

    @BeforeClass
    public void notStatic() {
    }

    public void testAnything() {
        assertTrue(true);
    }
}
