package jerrinot.info.unitengine.fixtures;

import jerrinot.info.unitengine.framework.Test;
import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.framework.TestSuite;

/**
 * Builds its suite by hand, picking a single method.
 */
public class SuiteMethodFixture extends TestCase {

    public static Test suite() {
        TestSuite suite = new TestSuite("hand-made");
        suite.addTest(TestSuite.createTest(SuiteMethodFixture.class, "testChosen"));
        return suite;
    }

    public void testChosen() {
        assertTrue(true);
    }

    public void testIgnored() {
        fail("not part of the suite");
    }
}
