package jerrinot.info.unitengine.fixtures;

import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.framework.TestSize;
import jerrinot.info.unitengine.metadata.Depends;
import jerrinot.info.unitengine.metadata.Group;
import jerrinot.info.unitengine.metadata.Order;
import jerrinot.info.unitengine.metadata.Size;

public class SizeFixture extends TestCase {

    @Order(1)
    @Size(TestSize.LARGE)
    public String testLarge() {
        assertTrue(true);
        return "large";
    }

    @Order(2)
    @Size(TestSize.SMALL)
    @Depends("testLarge")
    public void testSmallDependsOnLarge(String value) {
        fail("never runs");
    }

    @Order(3)
    @Group("large")
    @Depends("testLarge")
    public void testLargeDependsOnLarge(String value) {
        assertEquals("large", value);
    }

    @Order(4)
    @Depends("testLarge")
    public void testUnknownDependsOnLarge(String value) {
        assertEquals("large", value);
    }

    @Order(5)
    @Depends("missing")
    public void testMissingDependency() {
        fail("never runs");
    }
}
