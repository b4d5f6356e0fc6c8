package jerrinot.info.unitengine.fixtures;

import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.metadata.Order;

import java.util.ArrayList;
import java.util.List;

public class SequenceFixture extends TestCase {

    public static final List<String> EXECUTED = new ArrayList<>();

    @Order(1)
    public void testFirst() {
        EXECUTED.add("first");
        fail("first fails");
    }

    @Order(2)
    public void testSecond() {
        EXECUTED.add("second");
        assertTrue(true);
    }

    @Order(3)
    public void testThird() {
        EXECUTED.add("third");
        assertTrue(true);
    }
}
