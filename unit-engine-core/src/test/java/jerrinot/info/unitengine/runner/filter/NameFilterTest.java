package jerrinot.info.unitengine.runner.filter;

import jerrinot.info.unitengine.fixtures.AdditionFixture;
import jerrinot.info.unitengine.fixtures.DataProviderFixture;
import jerrinot.info.unitengine.fixtures.GroupFixture;
import jerrinot.info.unitengine.framework.DataProviderTestSuite;
import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.framework.TestResult;
import jerrinot.info.unitengine.framework.TestSuite;
import jerrinot.info.unitengine.framework.WarningTestCase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameFilterTest {

    private final TestSuite suite = new TestSuite("filtered");

    @Test
    void matchesQualifiedName() {
        TestCase fast = (TestCase) TestSuite.createTest(GroupFixture.class, "testFast");

        assertTrue(new NameFilter("GroupFixture::testFast").accept(fast, suite));
        assertTrue(new NameFilter("test(Fast|Slow)").accept(fast, suite));
        assertFalse(new NameFilter("testSlow").accept(fast, suite));
    }

    @Test
    void invalidExpressionIsMatchedLiterally() {
        TestCase fast = (TestCase) TestSuite.createTest(GroupFixture.class, "testFast");

        assertFalse(new NameFilter("testFast(").accept(fast, suite));
        assertTrue(new NameFilter("::testF").accept(fast, suite));
    }

    @Test
    void suitesAlwaysPass() {
        assertTrue(new NameFilter("nothing matches this").accept(new TestSuite("nested"), suite));
    }

    @Test
    void warningsMatchTheirMessage() {
        WarningTestCase warning = new WarningTestCase("No tests found in class \"Empty\".");

        assertTrue(new NameFilter("No tests found").accept(warning, suite));
        assertFalse(new NameFilter("Warning").accept(warning, suite));
    }

    @Test
    void dataSetIndexAndRange() {
        DataProviderTestSuite instance =
                (DataProviderTestSuite) TestSuite.createTest(DataProviderFixture.class, "testInstance");
        TestCase first = (TestCase) instance.testAt(0);
        TestCase second = (TestCase) instance.testAt(1);

        NameFilter single = new NameFilter("testInstance#1");
        NameFilter range = new NameFilter("testInstance#0-1");

        assertFalse(single.accept(first, instance));
        assertTrue(single.accept(second, instance));
        assertTrue(range.accept(first, instance));
        assertTrue(range.accept(second, instance));
    }

    @Test
    void dataSetSelectionAppliesToTheWholeAlternation() {
        TestSuite parent = new TestSuite("all");
        parent.addTestSuite(GroupFixture.class);
        parent.addTestSuite(AdditionFixture.class);
        parent.injectFilter(new NameFilter("testFast|testAdd#1"));
        TestResult result = new TestResult();

        parent.run(result);

        assertEquals(1, result.count());
        assertTrue(result.wasSuccessful());
        assertEquals(List.of(AdditionFixture.class.getName() + "::testAdd with data set #1"),
                List.copyOf(result.passed().keySet()));
    }

    @Test
    void dataSetIndexIsReadDespiteGroupsInThePrefix() {
        DataProviderTestSuite instance =
                (DataProviderTestSuite) TestSuite.createTest(DataProviderFixture.class, "testInstance");
        NameFilter filter = new NameFilter("test(Instance|Other)#1");

        assertFalse(filter.accept(instance.testAt(0), instance));
        assertTrue(filter.accept(instance.testAt(1), instance));
    }

    @Test
    void dataSetLabel() {
        DataProviderTestSuite named =
                (DataProviderTestSuite) TestSuite.createTest(DataProviderFixture.class, "testNamed");

        NameFilter filter = new NameFilter("testNamed@two");

        assertFalse(filter.accept(named.testAt(0), named));
        assertTrue(filter.accept(named.testAt(1), named));
    }
}
