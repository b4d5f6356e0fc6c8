package jerrinot.info.unitengine.dependency;

import jerrinot.info.unitengine.framework.PassedTest;
import jerrinot.info.unitengine.framework.TestSize;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private static final String CLASS = "com.example.StackTest";

    private final Map<String, PassedTest> passed = new LinkedHashMap<>();

    @Test
    void bareNamesAreQualifiedWithTheDependentClass() {
        assertEquals(CLASS + "::testPush", DependencyResolver.qualify(CLASS, "testPush"));
        assertEquals("other.Test::testPush", DependencyResolver.qualify(CLASS, "other.Test::testPush"));
    }

    @Test
    void noDependenciesIsSatisfied() {
        Resolution resolution = DependencyResolver.resolve(CLASS, List.of(), TestSize.UNKNOWN, passed);

        assertTrue(resolution.isSatisfied());
        assertTrue(resolution.getInputs().isEmpty());
        assertNull(resolution.getReason());
    }

    @Test
    void missingPrerequisiteIsUnmet() {
        passed.put(CLASS + "::testEmpty", new PassedTest(List.of(), TestSize.UNKNOWN));

        Resolution resolution = DependencyResolver.resolve(CLASS, List.of("testEmpty", "testPush"),
                TestSize.UNKNOWN, passed);

        assertFalse(resolution.isSatisfied());
        assertEquals("This test depends on \"" + CLASS + "::testPush\" to pass.", resolution.getReason());
    }

    @Test
    void inputsFollowDeclarationOrder() {
        passed.put(CLASS + "::testB", new PassedTest("b", TestSize.UNKNOWN));
        passed.put("other.Test::testA", new PassedTest("a", TestSize.UNKNOWN));

        Resolution resolution = DependencyResolver.resolve(CLASS, List.of("other.Test::testA", "testB"),
                TestSize.UNKNOWN, passed);

        assertTrue(resolution.isSatisfied());
        assertEquals(List.of("other.Test::testA", CLASS + "::testB"), List.copyOf(resolution.getInputs().keySet()));
        assertEquals(Arrays.asList("a", "b"), List.copyOf(resolution.getInputs().values()));
    }

    @Test
    void dataSetSuffixIsIgnoredAndInjectsNull() {
        passed.put(CLASS + "::testAdd with data set #0", new PassedTest(3, TestSize.UNKNOWN));

        Resolution resolution = DependencyResolver.resolve(CLASS, List.of("testAdd"), TestSize.UNKNOWN, passed);

        assertTrue(resolution.isSatisfied());
        assertTrue(resolution.getInputs().containsKey(CLASS + "::testAdd"));
        assertNull(resolution.getInputs().get(CLASS + "::testAdd"));
    }

    @Test
    void largerPrerequisiteIsUnmet() {
        passed.put(CLASS + "::testLarge", new PassedTest(null, TestSize.LARGE));

        Resolution small = DependencyResolver.resolve(CLASS, List.of("testLarge"), TestSize.SMALL, passed);
        Resolution large = DependencyResolver.resolve(CLASS, List.of("testLarge"), TestSize.LARGE, passed);
        Resolution unknown = DependencyResolver.resolve(CLASS, List.of("testLarge"), TestSize.UNKNOWN, passed);

        assertEquals("This test depends on a test that is larger than itself.", small.getReason());
        assertTrue(large.isSatisfied());
        assertTrue(unknown.isSatisfied());
    }

    @Test
    void sizeIsNotCheckedForDataSetMatches() {
        passed.put(CLASS + "::testLarge with data set #0", new PassedTest("row", TestSize.LARGE));

        Resolution resolution = DependencyResolver.resolve(CLASS, List.of("testLarge"), TestSize.SMALL, passed);

        assertTrue(resolution.isSatisfied());
        assertNull(resolution.getInputs().get(CLASS + "::testLarge"));
    }

    @Test
    void stripDataSet() {
        assertEquals("A::t", DependencyResolver.stripDataSet("A::t with data set \"x\""));
        assertEquals("A::t", DependencyResolver.stripDataSet("A::t"));
    }
}
