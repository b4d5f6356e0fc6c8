package jerrinot.info.unitengine.metadata;

import jerrinot.info.unitengine.fixtures.ConcreteFixture;
import jerrinot.info.unitengine.fixtures.CyclicDependencyFixture;
import jerrinot.info.unitengine.fixtures.GroupFixture;
import jerrinot.info.unitengine.fixtures.HookFixture;
import jerrinot.info.unitengine.fixtures.InvalidHookFixture;
import jerrinot.info.unitengine.fixtures.SizeFixture;
import jerrinot.info.unitengine.fixtures.StackFixture;
import jerrinot.info.unitengine.fixtures.StatusFixture;
import jerrinot.info.unitengine.framework.EngineException;
import jerrinot.info.unitengine.framework.TestSize;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MetadataExtractorTest {

    @Test
    void descriptorsAreCached() {
        assertSame(MetadataExtractor.describe(StackFixture.class), MetadataExtractor.describe(StackFixture.class));
    }

    @Test
    void testMethodsAreOrdered() {
        List<String> names = MetadataExtractor.describe(StackFixture.class).getTestMethods().stream()
                .map(TestMethodDescriptor::getName)
                .collect(Collectors.toList());

        assertEquals(List.of("testEmpty", "testPush", "testPop"), names);
    }

    @Test
    void prerequisitesOfTheSameClassComeFirst() {
        List<String> names = MetadataExtractor.describe(CyclicDependencyFixture.class).getTestMethods().stream()
                .map(TestMethodDescriptor::getName)
                .collect(Collectors.toList());

        assertEquals(List.of("testB", "testA", "testC", "testD"), names);
    }

    @Test
    void hookTableIsBuiltOnce() {
        HookMethods hooks = MetadataExtractor.getHookMethods(HookFixture.class);

        assertEquals(List.of("classPush"), names(hooks.getBeforeClass()));
        assertEquals(List.of("methodPush1"), names(hooks.getBefore()));
        assertEquals(List.of("methodPush2"), names(hooks.getAfter()));
        assertEquals(List.of("classPop"), names(hooks.getAfterClass()));
    }

    @Test
    void classAndMethodGroupsAreMerged() {
        assertEquals(List.of("hook"), MetadataExtractor.getGroups(HookFixture.class, "testPush"));
        assertEquals(List.of("slow", "database"), MetadataExtractor.getGroups(GroupFixture.class, "testSlow"));
        assertEquals(List.of(), MetadataExtractor.getGroups(GroupFixture.class, "testUngrouped"));
        assertEquals(List.of("concrete"), MetadataExtractor.getGroups(ConcreteFixture.class, "testInherited"));
    }

    @Test
    void dependenciesArePerMethod() {
        assertEquals(List.of("testEmpty"), MetadataExtractor.getDependencies(StackFixture.class, "testPush"));
        assertEquals(List.of(), MetadataExtractor.getDependencies(StackFixture.class, "testEmpty"));
    }

    @Test
    void sizeFromAnnotationOrGroups() {
        assertEquals(TestSize.LARGE, MetadataExtractor.getSize(SizeFixture.class, "testLarge"));
        assertEquals(TestSize.SMALL, MetadataExtractor.getSize(SizeFixture.class, "testSmallDependsOnLarge"));
        assertEquals(TestSize.LARGE, MetadataExtractor.getSize(SizeFixture.class, "testLargeDependsOnLarge"));
        assertEquals(TestSize.UNKNOWN, MetadataExtractor.getSize(SizeFixture.class, "testUnknownDependsOnLarge"));
        assertEquals(TestSize.MEDIUM, MetadataExtractor.sizeFromGroups(Set.of("medium", "small")));
    }

    @Test
    void todoAndErrorHandlerFlags() {
        assertTrue(MetadataExtractor.isTodo(StatusFixture.class, "testTodo"));
        assertFalse(MetadataExtractor.isTodo(StatusFixture.class, "testPasses"));
        assertEquals(Boolean.FALSE,
                MetadataExtractor.getErrorHandlerSettings(StatusFixture.class, "testThrowsErrorWithoutHandler"));
        assertNull(MetadataExtractor.getErrorHandlerSettings(StatusFixture.class, "testPasses"));
    }

    @Test
    void engineMethodsAreNotTests() throws Exception {
        Method inherited = StatusFixture.class.getMethod("toString");
        Method test = StatusFixture.class.getMethod("testPasses");

        assertFalse(MetadataExtractor.isTestMethod(inherited));
        assertTrue(MetadataExtractor.isTestMethod(test));
    }

    @Test
    void instanceBeforeClassHookIsRejected() {
        EngineException e = assertThrows(EngineException.class,
                () -> MetadataExtractor.describe(InvalidHookFixture.class));
        assertEquals("@BeforeClass method " + InvalidHookFixture.class.getName() + ".notStatic must be static",
                e.getMessage());
    }

    private static List<String> names(List<Method> methods) {
        return methods.stream().map(Method::getName).collect(Collectors.toList());
    }
}
