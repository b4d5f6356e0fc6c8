package jerrinot.info.unitengine.metadata;

import jerrinot.info.unitengine.dependency.DependencyResolver;
import jerrinot.info.unitengine.framework.EngineException;
import jerrinot.info.unitengine.framework.TestCase;
import jerrinot.info.unitengine.framework.TestSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads groups, dependencies, data providers, sizes and fixture hooks from the annotations of a test class.
 * Descriptors are cached per class.
 */
public final class MetadataExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataExtractor.class);

    static final String TEST_METHOD_PREFIX = "test";
    private static final Set<String> TEMPLATE_METHODS = Set.of("setUp", "tearDown");

    private static final Comparator<Method> DECLARATION_ORDER = Comparator
            .comparingInt(MetadataExtractor::orderOf)
            .thenComparing(Method::getName)
            .thenComparingInt(Method::getParameterCount);

    private static final Map<Class<?>, TestClassDescriptor> CACHE = new ConcurrentHashMap<>();

    private MetadataExtractor() {
    }

    public static TestClassDescriptor describe(Class<?> type) {
        return CACHE.computeIfAbsent(type, MetadataExtractor::build);
    }

    public static HookMethods getHookMethods(Class<?> type) {
        return describe(type).getHooks();
    }

    /**
     * Class groups followed by the groups of the named method, without duplicates.
     */
    public static List<String> getGroups(Class<?> type, String methodName) {
        TestClassDescriptor descriptor = describe(type);
        TestMethodDescriptor method = descriptor.getTestMethod(methodName);
        return method != null ? method.getGroups() : descriptor.getGroups();
    }

    public static List<String> getDependencies(Class<?> type, String methodName) {
        TestClassDescriptor descriptor = describe(type);
        TestMethodDescriptor method = descriptor.getTestMethod(methodName);
        return method != null ? method.getDependencies() : descriptor.getDependencies();
    }

    public static TestSize getSize(Class<?> type, String methodName) {
        TestClassDescriptor descriptor = describe(type);
        TestMethodDescriptor method = descriptor.getTestMethod(methodName);
        return method != null ? method.getSize() : descriptor.getSize();
    }

    public static boolean isTodo(Class<?> type, String methodName) {
        TestMethodDescriptor method = describe(type).getTestMethod(methodName);
        return method != null && method.isTodo();
    }

    /**
     * Error conversion override for the named method, or {@code null} when none is declared.
     */
    public static Boolean getErrorHandlerSettings(Class<?> type, String methodName) {
        TestClassDescriptor descriptor = describe(type);
        TestMethodDescriptor method = descriptor.getTestMethod(methodName);
        return method != null ? method.getErrorHandler() : descriptor.getErrorHandler();
    }

    public static boolean isTestMethod(Method method) {
        return method.getName().startsWith(TEST_METHOD_PREFIX)
                && Modifier.isPublic(method.getModifiers())
                && !Modifier.isStatic(method.getModifiers())
                && !method.isSynthetic()
                && !isEngineClass(method.getDeclaringClass());
    }

    static void clearCache() {
        CACHE.clear();
    }

    private static TestClassDescriptor build(Class<?> type) {
        List<Class<?>> lineage = lineage(type);

        Set<String> classGroups = new LinkedHashSet<>();
        Set<String> classDependencies = new LinkedHashSet<>();
        TestSize classSize = null;
        Boolean classErrorHandler = null;
        for (Class<?> c : lineage) {
            Group group = c.getAnnotation(Group.class);
            if (group != null) {
                classGroups.addAll(Arrays.asList(group.value()));
            }
            Depends depends = c.getAnnotation(Depends.class);
            if (depends != null) {
                classDependencies.addAll(Arrays.asList(depends.value()));
            }
            Size size = c.getAnnotation(Size.class);
            if (size != null) {
                classSize = size.value();
            }
            ErrorHandler errorHandler = c.getAnnotation(ErrorHandler.class);
            if (errorHandler != null) {
                classErrorHandler = errorHandler.value();
            }
        }
        TestSize resolvedClassSize = classSize != null ? classSize : sizeFromGroups(classGroups);

        List<TestMethodDescriptor> testMethods = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Method[] candidates = type.getMethods();
        Arrays.sort(candidates, DECLARATION_ORDER);
        for (Method method : candidates) {
            if (!isTestMethod(method) || !seen.add(method.getName())) {
                continue;
            }
            method.setAccessible(true);
            testMethods.add(describeMethod(method, classGroups, classDependencies, classSize, classErrorHandler));
        }

        HookMethods hooks = buildHooks(lineage);
        TestClassDescriptor descriptor = new TestClassDescriptor(type, List.copyOf(classGroups),
                List.copyOf(classDependencies), resolvedClassSize, classErrorHandler, hooks,
                prerequisitesFirst(type, testMethods));
        LOG.debug("Described {}", descriptor);
        return descriptor;
    }

    private static TestMethodDescriptor describeMethod(Method method, Set<String> classGroups,
                                                       Set<String> classDependencies, TestSize classSize,
                                                       Boolean classErrorHandler) {
        Set<String> groups = new LinkedHashSet<>(classGroups);
        Group group = method.getAnnotation(Group.class);
        if (group != null) {
            groups.addAll(Arrays.asList(group.value()));
        }

        Set<String> dependencies = new LinkedHashSet<>(classDependencies);
        Depends depends = method.getAnnotation(Depends.class);
        if (depends != null) {
            dependencies.addAll(Arrays.asList(depends.value()));
        }

        DataProvider provider = method.getAnnotation(DataProvider.class);
        Size size = method.getAnnotation(Size.class);
        TestSize resolvedSize;
        if (size != null) {
            resolvedSize = size.value();
        } else if (classSize != null) {
            resolvedSize = classSize;
        } else {
            resolvedSize = sizeFromGroups(groups);
        }

        ErrorHandler errorHandler = method.getAnnotation(ErrorHandler.class);
        Boolean resolvedErrorHandler = classErrorHandler;
        if (errorHandler != null) {
            resolvedErrorHandler = Boolean.valueOf(errorHandler.value());
        }
        return new TestMethodDescriptor(method, List.copyOf(groups), List.copyOf(dependencies),
                provider != null ? provider.value() : null,
                resolvedSize,
                method.isAnnotationPresent(Todo.class),
                resolvedErrorHandler);
    }

    /**
     * Moves each test behind the tests of the same class it depends on, otherwise keeping the given order.
     * A dependency cycle is broken at the test reached first.
     */
    static List<TestMethodDescriptor> prerequisitesFirst(Class<?> type, List<TestMethodDescriptor> methods) {
        Map<String, TestMethodDescriptor> byName = new LinkedHashMap<>();
        for (TestMethodDescriptor method : methods) {
            byName.put(method.getName(), method);
        }
        Set<String> visiting = new HashSet<>();
        Set<String> placed = new LinkedHashSet<>();
        List<TestMethodDescriptor> ordered = new ArrayList<>(methods.size());
        for (TestMethodDescriptor method : methods) {
            place(type, method, byName, visiting, placed, ordered);
        }
        return ordered;
    }

    private static void place(Class<?> type, TestMethodDescriptor method, Map<String, TestMethodDescriptor> byName,
                              Set<String> visiting, Set<String> placed, List<TestMethodDescriptor> ordered) {
        if (placed.contains(method.getName()) || !visiting.add(method.getName())) {
            return;
        }
        String prefix = type.getName() + DependencyResolver.QUALIFIER;
        for (String dependency : method.getDependencies()) {
            String qualified = DependencyResolver.qualify(type.getName(), dependency);
            if (!qualified.startsWith(prefix)) {
                continue;
            }
            TestMethodDescriptor prerequisite = byName.get(qualified.substring(prefix.length()));
            if (prerequisite != null) {
                place(type, prerequisite, byName, visiting, placed, ordered);
            }
        }
        visiting.remove(method.getName());
        if (placed.add(method.getName())) {
            ordered.add(method);
        }
    }

    static TestSize sizeFromGroups(Set<String> groups) {
        if (groups.contains("large")) {
            return TestSize.LARGE;
        }
        if (groups.contains("medium")) {
            return TestSize.MEDIUM;
        }
        if (groups.contains("small")) {
            return TestSize.SMALL;
        }
        return TestSize.UNKNOWN;
    }

    private static HookMethods buildHooks(List<Class<?>> lineage) {
        Map<String, Method> beforeClass = new LinkedHashMap<>();
        Map<String, Method> before = new LinkedHashMap<>();
        Map<String, Method> after = new LinkedHashMap<>();
        Map<String, Method> afterClass = new LinkedHashMap<>();

        for (Class<?> c : lineage) {
            Method[] declared = c.getDeclaredMethods();
            Arrays.sort(declared, DECLARATION_ORDER);
            for (Method method : declared) {
                if (method.isSynthetic() || method.isBridge()) {
                    continue;
                }
                if (method.isAnnotationPresent(BeforeClass.class)) {
                    register(beforeClass, method, true, BeforeClass.class);
                }
                if (method.isAnnotationPresent(Before.class)) {
                    register(before, method, false, Before.class);
                }
                if (method.isAnnotationPresent(After.class)) {
                    register(after, method, false, After.class);
                }
                if (method.isAnnotationPresent(AfterClass.class)) {
                    register(afterClass, method, true, AfterClass.class);
                }
            }
        }
        return new HookMethods(new ArrayList<>(beforeClass.values()), new ArrayList<>(before.values()),
                new ArrayList<>(after.values()), new ArrayList<>(afterClass.values()));
    }

    private static void register(Map<String, Method> hooks, Method method, boolean classLevel, Class<?> marker) {
        String where = method.getDeclaringClass().getName() + "." + method.getName();
        if (method.getParameterCount() != 0) {
            throw new EngineException("@" + marker.getSimpleName() + " method " + where + " must not take parameters");
        }
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (classLevel && !isStatic) {
            throw new EngineException("@" + marker.getSimpleName() + " method " + where + " must be static");
        }
        if (!classLevel && isStatic) {
            throw new EngineException("@" + marker.getSimpleName() + " method " + where + " must not be static");
        }
        if (!classLevel && TEMPLATE_METHODS.contains(method.getName())) {
            // setUp and tearDown always run first, an annotation would run them twice
            return;
        }
        method.setAccessible(true);
        // an overriding method keeps the position of the one it overrides
        String key = classLevel ? where : method.getName();
        hooks.putIfAbsent(key, method);
    }

    private static List<Class<?>> lineage(Class<?> type) {
        List<Class<?>> lineage = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class && !isEngineClass(c); c = c.getSuperclass()) {
            lineage.add(0, c);
        }
        return lineage;
    }

    private static boolean isEngineClass(Class<?> type) {
        return type == Object.class || type.getPackage() == TestCase.class.getPackage();
    }

    private static int orderOf(Method method) {
        Order order = method.getAnnotation(Order.class);
        return order != null ? order.value() : Order.DEFAULT;
    }
}
