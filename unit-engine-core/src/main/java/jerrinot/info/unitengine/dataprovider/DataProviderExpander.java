package jerrinot.info.unitengine.dataprovider;

import jerrinot.info.unitengine.framework.EngineException;
import jerrinot.info.unitengine.metadata.MetadataExtractor;
import jerrinot.info.unitengine.metadata.TestMethodDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Turns the data provider declared on a test method into labelled argument rows.
 * <p>
 * A provider is a no-argument method of the test class, static or not, returning {@code Object[][]},
 * an array, {@link Iterable}, {@link Iterator} or {@link Stream} of rows, or a {@link Map} of named rows.
 * A row is an {@code Object[]} or a {@link List}. Rows are keyed by their 0-based index, or by their
 * name for maps.
 */
public final class DataProviderExpander {

    private static final Logger LOG = LoggerFactory.getLogger(DataProviderExpander.class);

    private DataProviderExpander() {
    }

    /**
     * Rows for the named test method, or {@code null} when it declares no provider.
     * Exceptions raised by the provider itself are rethrown unchanged.
     *
     * @throws EngineException when the provider is missing or a row is not a sequence
     */
    public static Map<Object, List<Object>> getProvidedData(Class<?> testClass, String methodName) throws Throwable {
        TestMethodDescriptor method = MetadataExtractor.describe(testClass).getTestMethod(methodName);
        if (method == null || !method.hasDataProvider()) {
            return null;
        }
        Object provided = invokeProvider(testClass, method.getDataProvider());
        Map<Object, List<Object>> data = toRows(provided);
        LOG.debug("Data provider {}::{} supplied {} data sets", testClass.getName(), method.getDataProvider(),
                data.size());
        return data;
    }

    static Map<Object, List<Object>> toRows(Object provided) {
        Map<Object, List<Object>> rows = new LinkedHashMap<>();
        if (provided == null) {
            return rows;
        }
        if (provided instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) provided).entrySet()) {
                Object key = e.getKey() instanceof Integer ? e.getKey() : String.valueOf(e.getKey());
                rows.put(key, toRow(key, e.getValue()));
            }
            return rows;
        }
        Iterator<?> it = iteratorOf(provided);
        int index = 0;
        while (it.hasNext()) {
            rows.put(index, toRow(index, it.next()));
            index++;
        }
        return rows;
    }

    private static Iterator<?> iteratorOf(Object provided) {
        if (provided instanceof Object[]) {
            return Arrays.asList((Object[]) provided).iterator();
        }
        if (provided instanceof Iterable) {
            return ((Iterable<?>) provided).iterator();
        }
        if (provided instanceof Iterator) {
            return (Iterator<?>) provided;
        }
        if (provided instanceof Stream) {
            return ((Stream<?>) provided).iterator();
        }
        throw new EngineException("Data provider returned " + provided.getClass().getName()
                + " instead of a collection of data sets");
    }

    private static List<Object> toRow(Object key, Object row) {
        if (row instanceof Object[]) {
            return Collections.unmodifiableList(new ArrayList<>(Arrays.asList((Object[]) row)));
        }
        if (row instanceof List) {
            return Collections.unmodifiableList(new ArrayList<>((List<?>) row));
        }
        if (key instanceof Integer) {
            throw new EngineException(String.format("Data set #%d is invalid.", key));
        }
        throw new EngineException(String.format("Data set \"%s\" is invalid.", key));
    }

    private static Object invokeProvider(Class<?> testClass, String providerName) throws Throwable {
        Method provider = findProvider(testClass, providerName);
        if (provider == null) {
            throw new EngineException("Data provider method " + testClass.getName() + "::" + providerName
                    + " does not exist");
        }
        provider.setAccessible(true);
        try {
            Object target = Modifier.isStatic(provider.getModifiers()) ? null : instantiate(testClass);
            return provider.invoke(target);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    private static Method findProvider(Class<?> testClass, String providerName) {
        for (Class<?> c = testClass; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Method method : c.getDeclaredMethods()) {
                if (method.getName().equals(providerName) && method.getParameterCount() == 0) {
                    return method;
                }
            }
        }
        return null;
    }

    private static Object instantiate(Class<?> testClass) throws ReflectiveOperationException {
        Constructor<?> constructor = testClass.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }
}
