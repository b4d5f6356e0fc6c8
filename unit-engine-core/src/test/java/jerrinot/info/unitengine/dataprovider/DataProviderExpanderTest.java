package jerrinot.info.unitengine.dataprovider;

import jerrinot.info.unitengine.fixtures.AdditionFixture;
import jerrinot.info.unitengine.fixtures.DataProviderFixture;
import jerrinot.info.unitengine.fixtures.StatusFixture;
import jerrinot.info.unitengine.framework.EngineException;
import jerrinot.info.unitengine.framework.SkippedTestError;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DataProviderExpanderTest {

    @Test
    void methodWithoutProviderYieldsNull() throws Throwable {
        assertNull(DataProviderExpander.getProvidedData(StatusFixture.class, "testPasses"));
        assertNull(DataProviderExpander.getProvidedData(StatusFixture.class, "noSuchMethod"));
    }

    @Test
    void arrayRowsAreIndexed() throws Throwable {
        Map<Object, List<Object>> data = DataProviderExpander.getProvidedData(AdditionFixture.class, "testAdd");

        assertEquals(List.of(0, 1, 2, 3), List.copyOf(data.keySet()));
        assertEquals(List.of(1, 1, 2), data.get(3));
    }

    @Test
    void mapRowsKeepTheirNames() throws Throwable {
        Map<Object, List<Object>> data = DataProviderExpander.getProvidedData(DataProviderFixture.class, "testNamed");

        assertEquals(List.of("one", "two"), List.copyOf(data.keySet()));
    }

    @Test
    void instanceProviderIsSupported() throws Throwable {
        Map<Object, List<Object>> data =
                DataProviderExpander.getProvidedData(DataProviderFixture.class, "testInstance");

        assertEquals(List.of("a"), data.get(0));
        assertEquals(List.of("b"), data.get(1));
    }

    @Test
    void providerExceptionsPassThrough() {
        assertThrows(SkippedTestError.class,
                () -> DataProviderExpander.getProvidedData(DataProviderFixture.class, "testSkipping"));
        assertThrows(IllegalStateException.class,
                () -> DataProviderExpander.getProvidedData(DataProviderFixture.class, "testThrowing"));
    }

    @Test
    void missingProviderIsAnEngineError() {
        EngineException e = assertThrows(EngineException.class,
                () -> DataProviderExpander.getProvidedData(DataProviderFixture.class, "testMissing"));
        assertTrue(e.getMessage().contains("missingProvider"));
    }

    @Test
    void rowsMustBeSequences() {
        EngineException indexed = assertThrows(EngineException.class,
                () -> DataProviderExpander.toRows(List.of(List.of(1), 5)));
        assertEquals("Data set #1 is invalid.", indexed.getMessage());

        Map<String, Object> named = new LinkedHashMap<>();
        named.put("bad", "value");
        EngineException labelled = assertThrows(EngineException.class, () -> DataProviderExpander.toRows(named));
        assertEquals("Data set \"bad\" is invalid.", labelled.getMessage());
    }

    @Test
    void acceptsIteratorsAndStreams() {
        Iterator<Object[]> iterator = Arrays.asList(new Object[]{1}, new Object[]{2}).iterator();
        assertEquals(2, DataProviderExpander.toRows(iterator).size());
        assertEquals(1, DataProviderExpander.toRows(Stream.of(List.of("x"))).size());
        assertTrue(DataProviderExpander.toRows(null).isEmpty());
        assertThrows(EngineException.class, () -> DataProviderExpander.toRows("not a collection"));
    }
}
