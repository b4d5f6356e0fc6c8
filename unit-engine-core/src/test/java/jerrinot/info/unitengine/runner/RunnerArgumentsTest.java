package jerrinot.info.unitengine.runner;

import jerrinot.info.unitengine.framework.EngineException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RunnerArgumentsTest {

    @Test
    void defaults() {
        RunnerArguments arguments = RunnerArguments.defaults();

        assertNull(arguments.getFilter());
        assertTrue(arguments.getGroups().isEmpty());
        assertTrue(arguments.isConvertErrorsToExceptions());
        assertFalse(arguments.isStopOnFailure());
        assertEquals(0, arguments.getRepeat());
        assertNull(arguments.getBackupSystemProperties());
        assertNull(arguments.getDisallowChangesToGlobalState());
    }

    @Test
    void parseFlagAcceptsCommonSpellings() {
        assertTrue(RunnerArguments.parseFlag("", "verbose"));
        assertTrue(RunnerArguments.parseFlag(" YES ", "verbose"));
        assertTrue(RunnerArguments.parseFlag("1", "verbose"));
        assertFalse(RunnerArguments.parseFlag("off", "verbose"));
        assertFalse(RunnerArguments.parseFlag("False", "verbose"));

        EngineException e = assertThrows(EngineException.class, () -> RunnerArguments.parseFlag("maybe", "verbose"));
        assertEquals("Invalid value 'maybe' for unitengine.verbose", e.getMessage());
    }

    @Test
    void environmentNames() {
        assertEquals("UNITENGINE_STOP_ON_FAILURE", RunnerArguments.environmentName("stopOnFailure"));
        assertEquals("UNITENGINE_FILTER", RunnerArguments.environmentName("filter"));
    }

    @Test
    void propertiesWinOverEnvironment() {
        Properties properties = new Properties();
        properties.setProperty("unitengine.filter", " testPush ");
        properties.setProperty("unitengine.groups", "fast, slow,,");
        properties.setProperty("unitengine.stopOnFailure", "true");
        properties.setProperty("unitengine.repeat", "3");
        Map<String, String> environment = Map.of(
                "UNITENGINE_FILTER", "ignored",
                "UNITENGINE_EXCLUDE_GROUPS", "database",
                "UNITENGINE_BACKUP_SYSTEM_PROPERTIES", "yes");

        RunnerArguments arguments = RunnerArguments.fromProperties(properties, environment);

        assertEquals("testPush", arguments.getFilter());
        assertEquals(List.of("fast", "slow"), arguments.getGroups());
        assertEquals(List.of("database"), arguments.getExcludeGroups());
        assertTrue(arguments.isStopOnFailure());
        assertEquals(3, arguments.getRepeat());
        assertEquals(Boolean.TRUE, arguments.getBackupSystemProperties());
        assertNull(arguments.getDisallowChangesToGlobalState());
    }

    @Test
    void invalidRepeatIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("unitengine.repeat", "twice");

        EngineException e = assertThrows(EngineException.class,
                () -> RunnerArguments.fromProperties(properties, Map.of()));
        assertEquals("Invalid value 'twice' for unitengine.repeat", e.getMessage());
        assertThrows(EngineException.class, () -> RunnerArguments.builder().repeat(-1));
    }

    @Test
    void blankFilterIsIgnored() {
        RunnerArguments arguments = RunnerArguments.fromProperties(new Properties(),
                Map.of("UNITENGINE_FILTER", "  "));

        assertNull(arguments.getFilter());
    }
}
