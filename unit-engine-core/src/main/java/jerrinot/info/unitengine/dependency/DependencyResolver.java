package jerrinot.info.unitengine.dependency;

import jerrinot.info.unitengine.framework.PassedTest;
import jerrinot.info.unitengine.framework.TestSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches declared dependencies against the tests that passed so far in the current run.
 */
public final class DependencyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyResolver.class);

    public static final String QUALIFIER = "::";
    static final String DATA_SET_MARKER = " with data set ";

    private DependencyResolver() {
    }

    /**
     * @param className    class of the dependent test, used to qualify bare dependency names
     * @param dependencies declared dependencies, duplicates already removed
     * @param size         size of the dependent test
     * @param passed       passed tests keyed by qualified name, possibly with a data-set suffix
     */
    public static Resolution resolve(String className, List<String> dependencies, TestSize size,
                                     Map<String, PassedTest> passed) {
        Map<String, PassedTest> byTestName = new LinkedHashMap<>();
        for (Map.Entry<String, PassedTest> e : passed.entrySet()) {
            byTestName.putIfAbsent(stripDataSet(e.getKey()), e.getValue());
        }

        LinkedHashMap<String, Object> inputs = new LinkedHashMap<>();
        for (String dependency : dependencies) {
            String qualified = qualify(className, dependency);
            PassedTest prerequisite = byTestName.get(qualified);
            if (prerequisite == null) {
                LOG.debug("{} is not among the passed tests", qualified);
                return Resolution.unmet(String.format("This test depends on \"%s\" to pass.", qualified));
            }
            PassedTest exact = passed.get(qualified);
            // the size gate applies to exact matches only
            if (exact != null && exact.getSize().isLargerThan(size)) {
                return Resolution.unmet("This test depends on a test that is larger than itself.");
            }
            inputs.put(qualified, exact != null ? exact.getResult() : null);
        }
        return Resolution.satisfied(inputs);
    }

    public static String qualify(String className, String dependency) {
        return dependency.contains(QUALIFIER) ? dependency : className + QUALIFIER + dependency;
    }

    static String stripDataSet(String key) {
        int index = key.indexOf(DATA_SET_MARKER);
        return index < 0 ? key : key.substring(0, index);
    }
}
