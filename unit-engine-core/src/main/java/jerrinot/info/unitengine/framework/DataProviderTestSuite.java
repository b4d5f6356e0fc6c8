package jerrinot.info.unitengine.framework;

import java.util.List;

/**
 * The data sets of one test method, named {@code Class::method}.
 */
public class DataProviderTestSuite extends TestSuite {

    private List<String> dependencies = List.of();

    public DataProviderTestSuite(String name) {
        super(name);
    }

    /**
     * Every data set depends on the same tests as the method it was expanded from.
     */
    public void setDependencies(List<String> dependencies) {
        this.dependencies = List.copyOf(dependencies);
        for (Test test : tests()) {
            if (test instanceof TestCase) {
                ((TestCase) test).setDependencies(this.dependencies);
            }
        }
    }

    public List<String> getDependencies() { return dependencies; }
}
