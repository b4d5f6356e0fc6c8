package jerrinot.info.unitengine.runner;

public interface TestSuiteLoader {

    Class<?> load(String className) throws ClassNotFoundException;
}
