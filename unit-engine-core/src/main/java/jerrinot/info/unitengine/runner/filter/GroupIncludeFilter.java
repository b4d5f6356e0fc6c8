package jerrinot.info.unitengine.runner.filter;

import jerrinot.info.unitengine.framework.Test;
import jerrinot.info.unitengine.framework.TestSuite;

import java.util.List;

/**
 * Keeps the test cases a suite registered under one of the given groups.
 */
public final class GroupIncludeFilter implements TestFilter {

    private final List<String> groups;

    public GroupIncludeFilter(List<String> groups) {
        this.groups = List.copyOf(groups);
    }

    @Override
    public boolean accept(Test test, TestSuite suite) {
        if (test instanceof TestSuite) {
            return true;
        }
        return GroupExcludeFilter.inAnyGroup(test, suite, groups);
    }

    @Override
    public String toString() {
        return "GroupIncludeFilter" + groups;
    }
}
