package jerrinot.info.unitengine.runner.filter;

import jerrinot.info.unitengine.framework.Test;
import jerrinot.info.unitengine.framework.TestSuite;

import java.util.List;
import java.util.Map;

/**
 * Drops the test cases a suite registered under one of the given groups. Nested suites are filtered by their
 * own registrations.
 */
public final class GroupExcludeFilter implements TestFilter {

    private final List<String> groups;

    public GroupExcludeFilter(List<String> groups) {
        this.groups = List.copyOf(groups);
    }

    @Override
    public boolean accept(Test test, TestSuite suite) {
        if (test instanceof TestSuite) {
            return true;
        }
        return !inAnyGroup(test, suite, groups);
    }

    static boolean inAnyGroup(Test test, TestSuite suite, List<String> groups) {
        Map<String, List<Test>> details = suite.getGroupDetails();
        for (String group : groups) {
            List<Test> members = details.get(group);
            if (members == null) {
                continue;
            }
            for (Test member : members) {
                if (member == test) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "GroupExcludeFilter" + groups;
    }
}
