package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.Exporter;

import java.util.Collection;
import java.util.Objects;

/**
 * Substring check for strings, membership check for collections.
 */
public final class StringContains implements Constraint<Object> {

    private final Object needle;

    public StringContains(Object needle) {
        this.needle = needle;
    }

    @Override
    public boolean matches(Object other) {
        if (other instanceof CharSequence) {
            return needle != null && other.toString().contains(needle.toString());
        }
        if (other instanceof Collection) {
            for (Object element : (Collection<?>) other) {
                if (Objects.deepEquals(element, needle)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "contains " + Exporter.export(needle);
    }
}
