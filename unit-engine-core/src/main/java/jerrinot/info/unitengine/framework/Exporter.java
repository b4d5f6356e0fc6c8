package jerrinot.info.unitengine.framework;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/**
 * Renders values for failure messages and data-set labels.
 */
public final class Exporter {

    private static final int SHORTENED_LIMIT = 40;

    private Exporter() {
    }

    public static String export(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "'" + value + "'";
        }
        if (value instanceof Character) {
            return "'" + value + "'";
        }
        if (value.getClass().isArray()) {
            StringBuilder sb = new StringBuilder("[");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(export(Array.get(value, i)));
            }
            return sb.append(']').toString();
        }
        if (value instanceof Collection) {
            return exportAll(((Collection<?>) value).iterator());
        }
        if (value instanceof Map) {
            StringBuilder sb = new StringBuilder("{");
            Iterator<? extends Map.Entry<?, ?>> it = ((Map<?, ?>) value).entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> e = it.next();
                sb.append(export(e.getKey())).append(" => ").append(export(e.getValue()));
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append('}').toString();
        }
        if (value instanceof Throwable) {
            return value.getClass().getName();
        }
        return String.valueOf(value);
    }

    /**
     * Single-line export cut down to a length suitable for test names.
     */
    public static String shortenedExport(Object value) {
        String exported = export(value).replace("\r", "").replace('\n', ' ');
        if (exported.length() > SHORTENED_LIMIT) {
            return exported.substring(0, SHORTENED_LIMIT - 3) + "...";
        }
        return exported;
    }

    private static String exportAll(Iterator<?> it) {
        StringBuilder sb = new StringBuilder("[");
        while (it.hasNext()) {
            sb.append(export(it.next()));
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append(']').toString();
    }
}
