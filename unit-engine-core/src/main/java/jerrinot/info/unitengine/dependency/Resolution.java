package jerrinot.info.unitengine.dependency;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of resolving the dependencies of one test: either the values to inject or the reason to skip.
 */
public final class Resolution {

    private final Map<String, Object> inputs;
    private final String reason;

    private Resolution(Map<String, Object> inputs, String reason) {
        this.inputs = inputs;
        this.reason = reason;
    }

    static Resolution satisfied(LinkedHashMap<String, Object> inputs) {
        return new Resolution(Collections.unmodifiableMap(inputs), null);
    }

    static Resolution unmet(String reason) {
        return new Resolution(Map.of(), Objects.requireNonNull(reason, "reason"));
    }

    public boolean isSatisfied() { return reason == null; }

    /**
     * Values returned by the prerequisites, keyed by qualified name in declaration order. Values may be null.
     */
    public Map<String, Object> getInputs() { return inputs; }

    public String getReason() { return reason; }

    @Override
    public String toString() {
        return isSatisfied() ? "Resolution{satisfied, inputs=" + inputs.keySet() + "}" : "Resolution{unmet, " + reason + "}";
    }
}
