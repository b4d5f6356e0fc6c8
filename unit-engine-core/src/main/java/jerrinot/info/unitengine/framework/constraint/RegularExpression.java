package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.EngineException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class RegularExpression implements Constraint<Object> {

    private final String regex;
    private final Pattern pattern;

    public RegularExpression(String regex) {
        this.regex = regex;
        try {
            this.pattern = Pattern.compile(regex, Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            throw new EngineException("Invalid regular expression given: " + regex, e);
        }
    }

    @Override
    public boolean matches(Object other) {
        return other != null && pattern.matcher(other.toString()).find();
    }

    @Override
    public String toString() {
        return "matches pattern \"" + regex + "\"";
    }
}
