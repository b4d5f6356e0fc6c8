package jerrinot.info.unitengine.framework.constraint;

import jerrinot.info.unitengine.framework.EngineException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class ExceptionMessageRegularExpression implements Constraint<Throwable> {

    private final String regex;
    private final Pattern pattern;

    public ExceptionMessageRegularExpression(String regex) {
        this.regex = regex;
        try {
            this.pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new EngineException("Invalid expected exception message regex given: '" + regex + "'", e);
        }
    }

    @Override
    public boolean matches(Throwable other) {
        return pattern.matcher(ExceptionMessage.messageOf(other)).find();
    }

    @Override
    public String failureDescription(Throwable other) {
        return "exception message '" + ExceptionMessage.messageOf(other) + "' matches '" + regex + "'";
    }

    @Override
    public String toString() {
        return "exception message matches '" + regex + "'";
    }
}
