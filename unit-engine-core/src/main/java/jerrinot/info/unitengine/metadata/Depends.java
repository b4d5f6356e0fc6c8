package jerrinot.info.unitengine.metadata;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names tests that must have passed earlier in the same run. Bare names refer to the declaring class,
 * other tests are named {@code fully.qualified.Class::method}. The values the prerequisites returned are
 * passed to the dependent test after its data-set arguments, in declaration order.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Depends {

    String[] value();
}
