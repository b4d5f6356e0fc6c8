package jerrinot.info.unitengine.metadata;

import jerrinot.info.unitengine.framework.TestSize;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Size {

    TestSize value();
}
