package jerrinot.info.unitengine.framework;

/**
 * Implemented by exceptions that carry a numeric code checked by {@link TestCase#expectExceptionCode(int)}.
 */
public interface CodedException {

    int getCode();
}
