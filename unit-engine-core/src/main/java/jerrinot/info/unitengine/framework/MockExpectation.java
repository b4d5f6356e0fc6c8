package jerrinot.info.unitengine.framework;

import org.mockito.Mockito;
import org.mockito.verification.VerificationMode;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A call a mock must have received, checked once the test body has finished.
 */
final class MockExpectation<T> {

    private final T mock;
    private final VerificationMode mode;
    private final Consumer<? super T> invocation;

    MockExpectation(T mock, VerificationMode mode, Consumer<? super T> invocation) {
        this.mock = Objects.requireNonNull(mock, "mock");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.invocation = Objects.requireNonNull(invocation, "invocation");
    }

    void verify() {
        try {
            invocation.accept(Mockito.verify(mock, mode));
            Mockito.validateMockitoUsage();
        } catch (AssertionError e) {
            throw new ExpectationFailedException("Expectation failed for " + mockName() + ": "
                    + String.valueOf(e.getMessage()).trim(), e);
        }
    }

    private String mockName() {
        return Mockito.mockingDetails(mock).getMockCreationSettings().getTypeToMock().getName();
    }
}
