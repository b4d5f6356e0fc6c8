package jerrinot.info.unitengine.framework.constraint;

public final class IsEmpty implements Constraint<Object> {

    @Override
    public boolean matches(Object other) {
        return Count.sizeOf(other) == 0;
    }

    @Override
    public String toString() {
        return "is empty";
    }
}
