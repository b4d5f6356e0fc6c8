package jerrinot.info.unitengine.framework;

public enum TestSize {
    UNKNOWN(-1),
    SMALL(0),
    MEDIUM(1),
    LARGE(2);

    private final int ordinalSize;

    TestSize(int ordinalSize) {
        this.ordinalSize = ordinalSize;
    }

    public int getOrdinalSize() { return ordinalSize; }

    public boolean isKnown() { return this != UNKNOWN; }

    /**
     * True only when both sizes are known and this one is strictly larger.
     */
    public boolean isLargerThan(TestSize other) {
        return isKnown() && other.isKnown() && ordinalSize > other.ordinalSize;
    }
}
