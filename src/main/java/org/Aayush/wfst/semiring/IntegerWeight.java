package org.Aayush.wfst.semiring;

/**
 * Weight of the integer semiring {@code (+, *, 0, 1)}.
 */
public final class IntegerWeight {
    public static final IntegerWeight ZERO = new IntegerWeight(0);
    public static final IntegerWeight ONE = new IntegerWeight(1);

    private final int value;

    private IntegerWeight(int value) {
        this.value = value;
    }

    public static IntegerWeight of(int value) {
        if (value == 0) {
            return ZERO;
        }
        return value == 1 ? ONE : new IntegerWeight(value);
    }

    public int value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntegerWeight && ((IntegerWeight) o).value == value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
