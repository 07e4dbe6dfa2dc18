package org.Aayush.wfst.semiring;

/**
 * Weight of the boolean semiring {@code (or, and, false, true)}.
 */
public enum BooleanWeight {
    FALSE,
    TRUE;

    public static BooleanWeight of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean value() {
        return this == TRUE;
    }

    @Override
    public String toString() {
        return value() ? "1" : "0";
    }
}
