package org.Aayush.wfst.semiring;

/**
 * Weight of the log semiring {@code (-log(e^-x + e^-y), +, +inf, 0)}.
 */
public final class LogWeight extends FloatWeight {
    public static final LogWeight ZERO = new LogWeight(Float.POSITIVE_INFINITY);
    public static final LogWeight ONE = new LogWeight(0.0f);

    private LogWeight(float value) {
        super(value);
    }

    public static LogWeight of(float value) {
        if (value == 0.0f) {
            return ONE;
        }
        if (value == Float.POSITIVE_INFINITY) {
            return ZERO;
        }
        return new LogWeight(value);
    }
}
