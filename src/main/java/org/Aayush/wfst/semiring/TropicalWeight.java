package org.Aayush.wfst.semiring;

/**
 * Weight of the tropical semiring {@code (min, +, +inf, 0)}.
 */
public final class TropicalWeight extends FloatWeight {
    public static final TropicalWeight ZERO = new TropicalWeight(Float.POSITIVE_INFINITY);
    public static final TropicalWeight ONE = new TropicalWeight(0.0f);

    private TropicalWeight(float value) {
        super(value);
    }

    public static TropicalWeight of(float value) {
        if (value == 0.0f) {
            return ONE;
        }
        if (value == Float.POSITIVE_INFINITY) {
            return ZERO;
        }
        return new TropicalWeight(value);
    }
}
