package org.Aayush.wfst.semiring;

/**
 * Base value type for weights backed by a single IEEE float.
 *
 * <p>{@code -0.0f} is normalized to {@code 0.0f} on construction so that equal values never
 * compare unequal. Equality is exact on the normalized bits; NaN is not a semiring member.</p>
 */
public abstract class FloatWeight implements Comparable<FloatWeight> {
    private final float value;

    protected FloatWeight(float value) {
        // adding positive zero folds -0.0f into 0.0f
        this.value = value + 0.0f;
    }

    public final float value() {
        return value;
    }

    @Override
    public int compareTo(FloatWeight other) {
        return Float.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Float.floatToIntBits(value) == Float.floatToIntBits(((FloatWeight) o).value);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + Float.floatToIntBits(value);
    }

    @Override
    public String toString() {
        return formatFloat(value);
    }

    /**
     * Formats a weight value the way the text codec writes it.
     */
    public static String formatFloat(float value) {
        if (value == Float.POSITIVE_INFINITY) {
            return "Infinity";
        }
        if (value == Float.NEGATIVE_INFINITY) {
            return "-Infinity";
        }
        if (value == (long) value && Math.abs(value) < 1.0e15f) {
            return Long.toString((long) value);
        }
        return Float.toString(value);
    }
}
