package org.Aayush.wfst.semiring;

import java.util.Arrays;

/**
 * Label string weight; {@link #INFINITY} is the additive zero and {@link #EPSILON} the empty string.
 */
public final class StringWeight {
    public static final StringWeight INFINITY = new StringWeight(null);
    public static final StringWeight EPSILON = new StringWeight(new int[0]);

    // null marks the infinite string
    private final int[] labels;

    private StringWeight(int[] labels) {
        this.labels = labels;
    }

    public static StringWeight of(int... labels) {
        if (labels.length == 0) {
            return EPSILON;
        }
        return new StringWeight(labels.clone());
    }

    static StringWeight wrap(int[] labels) {
        return labels.length == 0 ? EPSILON : new StringWeight(labels);
    }

    public boolean isInfinity() {
        return labels == null;
    }

    public boolean isEmpty() {
        return labels != null && labels.length == 0;
    }

    /**
     * Number of labels; the infinite string has size zero.
     */
    public int size() {
        return labels == null ? 0 : labels.length;
    }

    public int label(int index) {
        if (labels == null) {
            throw new IndexOutOfBoundsException("infinite string has no labels");
        }
        return labels[index];
    }

    public int[] labels() {
        return labels == null ? new int[0] : labels.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StringWeight)) {
            return false;
        }
        return Arrays.equals(labels, ((StringWeight) o).labels);
    }

    @Override
    public int hashCode() {
        return labels == null ? -1 : Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        if (labels == null) {
            return "Infinity";
        }
        if (labels.length == 0) {
            return "Epsilon";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < labels.length; i++) {
            if (i > 0) {
                sb.append('_');
            }
            sb.append(labels[i]);
        }
        return sb.toString();
    }
}
