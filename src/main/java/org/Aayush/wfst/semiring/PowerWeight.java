package org.Aayush.wfst.semiring;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-length tuple of weights from one semiring, combined componentwise.
 *
 * @param <W> component type.
 */
public final class PowerWeight<W> {
    private final List<W> values;

    private PowerWeight(List<W> values) {
        this.values = values;
    }

    public static <W> PowerWeight<W> of(List<W> values) {
        Objects.requireNonNull(values, "values");
        return new PowerWeight<>(List.copyOf(values));
    }

    @SafeVarargs
    public static <W> PowerWeight<W> of(W... values) {
        return new PowerWeight<>(List.of(values));
    }

    static <W> PowerWeight<W> filled(W value, int size) {
        return new PowerWeight<>(Collections.nCopies(size, value));
    }

    public int size() {
        return values.size();
    }

    public W value(int index) {
        return values.get(index);
    }

    public List<W> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PowerWeight && values.equals(((PowerWeight<?>) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(values.get(i));
        }
        return sb.toString();
    }
}
