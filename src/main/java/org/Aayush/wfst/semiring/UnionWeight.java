package org.Aayush.wfst.semiring;

import java.util.List;
import java.util.Objects;

/**
 * Reduced set of weights kept sorted by the owning {@link UnionSemiring}'s order. The empty
 * union is the additive zero.
 *
 * @param <W> element type.
 */
public final class UnionWeight<W> {
    private final List<W> elements;

    UnionWeight(List<W> elements) {
        this.elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public W element(int index) {
        return elements.get(index);
    }

    public List<W> elements() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnionWeight && elements.equals(((UnionWeight<?>) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements);
    }

    @Override
    public String toString() {
        if (elements.isEmpty()) {
            return "EmptySet";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append('|');
            }
            sb.append(elements.get(i));
        }
        return sb.toString();
    }
}
