package org.Aayush.wfst.semiring;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.wfst.FstException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Union semiring: sets of base weights, where {@code plus} is a sorted merge that combines
 * elements the order considers equal and {@code times} is the pairwise product.
 *
 * @param <W> element type.
 */
@Getter
@Accessors(fluent = true)
public final class UnionSemiring<W> implements WeaklyDivisibleSemiring<UnionWeight<W>> {
    public static final String REASON_DIVISOR_NOT_SINGLETON = "UNION_DIVISOR_NOT_SINGLETON";
    public static final String REASON_BASE_NOT_DIVISIBLE = "UNION_BASE_NOT_DIVISIBLE";

    /**
     * Combines two elements that compare equal under the union's order.
     */
    @FunctionalInterface
    public interface Merger<W> {
        W merge(Semiring<W> base, W a, W b);
    }

    private final Semiring<W> base;
    private final Comparator<W> order;
    private final Merger<W> merger;
    @Getter(lombok.AccessLevel.NONE)
    private final Set<SemiringProperty> properties;

    public UnionSemiring(Semiring<W> base, Comparator<W> order, Merger<W> merger) {
        this.base = Objects.requireNonNull(base, "base");
        this.order = Objects.requireNonNull(order, "order");
        this.merger = Objects.requireNonNull(merger, "merger");
        EnumSet<SemiringProperty> props = EnumSet.of(
                SemiringProperty.LEFT_SEMIRING,
                SemiringProperty.RIGHT_SEMIRING,
                SemiringProperty.COMMUTATIVE,
                SemiringProperty.IDEMPOTENT
        );
        props.retainAll(base.properties());
        this.properties = Collections.unmodifiableSet(props);
    }

    /**
     * Union semiring that merges equal elements with the base addition.
     */
    public static <W> UnionSemiring<W> of(Semiring<W> base, Comparator<W> order) {
        return new UnionSemiring<>(base, order, Semiring::plus);
    }

    @Override
    public String name() {
        return base.name() + "_union";
    }

    @Override
    public UnionWeight<W> zero() {
        return new UnionWeight<>(List.of());
    }

    @Override
    public UnionWeight<W> one() {
        return new UnionWeight<>(List.of(base.one()));
    }

    /**
     * Wraps one base weight; the base zero maps to the empty union.
     */
    public UnionWeight<W> singleton(W weight) {
        if (base.isZero(weight)) {
            return zero();
        }
        return new UnionWeight<>(List.of(weight));
    }

    @Override
    public boolean isZero(UnionWeight<W> weight) {
        return weight.isEmpty();
    }

    @Override
    public UnionWeight<W> plus(UnionWeight<W> a, UnionWeight<W> b) {
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        List<W> out = new ArrayList<>(a.size() + b.size());
        int i = 0;
        int j = 0;
        while (i < a.size() || j < b.size()) {
            W next;
            if (j >= b.size() || (i < a.size() && order.compare(a.element(i), b.element(j)) <= 0)) {
                next = a.element(i++);
            } else {
                next = b.element(j++);
            }
            int last = out.size() - 1;
            if (last >= 0 && order.compare(out.get(last), next) == 0) {
                out.set(last, merger.merge(base, out.get(last), next));
            } else {
                out.add(next);
            }
        }
        return new UnionWeight<>(out);
    }

    @Override
    public UnionWeight<W> times(UnionWeight<W> a, UnionWeight<W> b) {
        UnionWeight<W> sum = zero();
        for (W x : a.elements()) {
            for (W y : b.elements()) {
                sum = plus(sum, singleton(base.times(x, y)));
            }
        }
        return sum;
    }

    @Override
    public UnionWeight<W> divide(UnionWeight<W> a, UnionWeight<W> b, DivideType type) {
        if (b.isEmpty()) {
            throw FstException.domain(REASON_DIVIDE_BY_ZERO, name() + ": division by zero weight");
        }
        if (b.size() != 1) {
            throw FstException.domain(
                    REASON_DIVISOR_NOT_SINGLETON,
                    name() + ": divisor must hold exactly one element, got " + b.size()
            );
        }
        if (!(base instanceof WeaklyDivisibleSemiring)) {
            throw FstException.domain(REASON_BASE_NOT_DIVISIBLE, base.name() + " does not support division");
        }
        WeaklyDivisibleSemiring<W> divisible = (WeaklyDivisibleSemiring<W>) base;
        UnionWeight<W> out = zero();
        for (W x : a.elements()) {
            out = plus(out, singleton(divisible.divide(x, b.element(0), type)));
        }
        return out;
    }

    @Override
    public Set<SemiringProperty> properties() {
        return properties;
    }

    @Override
    public boolean isMember(UnionWeight<W> weight) {
        if (weight == null) {
            return false;
        }
        for (W w : weight.elements()) {
            if (!base.isMember(w)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public UnionWeight<W> quantize(UnionWeight<W> weight, float delta) {
        UnionWeight<W> out = zero();
        for (W w : weight.elements()) {
            out = plus(out, singleton(base.quantize(w, delta)));
        }
        return out;
    }

    @Override
    public boolean approxEqual(UnionWeight<W> a, UnionWeight<W> b, float delta) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!base.approxEqual(a.element(i), b.element(i), delta)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public UnionWeight<W> reverse(UnionWeight<W> weight) {
        UnionSemiring<W> reversed = reverseSemiring();
        UnionWeight<W> out = reversed.zero();
        for (W w : weight.elements()) {
            out = reversed.plus(out, reversed.singleton(base.reverse(w)));
        }
        return out;
    }

    @Override
    public UnionSemiring<W> reverseSemiring() {
        return new UnionSemiring<>(base.reverseSemiring(), order, merger);
    }

    @Override
    public String toString() {
        return name();
    }
}
