package org.Aayush.wfst.semiring;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.wfst.FstException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * Cartesian power {@code W^n} of a semiring.
 *
 * @param <W> component type.
 */
@Getter
@Accessors(fluent = true)
public final class PowerSemiring<W> implements WeaklyDivisibleSemiring<PowerWeight<W>> {
    public static final String REASON_SIZE_MISMATCH = "POWER_SIZE_MISMATCH";
    public static final String REASON_BASE_NOT_DIVISIBLE = "POWER_BASE_NOT_DIVISIBLE";

    private final Semiring<W> base;
    private final int size;
    @Getter(lombok.AccessLevel.NONE)
    private final Set<SemiringProperty> properties;

    public PowerSemiring(Semiring<W> base, int size) {
        this.base = Objects.requireNonNull(base, "base");
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        this.size = size;
        EnumSet<SemiringProperty> props = EnumSet.of(
                SemiringProperty.LEFT_SEMIRING,
                SemiringProperty.RIGHT_SEMIRING,
                SemiringProperty.COMMUTATIVE,
                SemiringProperty.IDEMPOTENT
        );
        props.retainAll(base.properties());
        this.properties = Collections.unmodifiableSet(props);
    }

    @Override
    public String name() {
        return base.name() + "_^" + size;
    }

    @Override
    public PowerWeight<W> zero() {
        return PowerWeight.filled(base.zero(), size);
    }

    @Override
    public PowerWeight<W> one() {
        return PowerWeight.filled(base.one(), size);
    }

    @Override
    public PowerWeight<W> plus(PowerWeight<W> a, PowerWeight<W> b) {
        return componentwise(a, b, base::plus);
    }

    @Override
    public PowerWeight<W> times(PowerWeight<W> a, PowerWeight<W> b) {
        return componentwise(a, b, base::times);
    }

    @Override
    public PowerWeight<W> divide(PowerWeight<W> a, PowerWeight<W> b, DivideType type) {
        if (!(base instanceof WeaklyDivisibleSemiring)) {
            throw FstException.domain(REASON_BASE_NOT_DIVISIBLE, base.name() + " does not support division");
        }
        WeaklyDivisibleSemiring<W> divisible = (WeaklyDivisibleSemiring<W>) base;
        return componentwise(a, b, (x, y) -> divisible.divide(x, y, type));
    }

    @Override
    public Set<SemiringProperty> properties() {
        return properties;
    }

    @Override
    public boolean isMember(PowerWeight<W> weight) {
        if (weight == null || weight.size() != size) {
            return false;
        }
        for (W w : weight.values()) {
            if (!base.isMember(w)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public PowerWeight<W> quantize(PowerWeight<W> weight, float delta) {
        List<W> out = new ArrayList<>(weight.size());
        for (W w : weight.values()) {
            out.add(base.quantize(w, delta));
        }
        return PowerWeight.of(out);
    }

    @Override
    public boolean approxEqual(PowerWeight<W> a, PowerWeight<W> b, float delta) {
        checkSize(a);
        checkSize(b);
        for (int i = 0; i < size; i++) {
            if (!base.approxEqual(a.value(i), b.value(i), delta)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public PowerWeight<W> reverse(PowerWeight<W> weight) {
        List<W> out = new ArrayList<>(weight.size());
        for (W w : weight.values()) {
            out.add(base.reverse(w));
        }
        return PowerWeight.of(out);
    }

    @Override
    public PowerSemiring<W> reverseSemiring() {
        return new PowerSemiring<>(base.reverseSemiring(), size);
    }

    @Override
    public String toString() {
        return name();
    }

    private PowerWeight<W> componentwise(PowerWeight<W> a, PowerWeight<W> b, BinaryOperator<W> op) {
        checkSize(a);
        checkSize(b);
        List<W> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(op.apply(a.value(i), b.value(i)));
        }
        return PowerWeight.of(out);
    }

    private void checkSize(PowerWeight<W> weight) {
        if (weight.size() != size) {
            throw FstException.domain(
                    REASON_SIZE_MISMATCH,
                    "power weight of size " + weight.size() + " used with " + name()
            );
        }
    }
}
