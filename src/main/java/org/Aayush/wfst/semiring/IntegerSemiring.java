package org.Aayush.wfst.semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Integer semiring {@code (+, *, 0, 1)}; counts paths when every weight is one.
 */
public final class IntegerSemiring implements Semiring<IntegerWeight> {
    public static final IntegerSemiring INSTANCE = new IntegerSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
            SemiringProperty.LEFT_SEMIRING,
            SemiringProperty.RIGHT_SEMIRING,
            SemiringProperty.COMMUTATIVE
    ));

    private IntegerSemiring() {
    }

    @Override
    public String name() {
        return "integer";
    }

    @Override
    public IntegerWeight zero() {
        return IntegerWeight.ZERO;
    }

    @Override
    public IntegerWeight one() {
        return IntegerWeight.ONE;
    }

    @Override
    public IntegerWeight plus(IntegerWeight a, IntegerWeight b) {
        return IntegerWeight.of(a.value() + b.value());
    }

    @Override
    public IntegerWeight times(IntegerWeight a, IntegerWeight b) {
        return IntegerWeight.of(a.value() * b.value());
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public IntegerWeight reverse(IntegerWeight weight) {
        return weight;
    }

    @Override
    public IntegerSemiring reverseSemiring() {
        return this;
    }

    @Override
    public String toString() {
        return name();
    }
}
