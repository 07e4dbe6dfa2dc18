package org.Aayush.wfst.semiring;

import org.Aayush.wfst.FstException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Boolean semiring; every path is either accepted or not.
 */
public final class BooleanSemiring implements WeaklyDivisibleSemiring<BooleanWeight> {
    public static final BooleanSemiring INSTANCE = new BooleanSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(
            EnumSet.allOf(SemiringProperty.class)
    );

    private BooleanSemiring() {
    }

    @Override
    public String name() {
        return "boolean";
    }

    @Override
    public BooleanWeight zero() {
        return BooleanWeight.FALSE;
    }

    @Override
    public BooleanWeight one() {
        return BooleanWeight.TRUE;
    }

    @Override
    public BooleanWeight plus(BooleanWeight a, BooleanWeight b) {
        return BooleanWeight.of(a.value() || b.value());
    }

    @Override
    public BooleanWeight times(BooleanWeight a, BooleanWeight b) {
        return BooleanWeight.of(a.value() && b.value());
    }

    @Override
    public BooleanWeight divide(BooleanWeight a, BooleanWeight b, DivideType type) {
        if (!b.value()) {
            throw FstException.domain(REASON_DIVIDE_BY_ZERO, "boolean: division by zero weight");
        }
        return a;
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public BooleanWeight reverse(BooleanWeight weight) {
        return weight;
    }

    @Override
    public BooleanSemiring reverseSemiring() {
        return this;
    }

    @Override
    public boolean naturalLess(BooleanWeight a, BooleanWeight b) {
        return a.value() && !b.value();
    }

    @Override
    public String toString() {
        return name();
    }
}
