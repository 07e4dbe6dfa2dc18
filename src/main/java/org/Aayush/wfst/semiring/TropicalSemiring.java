package org.Aayush.wfst.semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tropical semiring {@code (min, +, +inf, 0)} over floats.
 */
public final class TropicalSemiring extends FloatSemiring<TropicalWeight> {
    public static final TropicalSemiring INSTANCE = new TropicalSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
            SemiringProperty.LEFT_SEMIRING,
            SemiringProperty.RIGHT_SEMIRING,
            SemiringProperty.COMMUTATIVE,
            SemiringProperty.IDEMPOTENT,
            SemiringProperty.PATH
    ));

    private TropicalSemiring() {
    }

    @Override
    TropicalWeight of(float value) {
        return TropicalWeight.of(value);
    }

    /**
     * Convenience factory mirroring {@link TropicalWeight#of(float)}.
     */
    public TropicalWeight weight(float value) {
        return TropicalWeight.of(value);
    }

    @Override
    public String name() {
        return "tropical";
    }

    @Override
    public TropicalWeight plus(TropicalWeight a, TropicalWeight b) {
        return a.value() <= b.value() ? a : b;
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public TropicalSemiring reverseSemiring() {
        return this;
    }

    @Override
    public boolean naturalLess(TropicalWeight a, TropicalWeight b) {
        return a.value() < b.value();
    }
}
