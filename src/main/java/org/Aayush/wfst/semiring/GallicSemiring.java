package org.Aayush.wfst.semiring;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.wfst.FstException;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Gallic semiring: string semiring times a base semiring.
 *
 * @param <W> underlying weight type.
 */
@Getter
@Accessors(fluent = true)
public final class GallicSemiring<W> implements WeaklyDivisibleSemiring<GallicWeight<W>> {
    public static final String REASON_BASE_NOT_DIVISIBLE = "GALLIC_BASE_NOT_DIVISIBLE";

    private final GallicType type;
    private final Semiring<W> weightSemiring;
    private final StringSemiring stringSemiring;
    @Getter(lombok.AccessLevel.NONE)
    private final Set<SemiringProperty> properties;

    public GallicSemiring(GallicType type, Semiring<W> weightSemiring) {
        this.type = Objects.requireNonNull(type, "type");
        this.weightSemiring = Objects.requireNonNull(weightSemiring, "weightSemiring");
        this.stringSemiring = StringSemiring.of(type.stringType());
        EnumSet<SemiringProperty> props = EnumSet.of(
                SemiringProperty.LEFT_SEMIRING,
                SemiringProperty.RIGHT_SEMIRING,
                SemiringProperty.IDEMPOTENT
        );
        props.retainAll(stringSemiring.properties());
        props.retainAll(weightSemiring.properties());
        if (type == GallicType.MIN) {
            props.add(SemiringProperty.IDEMPOTENT);
            if (weightSemiring.hasProperty(SemiringProperty.PATH)) {
                props.add(SemiringProperty.PATH);
            }
        }
        this.properties = Collections.unmodifiableSet(props);
    }

    @Override
    public String name() {
        switch (type) {
            case LEFT:
                return "left_gallic_" + weightSemiring.name();
            case RIGHT:
                return "right_gallic_" + weightSemiring.name();
            case MIN:
                return "min_gallic_" + weightSemiring.name();
            default:
                return "restricted_gallic_" + weightSemiring.name();
        }
    }

    @Override
    public GallicWeight<W> zero() {
        return GallicWeight.of(StringWeight.INFINITY, weightSemiring.zero());
    }

    @Override
    public GallicWeight<W> one() {
        return GallicWeight.of(StringWeight.EPSILON, weightSemiring.one());
    }

    @Override
    public boolean isZero(GallicWeight<W> weight) {
        return weight.string().isInfinity() || weightSemiring.isZero(weight.weight());
    }

    @Override
    public GallicWeight<W> plus(GallicWeight<W> a, GallicWeight<W> b) {
        if (type == GallicType.MIN) {
            if (isZero(a)) {
                return b;
            }
            if (isZero(b)) {
                return a;
            }
            return weightSemiring.naturalLess(a.weight(), b.weight()) ? a : b;
        }
        return GallicWeight.of(
                stringSemiring.plus(a.string(), b.string()),
                weightSemiring.plus(a.weight(), b.weight())
        );
    }

    @Override
    public GallicWeight<W> times(GallicWeight<W> a, GallicWeight<W> b) {
        return GallicWeight.of(
                stringSemiring.times(a.string(), b.string()),
                weightSemiring.times(a.weight(), b.weight())
        );
    }

    @Override
    public GallicWeight<W> divide(GallicWeight<W> a, GallicWeight<W> b, DivideType divideType) {
        if (!(weightSemiring instanceof WeaklyDivisibleSemiring)) {
            throw FstException.domain(
                    REASON_BASE_NOT_DIVISIBLE,
                    weightSemiring.name() + " does not support division"
            );
        }
        WeaklyDivisibleSemiring<W> divisible = (WeaklyDivisibleSemiring<W>) weightSemiring;
        return GallicWeight.of(
                stringSemiring.divide(a.string(), b.string(), divideType),
                divisible.divide(a.weight(), b.weight(), divideType)
        );
    }

    @Override
    public Set<SemiringProperty> properties() {
        return properties;
    }

    @Override
    public boolean isMember(GallicWeight<W> weight) {
        return weight != null && weight.string() != null && weightSemiring.isMember(weight.weight());
    }

    @Override
    public GallicWeight<W> quantize(GallicWeight<W> weight, float delta) {
        return GallicWeight.of(weight.string(), weightSemiring.quantize(weight.weight(), delta));
    }

    @Override
    public boolean approxEqual(GallicWeight<W> a, GallicWeight<W> b, float delta) {
        return a.string().equals(b.string()) && weightSemiring.approxEqual(a.weight(), b.weight(), delta);
    }

    @Override
    public GallicWeight<W> reverse(GallicWeight<W> weight) {
        return GallicWeight.of(stringSemiring.reverse(weight.string()), weightSemiring.reverse(weight.weight()));
    }

    @Override
    public GallicSemiring<W> reverseSemiring() {
        GallicType reversed = type == GallicType.LEFT
                ? GallicType.RIGHT
                : (type == GallicType.RIGHT ? GallicType.LEFT : type);
        return new GallicSemiring<>(reversed, weightSemiring.reverseSemiring());
    }

    /**
     * Common divisor used by transducer determinization: single shared first label and the sum
     * of the weights.
     */
    public GallicWeight<W> commonDivisor(GallicWeight<W> a, GallicWeight<W> b) {
        return GallicWeight.of(
                StringSemiring.labelCommonDivisor(a.string(), b.string()),
                weightSemiring.plus(a.weight(), b.weight())
        );
    }

    /**
     * Union semiring over restricted Gallic weights, used for non-functional determinization.
     * Elements are ordered by their strings and elements with equal strings are merged by
     * adding their weights.
     */
    public UnionSemiring<GallicWeight<W>> unionSemiring() {
        return new UnionSemiring<>(this, stringOrder(), GallicSemiring::mergeEqualStrings);
    }

    private static <W> GallicWeight<W> mergeEqualStrings(
            Semiring<GallicWeight<W>> semiring,
            GallicWeight<W> a,
            GallicWeight<W> b
    ) {
        Semiring<W> weights = ((GallicSemiring<W>) semiring).weightSemiring();
        return GallicWeight.of(a.string(), weights.plus(a.weight(), b.weight()));
    }

    private static <W> Comparator<GallicWeight<W>> stringOrder() {
        return (x, y) -> compareStrings(x.string(), y.string());
    }

    /**
     * Orders strings by length first, then lexicographically by label.
     */
    static int compareStrings(StringWeight x, StringWeight y) {
        if (x.isInfinity() || y.isInfinity()) {
            return Boolean.compare(x.isInfinity(), y.isInfinity());
        }
        if (x.size() != y.size()) {
            return Integer.compare(x.size(), y.size());
        }
        for (int i = 0; i < x.size(); i++) {
            int c = Integer.compare(x.label(i), y.label(i));
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    @Override
    public String toString() {
        return name();
    }
}
