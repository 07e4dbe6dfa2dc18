package org.Aayush.wfst.semiring;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.wfst.FstException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Cartesian product of two semirings.
 *
 * @param <W1> first component type.
 * @param <W2> second component type.
 */
@Getter
@Accessors(fluent = true)
public final class ProductSemiring<W1, W2> implements WeaklyDivisibleSemiring<ProductWeight<W1, W2>> {
    public static final String REASON_COMPONENT_NOT_DIVISIBLE = "PRODUCT_COMPONENT_NOT_DIVISIBLE";

    private final Semiring<W1> first;
    private final Semiring<W2> second;
    @Getter(lombok.AccessLevel.NONE)
    private final Set<SemiringProperty> properties;

    public ProductSemiring(Semiring<W1> first, Semiring<W2> second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
        EnumSet<SemiringProperty> props = EnumSet.of(
                SemiringProperty.LEFT_SEMIRING,
                SemiringProperty.RIGHT_SEMIRING,
                SemiringProperty.COMMUTATIVE,
                SemiringProperty.IDEMPOTENT
        );
        props.retainAll(first.properties());
        props.retainAll(second.properties());
        this.properties = Collections.unmodifiableSet(props);
    }

    @Override
    public String name() {
        return first.name() + "_X_" + second.name();
    }

    @Override
    public ProductWeight<W1, W2> zero() {
        return ProductWeight.of(first.zero(), second.zero());
    }

    @Override
    public ProductWeight<W1, W2> one() {
        return ProductWeight.of(first.one(), second.one());
    }

    @Override
    public ProductWeight<W1, W2> plus(ProductWeight<W1, W2> a, ProductWeight<W1, W2> b) {
        return ProductWeight.of(first.plus(a.value1(), b.value1()), second.plus(a.value2(), b.value2()));
    }

    @Override
    public ProductWeight<W1, W2> times(ProductWeight<W1, W2> a, ProductWeight<W1, W2> b) {
        return ProductWeight.of(first.times(a.value1(), b.value1()), second.times(a.value2(), b.value2()));
    }

    @Override
    public ProductWeight<W1, W2> divide(ProductWeight<W1, W2> a, ProductWeight<W1, W2> b, DivideType type) {
        return ProductWeight.of(
                divisible(first).divide(a.value1(), b.value1(), type),
                divisible(second).divide(a.value2(), b.value2(), type)
        );
    }

    @Override
    public Set<SemiringProperty> properties() {
        return properties;
    }

    @Override
    public boolean isMember(ProductWeight<W1, W2> weight) {
        return weight != null && first.isMember(weight.value1()) && second.isMember(weight.value2());
    }

    @Override
    public ProductWeight<W1, W2> quantize(ProductWeight<W1, W2> weight, float delta) {
        return ProductWeight.of(first.quantize(weight.value1(), delta), second.quantize(weight.value2(), delta));
    }

    @Override
    public boolean approxEqual(ProductWeight<W1, W2> a, ProductWeight<W1, W2> b, float delta) {
        return first.approxEqual(a.value1(), b.value1(), delta)
                && second.approxEqual(a.value2(), b.value2(), delta);
    }

    @Override
    public ProductWeight<W1, W2> reverse(ProductWeight<W1, W2> weight) {
        return ProductWeight.of(first.reverse(weight.value1()), second.reverse(weight.value2()));
    }

    @Override
    public ProductSemiring<W1, W2> reverseSemiring() {
        return new ProductSemiring<>(first.reverseSemiring(), second.reverseSemiring());
    }

    @Override
    public String toString() {
        return name();
    }

    private static <W> WeaklyDivisibleSemiring<W> divisible(Semiring<W> semiring) {
        if (!(semiring instanceof WeaklyDivisibleSemiring)) {
            throw FstException.domain(
                    REASON_COMPONENT_NOT_DIVISIBLE,
                    "component semiring " + semiring.name() + " does not support division"
            );
        }
        return (WeaklyDivisibleSemiring<W>) semiring;
    }
}
