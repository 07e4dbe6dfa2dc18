package org.Aayush.wfst.semiring;

import org.Aayush.wfst.FstException;

/**
 * Shared algebra for float-backed semirings whose product is addition of values
 * (tropical and log).
 *
 * @param <W> concrete float weight type.
 */
abstract class FloatSemiring<W extends FloatWeight> implements WeaklyDivisibleSemiring<W> {

    /**
     * Wraps a raw value into this family's weight type.
     */
    abstract W of(float value);

    @Override
    public W zero() {
        return of(Float.POSITIVE_INFINITY);
    }

    @Override
    public W one() {
        return of(0.0f);
    }

    @Override
    public W times(W a, W b) {
        float x = a.value();
        float y = b.value();
        if (x == Float.POSITIVE_INFINITY || y == Float.POSITIVE_INFINITY) {
            return zero();
        }
        return of(x + y);
    }

    @Override
    public W divide(W a, W b, DivideType type) {
        float x = a.value();
        float y = b.value();
        if (y == Float.POSITIVE_INFINITY) {
            throw FstException.domain(REASON_DIVIDE_BY_ZERO, name() + ": division by zero weight");
        }
        if (x == Float.POSITIVE_INFINITY) {
            return zero();
        }
        return of(x - y);
    }

    @Override
    public boolean isMember(W weight) {
        return weight != null
                && !Float.isNaN(weight.value())
                && weight.value() != Float.NEGATIVE_INFINITY;
    }

    @Override
    public W quantize(W weight, float delta) {
        float v = weight.value();
        if (Float.isInfinite(v) || Float.isNaN(v)) {
            return weight;
        }
        return of((float) Math.floor(v / delta + 0.5f) * delta);
    }

    @Override
    public boolean approxEqual(W a, W b, float delta) {
        float x = a.value();
        float y = b.value();
        if (x == y) {
            return true;
        }
        return x <= y + delta && y <= x + delta;
    }

    @Override
    public W reverse(W weight) {
        return weight;
    }

    @Override
    public String toString() {
        return name();
    }
}
