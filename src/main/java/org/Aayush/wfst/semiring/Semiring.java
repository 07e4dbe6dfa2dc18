package org.Aayush.wfst.semiring;

import org.Aayush.wfst.FstException;

import java.util.Comparator;
import java.util.Set;

/**
 * Algebra over immutable weight values of type {@code W}.
 *
 * <p>Weights are plain values with consistent {@code equals}/{@code hashCode}. The operations,
 * identities and metadata of a weight family live here, so an automaton only needs to carry one
 * semiring instance to build any weight it needs (including for an empty automaton).</p>
 *
 * <p>A reversed weight keeps its Java value type. Families whose reverse algebra differs
 * (left/right string semirings, left/right Gallic semirings) return a different
 * {@link #reverseSemiring()} instance operating on the same value type.</p>
 *
 * @param <W> weight value type.
 */
public interface Semiring<W> {

    /** Default quantization and convergence delta. */
    float DEFAULT_DELTA = 1.0f / 1024.0f;

    String REASON_NOT_IDEMPOTENT = "SEMIRING_NOT_IDEMPOTENT";

    /**
     * Short family name, used in diagnostics and as the serialized arc type.
     */
    String name();

    /** Additive identity, annihilator for {@link #times}. */
    W zero();

    /** Multiplicative identity. */
    W one();

    W plus(W a, W b);

    W times(W a, W b);

    /**
     * Properties declared by this algebra.
     */
    Set<SemiringProperty> properties();

    /**
     * Maps a weight to its counterpart in {@link #reverseSemiring()}.
     */
    W reverse(W weight);

    /**
     * Algebra of reversed weights.
     */
    Semiring<W> reverseSemiring();

    default boolean isZero(W weight) {
        return zero().equals(weight);
    }

    default boolean isOne(W weight) {
        return one().equals(weight);
    }

    /**
     * Returns whether a value is a legal member of this semiring (e.g. not NaN).
     */
    default boolean isMember(W weight) {
        return weight != null;
    }

    /**
     * Maps a weight to its canonical representative within {@code delta}.
     */
    default W quantize(W weight, float delta) {
        return weight;
    }

    /**
     * Equality up to {@code delta}.
     */
    default boolean approxEqual(W a, W b, float delta) {
        return quantize(a, delta).equals(quantize(b, delta));
    }

    default boolean hasProperty(SemiringProperty property) {
        return properties().contains(property);
    }

    /**
     * Natural order: {@code a < b} iff {@code a + b = a} and {@code a != b}.
     *
     * @throws FstException when the semiring is not idempotent.
     */
    default boolean naturalLess(W a, W b) {
        requireIdempotent();
        return !a.equals(b) && plus(a, b).equals(a);
    }

    /**
     * Comparator view of {@link #naturalLess(Object, Object)}. Total only for path semirings.
     */
    default Comparator<W> naturalOrder() {
        requireIdempotent();
        return (a, b) -> {
            if (naturalLess(a, b)) {
                return -1;
            }
            return naturalLess(b, a) ? 1 : 0;
        };
    }

    private void requireIdempotent() {
        if (!hasProperty(SemiringProperty.IDEMPOTENT)) {
            throw FstException.precondition(
                    REASON_NOT_IDEMPOTENT,
                    "natural order requires an idempotent semiring, got " + name()
            );
        }
    }
}
