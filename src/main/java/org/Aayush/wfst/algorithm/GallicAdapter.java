package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.semiring.GallicSemiring;
import org.Aayush.wfst.semiring.GallicWeight;
import org.Aayush.wfst.semiring.StringWeight;
import org.Aayush.wfst.semiring.UnionSemiring;
import org.Aayush.wfst.semiring.UnionWeight;
import org.Aayush.wfst.semiring.WeaklyDivisibleSemiring;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds a Gallic-like weight family {@code G} to the plain Gallic weights it is built from.
 *
 * <p>Transducer algorithms (determinization, label pushing) work over either plain Gallic
 * weights or unions of restricted Gallic weights; this adapter hides which one.</p>
 *
 * @param <W> underlying weight type.
 * @param <G> Gallic-like weight type.
 */
public abstract class GallicAdapter<W, G> {
    public static final String REASON_UNFACTORED_UNION = "GALLIC_UNION_NOT_FACTORED";

    private final GallicSemiring<W> gallic;

    private GallicAdapter(GallicSemiring<W> gallic) {
        this.gallic = gallic;
    }

    /**
     * Adapter over plain Gallic weights.
     */
    public static <W> GallicAdapter<W, GallicWeight<W>> of(GallicSemiring<W> gallic) {
        return new Plain<>(gallic);
    }

    /**
     * Adapter over unions of {@code restrict} Gallic weights.
     */
    public static <W> GallicAdapter<W, UnionWeight<GallicWeight<W>>> union(GallicSemiring<W> restrict) {
        return new Union<>(restrict);
    }

    public GallicSemiring<W> gallic() {
        return gallic;
    }

    public abstract WeaklyDivisibleSemiring<G> semiring();

    /** Lifts a plain Gallic weight. */
    public abstract G fromGallic(GallicWeight<W> weight);

    /**
     * Lowers to a plain Gallic weight.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} when the weight is a union of more than
     * one element.
     */
    public abstract GallicWeight<W> toGallic(G weight);

    /** Divisor that determinization extracts from a group of residuals. */
    public abstract G commonDivisor(G a, G b);

    public abstract WeightFactorizer<G> factorizer();

    /**
     * Splits a Gallic weight whose string is longer than one label into its first label and the
     * rest.
     */
    List<WeightFactor<GallicWeight<W>>> factorGallic(GallicWeight<W> weight) {
        StringWeight s = weight.string();
        if (s.isInfinity() || s.size() <= 1) {
            return List.of();
        }
        int[] labels = s.labels();
        int[] rest = new int[labels.length - 1];
        System.arraycopy(labels, 1, rest, 0, rest.length);
        return List.of(WeightFactor.of(
                GallicWeight.of(StringWeight.of(labels[0]), weight.weight()),
                GallicWeight.of(StringWeight.of(rest), gallic.weightSemiring().one())
        ));
    }

    private static final class Plain<W> extends GallicAdapter<W, GallicWeight<W>> {

        Plain(GallicSemiring<W> gallic) {
            super(gallic);
        }

        @Override
        public WeaklyDivisibleSemiring<GallicWeight<W>> semiring() {
            return gallic();
        }

        @Override
        public GallicWeight<W> fromGallic(GallicWeight<W> weight) {
            return weight;
        }

        @Override
        public GallicWeight<W> toGallic(GallicWeight<W> weight) {
            return weight;
        }

        @Override
        public GallicWeight<W> commonDivisor(GallicWeight<W> a, GallicWeight<W> b) {
            return gallic().commonDivisor(a, b);
        }

        @Override
        public WeightFactorizer<GallicWeight<W>> factorizer() {
            return this::factorGallic;
        }
    }

    private static final class Union<W> extends GallicAdapter<W, UnionWeight<GallicWeight<W>>> {
        private final UnionSemiring<GallicWeight<W>> union;

        Union(GallicSemiring<W> restrict) {
            super(restrict);
            this.union = restrict.unionSemiring();
        }

        @Override
        public WeaklyDivisibleSemiring<UnionWeight<GallicWeight<W>>> semiring() {
            return union;
        }

        @Override
        public UnionWeight<GallicWeight<W>> fromGallic(GallicWeight<W> weight) {
            return gallic().isZero(weight) ? union.zero() : union.singleton(weight);
        }

        @Override
        public GallicWeight<W> toGallic(UnionWeight<GallicWeight<W>> weight) {
            if (weight.isEmpty()) {
                return gallic().zero();
            }
            if (weight.size() > 1) {
                throw FstException.precondition(
                        REASON_UNFACTORED_UNION,
                        "union weight must hold at most one element, got " + weight
                );
            }
            return weight.element(0);
        }

        @Override
        public UnionWeight<GallicWeight<W>> commonDivisor(
                UnionWeight<GallicWeight<W>> a,
                UnionWeight<GallicWeight<W>> b
        ) {
            GallicWeight<W> divisor = gallic().zero();
            for (GallicWeight<W> w : a.elements()) {
                divisor = gallic().commonDivisor(divisor, w);
            }
            for (GallicWeight<W> w : b.elements()) {
                divisor = gallic().commonDivisor(divisor, w);
            }
            return fromGallic(divisor);
        }

        @Override
        public WeightFactorizer<UnionWeight<GallicWeight<W>>> factorizer() {
            return weight -> {
                if (weight.size() == 1) {
                    List<WeightFactor<UnionWeight<GallicWeight<W>>>> out = new ArrayList<>(1);
                    for (WeightFactor<GallicWeight<W>> f : factorGallic(weight.element(0))) {
                        out.add(WeightFactor.of(fromGallic(f.first()), fromGallic(f.second())));
                    }
                    return out;
                }
                List<WeightFactor<UnionWeight<GallicWeight<W>>>> out = new ArrayList<>(weight.size());
                for (GallicWeight<W> element : weight.elements()) {
                    List<WeightFactor<GallicWeight<W>>> split = factorGallic(element);
                    if (split.isEmpty()) {
                        out.add(WeightFactor.of(fromGallic(element), union.one()));
                    } else {
                        WeightFactor<GallicWeight<W>> f = split.get(0);
                        out.add(WeightFactor.of(fromGallic(f.first()), fromGallic(f.second())));
                    }
                }
                return out;
            };
        }
    }
}
