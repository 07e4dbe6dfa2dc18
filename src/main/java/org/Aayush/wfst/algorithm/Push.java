package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.algorithm.mapper.FromGallicConverter;
import org.Aayush.wfst.algorithm.mapper.RmWeightMapper;
import org.Aayush.wfst.algorithm.mapper.ToGallicConverter;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.GallicSemiring;
import org.Aayush.wfst.semiring.GallicType;
import org.Aayush.wfst.semiring.GallicWeight;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.StringWeight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Moves weights and output labels toward the start state or toward the final states without
 * changing the weighted relation.
 */
public final class Push {
    private static final Logger LOGGER = LoggerFactory.getLogger(Push.class);

    public static final int PUSH_WEIGHTS = 0x1;
    public static final int PUSH_LABELS = 0x2;
    public static final int REMOVE_TOTAL_WEIGHT = 0x4;
    public static final int REMOVE_COMMON_AFFIX = 0x8;

    private Push() {
    }

    public static <W> void pushWeights(MutableFst<W> fst, ReweightType type) {
        pushWeights(fst, type, false, ShortestDistanceConfig.defaults());
    }

    public static <W> void pushWeights(MutableFst<W> fst, ReweightType type, boolean removeTotalWeight) {
        pushWeights(fst, type, removeTotalWeight, ShortestDistanceConfig.defaults());
    }

    /**
     * Pushes weights in place using shortest distances as potentials: distances to the final
     * states for {@link ReweightType#TO_INITIAL}, distances from the start for
     * {@link ReweightType#TO_FINAL}.
     *
     * @param removeTotalWeight also divide the total path weight out of the result.
     */
    public static <W> void pushWeights(
            MutableFst<W> fst,
            ReweightType type,
            boolean removeTotalWeight,
            ShortestDistanceConfig config
    ) {
        Objects.requireNonNull(type, "type");
        Reweight.divisible(fst.semiring());
        if (fst.start() == Fst.NO_STATE) {
            return;
        }
        boolean toInitial = type == ReweightType.TO_INITIAL;
        List<W> distances = toInitial
                ? ShortestDistance.reverseShortestDistance(fst, config)
                : ShortestDistance.shortestDistance(fst, config);
        W total = totalWeight(fst, distances, toInitial);
        Reweight.reweight(fst, distances, type);
        if (removeTotalWeight) {
            Reweight.removeWeight(fst, total, !toInitial);
        }
        LOGGER.debug("pushed weights {} over {} states", type, fst.numStates());
    }

    public static <W> VectorFst<W> push(Fst<W> fst, ReweightType type, int flags) {
        return push(fst, type, flags, ShortestDistanceConfig.defaults());
    }

    /**
     * Returns a pushed copy of {@code fst}.
     *
     * @param flags bitwise or of {@link #PUSH_WEIGHTS}, {@link #PUSH_LABELS},
     * {@link #REMOVE_TOTAL_WEIGHT} and {@link #REMOVE_COMMON_AFFIX}.
     */
    public static <W> VectorFst<W> push(Fst<W> fst, ReweightType type, int flags, ShortestDistanceConfig config) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(config, "config");
        if ((flags & PUSH_LABELS) == 0) {
            VectorFst<W> out = VectorFst.copyOf(fst);
            if ((flags & PUSH_WEIGHTS) != 0) {
                pushWeights(out, type, (flags & REMOVE_TOTAL_WEIGHT) != 0, config);
            }
            return out;
        }
        return pushLabels(fst, type, flags, config);
    }

    private static <W> VectorFst<W> pushLabels(
            Fst<W> fst,
            ReweightType type,
            int flags,
            ShortestDistanceConfig config
    ) {
        boolean toInitial = type == ReweightType.TO_INITIAL;
        GallicSemiring<W> gallic = new GallicSemiring<>(
                toInitial ? GallicType.LEFT : GallicType.RIGHT,
                fst.semiring()
        );
        GallicAdapter<W, GallicWeight<W>> adapter = GallicAdapter.of(gallic);
        VectorFst<GallicWeight<W>> gfst = WeightConvert.convert(fst, gallic, new ToGallicConverter<>(adapter));
        Fst<GallicWeight<W>> distanceSource = gfst;
        if ((flags & PUSH_WEIGHTS) == 0) {
            VectorFst<W> unweighted = WeightConvert.convert(fst, new RmWeightMapper<>(fst.semiring()));
            distanceSource = WeightConvert.convert(unweighted, gallic, new ToGallicConverter<>(adapter));
        }
        List<GallicWeight<W>> distances = toInitial
                ? ShortestDistance.reverseShortestDistance(distanceSource, config)
                : ShortestDistance.shortestDistance(distanceSource, config);
        boolean removeAffix = (flags & REMOVE_COMMON_AFFIX) != 0;
        boolean removeWeight = (flags & REMOVE_TOTAL_WEIGHT) != 0;
        GallicWeight<W> total = gallic.one();
        if (removeAffix || removeWeight) {
            GallicWeight<W> sum = totalWeight(gfst, distances, toInitial);
            Semiring<W> weights = gallic.weightSemiring();
            total = GallicWeight.of(
                    removeAffix ? sum.string() : StringWeight.EPSILON,
                    removeWeight ? sum.weight() : weights.one()
            );
        }
        Reweight.reweight(gfst, distances, type);
        if (removeAffix || removeWeight) {
            Reweight.removeWeight(gfst, total, !toInitial);
        }
        VectorFst<GallicWeight<W>> factored = FactorWeight.factorWeight(
                gfst,
                adapter.factorizer(),
                FactorWeight.FACTOR_ARC_WEIGHTS | FactorWeight.FACTOR_FINAL_WEIGHTS,
                config.getDelta()
        );
        VectorFst<W> out = WeightConvert.convert(factored, fst.semiring(), new FromGallicConverter<>(adapter));
        LOGGER.debug("pushed labels {} into {} states", type, out.numStates());
        return out;
    }

    private static <W> W totalWeight(Fst<W> fst, List<W> distances, boolean fromInitial) {
        Semiring<W> semiring = fst.semiring();
        if (fst.start() == Fst.NO_STATE) {
            return semiring.zero();
        }
        if (fromInitial) {
            return distances.get(fst.start());
        }
        W sum = semiring.zero();
        for (int s = 0; s < fst.numStates() && s < distances.size(); s++) {
            sum = semiring.plus(sum, semiring.times(distances.get(s), fst.finalWeight(s)));
        }
        return sum;
    }
}
