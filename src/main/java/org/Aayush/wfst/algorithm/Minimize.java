package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.mapper.QuantizeMapper;
import org.Aayush.wfst.algorithm.mapper.WeightFunctionConverter;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.BooleanSemiring;
import org.Aayush.wfst.semiring.BooleanWeight;
import org.Aayush.wfst.semiring.Semiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Minimizes an input-deterministic automaton.
 *
 * <p>Weights are pushed toward the start state and quantized so equivalent suffixes carry
 * identical weights; labels and weights are then encoded into an unweighted acceptor, which is
 * minimized by double reversal and determinization before being decoded.</p>
 */
public final class Minimize {
    private static final Logger LOGGER = LoggerFactory.getLogger(Minimize.class);

    public static final String REASON_NOT_DETERMINISTIC = "MINIMIZE_INPUT_NOT_DETERMINISTIC";

    private Minimize() {
    }

    public static <W> void minimize(MutableFst<W> fst) {
        minimize(fst, MinimizeConfig.defaults());
    }

    /**
     * @throws FstException {@code PRECONDITION_VIOLATED} when {@code fst} is not
     * input-deterministic, or when it is weighted over a semiring that cannot push weights.
     */
    public static <W> void minimize(MutableFst<W> fst, MinimizeConfig config) {
        Objects.requireNonNull(config, "config");
        if (fst.start() == Fst.NO_STATE) {
            return;
        }
        if (!fst.hasProperties(FstProperties.I_DETERMINISTIC)) {
            throw FstException.precondition(
                    REASON_NOT_DETERMINISTIC,
                    "minimization requires an input-deterministic automaton"
            );
        }
        int before = fst.numStates();
        Semiring<W> semiring = fst.semiring();
        boolean weighted = !fst.hasProperties(FstProperties.UNWEIGHTED);
        if (weighted) {
            ShortestDistanceConfig distances = ShortestDistanceConfig.builder()
                    .delta(config.getDelta())
                    .maxIterations(AlgorithmDefaults.maxIterations())
                    .build();
            Push.pushWeights(fst, ReweightType.TO_INITIAL, false, distances);
            ArcMap.map(fst, new QuantizeMapper<>(semiring, config.getDelta()));
        }
        EncodeTable<W> table = null;
        if (weighted || !fst.hasProperties(FstProperties.ACCEPTOR)) {
            int flags = EncodeTable.ENCODE_LABELS | (weighted ? EncodeTable.ENCODE_WEIGHTS : 0);
            table = Encode.encode(fst, flags);
        }
        VectorFst<BooleanWeight> acceptor = WeightConvert.convert(
                fst,
                BooleanSemiring.INSTANCE,
                new WeightFunctionConverter<>(w -> BooleanWeight.of(!semiring.isZero(w)))
        );
        for (int round = 0; round < 2; round++) {
            VectorFst<BooleanWeight> reversed = Reverse.reverse(acceptor);
            RmEpsilon.rmEpsilon(reversed);
            acceptor = Determinize.determinize(reversed);
        }
        fst.replaceWith(WeightConvert.convert(
                acceptor,
                semiring,
                new WeightFunctionConverter<>(b -> b.value() ? semiring.one() : semiring.zero())
        ));
        if (table != null) {
            Encode.decode(fst, table);
        }
        Connect.connect(fst);
        LOGGER.debug("minimize reduced {} states to {}", before, fst.numStates());
    }
}
