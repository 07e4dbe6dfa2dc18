package org.Aayush.wfst.algorithm;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.semiring.Semiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds arc labels and/or weights into single synthetic labels, and back.
 */
public final class Encode {
    private static final Logger LOGGER = LoggerFactory.getLogger(Encode.class);

    private Encode() {
    }

    /**
     * Encodes {@code fst} in place. With {@link EncodeTable#ENCODE_LABELS} the result is an
     * acceptor; with {@link EncodeTable#ENCODE_WEIGHTS} it is unweighted and final weights move
     * onto arcs into a new super-final state.
     *
     * @return the table needed by {@link #decode}.
     */
    public static <W> EncodeTable<W> encode(MutableFst<W> fst, int flags) {
        EncodeTable<W> table = new EncodeTable<>(fst.semiring(), flags);
        ArcMap.map(fst, new EncodeMapper<>(table));
        LOGGER.debug("encoded {} states into {} labels", fst.numStates(), table.size());
        return table;
    }

    /**
     * Restores what {@link #encode} folded, then removes the super-final state it added.
     *
     * @throws org.Aayush.wfst.FstException {@code NOT_FOUND} for a label absent from the table.
     */
    public static <W> void decode(MutableFst<W> fst, EncodeTable<W> table) {
        ArcMap.map(fst, new DecodeMapper<>(table));
        RmFinalEpsilon.rmFinalEpsilon(fst);
        LOGGER.debug("decoded into {} states", fst.numStates());
    }

    @RequiredArgsConstructor
    private static final class EncodeMapper<W> implements ArcMapper<W> {
        private final EncodeTable<W> table;

        @Override
        public Arc<W> map(Arc<W> arc) {
            int label = table.encode(arc.ilabel(), arc.olabel(), arc.weight());
            return Arc.of(
                    label,
                    table.encodesLabels() ? label : arc.olabel(),
                    table.encodesWeights() ? table.semiring().one() : arc.weight(),
                    arc.nextState()
            );
        }

        @Override
        public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
            Semiring<W> semiring = table.semiring();
            if (!table.encodesWeights() || semiring.isZero(finalArc.weight())) {
                return finalArc;
            }
            int label = table.encode(finalArc.ilabel(), finalArc.olabel(), finalArc.weight());
            return FinalArc.of(label, table.encodesLabels() ? label : finalArc.olabel(), semiring.one());
        }

        @Override
        public MapFinalAction finalAction() {
            return table.encodesWeights() ? MapFinalAction.REQUIRE_SUPERFINAL : MapFinalAction.NO_SUPERFINAL;
        }
    }

    @RequiredArgsConstructor
    private static final class DecodeMapper<W> implements ArcMapper<W> {
        private final EncodeTable<W> table;

        @Override
        public Arc<W> map(Arc<W> arc) {
            if (arc.ilabel() == Labels.EPSILON) {
                return arc;
            }
            EncodeTable.Triple<W> triple = table.decode(arc.ilabel());
            return Arc.of(
                    triple.ilabel(),
                    table.encodesLabels() ? triple.olabel() : arc.olabel(),
                    table.encodesWeights() ? triple.weight() : arc.weight(),
                    arc.nextState()
            );
        }

        @Override
        public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
            return finalArc;
        }

        @Override
        public MapFinalAction finalAction() {
            return MapFinalAction.NO_SUPERFINAL;
        }
    }
}
