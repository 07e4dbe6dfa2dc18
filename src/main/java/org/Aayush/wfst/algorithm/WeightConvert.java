package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.mapper.FromGallicConverter;
import org.Aayush.wfst.algorithm.mapper.ToGallicConverter;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.GallicSemiring;
import org.Aayush.wfst.semiring.GallicType;
import org.Aayush.wfst.semiring.GallicWeight;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Copies an automaton into another semiring through a {@link WeightConverter}.
 */
public final class WeightConvert {

    private WeightConvert() {
    }

    /**
     * Builds a new automaton over {@code target}. State ids are preserved; a super-final state,
     * when the converter's final action asks for one, gets the next free id.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} under
     * {@link MapFinalAction#NO_SUPERFINAL} when a converted final arc carries labels.
     */
    public static <W1, W2> VectorFst<W2> convert(
            Fst<W1> fst,
            Semiring<W2> target,
            WeightConverter<W1, W2> converter
    ) {
        VectorFst<W2> out = new VectorFst<>(target);
        int n = fst.numStates();
        if (fst.start() == Fst.NO_STATE) {
            return out;
        }
        out.reserveStates(n + 1);
        out.addStates(n);
        out.setStart(fst.start());
        MapFinalAction action = converter.finalAction();
        int superfinal = Fst.NO_STATE;
        if (action == MapFinalAction.REQUIRE_SUPERFINAL) {
            superfinal = out.addState();
            out.setFinal(superfinal, target.one());
        }
        for (int s = 0; s < n; s++) {
            out.reserveArcs(s, fst.numArcs(s));
            for (Arc<W1> arc : fst.arcs(s)) {
                out.addArc(s, converter.map(arc));
            }
            if (!fst.isFinal(s)) {
                continue;
            }
            FinalArc<W2> mapped = converter.mapFinal(FinalArc.of(fst.finalWeight(s)));
            switch (action) {
                case NO_SUPERFINAL:
                    if (!mapped.hasEpsilonLabels()) {
                        throw FstException.precondition(
                                ArcMap.REASON_NON_EPSILON_FINAL,
                                "converter produced labels on the final arc of state " + s
                        );
                    }
                    out.setFinal(s, mapped.weight());
                    break;
                case ALLOW_SUPERFINAL:
                    if (mapped.hasEpsilonLabels()) {
                        out.setFinal(s, mapped.weight());
                    } else {
                        if (superfinal == Fst.NO_STATE) {
                            superfinal = out.addState();
                            out.setFinal(superfinal, target.one());
                        }
                        out.addArc(s, Arc.of(mapped.ilabel(), mapped.olabel(), mapped.weight(), superfinal));
                    }
                    break;
                default:
                    if (!mapped.hasEpsilonLabels() || !target.isZero(mapped.weight())) {
                        out.addArc(s, Arc.of(mapped.ilabel(), mapped.olabel(), mapped.weight(), superfinal));
                    }
                    break;
            }
        }
        return out;
    }

    /**
     * Adapts a same-type {@link ArcMapper} into a copying conversion.
     */
    public static <W> VectorFst<W> convert(Fst<W> fst, ArcMapper<W> mapper) {
        return convert(fst, fst.semiring(), new WeightConverter<W, W>() {
            @Override
            public Arc<W> map(Arc<W> arc) {
                return mapper.map(arc);
            }

            @Override
            public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
                return mapper.mapFinal(finalArc);
            }

            @Override
            public MapFinalAction finalAction() {
                return mapper.finalAction();
            }
        });
    }

    /**
     * Moves output labels into the weights: arc {@code i:o/w} becomes {@code i:i/(o, w)}.
     */
    public static <W> VectorFst<GallicWeight<W>> toGallic(Fst<W> fst, GallicType type) {
        GallicAdapter<W, GallicWeight<W>> adapter = GallicAdapter.of(new GallicSemiring<>(type, fst.semiring()));
        return convert(fst, adapter.semiring(), new ToGallicConverter<>(adapter));
    }

    /**
     * Inverse of {@link #toGallic}; every string must hold at most one label.
     */
    public static <W> VectorFst<W> fromGallic(Fst<GallicWeight<W>> fst) {
        GallicSemiring<W> semiring = (GallicSemiring<W>) fst.semiring();
        GallicAdapter<W, GallicWeight<W>> adapter = GallicAdapter.of(semiring);
        return convert(fst, semiring.weightSemiring(), new FromGallicConverter<>(adapter));
    }
}
