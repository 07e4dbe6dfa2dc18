package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Applies an {@link ArcMapper} in place.
 */
public final class ArcMap {
    public static final String REASON_NON_EPSILON_FINAL = "ARC_MAP_NON_EPSILON_FINAL_ARC";

    private ArcMap() {
    }

    /**
     * Maps every arc and every final weight of {@code fst}. Final weights whose mapped labels are
     * not epsilon are handled according to {@link ArcMapper#finalAction()}.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} under {@link MapFinalAction#NO_SUPERFINAL}
     * when a mapped final arc carries labels.
     */
    public static <W> void map(MutableFst<W> fst, ArcMapper<W> mapper) {
        if (fst.start() == Fst.NO_STATE) {
            return;
        }
        Semiring<W> semiring = fst.semiring();
        MapFinalAction action = mapper.finalAction();
        int superfinal = Fst.NO_STATE;
        int n = fst.numStates();
        if (action == MapFinalAction.REQUIRE_SUPERFINAL) {
            superfinal = fst.addState();
            fst.setFinal(superfinal, semiring.one());
        }
        for (int s = 0; s < n; s++) {
            int arcs = fst.numArcs(s);
            for (int i = 0; i < arcs; i++) {
                fst.setArc(s, i, mapper.map(fst.arc(s, i)));
            }
            if (!fst.isFinal(s)) {
                continue;
            }
            FinalArc<W> mapped = mapper.mapFinal(FinalArc.of(fst.finalWeight(s)));
            switch (action) {
                case NO_SUPERFINAL:
                    if (!mapped.hasEpsilonLabels()) {
                        throw FstException.precondition(
                                REASON_NON_EPSILON_FINAL,
                                "mapper produced labels on the final arc of state " + s
                        );
                    }
                    fst.setFinal(s, mapped.weight());
                    break;
                case ALLOW_SUPERFINAL:
                    if (mapped.hasEpsilonLabels()) {
                        fst.setFinal(s, mapped.weight());
                    } else {
                        if (superfinal == Fst.NO_STATE) {
                            superfinal = fst.addState();
                            fst.setFinal(superfinal, semiring.one());
                        }
                        fst.addArc(s, Arc.of(mapped.ilabel(), mapped.olabel(), mapped.weight(), superfinal));
                        fst.deleteFinal(s);
                    }
                    break;
                default:
                    if (!mapped.hasEpsilonLabels() || !semiring.isZero(mapped.weight())) {
                        fst.addArc(s, Arc.of(mapped.ilabel(), mapped.olabel(), mapped.weight(), superfinal));
                    }
                    fst.deleteFinal(s);
                    break;
            }
        }
    }
}
