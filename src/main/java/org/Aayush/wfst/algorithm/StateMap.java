package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.MutableFst;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link StateMapper} in place to every state.
 */
public final class StateMap {

    private StateMap() {
    }

    public static <W> void map(MutableFst<W> fst, StateMapper<W> mapper) {
        for (int s = 0; s < fst.numStates(); s++) {
            List<Arc<W>> mapped = mapper.mapArcs(s, new ArrayList<>(fst.arcs(s)));
            fst.deleteArcs(s);
            fst.reserveArcs(s, mapped.size());
            for (Arc<W> arc : mapped) {
                fst.addArc(s, arc);
            }
            fst.setFinal(s, mapper.mapFinal(s, fst.finalWeight(s)));
        }
    }
}
