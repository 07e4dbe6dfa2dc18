package org.Aayush.wfst.analysis;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.fst.VectorFst;

import java.util.BitSet;

/**
 * Renumbers states by a permutation.
 */
public final class StateSort {
    public static final String REASON_NOT_A_PERMUTATION = "STATE_SORT_NOT_A_PERMUTATION";

    private StateSort() {
    }

    /**
     * Moves state {@code s} to {@code order[s]}; arcs keep their relative order.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} when {@code order} is not a permutation
     * of the state ids.
     */
    public static <W> void sort(MutableFst<W> fst, int[] order) {
        int n = fst.numStates();
        if (order.length != n) {
            throw FstException.precondition(
                    REASON_NOT_A_PERMUTATION,
                    "order has " + order.length + " entries for " + n + " states"
            );
        }
        BitSet used = new BitSet(n);
        for (int target : order) {
            if (target < 0 || target >= n || used.get(target)) {
                throw FstException.precondition(REASON_NOT_A_PERMUTATION, "invalid or repeated target " + target);
            }
            used.set(target);
        }
        VectorFst<W> snapshot = VectorFst.copyOf(fst);
        fst.deleteAllStates();
        fst.addStates(n);
        for (int s = 0; s < n; s++) {
            int target = order[s];
            fst.setFinal(target, snapshot.finalWeight(s));
            fst.reserveArcs(target, snapshot.numArcs(s));
            for (Arc<W> arc : snapshot.arcs(s)) {
                fst.addArc(target, arc.withNextState(order[arc.nextState()]));
            }
        }
        if (snapshot.start() != Fst.NO_STATE) {
            fst.setStart(order[snapshot.start()]);
        }
    }
}
