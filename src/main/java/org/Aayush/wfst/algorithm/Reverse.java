package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Reverses every path of an automaton.
 */
public final class Reverse {

    private Reverse() {
    }

    /**
     * Returns the reversal over {@code fst.semiring().reverseSemiring()}. State {@code 0} is a new
     * start state with an epsilon arc to each former final state; former state {@code s} becomes
     * state {@code s + 1} and the former start state is the only final state.
     */
    public static <W> VectorFst<W> reverse(Fst<W> fst) {
        Semiring<W> semiring = fst.semiring();
        Semiring<W> reversed = semiring.reverseSemiring();
        VectorFst<W> out = new VectorFst<>(reversed);
        if (fst.start() == Fst.NO_STATE) {
            return out;
        }
        int n = fst.numStates();
        out.reserveStates(n + 1);
        out.addStates(n + 1);
        out.setStart(0);
        out.setFinal(fst.start() + 1, reversed.one());
        for (int s = 0; s < n; s++) {
            if (fst.isFinal(s)) {
                out.addArc(0, Arc.of(Labels.EPSILON, Labels.EPSILON, semiring.reverse(fst.finalWeight(s)), s + 1));
            }
            for (Arc<W> arc : fst.arcs(s)) {
                out.addArc(
                        arc.nextState() + 1,
                        Arc.of(arc.ilabel(), arc.olabel(), semiring.reverse(arc.weight()), s + 1)
                );
            }
        }
        return out;
    }
}
