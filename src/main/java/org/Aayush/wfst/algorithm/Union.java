package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Adds the paths of another automaton to a mutable one.
 */
public final class Union {

    private Union() {
    }

    /**
     * Appends the states of {@code other} and joins both behind a new start state with epsilon
     * arcs of weight one. When {@code fst} is empty it simply receives a copy of {@code other}.
     */
    public static <W> void union(MutableFst<W> fst, Fst<W> other) {
        if (other.start() == Fst.NO_STATE) {
            return;
        }
        if (fst.start() == Fst.NO_STATE) {
            fst.replaceWith(other);
            return;
        }
        Semiring<W> semiring = fst.semiring();
        int offset = fst.numStates();
        fst.reserveStates(offset + other.numStates() + 1);
        fst.addStates(other.numStates());
        for (int s = 0; s < other.numStates(); s++) {
            for (Arc<W> arc : other.arcs(s)) {
                fst.addArc(s + offset, arc.withNextState(arc.nextState() + offset));
            }
            if (other.isFinal(s)) {
                fst.setFinal(s + offset, other.finalWeight(s));
            }
        }
        int start = fst.addState();
        fst.addArc(start, Arc.of(Labels.EPSILON, Labels.EPSILON, semiring.one(), fst.start()));
        fst.addArc(start, Arc.of(Labels.EPSILON, Labels.EPSILON, semiring.one(), other.start() + offset));
        fst.setStart(start);
    }
}
