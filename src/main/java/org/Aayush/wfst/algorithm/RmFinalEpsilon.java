package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.analysis.ArcFilters;
import org.Aayush.wfst.analysis.SccResult;
import org.Aayush.wfst.analysis.SccVisitor;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.semiring.Semiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.List;

/**
 * Folds {@code eps:eps} arcs into dead-end final states back into the source's final weight.
 *
 * <p>A dead-end final state is a final state whose only useful future is its final weight:
 * every arc to a coaccessible state is an {@code eps:eps} arc to another dead-end final state.
 * Chains of such states are collapsed from the end; the result is connected.</p>
 */
public final class RmFinalEpsilon {
    private static final Logger LOGGER = LoggerFactory.getLogger(RmFinalEpsilon.class);

    public static final String REASON_EPSILON_CYCLE = "RM_FINAL_EPSILON_CYCLE";

    private RmFinalEpsilon() {
    }

    /**
     * @throws FstException {@code PRECONDITION_VIOLATED} when dead-end final states form an
     * epsilon cycle.
     */
    public static <W> void rmFinalEpsilon(MutableFst<W> fst) {
        int n = fst.numStates();
        if (fst.start() == Fst.NO_STATE || n == 0) {
            return;
        }
        Semiring<W> semiring = fst.semiring();
        BitSet deadEnds = deadEndFinals(fst, Connect.coaccessible(fst));
        SccResult epsilonScc = SccVisitor.compute(fst, ArcFilters.epsilon());
        for (int s = deadEnds.nextSetBit(0); s >= 0; s = deadEnds.nextSetBit(s + 1)) {
            for (Arc<W> arc : fst.arcs(s)) {
                if (arc.isEpsilon()
                        && deadEnds.get(arc.nextState())
                        && epsilonScc.component(s) == epsilonScc.component(arc.nextState())) {
                    throw FstException.precondition(
                            REASON_EPSILON_CYCLE,
                            "epsilon cycle among final states through state " + s
                    );
                }
            }
        }
        List<W> folded = foldDeadEnds(fst, deadEnds);
        int removed = 0;
        ObjectArrayList<Arc<W>> kept = new ObjectArrayList<>();
        for (int s = 0; s < n; s++) {
            W weight = deadEnds.get(s) ? folded.get(s) : fst.finalWeight(s);
            kept.clear();
            for (Arc<W> arc : fst.arcs(s)) {
                if (arc.isEpsilon() && deadEnds.get(arc.nextState())) {
                    if (!deadEnds.get(s)) {
                        weight = semiring.plus(weight, semiring.times(arc.weight(), folded.get(arc.nextState())));
                    }
                } else {
                    kept.add(arc);
                }
            }
            if (kept.size() < fst.numArcs(s)) {
                removed += fst.numArcs(s) - kept.size();
                fst.deleteArcs(s);
                for (Arc<W> arc : kept) {
                    fst.addArc(s, arc);
                }
            }
            fst.setFinal(s, weight);
        }
        Connect.connect(fst);
        LOGGER.debug("removed {} final epsilon arcs", removed);
    }

    private static <W> BitSet deadEndFinals(Fst<W> fst, BitSet coaccessible) {
        BitSet candidates = new BitSet(fst.numStates());
        for (int s = 0; s < fst.numStates(); s++) {
            if (fst.isFinal(s)) {
                candidates.set(s);
            }
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int s = candidates.nextSetBit(0); s >= 0; s = candidates.nextSetBit(s + 1)) {
                for (Arc<W> arc : fst.arcs(s)) {
                    int t = arc.nextState();
                    if (coaccessible.get(t) && !(arc.isEpsilon() && candidates.get(t))) {
                        candidates.clear(s);
                        changed = true;
                        break;
                    }
                }
            }
        }
        return candidates;
    }

    // Final weight of each dead-end state including its epsilon chain; acyclic by the caller.
    private static <W> List<W> foldDeadEnds(Fst<W> fst, BitSet deadEnds) {
        Semiring<W> semiring = fst.semiring();
        int n = fst.numStates();
        ObjectArrayList<W> folded = new ObjectArrayList<>(n);
        for (int s = 0; s < n; s++) {
            folded.add(null);
        }
        IntArrayList stack = new IntArrayList();
        for (int root = deadEnds.nextSetBit(0); root >= 0; root = deadEnds.nextSetBit(root + 1)) {
            if (folded.get(root) != null) {
                continue;
            }
            stack.add(root);
            while (!stack.isEmpty()) {
                int s = stack.getInt(stack.size() - 1);
                boolean ready = true;
                for (Arc<W> arc : fst.arcs(s)) {
                    int t = arc.nextState();
                    if (arc.isEpsilon() && deadEnds.get(t) && folded.get(t) == null) {
                        stack.add(t);
                        ready = false;
                    }
                }
                if (!ready) {
                    continue;
                }
                stack.removeInt(stack.size() - 1);
                if (folded.get(s) != null) {
                    continue;
                }
                W weight = fst.finalWeight(s);
                for (Arc<W> arc : fst.arcs(s)) {
                    if (arc.isEpsilon() && deadEnds.get(arc.nextState())) {
                        weight = semiring.plus(weight, semiring.times(arc.weight(), folded.get(arc.nextState())));
                    }
                }
                folded.set(s, weight);
            }
        }
        return folded;
    }
}
