package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.semiring.Semiring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Structural equality up to state renumbering.
 *
 * <p>States are paired breadth-first from the start states. Arcs of paired states are matched
 * after a stable sort by input then output label, so arcs sharing both labels are matched in
 * their stored order.</p>
 */
public final class Isomorphic {

    private Isomorphic() {
    }

    public static <W> boolean isomorphic(Fst<W> a, Fst<W> b) {
        return isomorphic(a, b, AlgorithmDefaults.delta());
    }

    /**
     * @param delta tolerance for comparing weights.
     */
    public static <W> boolean isomorphic(Fst<W> a, Fst<W> b, float delta) {
        if (a.numStates() != b.numStates()) {
            return false;
        }
        if (a.start() == Fst.NO_STATE || b.start() == Fst.NO_STATE) {
            return a.start() == b.start();
        }
        Semiring<W> semiring = a.semiring();
        int n = a.numStates();
        int[] forward = new int[n];
        int[] backward = new int[n];
        Arrays.fill(forward, Fst.NO_STATE);
        Arrays.fill(backward, Fst.NO_STATE);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        forward[a.start()] = b.start();
        backward[b.start()] = a.start();
        queue.enqueue(a.start());
        Comparator<Arc<W>> order = ArcComparators.inputOutput();
        while (!queue.isEmpty()) {
            int s1 = queue.dequeueInt();
            int s2 = forward[s1];
            if (a.isFinal(s1) != b.isFinal(s2)
                    || !semiring.approxEqual(a.finalWeight(s1), b.finalWeight(s2), delta)
                    || a.numArcs(s1) != b.numArcs(s2)) {
                return false;
            }
            List<Arc<W>> arcs1 = new ArrayList<>(a.arcs(s1));
            List<Arc<W>> arcs2 = new ArrayList<>(b.arcs(s2));
            arcs1.sort(order);
            arcs2.sort(order);
            for (int i = 0; i < arcs1.size(); i++) {
                Arc<W> x = arcs1.get(i);
                Arc<W> y = arcs2.get(i);
                if (x.ilabel() != y.ilabel()
                        || x.olabel() != y.olabel()
                        || !semiring.approxEqual(x.weight(), y.weight(), delta)) {
                    return false;
                }
                int t1 = x.nextState();
                int t2 = y.nextState();
                if (forward[t1] == Fst.NO_STATE && backward[t2] == Fst.NO_STATE) {
                    forward[t1] = t2;
                    backward[t2] = t1;
                    queue.enqueue(t1);
                } else if (forward[t1] != t2 || backward[t2] != t1) {
                    return false;
                }
            }
        }
        return true;
    }
}
