package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.wfst.analysis.ReverseAdjacency;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.MutableFst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;

/**
 * Trims an automaton to its useful states: those reachable from the start state and from which
 * a final state is reachable.
 */
public final class Connect {
    private static final Logger LOGGER = LoggerFactory.getLogger(Connect.class);

    private Connect() {
    }

    public static <W> void connect(MutableFst<W> fst) {
        int n = fst.numStates();
        if (n == 0) {
            return;
        }
        BitSet accessible = accessible(fst);
        BitSet coaccessible = coaccessible(fst);
        IntArrayList dead = new IntArrayList();
        for (int s = 0; s < n; s++) {
            if (!accessible.get(s) || !coaccessible.get(s)) {
                dead.add(s);
            }
        }
        fst.deleteStates(dead);
        LOGGER.debug("connect kept {} of {} states", fst.numStates(), n);
    }

    /**
     * States reachable from the start state.
     */
    public static <W> BitSet accessible(Fst<W> fst) {
        BitSet seen = new BitSet(fst.numStates());
        if (fst.start() == Fst.NO_STATE) {
            return seen;
        }
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        seen.set(fst.start());
        queue.enqueue(fst.start());
        while (!queue.isEmpty()) {
            int s = queue.dequeueInt();
            for (Arc<W> arc : fst.arcs(s)) {
                if (!seen.get(arc.nextState())) {
                    seen.set(arc.nextState());
                    queue.enqueue(arc.nextState());
                }
            }
        }
        return seen;
    }

    /**
     * States from which some final state is reachable.
     */
    public static <W> BitSet coaccessible(Fst<W> fst) {
        int n = fst.numStates();
        BitSet seen = new BitSet(n);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int s = 0; s < n; s++) {
            if (fst.isFinal(s)) {
                seen.set(s);
                queue.enqueue(s);
            }
        }
        if (queue.isEmpty()) {
            return seen;
        }
        ReverseAdjacency reverse = ReverseAdjacency.build(fst);
        while (!queue.isEmpty()) {
            int t = queue.dequeueInt();
            for (int i = reverse.incomingStart(t); i < reverse.incomingEnd(t); i++) {
                int source = reverse.sourceAt(i);
                if (!seen.get(source)) {
                    seen.set(source);
                    queue.enqueue(source);
                }
            }
        }
        return seen;
    }
}
