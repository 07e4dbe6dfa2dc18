package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.analysis.ArcFilters;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.queue.Queues;
import org.Aayush.wfst.queue.StateQueue;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.SemiringProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Extracts the best accepted paths of an automaton over a path semiring.
 */
public final class ShortestPath {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortestPath.class);

    public static final String REASON_NOT_PATH_SEMIRING = "SHORTEST_PATH_NOT_PATH_SEMIRING";

    private static final int SUPERFINAL = -2;

    private ShortestPath() {
    }

    public static <W> VectorFst<W> shortestPath(Fst<W> fst) {
        return shortestPath(fst, ShortestPathConfig.defaults());
    }

    /**
     * Returns an automaton holding the {@code nshortest} best paths, or an empty automaton when
     * no final state is reachable. With {@code nshortest == 1} the result is a linear automaton.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} when the semiring is not an idempotent
     * path semiring or {@code nshortest < 1}.
     */
    public static <W> VectorFst<W> shortestPath(Fst<W> fst, ShortestPathConfig config) {
        Objects.requireNonNull(fst, "fst");
        Objects.requireNonNull(config, "config");
        Semiring<W> semiring = fst.semiring();
        if (!semiring.hasProperty(SemiringProperty.PATH) || !semiring.hasProperty(SemiringProperty.IDEMPOTENT)) {
            throw FstException.precondition(
                    REASON_NOT_PATH_SEMIRING,
                    "shortest path requires an idempotent path semiring, got " + semiring.name()
            );
        }
        if (config.getNshortest() < 1) {
            throw FstException.precondition(
                    ShortestPathConfig.REASON_INVALID_NSHORTEST,
                    "nshortest must be >= 1, got " + config.getNshortest()
            );
        }
        VectorFst<W> out = config.getNshortest() == 1
                ? singleShortestPath(fst, config)
                : nShortestPaths(fst, config);
        LOGGER.debug("shortest path kept {} states of {}", out.numStates(), fst.numStates());
        return out;
    }

    private static <W> VectorFst<W> singleShortestPath(Fst<W> fst, ShortestPathConfig config) {
        Semiring<W> semiring = fst.semiring();
        VectorFst<W> out = new VectorFst<>(semiring);
        int start = fst.start();
        if (start == Fst.NO_STATE) {
            return out;
        }
        int n = fst.numStates();
        ObjectArrayList<W> distances = new ObjectArrayList<>(n);
        for (int s = 0; s < n; s++) {
            distances.add(semiring.zero());
        }
        int[] parent = new int[n];
        int[] parentArc = new int[n];
        Arrays.fill(parent, Fst.NO_STATE);
        BitSet enqueued = new BitSet(n);
        StateQueue queue = Queues.create(config.getQueueType(), fst, distances, ArcFilters.any());
        distances.set(start, semiring.one());
        queue.push(start);
        enqueued.set(start);
        int bestFinal = Fst.NO_STATE;
        W bestWeight = semiring.zero();
        int maxIterations = config.getMaxIterations();
        long iterations = 0L;
        while (!queue.isEmpty()) {
            int s = queue.pop();
            enqueued.clear(s);
            iterations++;
            if (maxIterations > 0 && iterations > maxIterations) {
                LOGGER.warn("single shortest path stopped after {} iterations", maxIterations);
                throw FstException.nonConvergent(
                        ShortestDistance.REASON_ITERATION_LIMIT,
                        "no convergence within " + maxIterations + " iterations"
                );
            }
            W d = distances.get(s);
            if (fst.isFinal(s)) {
                W fw = semiring.times(d, fst.finalWeight(s));
                if (bestFinal == Fst.NO_STATE || semiring.naturalLess(fw, bestWeight)) {
                    bestFinal = s;
                    bestWeight = fw;
                }
            }
            List<Arc<W>> arcs = fst.arcs(s);
            for (int i = 0; i < arcs.size(); i++) {
                Arc<W> arc = arcs.get(i);
                int t = arc.nextState();
                W nd = semiring.times(d, arc.weight());
                W current = distances.get(t);
                if (semiring.isZero(nd)) {
                    continue;
                }
                if (semiring.isZero(current)
                        || (semiring.naturalLess(nd, current) && !semiring.approxEqual(nd, current, config.getDelta()))) {
                    distances.set(t, nd);
                    parent[t] = s;
                    parentArc[t] = i;
                    if (enqueued.get(t)) {
                        queue.update(t);
                    } else {
                        queue.push(t);
                        enqueued.set(t);
                    }
                }
            }
        }
        if (bestFinal == Fst.NO_STATE) {
            return out;
        }
        IntArrayList chain = new IntArrayList();
        for (int s = bestFinal; s != start; s = parent[s]) {
            chain.add(s);
        }
        chain.add(start);
        int prev = out.addState();
        out.setStart(prev);
        for (int k = chain.size() - 2; k >= 0; k--) {
            int s = chain.getInt(k);
            int next = out.addState();
            out.addArc(prev, fst.arc(parent[s], parentArc[s]).withNextState(next));
            prev = next;
        }
        out.setFinal(prev, fst.finalWeight(bestFinal));
        return out;
    }

    private static final class Entry<W> {
        final int state;
        final W weight;
        final W priority;
        final Entry<W> parent;
        final Arc<W> arc;
        final long sequence;
        int outState = Fst.NO_STATE;

        Entry(int state, W weight, W priority, Entry<W> parent, Arc<W> arc, long sequence) {
            this.state = state;
            this.weight = weight;
            this.priority = priority;
            this.parent = parent;
            this.arc = arc;
            this.sequence = sequence;
        }
    }

    // Best-first search guided by the exact distance to the final states; each state is
    // expanded at most n times.
    private static <W> VectorFst<W> nShortestPaths(Fst<W> fst, ShortestPathConfig config) {
        Semiring<W> semiring = fst.semiring();
        VectorFst<W> out = new VectorFst<>(semiring);
        int start = fst.start();
        if (start == Fst.NO_STATE) {
            return out;
        }
        int nshortest = config.getNshortest();
        List<W> rd = ShortestDistance.reverseShortestDistance(fst, config.distanceConfig());
        if (semiring.isZero(rd.get(start))) {
            return out;
        }
        Comparator<W> natural = semiring.naturalOrder();
        PriorityQueue<Entry<W>> heap = new PriorityQueue<>((a, b) -> {
            int c = natural.compare(a.priority, b.priority);
            if (c != 0) {
                return c;
            }
            boolean ca = a.state == SUPERFINAL;
            boolean cb = b.state == SUPERFINAL;
            if (ca != cb) {
                return ca ? 1 : -1;
            }
            return Long.compare(a.sequence, b.sequence);
        });
        int[] expanded = new int[fst.numStates()];
        long sequence = 0L;
        heap.add(new Entry<>(start, semiring.one(), rd.get(start), null, null, sequence++));
        int found = 0;
        while (!heap.isEmpty() && found < nshortest) {
            Entry<W> e = heap.poll();
            if (e.state == SUPERFINAL) {
                out.setFinal(e.parent.outState, fst.finalWeight(e.parent.state));
                found++;
                continue;
            }
            if (expanded[e.state] >= nshortest) {
                continue;
            }
            expanded[e.state]++;
            e.outState = out.addState();
            if (e.parent == null) {
                out.setStart(e.outState);
            } else {
                out.addArc(e.parent.outState, e.arc.withNextState(e.outState));
            }
            if (fst.isFinal(e.state)) {
                W complete = semiring.times(e.weight, fst.finalWeight(e.state));
                heap.add(new Entry<>(SUPERFINAL, complete, complete, e, null, sequence++));
            }
            for (Arc<W> arc : fst.arcs(e.state)) {
                W toFinal = rd.get(arc.nextState());
                if (semiring.isZero(toFinal) || semiring.isZero(arc.weight())) {
                    continue;
                }
                W acc = semiring.times(e.weight, arc.weight());
                heap.add(new Entry<>(arc.nextState(), acc, semiring.times(acc, toFinal), e, arc, sequence++));
            }
        }
        Connect.connect(out);
        return out;
    }
}
