package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.analysis.ArcFilter;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.queue.Queues;
import org.Aayush.wfst.queue.StateQueue;
import org.Aayush.wfst.semiring.Semiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.List;

/**
 * Relaxation state that can be reused for several single-source runs over the same automaton.
 *
 * <p>With {@code retain} set, distances of earlier runs are kept and lazily reset when a later
 * run from another source first touches the state; without it every run starts from empty
 * storage.</p>
 */
final class ShortestDistanceState<W> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortestDistanceState.class);

    private final Fst<W> fst;
    private final Semiring<W> semiring;
    private final ArcFilter<W> filter;
    private final float delta;
    private final int maxIterations;
    private final boolean retain;
    private final ObjectArrayList<W> distances = new ObjectArrayList<>();
    private final ObjectArrayList<W> residuals = new ObjectArrayList<>();
    private final IntArrayList sources = new IntArrayList();
    private final BitSet enqueued = new BitSet();
    private final StateQueue queue;

    ShortestDistanceState(Fst<W> fst, ArcFilter<W> filter, ShortestDistanceConfig config, boolean retain) {
        this.fst = fst;
        this.semiring = fst.semiring();
        this.filter = filter;
        this.delta = config.getDelta();
        this.maxIterations = config.getMaxIterations();
        this.retain = retain;
        this.queue = Queues.create(config.getQueueType(), fst, distances, filter);
    }

    /**
     * Distances computed so far, indexed by state; states never reached are absent or zero.
     */
    List<W> distances() {
        return distances;
    }

    /**
     * Whether the latest run from {@code source} reached {@code state}.
     */
    boolean reached(int state, int source) {
        return state < sources.size()
                && sources.getInt(state) == source
                && !semiring.isZero(distances.get(state));
    }

    /**
     * Runs the relaxation from {@code source}.
     *
     * @throws FstException {@code NON_CONVERGENT} when the iteration ceiling is exceeded.
     */
    void run(int source) {
        if (source == Fst.NO_STATE) {
            return;
        }
        if (!retain) {
            distances.clear();
            residuals.clear();
            sources.clear();
        }
        queue.clear();
        enqueued.clear();
        touch(source, source);
        distances.set(source, semiring.one());
        residuals.set(source, semiring.one());
        queue.push(source);
        enqueued.set(source);
        long iterations = 0L;
        while (!queue.isEmpty()) {
            int s = queue.pop();
            enqueued.clear(s);
            iterations++;
            if (maxIterations > 0 && iterations > maxIterations) {
                LOGGER.warn("shortest distance from state {} stopped after {} iterations", source, maxIterations);
                throw FstException.nonConvergent(
                        ShortestDistance.REASON_ITERATION_LIMIT,
                        "no convergence within " + maxIterations + " iterations"
                );
            }
            W residual = residuals.get(s);
            residuals.set(s, semiring.zero());
            for (Arc<W> arc : fst.arcs(s)) {
                if (!filter.keep(arc)) {
                    continue;
                }
                int t = arc.nextState();
                touch(t, source);
                W w = semiring.times(residual, arc.weight());
                W current = distances.get(t);
                W next = semiring.plus(current, w);
                if (semiring.approxEqual(current, next, delta)) {
                    continue;
                }
                distances.set(t, next);
                residuals.set(t, semiring.plus(residuals.get(t), w));
                if (enqueued.get(t)) {
                    queue.update(t);
                } else {
                    queue.push(t);
                    enqueued.set(t);
                }
            }
        }
        LOGGER.debug("shortest distance from state {} converged after {} iterations", source, iterations);
    }

    private void touch(int state, int source) {
        while (distances.size() <= state) {
            distances.add(semiring.zero());
            residuals.add(semiring.zero());
            sources.add(Fst.NO_STATE);
        }
        if (sources.getInt(state) != source) {
            distances.set(state, semiring.zero());
            residuals.set(state, semiring.zero());
            sources.set(state, source);
        }
    }
}
