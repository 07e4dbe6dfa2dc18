package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Value;
import org.Aayush.wfst.analysis.ArcFilter;
import org.Aayush.wfst.analysis.ArcFilters;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.semiring.Semiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Removes {@code eps:eps} arcs.
 *
 * <p>For every state the weighted epsilon closure is computed by a shortest-distance run over
 * epsilon arcs only; the state then receives the non-epsilon arcs and the final weights of its
 * closure, weighted by the closure distance. Arcs that end up with the same labels and
 * destination are summed.</p>
 */
public final class RmEpsilon {
    private static final Logger LOGGER = LoggerFactory.getLogger(RmEpsilon.class);

    private RmEpsilon() {
    }

    @Value
    private static class ArcKey {
        int ilabel;
        int olabel;
        int nextState;
    }

    public static <W> void rmEpsilon(MutableFst<W> fst) {
        rmEpsilon(fst, RmEpsilonConfig.defaults());
    }

    /**
     * @throws org.Aayush.wfst.FstException {@code NON_CONVERGENT} when an epsilon closure
     * exceeds the iteration ceiling.
     */
    public static <W> void rmEpsilon(MutableFst<W> fst, RmEpsilonConfig config) {
        Objects.requireNonNull(config, "config");
        int n = fst.numStates();
        if (fst.start() == Fst.NO_STATE || n == 0) {
            return;
        }
        Semiring<W> semiring = fst.semiring();
        ArcFilter<W> epsilon = ArcFilters.epsilon();
        ShortestDistanceState<W> closure = new ShortestDistanceState<>(fst, epsilon, config.distanceConfig(), true);
        ObjectArrayList<List<Arc<W>>> newArcs = new ObjectArrayList<>(n);
        ObjectArrayList<W> newFinals = new ObjectArrayList<>(n);
        int removed = 0;
        for (int s = 0; s < n; s++) {
            if (fst.numInputEpsilons(s) == 0 || !hasEpsilonArc(fst, s)) {
                newArcs.add(null);
                newFinals.add(null);
                continue;
            }
            closure.run(s);
            List<W> distances = closure.distances();
            ObjectArrayList<Arc<W>> arcs = new ObjectArrayList<>();
            Object2IntOpenHashMap<ArcKey> index = new Object2IntOpenHashMap<>();
            index.defaultReturnValue(-1);
            W finalWeight = semiring.zero();
            for (int t = 0; t < distances.size(); t++) {
                if (!closure.reached(t, s)) {
                    continue;
                }
                W d = distances.get(t);
                if (fst.isFinal(t)) {
                    finalWeight = semiring.plus(finalWeight, semiring.times(d, fst.finalWeight(t)));
                }
                for (Arc<W> arc : fst.arcs(t)) {
                    if (epsilon.keep(arc)) {
                        removed++;
                        continue;
                    }
                    W w = semiring.times(d, arc.weight());
                    ArcKey key = new ArcKey(arc.ilabel(), arc.olabel(), arc.nextState());
                    int at = index.getInt(key);
                    if (at < 0) {
                        index.put(key, arcs.size());
                        arcs.add(arc.withWeight(w));
                    } else {
                        Arc<W> prev = arcs.get(at);
                        arcs.set(at, prev.withWeight(semiring.plus(prev.weight(), w)));
                    }
                }
            }
            newArcs.add(arcs);
            newFinals.add(finalWeight);
        }
        for (int s = 0; s < n; s++) {
            List<Arc<W>> arcs = newArcs.get(s);
            if (arcs == null) {
                continue;
            }
            fst.deleteArcs(s);
            fst.reserveArcs(s, arcs.size());
            for (Arc<W> arc : arcs) {
                fst.addArc(s, arc);
            }
            fst.setFinal(s, newFinals.get(s));
        }
        if (config.isConnect()) {
            Connect.connect(fst);
        }
        LOGGER.debug("epsilon removal visited {} epsilon arcs, {} states remain", removed, fst.numStates());
    }

    private static <W> boolean hasEpsilonArc(Fst<W> fst, int state) {
        for (Arc<W> arc : fst.arcs(state)) {
            if (arc.isEpsilon()) {
                return true;
            }
        }
        return false;
    }
}
