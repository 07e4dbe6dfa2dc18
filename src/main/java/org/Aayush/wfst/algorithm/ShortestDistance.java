package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.analysis.ArcFilters;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.Semiring;

import java.util.List;
import java.util.Objects;

/**
 * Single-source shortest distance over a semiring: for every state, the sum over all paths from
 * the start state of the path weights.
 *
 * <p>The relaxation keeps a residual per state and stops once no distance moves by more than the
 * configured delta. It terminates for k-closed semirings; elsewhere the iteration ceiling is the
 * only bound.</p>
 */
public final class ShortestDistance {
    public static final String REASON_ITERATION_LIMIT = "SHORTEST_DISTANCE_ITERATION_LIMIT";

    private ShortestDistance() {
    }

    public static <W> List<W> shortestDistance(Fst<W> fst) {
        return shortestDistance(fst, ShortestDistanceConfig.defaults());
    }

    /**
     * Forward distances, one entry per state; unreachable states hold zero.
     */
    public static <W> List<W> shortestDistance(Fst<W> fst, ShortestDistanceConfig config) {
        Objects.requireNonNull(fst, "fst");
        Objects.requireNonNull(config, "config");
        ShortestDistanceState<W> state = new ShortestDistanceState<>(fst, ArcFilters.any(), config, false);
        state.run(fst.start());
        return pad(state.distances(), fst.numStates(), fst.semiring());
    }

    public static <W> List<W> reverseShortestDistance(Fst<W> fst) {
        return reverseShortestDistance(fst, ShortestDistanceConfig.defaults());
    }

    /**
     * Distances to the final states: entry {@code s} is the sum over all paths from {@code s}
     * of the path weight times the final weight.
     */
    public static <W> List<W> reverseShortestDistance(Fst<W> fst, ShortestDistanceConfig config) {
        Objects.requireNonNull(fst, "fst");
        Objects.requireNonNull(config, "config");
        Semiring<W> semiring = fst.semiring();
        int n = fst.numStates();
        ObjectArrayList<W> out = new ObjectArrayList<>(n);
        if (fst.start() == Fst.NO_STATE) {
            for (int s = 0; s < n; s++) {
                out.add(semiring.zero());
            }
            return out;
        }
        VectorFst<W> reversed = Reverse.reverse(fst);
        Semiring<W> reversedSemiring = reversed.semiring();
        List<W> rd = shortestDistance(reversed, config);
        for (int s = 0; s < n; s++) {
            out.add(reversedSemiring.reverse(rd.get(s + 1)));
        }
        return out;
    }

    /**
     * Sum of the weights of all accepted paths.
     */
    public static <W> W totalWeight(Fst<W> fst) {
        return totalWeight(fst, ShortestDistanceConfig.defaults());
    }

    public static <W> W totalWeight(Fst<W> fst, ShortestDistanceConfig config) {
        Semiring<W> semiring = fst.semiring();
        List<W> distances = shortestDistance(fst, config);
        W sum = semiring.zero();
        for (int s = 0; s < fst.numStates(); s++) {
            if (fst.isFinal(s)) {
                sum = semiring.plus(sum, semiring.times(distances.get(s), fst.finalWeight(s)));
            }
        }
        return sum;
    }

    private static <W> List<W> pad(List<W> distances, int n, Semiring<W> semiring) {
        ObjectArrayList<W> out = new ObjectArrayList<>(n);
        for (int s = 0; s < n; s++) {
            out.add(s < distances.size() ? distances.get(s) : semiring.zero());
        }
        return out;
    }
}
