package org.Aayush.wfst.fst;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.semiring.Semiring;

import java.util.List;

/**
 * Read-only weighted finite-state transducer.
 *
 * <p>States are dense ids {@code 0..numStates()-1}; each state owns an ordered arc list and a final
 * weight, where the semiring zero means "not final". {@link #start()} is {@link #NO_STATE} for
 * an automaton without a start state.</p>
 *
 * @param <W> weight type.
 */
public interface Fst<W> {

    int NO_STATE = -1;

    String REASON_UNKNOWN_STATE = "FST_UNKNOWN_STATE";
    String REASON_ARC_INDEX_OUT_OF_RANGE = "FST_ARC_INDEX_OUT_OF_RANGE";

    /**
     * Algebra of this automaton's weights.
     */
    Semiring<W> semiring();

    int start();

    /**
     * Final weight of a state; zero when the state is not final.
     *
     * @throws FstException with kind {@code NOT_FOUND} for an unknown state.
     */
    W finalWeight(int state);

    default boolean isFinal(int state) {
        return !semiring().isZero(finalWeight(state));
    }

    int numStates();

    int numArcs(int state);

    Arc<W> arc(int state, int index);

    /**
     * Unmodifiable view of the arcs leaving a state.
     */
    List<Arc<W>> arcs(int state);

    int numInputEpsilons(int state);

    int numOutputEpsilons(int state);

    /**
     * Structural properties of this automaton restricted to {@code mask}; see
     * {@link org.Aayush.wfst.properties.FstProperties}.
     */
    long properties(long mask);

    /**
     * Returns whether every property in {@code mask} holds.
     */
    default boolean hasProperties(long mask) {
        return properties(mask) == mask;
    }

    /**
     * Total number of arcs over all states.
     */
    default long totalArcs() {
        long total = 0;
        for (int s = 0; s < numStates(); s++) {
            total += numArcs(s);
        }
        return total;
    }

    /**
     * Returns a reusable iterator; call {@link ArcIterator#reset(int)} to position it on a state.
     */
    default ArcIterator<W> arcIterator() {
        return new ArcIterator<>(this);
    }

    /**
     * Validates a state id against this automaton.
     *
     * @throws FstException with kind {@code NOT_FOUND} when the id is out of range.
     */
    default void checkState(int state) {
        if (state < 0 || state >= numStates()) {
            throw FstException.notFound(
                    REASON_UNKNOWN_STATE,
                    "state " + state + " out of bounds [0, " + numStates() + ")"
            );
        }
    }
}
