package org.Aayush.wfst.fst;

import it.unimi.dsi.fastutil.ints.IntCollection;

import java.util.Comparator;

/**
 * Editable automaton. Every structural mutation invalidates cached properties.
 *
 * @param <W> weight type.
 */
public interface MutableFst<W> extends Fst<W> {

    String REASON_ARC_TARGET_OUT_OF_RANGE = "FST_ARC_TARGET_OUT_OF_RANGE";

    /**
     * Appends a non-final state without arcs and returns its id.
     */
    int addState();

    /**
     * Appends {@code count} states; returns the id of the first one.
     */
    int addStates(int count);

    void setStart(int state);

    void setFinal(int state, W weight);

    default void deleteFinal(int state) {
        setFinal(state, semiring().zero());
    }

    /**
     * Empties this automaton and copies {@code source} into it.
     */
    default void replaceWith(Fst<W> source) {
        deleteAllStates();
        int n = source.numStates();
        reserveStates(n);
        addStates(n);
        for (int s = 0; s < n; s++) {
            reserveArcs(s, source.numArcs(s));
            for (Arc<W> arc : source.arcs(s)) {
                addArc(s, arc);
            }
            if (source.isFinal(s)) {
                setFinal(s, source.finalWeight(s));
            }
        }
        if (source.start() != Fst.NO_STATE) {
            setStart(source.start());
        }
    }

    /**
     * Appends an arc to a state.
     *
     * @throws org.Aayush.wfst.FstException {@code NOT_FOUND} for an unknown source state,
     * {@code MALFORMED} when {@code arc.nextState()} is not a state of this automaton.
     */
    void addArc(int state, Arc<W> arc);

    default void addArc(int state, int ilabel, int olabel, W weight, int nextState) {
        addArc(state, Arc.of(ilabel, olabel, weight, nextState));
    }

    void setArc(int state, int index, Arc<W> arc);

    /**
     * Removes every arc leaving a state.
     */
    void deleteArcs(int state);

    /**
     * Removes the last {@code count} arcs of a state.
     */
    void deleteArcs(int state, int count);

    /**
     * Removes a set of states together with every arc entering them. Remaining states are
     * renumbered densely in their original order; a deleted start state leaves no start.
     */
    void deleteStates(IntCollection states);

    void deleteAllStates();

    void reserveStates(int count);

    void reserveArcs(int state, int count);

    /**
     * Stable sort of the arcs leaving one state.
     */
    void sortArcs(int state, Comparator<? super Arc<W>> comparator);
}
