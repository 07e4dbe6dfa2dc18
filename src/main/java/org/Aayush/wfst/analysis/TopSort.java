package org.Aayush.wfst.analysis;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.MutableFst;

/**
 * Topological renumbering of acyclic automata.
 */
public final class TopSort {
    public static final String REASON_CYCLIC = "TOPSORT_CYCLIC_INPUT";

    private TopSort() {
    }

    /**
     * Renumbers states so every arc goes from a lower to a higher id.
     *
     * @return {@code false}, leaving {@code fst} untouched, when it has a cycle.
     */
    public static <W> boolean topSort(MutableFst<W> fst) {
        TopOrder order = TopOrderVisitor.compute(fst);
        if (!order.acyclic()) {
            return false;
        }
        StateSort.sort(fst, order.ranks());
        return true;
    }

    /**
     * Topological order of an automaton that must be acyclic.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} when the automaton has a cycle.
     */
    public static <W> TopOrder requireTopOrder(Fst<W> fst) {
        return requireTopOrder(fst, ArcFilters.any());
    }

    public static <W> TopOrder requireTopOrder(Fst<W> fst, ArcFilter<W> filter) {
        TopOrder order = TopOrderVisitor.compute(fst, filter);
        if (!order.acyclic()) {
            throw FstException.precondition(REASON_CYCLIC, "automaton is cyclic, no topological order exists");
        }
        return order;
    }
}
