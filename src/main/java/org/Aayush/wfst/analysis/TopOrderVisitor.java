package org.Aayush.wfst.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;

/**
 * Derives a topological order from DFS finishing times; any back arc marks the automaton cyclic
 * and stops the traversal.
 *
 * @param <W> weight type.
 */
public final class TopOrderVisitor<W> implements DfsVisitor<W> {
    private final IntArrayList finished = new IntArrayList();
    private int numStates;
    private boolean acyclic;
    private TopOrder order;

    public static <W> TopOrder compute(Fst<W> fst) {
        return compute(fst, ArcFilters.any());
    }

    public static <W> TopOrder compute(Fst<W> fst, ArcFilter<W> filter) {
        TopOrderVisitor<W> visitor = new TopOrderVisitor<>();
        DfsVisit.visit(fst, visitor, filter, false);
        return visitor.order;
    }

    @Override
    public void initVisit(Fst<W> fst) {
        finished.clear();
        numStates = fst.numStates();
        acyclic = true;
        order = null;
    }

    @Override
    public boolean initState(int state, int root) {
        return true;
    }

    @Override
    public boolean treeArc(int state, Arc<W> arc) {
        return true;
    }

    @Override
    public boolean backArc(int state, Arc<W> arc) {
        acyclic = false;
        return false;
    }

    @Override
    public boolean forwardOrCrossArc(int state, Arc<W> arc) {
        return true;
    }

    @Override
    public void finishState(int state, int parent, Arc<W> parentArc) {
        finished.add(state);
    }

    @Override
    public void finishVisit() {
        int[] ranks = new int[numStates];
        if (acyclic) {
            int n = finished.size();
            for (int i = 0; i < n; i++) {
                ranks[finished.getInt(n - 1 - i)] = i;
            }
        }
        order = new TopOrder(ranks, acyclic);
    }
}
