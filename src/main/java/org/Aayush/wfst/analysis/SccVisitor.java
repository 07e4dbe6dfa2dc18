package org.Aayush.wfst.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;

import java.util.Arrays;

/**
 * Tarjan's strongly connected components as a DFS visitor. Also records accessibility from the
 * start state and coaccessibility to a final state.
 *
 * @param <W> weight type.
 */
public final class SccVisitor<W> implements DfsVisitor<W> {
    private Fst<W> fst;
    private int start;
    private int[] scc;
    private boolean[] access;
    private boolean[] coaccess;
    private int[] dfnumber;
    private int[] lowlink;
    private boolean[] onStack;
    private final IntArrayList sccStack = new IntArrayList();
    private int discovered;
    private int nscc;
    private boolean initialCyclic;
    private SccResult result;

    /**
     * Components over all arcs.
     */
    public static <W> SccResult compute(Fst<W> fst) {
        return compute(fst, ArcFilters.any());
    }

    /**
     * Components over the arcs accepted by {@code filter}.
     */
    public static <W> SccResult compute(Fst<W> fst, ArcFilter<W> filter) {
        SccVisitor<W> visitor = new SccVisitor<>();
        DfsVisit.visit(fst, visitor, filter, false);
        return visitor.result(fst, filter);
    }

    @Override
    public void initVisit(Fst<W> fst) {
        this.fst = fst;
        this.start = fst.start();
        int n = fst.numStates();
        scc = new int[n];
        Arrays.fill(scc, -1);
        access = new boolean[n];
        coaccess = new boolean[n];
        dfnumber = new int[n];
        Arrays.fill(dfnumber, -1);
        lowlink = new int[n];
        onStack = new boolean[n];
        sccStack.clear();
        discovered = 0;
        nscc = 0;
        initialCyclic = false;
        result = null;
    }

    @Override
    public boolean initState(int state, int root) {
        sccStack.add(state);
        dfnumber[state] = discovered;
        lowlink[state] = discovered;
        onStack[state] = true;
        if (root == start) {
            access[state] = true;
        }
        discovered++;
        return true;
    }

    @Override
    public boolean treeArc(int state, Arc<W> arc) {
        return true;
    }

    @Override
    public boolean backArc(int state, Arc<W> arc) {
        int t = arc.nextState();
        if (dfnumber[t] < lowlink[state]) {
            lowlink[state] = dfnumber[t];
        }
        if (coaccess[t]) {
            coaccess[state] = true;
        }
        if (t == start) {
            initialCyclic = true;
        }
        return true;
    }

    @Override
    public boolean forwardOrCrossArc(int state, Arc<W> arc) {
        int t = arc.nextState();
        if (dfnumber[t] < dfnumber[state] && onStack[t] && dfnumber[t] < lowlink[state]) {
            lowlink[state] = dfnumber[t];
        }
        if (coaccess[t]) {
            coaccess[state] = true;
        }
        return true;
    }

    @Override
    public void finishState(int state, int parent, Arc<W> parentArc) {
        if (fst.isFinal(state)) {
            coaccess[state] = true;
        }
        if (dfnumber[state] == lowlink[state]) {
            boolean sccCoaccess = false;
            int i = sccStack.size();
            int t;
            do {
                t = sccStack.getInt(--i);
                if (coaccess[t]) {
                    sccCoaccess = true;
                }
            } while (t != state);
            do {
                t = sccStack.removeInt(sccStack.size() - 1);
                scc[t] = nscc;
                if (sccCoaccess) {
                    coaccess[t] = true;
                }
                onStack[t] = false;
            } while (t != state);
            nscc++;
        }
        if (parent != Fst.NO_STATE) {
            if (coaccess[state]) {
                coaccess[parent] = true;
            }
            if (lowlink[state] < lowlink[parent]) {
                lowlink[parent] = lowlink[state];
            }
        }
    }

    @Override
    public void finishVisit() {
        // Tarjan emits sink components first; flip to topological order.
        for (int s = 0; s < scc.length; s++) {
            if (scc[s] >= 0) {
                scc[s] = nscc - 1 - scc[s];
            }
        }
    }

    /**
     * Packages the visit into an immutable result.
     */
    SccResult result(Fst<W> visited, ArcFilter<W> filter) {
        if (result != null) {
            return result;
        }
        int n = scc.length;
        int count = nscc;
        boolean[] cyclic = new boolean[count];
        for (int s = 0; s < n; s++) {
            for (Arc<W> arc : visited.arcs(s)) {
                if (filter.keep(arc) && scc[s] == scc[arc.nextState()]) {
                    cyclic[scc[s]] = true;
                }
            }
            if (visited.isFinal(s)) {
                coaccess[s] = true;
            }
        }
        result = new SccResult(scc, access, coaccess, cyclic, initialCyclic);
        return result;
    }
}
