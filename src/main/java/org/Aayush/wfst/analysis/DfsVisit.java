package org.Aayush.wfst.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;

import java.util.Objects;

/**
 * Iterative depth-first traversal with an explicit stack, so deep automata never overflow the
 * call stack.
 */
public final class DfsVisit {
    private static final byte WHITE = 0;
    private static final byte GREY = 1;
    private static final byte BLACK = 2;

    private DfsVisit() {
    }

    public static <W> void visit(Fst<W> fst, DfsVisitor<W> visitor) {
        visit(fst, visitor, ArcFilters.any(), false);
    }

    /**
     * Visits states reachable from the start state first, then (unless {@code accessOnly}) every
     * remaining state in id order as a new tree root. Without a start state the full visit roots
     * at state 0 and the access-only visit sees nothing.
     */
    public static <W> void visit(Fst<W> fst, DfsVisitor<W> visitor, ArcFilter<W> filter, boolean accessOnly) {
        Objects.requireNonNull(fst, "fst");
        Objects.requireNonNull(visitor, "visitor");
        Objects.requireNonNull(filter, "filter");
        visitor.initVisit(fst);
        int start = fst.start();
        int n = fst.numStates();
        if (n == 0 || (start == Fst.NO_STATE && accessOnly)) {
            visitor.finishVisit();
            return;
        }
        byte[] color = new byte[n];
        IntArrayList stackStates = new IntArrayList();
        IntArrayList stackPositions = new IntArrayList();

        boolean dfs = true;
        int root = start == Fst.NO_STATE ? 0 : start;
        while (dfs && root < n) {
            color[root] = GREY;
            stackStates.add(root);
            stackPositions.add(0);
            dfs = visitor.initState(root, root);
            while (!stackStates.isEmpty()) {
                int top = stackStates.size() - 1;
                int s = stackStates.getInt(top);
                int position = stackPositions.getInt(top);
                if (!dfs || position >= fst.numArcs(s)) {
                    color[s] = BLACK;
                    stackStates.removeInt(top);
                    stackPositions.removeInt(top);
                    if (top > 0) {
                        int parent = stackStates.getInt(top - 1);
                        int parentPosition = stackPositions.getInt(top - 1);
                        visitor.finishState(s, parent, fst.arc(parent, parentPosition));
                        stackPositions.set(top - 1, parentPosition + 1);
                    } else {
                        visitor.finishState(s, Fst.NO_STATE, null);
                    }
                    continue;
                }
                Arc<W> arc = fst.arc(s, position);
                if (!filter.keep(arc)) {
                    stackPositions.set(top, position + 1);
                    continue;
                }
                int next = arc.nextState();
                switch (color[next]) {
                    case WHITE:
                        dfs = visitor.treeArc(s, arc);
                        if (!dfs) {
                            break;
                        }
                        color[next] = GREY;
                        stackStates.add(next);
                        stackPositions.add(0);
                        dfs = visitor.initState(next, root);
                        break;
                    case GREY:
                        dfs = visitor.backArc(s, arc);
                        stackPositions.set(top, position + 1);
                        break;
                    default:
                        dfs = visitor.forwardOrCrossArc(s, arc);
                        stackPositions.set(top, position + 1);
                        break;
                }
            }
            if (accessOnly) {
                break;
            }
            root = root == start ? 0 : root + 1;
            while (root < n && color[root] != WHITE) {
                root++;
            }
        }
        visitor.finishVisit();
    }
}
