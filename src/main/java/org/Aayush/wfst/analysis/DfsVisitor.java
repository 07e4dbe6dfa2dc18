package org.Aayush.wfst.analysis;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;

/**
 * Callbacks of a depth-first traversal driven by {@link DfsVisit}. Returning {@code false} from
 * any arc or state callback stops the traversal after the current stack unwinds.
 *
 * @param <W> weight type.
 */
public interface DfsVisitor<W> {

    void initVisit(Fst<W> fst);

    /**
     * Called when a state is first discovered; {@code root} is the root of its DFS tree.
     */
    boolean initState(int state, int root);

    /** Arc to an undiscovered state. */
    boolean treeArc(int state, Arc<W> arc);

    /** Arc to a state still on the DFS stack; its presence means a cycle. */
    boolean backArc(int state, Arc<W> arc);

    /** Arc to an already finished state. */
    boolean forwardOrCrossArc(int state, Arc<W> arc);

    /**
     * Called when all arcs of a state have been explored. {@code parent} is
     * {@link Fst#NO_STATE} and {@code parentArc} is {@code null} for a DFS tree root.
     */
    void finishState(int state, int parent, Arc<W> parentArc);

    void finishVisit();
}
