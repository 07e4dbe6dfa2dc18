package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.fst.Arc;

import java.util.List;

/**
 * Rewrites the whole arc list and the final weight of one state at a time.
 *
 * @param <W> weight type.
 */
public interface StateMapper<W> {

    W mapFinal(int state, W finalWeight);

    /**
     * Returns the replacement arc list of {@code state}; destinations must stay valid state ids.
     */
    List<Arc<W>> mapArcs(int state, List<Arc<W>> arcs);
}
