package org.Aayush.wfst.analysis;

import org.Aayush.wfst.fst.Arc;

/**
 * Decides which arcs a traversal follows.
 *
 * @param <W> weight type.
 */
@FunctionalInterface
public interface ArcFilter<W> {
    boolean keep(Arc<W> arc);
}
