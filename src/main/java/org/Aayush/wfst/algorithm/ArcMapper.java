package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.fst.Arc;

/**
 * Rewrites arcs and final weights one at a time without changing the weight type.
 *
 * @param <W> weight type.
 */
public interface ArcMapper<W> {

    Arc<W> map(Arc<W> arc);

    FinalArc<W> mapFinal(FinalArc<W> finalArc);

    MapFinalAction finalAction();

    /**
     * Properties guaranteed on the output given the input properties {@code inProps}; zero when
     * nothing can be guaranteed.
     */
    default long properties(long inProps) {
        return 0L;
    }
}
