package org.Aayush.wfst.analysis;

import org.Aayush.wfst.fst.Labels;

/**
 * Stock arc filters.
 */
public final class ArcFilters {

    private ArcFilters() {
    }

    /** Follows every arc. */
    public static <W> ArcFilter<W> any() {
        return arc -> true;
    }

    /** Follows only {@code eps:eps} arcs. */
    public static <W> ArcFilter<W> epsilon() {
        return arc -> arc.ilabel() == Labels.EPSILON && arc.olabel() == Labels.EPSILON;
    }

    /** Follows arcs with an epsilon input label. */
    public static <W> ArcFilter<W> inputEpsilon() {
        return arc -> arc.ilabel() == Labels.EPSILON;
    }

    /** Follows arcs with an epsilon output label. */
    public static <W> ArcFilter<W> outputEpsilon() {
        return arc -> arc.olabel() == Labels.EPSILON;
    }
}
