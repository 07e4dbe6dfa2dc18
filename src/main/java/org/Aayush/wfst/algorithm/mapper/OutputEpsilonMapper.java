package org.Aayush.wfst.algorithm.mapper;

import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Labels;

/**
 * Replaces every output label with epsilon.
 */
public final class OutputEpsilonMapper<W> implements ArcMapper<W> {

    @Override
    public Arc<W> map(Arc<W> arc) {
        return arc.olabel() == Labels.EPSILON ? arc : arc.withOlabel(Labels.EPSILON);
    }

    @Override
    public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
        return finalArc;
    }

    @Override
    public MapFinalAction finalAction() {
        return MapFinalAction.NO_SUPERFINAL;
    }
}
