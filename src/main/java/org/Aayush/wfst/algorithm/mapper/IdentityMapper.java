package org.Aayush.wfst.algorithm.mapper;

import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.fst.Arc;

/**
 * Leaves everything unchanged.
 */
public final class IdentityMapper<W> implements ArcMapper<W> {

    @Override
    public Arc<W> map(Arc<W> arc) {
        return arc;
    }

    @Override
    public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
        return finalArc;
    }

    @Override
    public MapFinalAction finalAction() {
        return MapFinalAction.NO_SUPERFINAL;
    }

    @Override
    public long properties(long inProps) {
        return inProps;
    }
}
