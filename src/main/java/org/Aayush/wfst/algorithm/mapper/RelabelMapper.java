package org.Aayush.wfst.algorithm.mapper;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.fst.Arc;

/**
 * Rewrites labels through lookup tables; labels absent from a table are kept.
 */
@RequiredArgsConstructor
public final class RelabelMapper<W> implements ArcMapper<W> {
    private final Int2IntMap inputLabels;
    private final Int2IntMap outputLabels;

    @Override
    public Arc<W> map(Arc<W> arc) {
        int ilabel = inputLabels.getOrDefault(arc.ilabel(), arc.ilabel());
        int olabel = outputLabels.getOrDefault(arc.olabel(), arc.olabel());
        if (ilabel == arc.ilabel() && olabel == arc.olabel()) {
            return arc;
        }
        return Arc.of(ilabel, olabel, arc.weight(), arc.nextState());
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
