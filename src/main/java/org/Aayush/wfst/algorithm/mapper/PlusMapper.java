package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Adds a constant to every weight.
 */
@RequiredArgsConstructor
public final class PlusMapper<W> implements ArcMapper<W> {
    private final Semiring<W> semiring;
    private final W value;

    @Override
    public Arc<W> map(Arc<W> arc) {
        return arc.withWeight(semiring.plus(arc.weight(), value));
    }

    @Override
    public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
        return finalArc.withWeight(semiring.plus(finalArc.weight(), value));
    }

    @Override
    public MapFinalAction finalAction() {
        return MapFinalAction.NO_SUPERFINAL;
    }
}
