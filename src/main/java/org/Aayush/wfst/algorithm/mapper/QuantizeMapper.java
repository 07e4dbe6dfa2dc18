package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Snaps every weight to its quantized representative.
 */
@RequiredArgsConstructor
public final class QuantizeMapper<W> implements ArcMapper<W> {
    private final Semiring<W> semiring;
    private final float delta;

    @Override
    public Arc<W> map(Arc<W> arc) {
        return arc.withWeight(semiring.quantize(arc.weight(), delta));
    }

    @Override
    public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
        return finalArc.withWeight(semiring.quantize(finalArc.weight(), delta));
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
