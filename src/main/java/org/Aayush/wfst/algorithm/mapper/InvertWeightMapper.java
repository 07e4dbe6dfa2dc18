package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.semiring.DivideType;
import org.Aayush.wfst.semiring.WeaklyDivisibleSemiring;

/**
 * Replaces every weight {@code w} with {@code one / w}.
 */
@RequiredArgsConstructor
public final class InvertWeightMapper<W> implements ArcMapper<W> {
    private final WeaklyDivisibleSemiring<W> semiring;

    @Override
    public Arc<W> map(Arc<W> arc) {
        return arc.withWeight(invert(arc.weight()));
    }

    @Override
    public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
        return finalArc.withWeight(invert(finalArc.weight()));
    }

    @Override
    public MapFinalAction finalAction() {
        return MapFinalAction.NO_SUPERFINAL;
    }

    private W invert(W weight) {
        return semiring.divide(semiring.one(), weight, DivideType.ANY);
    }
}
