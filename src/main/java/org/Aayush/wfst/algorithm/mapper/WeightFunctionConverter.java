package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.algorithm.WeightConverter;
import org.Aayush.wfst.fst.Arc;

import java.util.function.Function;

/**
 * Converts every weight with a plain function, keeping labels and destinations.
 */
@RequiredArgsConstructor
public final class WeightFunctionConverter<W1, W2> implements WeightConverter<W1, W2> {
    private final Function<W1, W2> function;

    @Override
    public Arc<W2> map(Arc<W1> arc) {
        return Arc.of(arc.ilabel(), arc.olabel(), function.apply(arc.weight()), arc.nextState());
    }

    @Override
    public FinalArc<W2> mapFinal(FinalArc<W1> finalArc) {
        return FinalArc.of(finalArc.ilabel(), finalArc.olabel(), function.apply(finalArc.weight()));
    }

    @Override
    public MapFinalAction finalAction() {
        return MapFinalAction.NO_SUPERFINAL;
    }
}
