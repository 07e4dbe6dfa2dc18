package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.GallicAdapter;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.algorithm.WeightConverter;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.semiring.GallicWeight;
import org.Aayush.wfst.semiring.StringWeight;

/**
 * Moves each output label into the weight: {@code i:o/w} becomes {@code i:i/(o, w)}.
 */
@RequiredArgsConstructor
public final class ToGallicConverter<W, G> implements WeightConverter<W, G> {
    private final GallicAdapter<W, G> adapter;

    @Override
    public Arc<G> map(Arc<W> arc) {
        StringWeight s = arc.olabel() == Labels.EPSILON ? StringWeight.EPSILON : StringWeight.of(arc.olabel());
        return Arc.of(arc.ilabel(), arc.ilabel(), lift(s, arc.weight()), arc.nextState());
    }

    @Override
    public FinalArc<G> mapFinal(FinalArc<W> finalArc) {
        return FinalArc.of(lift(StringWeight.EPSILON, finalArc.weight()));
    }

    @Override
    public MapFinalAction finalAction() {
        return MapFinalAction.NO_SUPERFINAL;
    }

    private G lift(StringWeight s, W weight) {
        if (adapter.gallic().weightSemiring().isZero(weight)) {
            return adapter.semiring().zero();
        }
        return adapter.fromGallic(GallicWeight.of(s, weight));
    }
}
