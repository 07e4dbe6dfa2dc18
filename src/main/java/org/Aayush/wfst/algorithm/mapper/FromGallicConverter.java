package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.GallicAdapter;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.algorithm.WeightConverter;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.semiring.GallicWeight;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.StringWeight;

/**
 * Restores output labels from Gallic weights. Each string must hold at most one label; a
 * labelled final weight becomes an arc to a super-final state.
 */
@RequiredArgsConstructor
public final class FromGallicConverter<W, G> implements WeightConverter<G, W> {
    public static final String REASON_NOT_FACTORED = "FROM_GALLIC_STRING_NOT_FACTORED";

    private final GallicAdapter<W, G> adapter;

    @Override
    public Arc<W> map(Arc<G> arc) {
        GallicWeight<W> g = adapter.toGallic(arc.weight());
        Semiring<W> weights = adapter.gallic().weightSemiring();
        if (adapter.gallic().isZero(g)) {
            return Arc.of(arc.ilabel(), Labels.EPSILON, weights.zero(), arc.nextState());
        }
        return Arc.of(arc.ilabel(), label(g.string()), g.weight(), arc.nextState());
    }

    @Override
    public FinalArc<W> mapFinal(FinalArc<G> finalArc) {
        GallicWeight<W> g = adapter.toGallic(finalArc.weight());
        if (adapter.gallic().isZero(g)) {
            return FinalArc.of(adapter.gallic().weightSemiring().zero());
        }
        return FinalArc.of(Labels.EPSILON, label(g.string()), g.weight());
    }

    @Override
    public MapFinalAction finalAction() {
        return MapFinalAction.ALLOW_SUPERFINAL;
    }

    private static int label(StringWeight s) {
        if (s.isEmpty()) {
            return Labels.EPSILON;
        }
        if (s.size() > 1) {
            throw FstException.precondition(
                    REASON_NOT_FACTORED,
                    "string weight " + s + " holds more than one label; factor the weights first"
            );
        }
        return s.label(0);
    }
}
