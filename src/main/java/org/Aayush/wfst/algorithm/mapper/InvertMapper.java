package org.Aayush.wfst.algorithm.mapper;

import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.properties.FstProperties;

/**
 * Swaps input and output labels.
 */
public final class InvertMapper<W> implements ArcMapper<W> {

    @Override
    public Arc<W> map(Arc<W> arc) {
        return Arc.of(arc.olabel(), arc.ilabel(), arc.weight(), arc.nextState());
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
        long out = inProps;
        out = swap(out, inProps, FstProperties.I_DETERMINISTIC, FstProperties.O_DETERMINISTIC);
        out = swap(out, inProps, FstProperties.NON_I_DETERMINISTIC, FstProperties.NON_O_DETERMINISTIC);
        out = swap(out, inProps, FstProperties.I_EPSILONS, FstProperties.O_EPSILONS);
        out = swap(out, inProps, FstProperties.NO_I_EPSILONS, FstProperties.NO_O_EPSILONS);
        out = swap(out, inProps, FstProperties.I_LABEL_SORTED, FstProperties.O_LABEL_SORTED);
        out = swap(out, inProps, FstProperties.NOT_I_LABEL_SORTED, FstProperties.NOT_O_LABEL_SORTED);
        return out;
    }

    private static long swap(long out, long in, long a, long b) {
        long cleared = out & ~(a | b);
        if ((in & a) != 0) {
            cleared |= b;
        }
        if ((in & b) != 0) {
            cleared |= a;
        }
        return cleared;
    }
}
