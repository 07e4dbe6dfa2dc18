package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Sets every non-zero weight to one.
 */
@RequiredArgsConstructor
public final class RmWeightMapper<W> implements ArcMapper<W> {
    private final Semiring<W> semiring;

    @Override
    public Arc<W> map(Arc<W> arc) {
        return arc.withWeight(strip(arc.weight()));
    }

    @Override
    public FinalArc<W> mapFinal(FinalArc<W> finalArc) {
        return finalArc.withWeight(strip(finalArc.weight()));
    }

    @Override
    public MapFinalAction finalAction() {
        return MapFinalAction.NO_SUPERFINAL;
    }

    @Override
    public long properties(long inProps) {
        long structural = FstProperties.ALL
                & ~(FstProperties.WEIGHTED | FstProperties.UNWEIGHTED
                | FstProperties.WEIGHTED_CYCLES | FstProperties.UNWEIGHTED_CYCLES);
        return (inProps & structural) | FstProperties.UNWEIGHTED | FstProperties.UNWEIGHTED_CYCLES;
    }

    private W strip(W weight) {
        return semiring.isZero(weight) ? weight : semiring.one();
    }
}
