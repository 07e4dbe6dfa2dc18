package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.ArcMapper;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.MapFinalAction;
import org.Aayush.wfst.algorithm.ProjectType;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.properties.FstProperties;

/**
 * Copies one side's labels onto the other, turning a transducer into an acceptor.
 */
@RequiredArgsConstructor
public final class ProjectMapper<W> implements ArcMapper<W> {
    private final ProjectType type;

    @Override
    public Arc<W> map(Arc<W> arc) {
        int label = type == ProjectType.INPUT ? arc.ilabel() : arc.olabel();
        if (arc.ilabel() == label && arc.olabel() == label) {
            return arc;
        }
        return Arc.of(label, label, arc.weight(), arc.nextState());
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
        long structural = FstProperties.CYCLIC | FstProperties.ACYCLIC
                | FstProperties.INITIAL_CYCLIC | FstProperties.INITIAL_ACYCLIC
                | FstProperties.TOP_SORTED | FstProperties.NOT_TOP_SORTED
                | FstProperties.ACCESSIBLE | FstProperties.NOT_ACCESSIBLE
                | FstProperties.COACCESSIBLE | FstProperties.NOT_COACCESSIBLE
                | FstProperties.WEIGHTED | FstProperties.UNWEIGHTED
                | FstProperties.STRING | FstProperties.NOT_STRING;
        return (inProps & structural) | FstProperties.ACCEPTOR;
    }
}
