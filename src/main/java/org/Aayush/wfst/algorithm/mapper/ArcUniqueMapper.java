package org.Aayush.wfst.algorithm.mapper;

import org.Aayush.wfst.algorithm.ArcComparators;
import org.Aayush.wfst.algorithm.StateMapper;
import org.Aayush.wfst.fst.Arc;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Removes exact duplicate arcs (same labels, weight and destination). Arcs come out sorted by
 * input label, output label and destination.
 */
public final class ArcUniqueMapper<W> implements StateMapper<W> {

    @Override
    public W mapFinal(int state, W finalWeight) {
        return finalWeight;
    }

    @Override
    public List<Arc<W>> mapArcs(int state, List<Arc<W>> arcs) {
        List<Arc<W>> sorted = new ArrayList<>(arcs);
        sorted.sort(ArcComparators.labelsThenState());
        return new ArrayList<>(new LinkedHashSet<>(sorted));
    }
}
