package org.Aayush.wfst.algorithm.mapper;

import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.algorithm.ArcComparators;
import org.Aayush.wfst.algorithm.StateMapper;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.semiring.Semiring;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges arcs sharing input label, output label and destination into one arc carrying the sum of
 * their weights. Arcs come out sorted by that triple; zero-weight sums are dropped.
 */
@RequiredArgsConstructor
public final class ArcSumMapper<W> implements StateMapper<W> {
    private final Semiring<W> semiring;

    @Override
    public W mapFinal(int state, W finalWeight) {
        return finalWeight;
    }

    @Override
    public List<Arc<W>> mapArcs(int state, List<Arc<W>> arcs) {
        List<Arc<W>> sorted = new ArrayList<>(arcs);
        sorted.sort(ArcComparators.labelsThenState());
        List<Arc<W>> out = new ArrayList<>(sorted.size());
        Arc<W> current = null;
        for (Arc<W> arc : sorted) {
            if (current != null
                    && current.ilabel() == arc.ilabel()
                    && current.olabel() == arc.olabel()
                    && current.nextState() == arc.nextState()) {
                current = current.withWeight(semiring.plus(current.weight(), arc.weight()));
                continue;
            }
            if (current != null && !semiring.isZero(current.weight())) {
                out.add(current);
            }
            current = arc;
        }
        if (current != null && !semiring.isZero(current.weight())) {
            out.add(current);
        }
        return out;
    }
}
