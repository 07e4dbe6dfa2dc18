package org.Aayush.wfst.properties;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.Aayush.wfst.analysis.SccResult;
import org.Aayush.wfst.analysis.SccVisitor;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.semiring.Semiring;

import static org.Aayush.wfst.properties.FstProperties.*;

/**
 * Computes the full property word of an automaton in one pass over its arcs plus one SCC pass.
 */
public final class PropertiesComputer {

    private PropertiesComputer() {
    }

    public static <W> long compute(Fst<W> fst) {
        Semiring<W> semiring = fst.semiring();
        int n = fst.numStates();

        boolean acceptor = true;
        boolean iDeterministic = true;
        boolean oDeterministic = true;
        boolean epsilons = false;
        boolean iEpsilons = false;
        boolean oEpsilons = false;
        boolean iSorted = true;
        boolean oSorted = true;
        boolean weighted = false;
        boolean topSorted = true;

        IntOpenHashSet iLabels = new IntOpenHashSet();
        IntOpenHashSet oLabels = new IntOpenHashSet();
        for (int s = 0; s < n; s++) {
            iLabels.clear();
            oLabels.clear();
            Arc<W> previous = null;
            for (Arc<W> arc : fst.arcs(s)) {
                if (arc.ilabel() != arc.olabel()) {
                    acceptor = false;
                }
                if (arc.ilabel() == Labels.EPSILON && arc.olabel() == Labels.EPSILON) {
                    epsilons = true;
                }
                if (arc.ilabel() == Labels.EPSILON) {
                    iEpsilons = true;
                }
                if (arc.olabel() == Labels.EPSILON) {
                    oEpsilons = true;
                }
                if (!iLabels.add(arc.ilabel())) {
                    iDeterministic = false;
                }
                if (!oLabels.add(arc.olabel())) {
                    oDeterministic = false;
                }
                if (previous != null) {
                    if (arc.ilabel() < previous.ilabel()) {
                        iSorted = false;
                    }
                    if (arc.olabel() < previous.olabel()) {
                        oSorted = false;
                    }
                }
                if (!semiring.isOne(arc.weight()) && !semiring.isZero(arc.weight())) {
                    weighted = true;
                }
                if (arc.nextState() <= s) {
                    topSorted = false;
                }
                previous = arc;
            }
            W finalWeight = fst.finalWeight(s);
            if (!semiring.isOne(finalWeight) && !semiring.isZero(finalWeight)) {
                weighted = true;
            }
        }

        SccResult scc = SccVisitor.compute(fst);
        boolean weightedCycles = false;
        for (int s = 0; s < n && !weightedCycles; s++) {
            for (Arc<W> arc : fst.arcs(s)) {
                if (scc.component(s) == scc.component(arc.nextState()) && !semiring.isOne(arc.weight())) {
                    weightedCycles = true;
                    break;
                }
            }
        }

        long props = 0L;
        props |= acceptor ? ACCEPTOR : NOT_ACCEPTOR;
        props |= iDeterministic ? I_DETERMINISTIC : NON_I_DETERMINISTIC;
        props |= oDeterministic ? O_DETERMINISTIC : NON_O_DETERMINISTIC;
        props |= epsilons ? EPSILONS : NO_EPSILONS;
        props |= iEpsilons ? I_EPSILONS : NO_I_EPSILONS;
        props |= oEpsilons ? O_EPSILONS : NO_O_EPSILONS;
        props |= iSorted ? I_LABEL_SORTED : NOT_I_LABEL_SORTED;
        props |= oSorted ? O_LABEL_SORTED : NOT_O_LABEL_SORTED;
        props |= weighted ? WEIGHTED : UNWEIGHTED;
        props |= scc.cyclic() ? CYCLIC : ACYCLIC;
        props |= scc.initialCyclic() ? INITIAL_CYCLIC : INITIAL_ACYCLIC;
        props |= topSorted ? TOP_SORTED : NOT_TOP_SORTED;
        props |= scc.allAccessible() ? ACCESSIBLE : NOT_ACCESSIBLE;
        props |= scc.allCoaccessible() ? COACCESSIBLE : NOT_COACCESSIBLE;
        props |= isString(fst) ? STRING : NOT_STRING;
        props |= weightedCycles ? WEIGHTED_CYCLES : UNWEIGHTED_CYCLES;
        return props;
    }

    /**
     * A string automaton is a single chain {@code 0 -> 1 -> ... -> n-1} whose last state alone is
     * final. The empty automaton counts as a string.
     */
    private static <W> boolean isString(Fst<W> fst) {
        int n = fst.numStates();
        if (n == 0) {
            return true;
        }
        if (fst.start() != 0) {
            return false;
        }
        for (int s = 0; s < n; s++) {
            boolean last = s == n - 1;
            if (last) {
                if (fst.numArcs(s) != 0 || !fst.isFinal(s)) {
                    return false;
                }
            } else if (fst.numArcs(s) != 1 || fst.arc(s, 0).nextState() != s + 1 || fst.isFinal(s)) {
                return false;
            }
        }
        return true;
    }
}
