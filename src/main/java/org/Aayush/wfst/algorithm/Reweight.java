package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.fst.MutableFst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.DivideType;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.SemiringProperty;
import org.Aayush.wfst.semiring.WeaklyDivisibleSemiring;

import java.util.List;
import java.util.Objects;

/**
 * Redistributes weight along paths using per-state potentials.
 *
 * <p>For {@link ReweightType#TO_INITIAL} an arc {@code p -> q} with weight {@code w} becomes
 * {@code V(p)^-1 w V(q)} and a final weight {@code f} becomes {@code V(p)^-1 f}; for
 * {@link ReweightType#TO_FINAL} the arc becomes {@code V(p) w V(q)^-1} and the final weight
 * {@code V(p) f}. The start potential is then applied at the start state so every path keeps
 * its weight.</p>
 */
public final class Reweight {
    public static final String REASON_NOT_DIVISIBLE = "REWEIGHT_SEMIRING_NOT_DIVISIBLE";
    public static final String REASON_WRONG_SIDE = "REWEIGHT_SEMIRING_WRONG_SIDE";

    private Reweight() {
    }

    public static <W> void reweight(MutableFst<W> fst, List<W> potentials, ReweightType type) {
        Objects.requireNonNull(potentials, "potentials");
        Objects.requireNonNull(type, "type");
        if (fst.numStates() == 0) {
            return;
        }
        WeaklyDivisibleSemiring<W> semiring = divisible(fst.semiring());
        SemiringProperty side = type == ReweightType.TO_INITIAL
                ? SemiringProperty.LEFT_SEMIRING
                : SemiringProperty.RIGHT_SEMIRING;
        if (!semiring.hasProperty(side)) {
            throw FstException.precondition(
                    REASON_WRONG_SIDE,
                    "reweighting " + type + " requires a " + side + " semiring, got " + semiring.name()
            );
        }
        int n = fst.numStates();
        for (int s = 0; s < n && s < potentials.size(); s++) {
            W potential = potentials.get(s);
            if (semiring.isZero(potential)) {
                continue;
            }
            int arcs = fst.numArcs(s);
            for (int i = 0; i < arcs; i++) {
                Arc<W> arc = fst.arc(s, i);
                int t = arc.nextState();
                if (t >= potentials.size() || semiring.isZero(potentials.get(t))) {
                    continue;
                }
                W next = potentials.get(t);
                W w = type == ReweightType.TO_INITIAL
                        ? semiring.divide(semiring.times(arc.weight(), next), potential, DivideType.LEFT)
                        : semiring.divide(semiring.times(potential, arc.weight()), next, DivideType.RIGHT);
                fst.setArc(s, i, arc.withWeight(w));
            }
            if (type == ReweightType.TO_INITIAL) {
                fst.setFinal(s, semiring.divide(fst.finalWeight(s), potential, DivideType.LEFT));
            } else {
                fst.setFinal(s, semiring.times(potential, fst.finalWeight(s)));
            }
        }
        int start = fst.start();
        if (start == Fst.NO_STATE || start >= potentials.size()) {
            return;
        }
        W startWeight = potentials.get(start);
        if (semiring.isOne(startWeight) || semiring.isZero(startWeight)) {
            return;
        }
        W applied = type == ReweightType.TO_INITIAL
                ? startWeight
                : semiring.divide(semiring.one(), startWeight, DivideType.RIGHT);
        if (fst.hasProperties(FstProperties.INITIAL_ACYCLIC)) {
            int arcs = fst.numArcs(start);
            for (int i = 0; i < arcs; i++) {
                Arc<W> arc = fst.arc(start, i);
                fst.setArc(start, i, arc.withWeight(semiring.times(applied, arc.weight())));
            }
            fst.setFinal(start, semiring.times(applied, fst.finalWeight(start)));
        } else {
            int newStart = fst.addState();
            fst.addArc(newStart, Arc.of(Labels.EPSILON, Labels.EPSILON, applied, start));
            fst.setStart(newStart);
        }
    }

    /**
     * Divides {@code weight} out of every path, at the start state or at the final states.
     */
    public static <W> void removeWeight(MutableFst<W> fst, W weight, boolean atFinal) {
        WeaklyDivisibleSemiring<W> semiring = divisible(fst.semiring());
        if (fst.start() == Fst.NO_STATE || semiring.isOne(weight) || semiring.isZero(weight)) {
            return;
        }
        if (atFinal) {
            for (int s = 0; s < fst.numStates(); s++) {
                if (fst.isFinal(s)) {
                    fst.setFinal(s, semiring.divide(fst.finalWeight(s), weight, DivideType.RIGHT));
                }
            }
            return;
        }
        int start = fst.start();
        int arcs = fst.numArcs(start);
        for (int i = 0; i < arcs; i++) {
            Arc<W> arc = fst.arc(start, i);
            fst.setArc(start, i, arc.withWeight(semiring.divide(arc.weight(), weight, DivideType.LEFT)));
        }
        fst.setFinal(start, semiring.divide(fst.finalWeight(start), weight, DivideType.LEFT));
    }

    static <W> WeaklyDivisibleSemiring<W> divisible(Semiring<W> semiring) {
        if (!(semiring instanceof WeaklyDivisibleSemiring)) {
            throw FstException.precondition(
                    REASON_NOT_DIVISIBLE,
                    "operation requires a weakly divisible semiring, got " + semiring.name()
            );
        }
        return (WeaklyDivisibleSemiring<W>) semiring;
    }
}
