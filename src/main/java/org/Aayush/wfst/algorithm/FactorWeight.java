package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.Semiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Splits weights into factors, pushing the second factor of each split into the destination
 * state. Each output state stands for a pair of an input state (or none, for a pending final
 * residual) and the residual weight still to be emitted.
 */
public final class FactorWeight {
    private static final Logger LOGGER = LoggerFactory.getLogger(FactorWeight.class);

    public static final int FACTOR_FINAL_WEIGHTS = 0x1;
    public static final int FACTOR_ARC_WEIGHTS = 0x2;

    private FactorWeight() {
    }

    private static final class Element<W> {
        final int state;
        final W residual;

        Element(int state, W residual) {
            this.state = state;
            this.residual = residual;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Element)) {
                return false;
            }
            Element<?> other = (Element<?>) o;
            return state == other.state && residual.equals(other.residual);
        }

        @Override
        public int hashCode() {
            return 31 * state + residual.hashCode();
        }
    }

    /**
     * @param mode bitwise or of {@link #FACTOR_FINAL_WEIGHTS} and {@link #FACTOR_ARC_WEIGHTS}.
     * @param delta quantization applied to residuals before state lookup.
     */
    public static <W> VectorFst<W> factorWeight(Fst<W> fst, WeightFactorizer<W> factorizer, int mode, float delta) {
        Objects.requireNonNull(factorizer, "factorizer");
        Semiring<W> semiring = fst.semiring();
        VectorFst<W> out = new VectorFst<>(semiring);
        if (fst.start() == Fst.NO_STATE) {
            return out;
        }
        boolean factorFinals = (mode & FACTOR_FINAL_WEIGHTS) != 0;
        boolean factorArcs = (mode & FACTOR_ARC_WEIGHTS) != 0;
        ObjectArrayList<Element<W>> elements = new ObjectArrayList<>();
        Object2IntOpenHashMap<Element<W>> ids = new Object2IntOpenHashMap<>();
        ids.defaultReturnValue(Fst.NO_STATE);
        IntArrayFIFOQueue pending = new IntArrayFIFOQueue();

        out.setStart(find(new Element<>(fst.start(), semiring.one()), elements, ids, out, pending));
        while (!pending.isEmpty()) {
            int s = pending.dequeueInt();
            Element<W> e = elements.get(s);
            boolean hasFinal = e.state == Fst.NO_STATE || fst.isFinal(e.state);
            W finalWeight = e.state == Fst.NO_STATE
                    ? e.residual
                    : semiring.times(e.residual, fst.finalWeight(e.state));
            List<WeightFactor<W>> finalFactors = hasFinal && factorFinals
                    ? factorizer.factor(finalWeight)
                    : List.of();
            out.setFinal(s, finalFactors.isEmpty() ? finalWeight : semiring.zero());
            if (e.state != Fst.NO_STATE) {
                for (Arc<W> arc : fst.arcs(e.state)) {
                    W value = semiring.times(e.residual, arc.weight());
                    List<WeightFactor<W>> factors = factorArcs ? factorizer.factor(value) : List.of();
                    if (factors.isEmpty()) {
                        int dest = find(new Element<>(arc.nextState(), semiring.one()), elements, ids, out, pending);
                        out.addArc(s, Arc.of(arc.ilabel(), arc.olabel(), value, dest));
                        continue;
                    }
                    for (WeightFactor<W> f : factors) {
                        Element<W> next = new Element<>(arc.nextState(), semiring.quantize(f.second(), delta));
                        int dest = find(next, elements, ids, out, pending);
                        out.addArc(s, Arc.of(arc.ilabel(), arc.olabel(), f.first(), dest));
                    }
                }
            }
            for (WeightFactor<W> f : finalFactors) {
                Element<W> next = new Element<>(Fst.NO_STATE, semiring.quantize(f.second(), delta));
                int dest = find(next, elements, ids, out, pending);
                out.addArc(s, Arc.of(Labels.EPSILON, Labels.EPSILON, f.first(), dest));
            }
        }
        LOGGER.debug("factor weight expanded {} states into {}", fst.numStates(), out.numStates());
        return out;
    }

    private static <W> int find(
            Element<W> element,
            ObjectArrayList<Element<W>> elements,
            Object2IntOpenHashMap<Element<W>> ids,
            VectorFst<W> out,
            IntArrayFIFOQueue pending
    ) {
        int id = ids.getInt(element);
        if (id != Fst.NO_STATE) {
            return id;
        }
        id = out.addState();
        elements.add(element);
        ids.put(element, id);
        pending.enqueue(id);
        return id;
    }
}
