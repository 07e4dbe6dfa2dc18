package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.mapper.FromGallicConverter;
import org.Aayush.wfst.algorithm.mapper.ToGallicConverter;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.DivideType;
import org.Aayush.wfst.semiring.GallicSemiring;
import org.Aayush.wfst.semiring.GallicType;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.SemiringProperty;
import org.Aayush.wfst.semiring.StringSemiring;
import org.Aayush.wfst.semiring.WeaklyDivisibleSemiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Weighted subset construction.
 *
 * <p>Each output state is a set of input states paired with residual weights, sorted by state.
 * Acceptors are determinized directly; transducers are first mapped into a Gallic semiring so
 * output labels travel as weights, then factored and mapped back.</p>
 *
 * <p>Termination is guaranteed only for determinizable inputs (e.g. acyclic automata or
 * automata with the twins property over a path semiring).</p>
 */
public final class Determinize {
    private static final Logger LOGGER = LoggerFactory.getLogger(Determinize.class);

    public static final String REASON_NON_FUNCTIONAL = "DETERMINIZE_NON_FUNCTIONAL_INPUT";
    public static final String REASON_NOT_LEFT_SEMIRING = "DETERMINIZE_NOT_LEFT_SEMIRING";
    public static final String REASON_NOT_PATH_SEMIRING = "DETERMINIZE_DISAMBIGUATE_NOT_PATH_SEMIRING";

    private Determinize() {
    }

    public static <W> VectorFst<W> determinize(Fst<W> fst) {
        return determinize(fst, DeterminizeConfig.defaults());
    }

    /**
     * Returns an input-deterministic automaton equivalent to {@code fst}.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} when the semiring is not weakly left
     * divisible, or when {@link DeterminizeType#FUNCTIONAL} meets a non-functional transducer.
     */
    public static <W> VectorFst<W> determinize(Fst<W> fst, DeterminizeConfig config) {
        Objects.requireNonNull(fst, "fst");
        Objects.requireNonNull(config, "config");
        WeaklyDivisibleSemiring<W> semiring = Reweight.divisible(fst.semiring());
        if (!semiring.hasProperty(SemiringProperty.LEFT_SEMIRING)) {
            throw FstException.precondition(
                    REASON_NOT_LEFT_SEMIRING,
                    "determinization requires a left semiring, got " + semiring.name()
            );
        }
        VectorFst<W> out;
        if (fst.hasProperties(FstProperties.ACCEPTOR)) {
            out = determinizeFsa(fst, semiring, semiring::plus, config.getDelta());
        } else {
            out = determinizeFst(fst, config);
        }
        LOGGER.debug("determinize {} states into {}", fst.numStates(), out.numStates());
        return out;
    }

    private static <W> VectorFst<W> determinizeFst(Fst<W> fst, DeterminizeConfig config) {
        Semiring<W> weights = fst.semiring();
        switch (config.getType()) {
            case NONFUNCTIONAL:
                return viaGallic(fst, GallicAdapter.union(new GallicSemiring<>(GallicType.RESTRICT, weights)), config);
            case DISAMBIGUATE:
                if (!weights.hasProperty(SemiringProperty.PATH)) {
                    throw FstException.precondition(
                            REASON_NOT_PATH_SEMIRING,
                            "disambiguation requires a path semiring, got " + weights.name()
                    );
                }
                return viaGallic(fst, GallicAdapter.of(new GallicSemiring<>(GallicType.MIN, weights)), config);
            default:
                try {
                    return viaGallic(fst, GallicAdapter.of(new GallicSemiring<>(GallicType.RESTRICT, weights)), config);
                } catch (FstException ex) {
                    if (StringSemiring.REASON_NON_FUNCTIONAL.equals(ex.reasonCode())) {
                        throw new FstException(
                                FstException.ErrorKind.PRECONDITION_VIOLATED,
                                REASON_NON_FUNCTIONAL,
                                "input transducer is not functional; use NONFUNCTIONAL or DISAMBIGUATE",
                                ex
                        );
                    }
                    throw ex;
                }
        }
    }

    private static <W, G> VectorFst<W> viaGallic(Fst<W> fst, GallicAdapter<W, G> adapter, DeterminizeConfig config) {
        VectorFst<G> gfst = WeightConvert.convert(fst, adapter.semiring(), new ToGallicConverter<>(adapter));
        VectorFst<G> determinized = determinizeFsa(gfst, adapter.semiring(), adapter::commonDivisor, config.getDelta());
        VectorFst<G> factored = FactorWeight.factorWeight(
                determinized,
                adapter.factorizer(),
                FactorWeight.FACTOR_FINAL_WEIGHTS,
                config.getDelta()
        );
        return WeightConvert.convert(factored, fst.semiring(), new FromGallicConverter<>(adapter));
    }

    /**
     * Output state: input states sorted ascending, each with its residual. Identity uses the
     * residuals quantized to the delta grid; the exact residuals are carried for the arithmetic.
     */
    private static final class Subset<W> {
        final int[] states;
        final ObjectArrayList<W> residuals;
        final ObjectArrayList<W> keys;
        final int hash;

        Subset(int[] states, ObjectArrayList<W> residuals, ObjectArrayList<W> keys) {
            this.states = states;
            this.residuals = residuals;
            this.keys = keys;
            this.hash = 31 * Arrays.hashCode(states) + keys.hashCode();
        }

        W residual(int i) {
            return residuals.get(i);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Subset)) {
                return false;
            }
            Subset<?> other = (Subset<?>) o;
            return hash == other.hash
                    && Arrays.equals(states, other.states)
                    && keys.equals(other.keys);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    /** Transitions of one subset leaving on one label. */
    private static final class LabelGroup<W> {
        final Targets<W> targets = new Targets<>();
        W divisor;

        LabelGroup(W zero) {
            this.divisor = zero;
        }
    }

    private static final class Targets<W> {
        final IntArrayList states = new IntArrayList();
        final ObjectArrayList<W> weights = new ObjectArrayList<>();

        void add(int state, W weight) {
            states.add(state);
            weights.add(weight);
        }
    }

    /**
     * Subset construction over an automaton whose input and output labels agree.
     *
     * @param commonDivisor folds the weights leaving a subset on one label into the arc weight.
     */
    static <W> VectorFst<W> determinizeFsa(
            Fst<W> fst,
            WeaklyDivisibleSemiring<W> semiring,
            BinaryOperator<W> commonDivisor,
            float delta
    ) {
        VectorFst<W> out = new VectorFst<>(semiring);
        if (fst.start() == Fst.NO_STATE) {
            return out;
        }
        ObjectArrayList<Subset<W>> subsets = new ObjectArrayList<>();
        Object2IntOpenHashMap<Subset<W>> ids = new Object2IntOpenHashMap<>();
        ids.defaultReturnValue(Fst.NO_STATE);
        IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
        ObjectArrayList<W> one = new ObjectArrayList<>();
        one.add(semiring.one());
        Subset<W> initial = new Subset<>(new int[]{fst.start()}, one, one);
        out.setStart(find(initial, subsets, ids, out, pending));

        while (!pending.isEmpty()) {
            int s = pending.dequeueInt();
            Subset<W> subset = subsets.get(s);
            W finalWeight = semiring.zero();
            Int2ObjectSortedMap<LabelGroup<W>> groups = new Int2ObjectAVLTreeMap<>();
            for (int i = 0; i < subset.states.length; i++) {
                int q = subset.states[i];
                W residual = subset.residual(i);
                if (fst.isFinal(q)) {
                    finalWeight = semiring.plus(finalWeight, semiring.times(residual, fst.finalWeight(q)));
                }
                for (Arc<W> arc : fst.arcs(q)) {
                    LabelGroup<W> group = groups.get(arc.ilabel());
                    if (group == null) {
                        group = new LabelGroup<>(semiring.zero());
                        groups.put(arc.ilabel(), group);
                    }
                    W w = semiring.times(residual, arc.weight());
                    group.divisor = commonDivisor.apply(group.divisor, w);
                    group.targets.add(arc.nextState(), w);
                }
            }
            out.setFinal(s, finalWeight);
            for (Int2ObjectMap.Entry<LabelGroup<W>> entry : groups.int2ObjectEntrySet()) {
                LabelGroup<W> group = entry.getValue();
                if (semiring.isZero(group.divisor)) {
                    continue;
                }
                Subset<W> next = normalize(group, semiring, delta);
                if (next == null) {
                    continue;
                }
                int dest = find(next, subsets, ids, out, pending);
                out.addArc(s, Arc.of(entry.getIntKey(), entry.getIntKey(), group.divisor, dest));
            }
        }
        return out;
    }

    // Merges targets by state, divides out the arc weight and drops residuals that quantize to zero.
    private static <W> Subset<W> normalize(LabelGroup<W> group, WeaklyDivisibleSemiring<W> semiring, float delta) {
        Int2ObjectAVLTreeMap<W> merged = new Int2ObjectAVLTreeMap<>();
        Targets<W> targets = group.targets;
        for (int i = 0; i < targets.states.size(); i++) {
            int t = targets.states.getInt(i);
            W w = targets.weights.get(i);
            W previous = merged.get(t);
            merged.put(t, previous == null ? w : semiring.plus(previous, w));
        }
        IntArrayList states = new IntArrayList(merged.size());
        ObjectArrayList<W> residuals = new ObjectArrayList<>(merged.size());
        ObjectArrayList<W> keys = new ObjectArrayList<>(merged.size());
        for (Int2ObjectMap.Entry<W> e : merged.int2ObjectEntrySet()) {
            W r = semiring.divide(e.getValue(), group.divisor, DivideType.LEFT);
            W key = semiring.quantize(r, delta);
            if (semiring.isZero(key)) {
                continue;
            }
            states.add(e.getIntKey());
            residuals.add(r);
            keys.add(key);
        }
        if (states.isEmpty()) {
            return null;
        }
        return new Subset<>(states.toIntArray(), residuals, keys);
    }

    private static <W> int find(
            Subset<W> subset,
            List<Subset<W>> subsets,
            Object2IntOpenHashMap<Subset<W>> ids,
            VectorFst<W> out,
            IntArrayFIFOQueue pending
    ) {
        int id = ids.getInt(subset);
        if (id != Fst.NO_STATE) {
            return id;
        }
        id = out.addState();
        subsets.add(subset);
        ids.put(subset, id);
        pending.enqueue(id);
        return id;
    }
}
