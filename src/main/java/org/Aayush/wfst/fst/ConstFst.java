package org.Aayush.wfst.fst;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.properties.PropertiesComputer;
import org.Aayush.wfst.semiring.Semiring;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;

/**
 * Compact immutable automaton.
 *
 * <p>Arcs of all states are stored contiguously in CSR order: {@code firstArc[s]} is the index of
 * the first arc of state {@code s} and {@code firstArc[s + 1]} its end. Properties are computed once
 * at construction.</p>
 *
 * @param <W> weight type.
 */
public final class ConstFst<W> implements Fst<W> {
    private final Semiring<W> semiring;
    private final int start;
    private final int numStates;

    private final int[] firstArc;
    private final ObjectArrayList<W> finals;
    private final int[] inputEpsilons;
    private final int[] outputEpsilons;
    private final ObjectArrayList<Arc<W>> arcs;

    private final long properties;

    private ConstFst(Fst<W> fst) {
        this.semiring = fst.semiring();
        this.start = fst.start();
        this.numStates = fst.numStates();
        this.firstArc = new int[numStates + 1];
        this.finals = new ObjectArrayList<>(numStates);
        this.inputEpsilons = new int[numStates];
        this.outputEpsilons = new int[numStates];

        long total = fst.totalArcs();
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("too many arcs for a compact automaton: " + total);
        }
        this.arcs = new ObjectArrayList<>((int) total);
        int cursor = 0;
        for (int s = 0; s < numStates; s++) {
            firstArc[s] = cursor;
            finals.add(fst.finalWeight(s));
            inputEpsilons[s] = fst.numInputEpsilons(s);
            outputEpsilons[s] = fst.numOutputEpsilons(s);
            for (Arc<W> arc : fst.arcs(s)) {
                arcs.add(arc);
                cursor++;
            }
        }
        firstArc[numStates] = cursor;
        this.properties = PropertiesComputer.compute(this);
    }

    /**
     * Freezes any automaton into compact form.
     */
    public static <W> ConstFst<W> copyOf(Fst<W> fst) {
        Objects.requireNonNull(fst, "fst");
        if (fst instanceof ConstFst) {
            return (ConstFst<W>) fst;
        }
        return new ConstFst<>(fst);
    }

    @Override
    public Semiring<W> semiring() {
        return semiring;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public W finalWeight(int state) {
        checkState(state);
        return finals.get(state);
    }

    @Override
    public int numStates() {
        return numStates;
    }

    @Override
    public int numArcs(int state) {
        checkState(state);
        return firstArc[state + 1] - firstArc[state];
    }

    @Override
    public Arc<W> arc(int state, int index) {
        int n = numArcs(state);
        if (index < 0 || index >= n) {
            throw FstException.notFound(
                    REASON_ARC_INDEX_OUT_OF_RANGE,
                    "arc " + index + " out of bounds [0, " + n + ") for state " + state
            );
        }
        return arcs.get(firstArc[state] + index);
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        checkState(state);
        final int begin = firstArc[state];
        final int size = firstArc[state + 1] - begin;
        return new AbstractList<>() {
            @Override
            public Arc<W> get(int index) {
                if (index < 0 || index >= size) {
                    throw new IndexOutOfBoundsException("arc " + index + " out of bounds [0, " + size + ")");
                }
                return arcs.get(begin + index);
            }

            @Override
            public int size() {
                return size;
            }
        };
    }

    @Override
    public int numInputEpsilons(int state) {
        checkState(state);
        return inputEpsilons[state];
    }

    @Override
    public int numOutputEpsilons(int state) {
        checkState(state);
        return outputEpsilons[state];
    }

    @Override
    public long properties(long mask) {
        return properties & mask;
    }

    @Override
    public String toString() {
        return String.format("ConstFst[%s, states=%d, arcs=%d, start=%d]",
                semiring.name(), numStates, arcs.size(), start);
    }
}
