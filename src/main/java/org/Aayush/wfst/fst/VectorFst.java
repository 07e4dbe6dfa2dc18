package org.Aayush.wfst.fst;

import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.properties.PropertiesComputer;
import org.Aayush.wfst.semiring.Semiring;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Mutable automaton backed by a growable arena of states.
 *
 * <p>States live in one array indexed by id; arcs reference destinations by id only. Input and
 * output epsilon counts are maintained incrementally so they are answered in O(1). Structural
 * properties are computed on first request and cached until the next mutation.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @param <W> weight type.
 */
public final class VectorFst<W> implements MutableFst<W> {

    private static final class State<W> {
        private W finalWeight;
        private final ArrayList<Arc<W>> arcs = new ArrayList<>();
        private final List<Arc<W>> view = Collections.unmodifiableList(arcs);
        private int inputEpsilons;
        private int outputEpsilons;

        private State(W finalWeight) {
            this.finalWeight = finalWeight;
        }

        private void countArc(Arc<W> arc, int sign) {
            if (arc.ilabel() == Labels.EPSILON) {
                inputEpsilons += sign;
            }
            if (arc.olabel() == Labels.EPSILON) {
                outputEpsilons += sign;
            }
        }
    }

    private final Semiring<W> semiring;
    private final ObjectArrayList<State<W>> states = new ObjectArrayList<>();
    private int start = NO_STATE;

    private long cachedProperties;
    private boolean propertiesValid;

    public VectorFst(Semiring<W> semiring) {
        this.semiring = Objects.requireNonNull(semiring, "semiring");
    }

    /**
     * Deep copy of any automaton into a new mutable one.
     */
    public static <W> VectorFst<W> copyOf(Fst<W> fst) {
        Objects.requireNonNull(fst, "fst");
        VectorFst<W> copy = new VectorFst<>(fst.semiring());
        copy.reserveStates(fst.numStates());
        copy.addStates(fst.numStates());
        for (int s = 0; s < fst.numStates(); s++) {
            State<W> state = copy.states.get(s);
            state.finalWeight = fst.finalWeight(s);
            state.arcs.ensureCapacity(fst.numArcs(s));
            for (Arc<W> arc : fst.arcs(s)) {
                state.arcs.add(arc);
                state.countArc(arc, 1);
            }
        }
        copy.start = fst.start();
        return copy;
    }

    @Override
    public void replaceWith(Fst<W> source) {
        VectorFst<W> copy = copyOf(source);
        states.clear();
        states.addAll(copy.states);
        start = copy.start;
        invalidate();
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
        return state(state).finalWeight;
    }

    @Override
    public int numStates() {
        return states.size();
    }

    @Override
    public int numArcs(int state) {
        return state(state).arcs.size();
    }

    @Override
    public Arc<W> arc(int state, int index) {
        State<W> s = state(state);
        checkArcIndex(state, s, index);
        return s.arcs.get(index);
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        return state(state).view;
    }

    @Override
    public int numInputEpsilons(int state) {
        return state(state).inputEpsilons;
    }

    @Override
    public int numOutputEpsilons(int state) {
        return state(state).outputEpsilons;
    }

    @Override
    public long properties(long mask) {
        if (!propertiesValid) {
            cachedProperties = PropertiesComputer.compute(this);
            propertiesValid = true;
        }
        return cachedProperties & mask;
    }

    @Override
    public int addState() {
        states.add(new State<>(semiring.zero()));
        invalidate();
        return states.size() - 1;
    }

    @Override
    public int addStates(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        int first = states.size();
        for (int i = 0; i < count; i++) {
            states.add(new State<>(semiring.zero()));
        }
        invalidate();
        return first;
    }

    @Override
    public void setStart(int state) {
        checkState(state);
        start = state;
        invalidate();
    }

    @Override
    public void setFinal(int state, W weight) {
        Objects.requireNonNull(weight, "weight");
        state(state).finalWeight = weight;
        invalidate();
    }

    @Override
    public void addArc(int state, Arc<W> arc) {
        Objects.requireNonNull(arc, "arc");
        State<W> s = state(state);
        checkTarget(arc);
        s.arcs.add(arc);
        s.countArc(arc, 1);
        invalidate();
    }

    @Override
    public void setArc(int state, int index, Arc<W> arc) {
        Objects.requireNonNull(arc, "arc");
        State<W> s = state(state);
        checkArcIndex(state, s, index);
        checkTarget(arc);
        s.countArc(s.arcs.get(index), -1);
        s.arcs.set(index, arc);
        s.countArc(arc, 1);
        invalidate();
    }

    @Override
    public void deleteArcs(int state) {
        State<W> s = state(state);
        s.arcs.clear();
        s.inputEpsilons = 0;
        s.outputEpsilons = 0;
        invalidate();
    }

    @Override
    public void deleteArcs(int state, int count) {
        State<W> s = state(state);
        if (count < 0 || count > s.arcs.size()) {
            throw FstException.notFound(
                    REASON_ARC_INDEX_OUT_OF_RANGE,
                    "cannot delete " + count + " arcs from state " + state + " with " + s.arcs.size()
            );
        }
        for (int i = 0; i < count; i++) {
            s.countArc(s.arcs.remove(s.arcs.size() - 1), -1);
        }
        invalidate();
    }

    @Override
    public void deleteStates(IntCollection toDelete) {
        Objects.requireNonNull(toDelete, "states");
        if (toDelete.isEmpty()) {
            return;
        }
        BitSet dead = new BitSet(states.size());
        for (int s : toDelete) {
            checkState(s);
            dead.set(s);
        }
        int[] newId = new int[states.size()];
        int next = 0;
        for (int s = 0; s < states.size(); s++) {
            newId[s] = dead.get(s) ? NO_STATE : next++;
        }
        ObjectArrayList<State<W>> kept = new ObjectArrayList<>(next);
        for (int s = 0; s < states.size(); s++) {
            if (dead.get(s)) {
                continue;
            }
            State<W> state = states.get(s);
            ArrayList<Arc<W>> arcs = new ArrayList<>(state.arcs);
            state.arcs.clear();
            state.inputEpsilons = 0;
            state.outputEpsilons = 0;
            for (Arc<W> arc : arcs) {
                int target = newId[arc.nextState()];
                if (target == NO_STATE) {
                    continue;
                }
                Arc<W> renumbered = target == arc.nextState() ? arc : arc.withNextState(target);
                state.arcs.add(renumbered);
                state.countArc(renumbered, 1);
            }
            kept.add(state);
        }
        states.clear();
        states.addAll(kept);
        start = start == NO_STATE ? NO_STATE : newId[start];
        invalidate();
    }

    @Override
    public void deleteAllStates() {
        states.clear();
        start = NO_STATE;
        invalidate();
    }

    @Override
    public void reserveStates(int count) {
        states.ensureCapacity(count);
    }

    @Override
    public void reserveArcs(int state, int count) {
        state(state).arcs.ensureCapacity(count);
    }

    @Override
    public void sortArcs(int state, Comparator<? super Arc<W>> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        state(state).arcs.sort(comparator);
        invalidate();
    }

    @Override
    public String toString() {
        return "VectorFst[" + semiring.name() + ", states=" + states.size() + ", start=" + start + "]";
    }

    private State<W> state(int state) {
        checkState(state);
        return states.get(state);
    }

    private void checkTarget(Arc<W> arc) {
        if (arc.nextState() < 0 || arc.nextState() >= states.size()) {
            throw FstException.malformed(
                    REASON_ARC_TARGET_OUT_OF_RANGE,
                    "arc target " + arc.nextState() + " out of bounds [0, " + states.size() + ")"
            );
        }
    }

    private static void checkArcIndex(int stateId, State<?> state, int index) {
        if (index < 0 || index >= state.arcs.size()) {
            throw FstException.notFound(
                    REASON_ARC_INDEX_OUT_OF_RANGE,
                    "arc " + index + " out of bounds for state " + stateId + " with " + state.arcs.size() + " arcs"
            );
        }
    }

    private void invalidate() {
        propertiesValid = false;
    }
}
