package org.Aayush.wfst.analysis;

import org.Aayush.wfst.fst.Fst;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable incoming-arc index.
 *
 * <p>CSR arrays: the arcs entering state {@code t} occupy positions
 * {@code [incomingStart(t), incomingEnd(t))}; each position records the source state and the
 * arc's index within that source.</p>
 */
public final class ReverseAdjacency {
    private final int numStates;
    private final int[] firstIncoming;
    private final int[] sources;
    private final int[] arcIndices;

    private ReverseAdjacency(int numStates, int[] firstIncoming, int[] sources, int[] arcIndices) {
        this.numStates = numStates;
        this.firstIncoming = firstIncoming;
        this.sources = sources;
        this.arcIndices = arcIndices;
    }

    public static <W> ReverseAdjacency build(Fst<W> fst) {
        Objects.requireNonNull(fst, "fst");
        int n = fst.numStates();
        int[] degree = new int[n];
        int total = 0;
        for (int s = 0; s < n; s++) {
            int arcs = fst.numArcs(s);
            for (int i = 0; i < arcs; i++) {
                degree[fst.arc(s, i).nextState()]++;
            }
            total += arcs;
        }
        int[] first = new int[n + 1];
        int cursor = 0;
        for (int t = 0; t < n; t++) {
            first[t] = cursor;
            cursor += degree[t];
        }
        first[n] = total;

        int[] fill = Arrays.copyOf(first, first.length);
        int[] sources = new int[total];
        int[] arcIndices = new int[total];
        for (int s = 0; s < n; s++) {
            int arcs = fst.numArcs(s);
            for (int i = 0; i < arcs; i++) {
                int position = fill[fst.arc(s, i).nextState()]++;
                sources[position] = s;
                arcIndices[position] = i;
            }
        }
        return new ReverseAdjacency(n, first, sources, arcIndices);
    }

    public int incomingStart(int state) {
        validateState(state);
        return firstIncoming[state];
    }

    public int incomingEnd(int state) {
        validateState(state);
        return firstIncoming[state + 1];
    }

    public int sourceAt(int position) {
        return sources[position];
    }

    public int arcIndexAt(int position) {
        return arcIndices[position];
    }

    public int numStates() {
        return numStates;
    }

    private void validateState(int state) {
        if (state < 0 || state >= numStates) {
            throw new IndexOutOfBoundsException("state out of bounds: " + state);
        }
    }
}
