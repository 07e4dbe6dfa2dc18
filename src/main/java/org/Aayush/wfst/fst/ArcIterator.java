package org.Aayush.wfst.fst;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Resettable cursor over the arcs of one state.
 *
 * <p>The iterator only keeps a reference to the arc list of the state it is positioned on, so one
 * instance can be reused across a whole traversal.</p>
 *
 * @param <W> weight type.
 */
public final class ArcIterator<W> {
    private final Fst<W> fst;
    private List<Arc<W>> arcs = List.of();
    private int position;

    ArcIterator(Fst<W> fst) {
        this.fst = fst;
    }

    /**
     * Positions the iterator on the first arc of a state.
     */
    public ArcIterator<W> reset(int state) {
        this.arcs = fst.arcs(state);
        this.position = 0;
        return this;
    }

    public boolean hasNext() {
        return position < arcs.size();
    }

    public Arc<W> next() {
        if (position >= arcs.size()) {
            throw new NoSuchElementException();
        }
        return arcs.get(position++);
    }

    /**
     * Index of the arc {@link #next()} would return.
     */
    public int position() {
        return position;
    }

    public void seek(int position) {
        if (position < 0 || position > arcs.size()) {
            throw new IndexOutOfBoundsException("arc position " + position + " out of bounds [0, " + arcs.size() + "]");
        }
        this.position = position;
    }
}
