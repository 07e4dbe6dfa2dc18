package org.Aayush.wfst.queue;

import org.Aayush.wfst.analysis.ArcFilter;
import org.Aayush.wfst.analysis.ArcFilters;
import org.Aayush.wfst.analysis.TopOrder;
import org.Aayush.wfst.analysis.TopSort;
import org.Aayush.wfst.fst.Fst;

import java.util.BitSet;

/**
 * Pops states in topological order of an acyclic automaton.
 */
public final class TopOrderQueue implements StateQueue {
    private final int[] rankToState;
    private final int[] stateToRank;
    private final BitSet enqueued = new BitSet();

    /**
     * @throws org.Aayush.wfst.FstException {@code PRECONDITION_VIOLATED} when the automaton is
     * cyclic over the arcs {@code filter} keeps.
     */
    public <W> TopOrderQueue(Fst<W> fst, ArcFilter<W> filter) {
        TopOrder order = TopSort.requireTopOrder(fst, filter);
        this.stateToRank = order.ranks();
        this.rankToState = new int[stateToRank.length];
        for (int s = 0; s < stateToRank.length; s++) {
            rankToState[stateToRank[s]] = s;
        }
    }

    public <W> TopOrderQueue(Fst<W> fst) {
        this(fst, ArcFilters.any());
    }

    @Override
    public int head() {
        int rank = enqueued.nextSetBit(0);
        if (rank < 0) {
            throw new EmptyQueueException("Queue is empty");
        }
        return rankToState[rank];
    }

    @Override
    public void push(int state) {
        enqueued.set(stateToRank[state]);
    }

    @Override
    public int pop() {
        int state = head();
        enqueued.clear(stateToRank[state]);
        return state;
    }

    @Override
    public void update(int state) {
    }

    @Override
    public boolean isEmpty() {
        return enqueued.isEmpty();
    }

    @Override
    public void clear() {
        enqueued.clear();
    }

    @Override
    public QueueType type() {
        return QueueType.TOP_ORDER;
    }
}
