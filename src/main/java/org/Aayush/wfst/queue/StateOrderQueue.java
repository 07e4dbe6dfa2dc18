package org.Aayush.wfst.queue;

import java.util.BitSet;

/**
 * Pops the smallest enqueued state id. On a top-sorted automaton this visits states in
 * topological order.
 */
public final class StateOrderQueue implements StateQueue {
    private final BitSet enqueued = new BitSet();

    @Override
    public int head() {
        int front = enqueued.nextSetBit(0);
        if (front < 0) {
            throw new EmptyQueueException("Queue is empty");
        }
        return front;
    }

    @Override
    public void push(int state) {
        enqueued.set(state);
    }

    @Override
    public int pop() {
        int front = head();
        enqueued.clear(front);
        return front;
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
        return QueueType.STATE_ORDER;
    }
}
