package org.Aayush.wfst.queue;

import org.Aayush.wfst.fst.Fst;

/**
 * Queue of capacity one, for components made of a single state.
 */
public final class TrivialQueue implements StateQueue {
    private int front = Fst.NO_STATE;

    @Override
    public int head() {
        if (front == Fst.NO_STATE) {
            throw new EmptyQueueException("Queue is empty");
        }
        return front;
    }

    @Override
    public void push(int state) {
        if (front != Fst.NO_STATE && front != state) {
            throw new IllegalStateException("trivial queue already holds state " + front);
        }
        front = state;
    }

    @Override
    public int pop() {
        int state = head();
        front = Fst.NO_STATE;
        return state;
    }

    @Override
    public void update(int state) {
    }

    @Override
    public boolean isEmpty() {
        return front == Fst.NO_STATE;
    }

    @Override
    public void clear() {
        front = Fst.NO_STATE;
    }

    @Override
    public QueueType type() {
        return QueueType.TRIVIAL;
    }
}
