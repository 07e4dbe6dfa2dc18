package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

/**
 * First-in first-out discipline.
 */
public final class FifoQueue implements StateQueue {
    private final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

    @Override
    public int head() {
        if (queue.isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return queue.firstInt();
    }

    @Override
    public void push(int state) {
        queue.enqueue(state);
    }

    @Override
    public int pop() {
        if (queue.isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return queue.dequeueInt();
    }

    @Override
    public void update(int state) {
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public QueueType type() {
        return QueueType.FIFO;
    }
}
