package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Last-in first-out discipline.
 */
public final class LifoQueue implements StateQueue {
    private final IntArrayList stack = new IntArrayList();

    @Override
    public int head() {
        if (stack.isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return stack.getInt(stack.size() - 1);
    }

    @Override
    public void push(int state) {
        stack.add(state);
    }

    @Override
    public int pop() {
        if (stack.isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return stack.removeInt(stack.size() - 1);
    }

    @Override
    public void update(int state) {
    }

    @Override
    public boolean isEmpty() {
        return stack.isEmpty();
    }

    @Override
    public void clear() {
        stack.clear();
    }

    @Override
    public QueueType type() {
        return QueueType.LIFO;
    }
}
