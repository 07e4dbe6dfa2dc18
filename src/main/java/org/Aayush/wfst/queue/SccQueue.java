package org.Aayush.wfst.queue;

import java.util.List;
import java.util.Objects;

/**
 * Serves strongly connected components in topological order; within a component the component's
 * own sub-queue decides.
 */
public final class SccQueue implements StateQueue {
    private final int[] components;
    private final List<StateQueue> queues;
    private int front;
    private int back = -1;

    /**
     * @param components component id of every state, topologically numbered.
     * @param queues one sub-queue per component id.
     */
    public SccQueue(int[] components, List<StateQueue> queues) {
        this.components = Objects.requireNonNull(components, "components");
        this.queues = List.copyOf(queues);
    }

    @Override
    public int head() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return queues.get(front).head();
    }

    @Override
    public void push(int state) {
        int c = components[state];
        if (front > back) {
            front = c;
            back = c;
        } else if (c > back) {
            back = c;
        } else if (c < front) {
            front = c;
        }
        queues.get(c).push(state);
    }

    @Override
    public int pop() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return queues.get(front).pop();
    }

    @Override
    public void update(int state) {
        queues.get(components[state]).update(state);
    }

    @Override
    public boolean isEmpty() {
        while (front <= back && queues.get(front).isEmpty()) {
            front++;
        }
        return front > back;
    }

    @Override
    public void clear() {
        for (int c = Math.max(front, 0); c <= back; c++) {
            queues.get(c).clear();
        }
        front = 0;
        back = -1;
    }

    @Override
    public QueueType type() {
        return QueueType.SCC;
    }
}
