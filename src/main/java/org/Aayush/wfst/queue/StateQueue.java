package org.Aayush.wfst.queue;

/**
 * Work list of state ids used by traversal and relaxation algorithms.
 */
public interface StateQueue {

    /**
     * Returns the next state without removing it.
     *
     * @throws EmptyQueueException when the queue is empty.
     */
    int head();

    void push(int state);

    /**
     * Removes and returns the next state.
     *
     * @throws EmptyQueueException when the queue is empty.
     */
    int pop();

    /**
     * Signals that the priority of an enqueued state changed. A no-op for disciplines that do
     * not order by priority.
     */
    void update(int state);

    boolean isEmpty();

    void clear();

    QueueType type();
}
