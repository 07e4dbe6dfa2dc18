package org.Aayush.wfst.queue;

/**
 * Queue disciplines available to traversal algorithms.
 */
public enum QueueType {
    /** Holds at most one state. */
    TRIVIAL,
    FIFO,
    LIFO,
    /** Pops the state with the best tentative distance. */
    SHORTEST_FIRST,
    /** Pops states in topological order; acyclic input only. */
    TOP_ORDER,
    /** Pops the smallest state id; suits top-sorted input. */
    STATE_ORDER,
    /** Pops components in topological order, each with its own sub-queue. */
    SCC,
    /** Picks one of the above from the automaton's properties. */
    AUTO
}
