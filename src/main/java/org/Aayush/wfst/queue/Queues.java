package org.Aayush.wfst.queue;

import org.Aayush.wfst.analysis.ArcFilter;
import org.Aayush.wfst.fst.Fst;

import java.util.List;
import java.util.Objects;

/**
 * Builds a queue of a requested discipline for one automaton.
 */
public final class Queues {

    private Queues() {
    }

    /**
     * Creates a queue over {@code fst}.
     *
     * @param distances live tentative distances, read by priority-ordered disciplines.
     * @param filter arcs considered by order-dependent disciplines.
     * @throws org.Aayush.wfst.FstException {@code PRECONDITION_VIOLATED} when the discipline's
     * requirement does not hold (shortest-first without natural order, topological order on a
     * cyclic automaton).
     */
    public static <W> StateQueue create(QueueType type, Fst<W> fst, List<W> distances, ArcFilter<W> filter) {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case TRIVIAL:
                return new TrivialQueue();
            case FIFO:
                return new FifoQueue();
            case LIFO:
                return new LifoQueue();
            case SHORTEST_FIRST:
                return ShortestFirstQueue.natural(fst.semiring(), distances);
            case TOP_ORDER:
                return new TopOrderQueue(fst, filter);
            case STATE_ORDER:
                return new StateOrderQueue();
            case SCC:
                return AutoQueue.perComponent(fst, distances, filter);
            default:
                return new AutoQueue(fst, distances, filter);
        }
    }
}
