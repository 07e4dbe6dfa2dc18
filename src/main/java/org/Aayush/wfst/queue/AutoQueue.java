package org.Aayush.wfst.queue;

import org.Aayush.wfst.analysis.ArcFilter;
import org.Aayush.wfst.analysis.SccResult;
import org.Aayush.wfst.analysis.SccVisitor;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.SemiringProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks a discipline from the automaton's structure.
 *
 * <ul>
 *   <li>top-sorted: state order;</li>
 *   <li>acyclic: topological order;</li>
 *   <li>unweighted over an idempotent semiring: LIFO;</li>
 *   <li>otherwise an SCC queue whose per-component queues are trivial for acyclic components,
 *   LIFO for unweighted ones, shortest-first when the semiring has a path order and FIFO
 *   elsewhere.</li>
 * </ul>
 */
public final class AutoQueue implements StateQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutoQueue.class);

    private final StateQueue delegate;

    public <W> AutoQueue(Fst<W> fst, List<W> distances, ArcFilter<W> filter) {
        this.delegate = choose(fst, distances, filter);
        LOGGER.debug("auto queue selected {} for {} states", delegate.type(), fst.numStates());
    }

    private static <W> StateQueue choose(Fst<W> fst, List<W> distances, ArcFilter<W> filter) {
        Semiring<W> semiring = fst.semiring();
        boolean idempotent = semiring.hasProperty(SemiringProperty.IDEMPOTENT);
        if (fst.start() == Fst.NO_STATE || fst.hasProperties(FstProperties.TOP_SORTED)) {
            return new StateOrderQueue();
        }
        if (fst.hasProperties(FstProperties.ACYCLIC)) {
            return new TopOrderQueue(fst, filter);
        }
        if (idempotent && fst.hasProperties(FstProperties.UNWEIGHTED)) {
            return new LifoQueue();
        }
        return perComponent(fst, distances, filter);
    }

    /**
     * SCC queue with one sub-queue per component, chosen from the component's shape.
     */
    static <W> SccQueue perComponent(Fst<W> fst, List<W> distances, ArcFilter<W> filter) {
        Semiring<W> semiring = fst.semiring();
        boolean idempotent = semiring.hasProperty(SemiringProperty.IDEMPOTENT);
        SccResult scc = SccVisitor.compute(fst, filter);
        boolean[] weighted = new boolean[scc.count()];
        for (int s = 0; s < fst.numStates(); s++) {
            for (Arc<W> arc : fst.arcs(s)) {
                if (filter.keep(arc)
                        && scc.component(s) == scc.component(arc.nextState())
                        && !semiring.isOne(arc.weight())) {
                    weighted[scc.component(s)] = true;
                }
            }
        }
        boolean path = semiring.hasProperty(SemiringProperty.PATH) && idempotent;
        List<StateQueue> queues = new ArrayList<>(scc.count());
        for (int c = 0; c < scc.count(); c++) {
            if (!scc.isCyclic(c)) {
                queues.add(new TrivialQueue());
            } else if (!weighted[c] && idempotent) {
                queues.add(new LifoQueue());
            } else if (path) {
                queues.add(ShortestFirstQueue.natural(semiring, distances));
            } else {
                queues.add(new FifoQueue());
            }
        }
        return new SccQueue(scc.components(), queues);
    }

    /**
     * Discipline actually in use.
     */
    public QueueType delegateType() {
        return delegate.type();
    }

    @Override
    public int head() {
        return delegate.head();
    }

    @Override
    public void push(int state) {
        delegate.push(state);
    }

    @Override
    public int pop() {
        return delegate.pop();
    }

    @Override
    public void update(int state) {
        delegate.update(state);
    }

    @Override
    public boolean isEmpty() {
        return delegate.isEmpty();
    }

    @Override
    public void clear() {
        delegate.clear();
    }

    @Override
    public QueueType type() {
        return QueueType.AUTO;
    }
}
