package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparator;
import org.Aayush.wfst.semiring.Semiring;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Binary min-heap of states ordered by an external priority, usually the tentative distance.
 *
 * <p>A position map gives O(1) lookup of a state's heap slot, so {@link #update(int)} restores
 * heap order in O(log n) after the state's priority changed. Pushing an already enqueued state
 * behaves like {@link #update(int)}.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class ShortestFirstQueue implements StateQueue {
    // 1-based heap of state ids
    private final IntArrayList heap = new IntArrayList();
    // positions[state] = heap index, 0 when absent
    private final IntArrayList positions = new IntArrayList();
    private final IntComparator order;

    /**
     * @param order strict priority order over state ids; smaller pops first.
     */
    public ShortestFirstQueue(IntComparator order) {
        this.order = Objects.requireNonNull(order, "order");
        heap.add(-1);
    }

    /**
     * Orders states by the semiring's natural order of {@code distances.get(state)}; states past
     * the end of the list count as zero. Ties pop the smaller state id first.
     *
     * @throws org.Aayush.wfst.FstException {@code PRECONDITION_VIOLATED} when the semiring has no
     * natural order.
     */
    public static <W> ShortestFirstQueue natural(Semiring<W> semiring, List<W> distances) {
        Comparator<W> natural = semiring.naturalOrder();
        return new ShortestFirstQueue((a, b) -> {
            W da = a < distances.size() ? distances.get(a) : semiring.zero();
            W db = b < distances.size() ? distances.get(b) : semiring.zero();
            int c = natural.compare(da, db);
            return c != 0 ? c : Integer.compare(a, b);
        });
    }

    @Override
    public int head() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return heap.getInt(1);
    }

    @Override
    public void push(int state) {
        if (state < 0) {
            throw new IllegalArgumentException("state must be non-negative: " + state);
        }
        if (position(state) > 0) {
            update(state);
            return;
        }
        heap.add(state);
        setPosition(state, size());
        swim(size());
    }

    @Override
    public int pop() {
        int min = head();
        int last = size();
        if (last == 1) {
            heap.removeInt(1);
            setPosition(min, 0);
            return min;
        }
        int moved = heap.removeInt(last);
        heap.set(1, moved);
        setPosition(moved, 1);
        setPosition(min, 0);
        sink(1);
        return min;
    }

    @Override
    public void update(int state) {
        int k = position(state);
        if (k == 0) {
            push(state);
            return;
        }
        swim(k);
        sink(position(state));
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public void clear() {
        for (int i = 1; i <= size(); i++) {
            setPosition(heap.getInt(i), 0);
        }
        heap.size(1);
    }

    @Override
    public QueueType type() {
        return QueueType.SHORTEST_FIRST;
    }

    public int size() {
        return heap.size() - 1;
    }

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        int size = size();
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) {
                j++;
            }
            if (!greater(k, j)) {
                break;
            }
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return order.compare(heap.getInt(i), heap.getInt(j)) > 0;
    }

    private void swap(int i, int j) {
        int a = heap.getInt(i);
        int b = heap.getInt(j);
        heap.set(i, b);
        heap.set(j, a);
        setPosition(a, j);
        setPosition(b, i);
    }

    private int position(int state) {
        return state < positions.size() ? positions.getInt(state) : 0;
    }

    private void setPosition(int state, int index) {
        if (state >= positions.size()) {
            positions.size(state + 1);
        }
        positions.set(state, index);
    }
}
