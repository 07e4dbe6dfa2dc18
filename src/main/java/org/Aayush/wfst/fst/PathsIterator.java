package org.Aayush.wfst.fst;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.wfst.semiring.Semiring;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Breadth-first enumeration of the accepted paths of an automaton.
 *
 * <p>Every path is produced once per distinct arc sequence, so the iteration only terminates on
 * acyclic automata.</p>
 *
 * @param <W> weight type.
 */
public final class PathsIterator<W> implements Iterator<FstPath<W>> {

    private static final class Partial<W> {
        private final int state;
        private final IntArrayList ilabels;
        private final IntArrayList olabels;
        private final W weight;

        private Partial(int state, IntArrayList ilabels, IntArrayList olabels, W weight) {
            this.state = state;
            this.ilabels = ilabels;
            this.olabels = olabels;
            this.weight = weight;
        }
    }

    private final Fst<W> fst;
    private final Semiring<W> semiring;
    private final ArrayDeque<Partial<W>> queue = new ArrayDeque<>();
    private FstPath<W> next;

    public PathsIterator(Fst<W> fst) {
        this.fst = Objects.requireNonNull(fst, "fst");
        this.semiring = fst.semiring();
        if (fst.start() != Fst.NO_STATE) {
            queue.add(new Partial<>(fst.start(), new IntArrayList(), new IntArrayList(), semiring.one()));
        }
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public FstPath<W> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        FstPath<W> path = next;
        next = null;
        return path;
    }

    private FstPath<W> advance() {
        while (!queue.isEmpty()) {
            Partial<W> partial = queue.removeFirst();
            for (Arc<W> arc : fst.arcs(partial.state)) {
                IntArrayList ilabels = new IntArrayList(partial.ilabels);
                IntArrayList olabels = new IntArrayList(partial.olabels);
                if (arc.ilabel() != Labels.EPSILON) {
                    ilabels.add(arc.ilabel());
                }
                if (arc.olabel() != Labels.EPSILON) {
                    olabels.add(arc.olabel());
                }
                queue.addLast(new Partial<>(
                        arc.nextState(),
                        ilabels,
                        olabels,
                        semiring.times(partial.weight, arc.weight())
                ));
            }
            if (fst.isFinal(partial.state)) {
                return FstPath.of(
                        partial.ilabels,
                        partial.olabels,
                        semiring.times(partial.weight, fst.finalWeight(partial.state))
                );
            }
        }
        return null;
    }
}
