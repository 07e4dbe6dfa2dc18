package org.Aayush.wfst.fst;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Builders for single-path automata and the inverse operation.
 */
public final class LinearFsts {
    public static final String REASON_LENGTH_MISMATCH = "LINEAR_LABEL_LENGTH_MISMATCH";
    public static final String REASON_NOT_LINEAR = "LINEAR_FST_NOT_LINEAR";

    private LinearFsts() {
    }

    /**
     * Chain accepting exactly {@code labels}, with {@code weight} as final weight.
     */
    public static <W> VectorFst<W> acceptor(Semiring<W> semiring, int[] labels, W weight) {
        return transducer(semiring, labels, labels, weight);
    }

    /**
     * Chain mapping {@code ilabels} to {@code olabels} position by position.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} when the label arrays differ in length.
     */
    public static <W> VectorFst<W> transducer(Semiring<W> semiring, int[] ilabels, int[] olabels, W weight) {
        if (ilabels.length != olabels.length) {
            throw FstException.precondition(
                    REASON_LENGTH_MISMATCH,
                    "input has " + ilabels.length + " labels, output has " + olabels.length
            );
        }
        VectorFst<W> fst = new VectorFst<>(semiring);
        fst.reserveStates(ilabels.length + 1);
        int state = fst.addState();
        fst.setStart(state);
        for (int i = 0; i < ilabels.length; i++) {
            int next = fst.addState();
            fst.addArc(state, ilabels[i], olabels[i], semiring.one(), next);
            state = next;
        }
        fst.setFinal(state, weight);
        return fst;
    }

    /**
     * The only path of a linear automaton; an automaton accepting nothing yields the empty path
     * with weight one.
     *
     * @throws FstException {@code PRECONDITION_VIOLATED} when more than one path is accepted.
     */
    public static <W> FstPath<W> decode(Fst<W> fst) {
        PathsIterator<W> paths = new PathsIterator<>(fst);
        if (!paths.hasNext()) {
            return FstPath.of(new int[0], new int[0], fst.semiring().one());
        }
        FstPath<W> path = paths.next();
        if (paths.hasNext()) {
            throw FstException.precondition(REASON_NOT_LINEAR, "automaton accepts more than one path");
        }
        return path;
    }
}
