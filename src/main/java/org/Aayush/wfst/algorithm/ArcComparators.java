package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.fst.Arc;

import java.util.Comparator;

/**
 * Arc orders used by {@link ArcSort} and the arc-merging mappers.
 */
public final class ArcComparators {

    private ArcComparators() {
    }

    /** Input label only; equal input labels keep their relative order under a stable sort. */
    public static <W> Comparator<Arc<W>> inputLabel() {
        return Comparator.comparingInt(Arc::ilabel);
    }

    /** Output label only. */
    public static <W> Comparator<Arc<W>> outputLabel() {
        return Comparator.comparingInt(Arc::olabel);
    }

    /** Input label, then output label. */
    public static <W> Comparator<Arc<W>> inputOutput() {
        return (a, b) -> {
            int c = Integer.compare(a.ilabel(), b.ilabel());
            return c != 0 ? c : Integer.compare(a.olabel(), b.olabel());
        };
    }

    /** Input label, output label, then destination. */
    public static <W> Comparator<Arc<W>> labelsThenState() {
        return (a, b) -> {
            int c = Integer.compare(a.ilabel(), b.ilabel());
            if (c != 0) {
                return c;
            }
            c = Integer.compare(a.olabel(), b.olabel());
            return c != 0 ? c : Integer.compare(a.nextState(), b.nextState());
        };
    }
}
