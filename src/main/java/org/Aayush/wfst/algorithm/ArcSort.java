package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.MutableFst;

import java.util.Comparator;

/**
 * Stable in-place sort of every state's arcs.
 */
public final class ArcSort {

    private ArcSort() {
    }

    public static <W> void sort(MutableFst<W> fst, Comparator<? super Arc<W>> comparator) {
        for (int s = 0; s < fst.numStates(); s++) {
            if (fst.numArcs(s) > 1) {
                fst.sortArcs(s, comparator);
            }
        }
    }
}
