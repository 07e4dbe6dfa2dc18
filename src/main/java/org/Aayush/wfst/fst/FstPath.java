package org.Aayush.wfst.fst;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * One accepted path: its non-epsilon input labels, non-epsilon output labels and total weight
 * (product of the arc weights and the final weight).
 *
 * @param <W> weight type.
 */
@Value
@Accessors(fluent = true)
public class FstPath<W> {
    IntList ilabels;
    IntList olabels;
    W weight;

    public static <W> FstPath<W> of(IntList ilabels, IntList olabels, W weight) {
        return new FstPath<>(
                IntLists.unmodifiable(new IntArrayList(ilabels)),
                IntLists.unmodifiable(new IntArrayList(olabels)),
                weight
        );
    }

    public static <W> FstPath<W> of(int[] ilabels, int[] olabels, W weight) {
        return of(IntArrayList.wrap(ilabels), IntArrayList.wrap(olabels), weight);
    }
}
