package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.mapper.RelabelMapper;
import org.Aayush.wfst.fst.MutableFst;

import java.util.Collection;
import java.util.Objects;

/**
 * Replaces labels according to {@code (old, new)} pairs.
 */
public final class RelabelPairs {
    public static final String REASON_DUPLICATE_PAIR = "RELABEL_DUPLICATE_LABEL";

    private RelabelPairs() {
    }

    /**
     * @throws FstException {@code PRECONDITION_VIOLATED} when a side lists the same old label
     * twice.
     */
    public static <W> void relabel(
            MutableFst<W> fst,
            Collection<IntIntPair> inputPairs,
            Collection<IntIntPair> outputPairs
    ) {
        ArcMap.map(fst, new RelabelMapper<>(
                table(Objects.requireNonNull(inputPairs, "inputPairs"), "input"),
                table(Objects.requireNonNull(outputPairs, "outputPairs"), "output")
        ));
    }

    private static Int2IntMap table(Collection<IntIntPair> pairs, String side) {
        Int2IntOpenHashMap table = new Int2IntOpenHashMap(pairs.size());
        for (IntIntPair pair : pairs) {
            if (table.containsKey(pair.leftInt())) {
                throw FstException.precondition(
                        REASON_DUPLICATE_PAIR,
                        side + " label " + pair.leftInt() + " is relabeled more than once"
                );
            }
            table.put(pair.leftInt(), pair.rightInt());
        }
        return table;
    }
}
