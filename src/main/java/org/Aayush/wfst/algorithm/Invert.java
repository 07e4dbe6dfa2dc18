package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.algorithm.mapper.InvertMapper;
import org.Aayush.wfst.fst.MutableFst;

/**
 * Swaps input and output labels in place.
 */
public final class Invert {

    private Invert() {
    }

    public static <W> void invert(MutableFst<W> fst) {
        ArcMap.map(fst, new InvertMapper<>());
    }
}
