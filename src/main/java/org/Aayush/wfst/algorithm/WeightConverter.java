package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.fst.Arc;

/**
 * Arc mapper that also changes the weight type.
 *
 * @param <W1> input weight type.
 * @param <W2> output weight type.
 */
public interface WeightConverter<W1, W2> {

    Arc<W2> map(Arc<W1> arc);

    FinalArc<W2> mapFinal(FinalArc<W1> finalArc);

    MapFinalAction finalAction();
}
