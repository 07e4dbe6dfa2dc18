package org.Aayush.wfst.algorithm;

import lombok.Value;
import lombok.With;
import lombok.experimental.Accessors;
import org.Aayush.wfst.fst.Labels;

/**
 * A final weight presented to a mapper as an arc {@code eps:eps/weight} without destination.
 *
 * @param <W> weight type.
 */
@Value(staticConstructor = "of")
@With
@Accessors(fluent = true)
public class FinalArc<W> {
    int ilabel;
    int olabel;
    W weight;

    public static <W> FinalArc<W> of(W weight) {
        return of(Labels.EPSILON, Labels.EPSILON, weight);
    }

    public boolean hasEpsilonLabels() {
        return ilabel == Labels.EPSILON && olabel == Labels.EPSILON;
    }
}
