package org.Aayush.wfst.fst;

import lombok.Value;
import lombok.With;
import lombok.experimental.Accessors;

/**
 * Immutable transition: input label, output label, weight and destination state.
 *
 * @param <W> weight type.
 */
@Value(staticConstructor = "of")
@With
@Accessors(fluent = true)
public class Arc<W> {
    int ilabel;
    int olabel;
    W weight;
    int nextState;

    public boolean isEpsilon() {
        return ilabel == Labels.EPSILON && olabel == Labels.EPSILON;
    }

    @Override
    public String toString() {
        return ilabel + ":" + olabel + "/" + weight + "->" + nextState;
    }
}
