package org.Aayush.wfst.semiring;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Product of an output-label string and a weight; folds transducer outputs into weights.
 *
 * @param <W> underlying weight type.
 */
@Value(staticConstructor = "of")
@Accessors(fluent = true)
public class GallicWeight<W> {
    StringWeight string;
    W weight;

    @Override
    public String toString() {
        return string + "," + weight;
    }
}
