package org.Aayush.wfst.algorithm;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * One term {@code first ⊗ second} of a weight decomposition.
 *
 * @param <W> weight type.
 */
@Value(staticConstructor = "of")
@Accessors(fluent = true)
public class WeightFactor<W> {
    W first;
    W second;
}
