package org.Aayush.wfst.algorithm;

import java.util.List;

/**
 * Splits a weight into terms whose sum of products equals the weight.
 *
 * @param <W> weight type.
 */
@FunctionalInterface
public interface WeightFactorizer<W> {

    /**
     * Returns the decomposition of {@code weight}, or an empty list when the weight is already
     * in factored form.
     */
    List<WeightFactor<W>> factor(W weight);
}
