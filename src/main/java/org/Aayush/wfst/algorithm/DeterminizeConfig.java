package org.Aayush.wfst.algorithm;

import lombok.Builder;
import lombok.Value;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Options of {@link Determinize}.
 */
@Value
@Builder
public class DeterminizeConfig {

    @Builder.Default
    DeterminizeType type = DeterminizeType.FUNCTIONAL;

    /** Quantization applied to subset residuals. */
    @Builder.Default
    float delta = Semiring.DEFAULT_DELTA;

    public static DeterminizeConfig defaults() {
        return DeterminizeConfig.builder().delta(AlgorithmDefaults.delta()).build();
    }

    public static DeterminizeConfig of(DeterminizeType type) {
        return DeterminizeConfig.builder().type(type).delta(AlgorithmDefaults.delta()).build();
    }
}
