package org.Aayush.wfst.algorithm;

import lombok.Builder;
import lombok.Value;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Options of {@link Minimize}.
 */
@Value
@Builder
public class MinimizeConfig {

    /** Quantization applied after weight pushing; weights within delta are merged. */
    @Builder.Default
    float delta = Semiring.DEFAULT_DELTA;

    public static MinimizeConfig defaults() {
        return MinimizeConfig.builder().delta(AlgorithmDefaults.delta()).build();
    }
}
