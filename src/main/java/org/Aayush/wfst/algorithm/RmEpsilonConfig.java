package org.Aayush.wfst.algorithm;

import lombok.Builder;
import lombok.Value;
import org.Aayush.wfst.queue.QueueType;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Options of {@link RmEpsilon}.
 */
@Value
@Builder
public class RmEpsilonConfig {

    /** Queue of the epsilon-closure distance runs. */
    @Builder.Default
    QueueType queueType = QueueType.AUTO;

    @Builder.Default
    float delta = Semiring.DEFAULT_DELTA;

    @Builder.Default
    int maxIterations = AlgorithmDefaults.UNBOUNDED;

    /** Trim useless states afterwards. */
    @Builder.Default
    boolean connect = true;

    public static RmEpsilonConfig defaults() {
        return RmEpsilonConfig.builder()
                .delta(AlgorithmDefaults.delta())
                .maxIterations(AlgorithmDefaults.maxIterations())
                .build();
    }

    ShortestDistanceConfig distanceConfig() {
        return ShortestDistanceConfig.builder()
                .queueType(queueType)
                .delta(delta)
                .maxIterations(maxIterations)
                .build();
    }
}
