package org.Aayush.wfst.algorithm;

import lombok.Builder;
import lombok.Value;
import org.Aayush.wfst.queue.QueueType;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Knobs of the generic shortest-distance relaxation.
 */
@Value
@Builder
public class ShortestDistanceConfig {

    @Builder.Default
    QueueType queueType = QueueType.AUTO;

    /** Two distances within {@code delta} count as converged. */
    @Builder.Default
    float delta = Semiring.DEFAULT_DELTA;

    /** Ceiling on queue pops; {@code <= 0} means unbounded. */
    @Builder.Default
    int maxIterations = AlgorithmDefaults.UNBOUNDED;

    /**
     * Built-in values overridden by {@code wfst.delta} and
     * {@code wfst.shortestdistance.maxIterations} when set.
     */
    public static ShortestDistanceConfig defaults() {
        return ShortestDistanceConfig.builder()
                .delta(AlgorithmDefaults.delta())
                .maxIterations(AlgorithmDefaults.maxIterations())
                .build();
    }
}
