package org.Aayush.wfst.algorithm;

import lombok.Builder;
import lombok.Value;
import org.Aayush.wfst.queue.QueueType;
import org.Aayush.wfst.semiring.Semiring;

/**
 * Options of {@link ShortestPath}.
 */
@Value
@Builder
public class ShortestPathConfig {
    public static final String REASON_INVALID_NSHORTEST = "SHORTEST_PATH_INVALID_NSHORTEST";

    /** Number of best paths to keep. */
    @Builder.Default
    int nshortest = 1;

    /** Queue used by the single-best search and the reverse distance pass. */
    @Builder.Default
    QueueType queueType = QueueType.AUTO;

    @Builder.Default
    float delta = Semiring.DEFAULT_DELTA;

    /** Ceiling on queue pops of every relaxation pass; {@code <= 0} means unbounded. */
    @Builder.Default
    int maxIterations = AlgorithmDefaults.UNBOUNDED;

    public static ShortestPathConfig defaults() {
        return ShortestPathConfig.builder()
                .delta(AlgorithmDefaults.delta())
                .maxIterations(AlgorithmDefaults.maxIterations())
                .build();
    }

    public static ShortestPathConfig nBest(int n) {
        return ShortestPathConfig.builder()
                .nshortest(n)
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
