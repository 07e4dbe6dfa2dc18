package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.queue.QueueType;
import org.Aayush.wfst.semiring.LogWeight;
import org.Aayush.wfst.semiring.TropicalSemiring;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.wfst.testutil.FstFixtureFactory.log;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tropical;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tw;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Shortest Distance")
class ShortestDistanceTest {

    private static ShortestDistanceConfig withQueue(QueueType type) {
        return ShortestDistanceConfig.builder().queueType(type).build();
    }

    @Nested
    @DisplayName("1. Forward Distances")
    class Forward {

        @Test
        @DisplayName("Distance to b is min(10, 2 + 3) = 5")
        void testKnownExample() {
            List<TropicalWeight> d = ShortestDistance.shortestDistance(FstFixtureFactory.shortestDistanceExample());
            assertEquals(List.of(tw(0), tw(2), tw(5), tw(6)), d);
        }

        @Test
        @DisplayName("Every correct queue discipline yields identical distances")
        void testQueueIndependence() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            List<TropicalWeight> expected = List.of(tw(0), tw(1), tw(2), tw(3), tw(4), tw(5));
            for (QueueType type : new QueueType[]{
                    QueueType.FIFO, QueueType.LIFO, QueueType.SHORTEST_FIRST,
                    QueueType.STATE_ORDER, QueueType.SCC, QueueType.AUTO}) {
                assertEquals(expected, ShortestDistance.shortestDistance(fst, withQueue(type)), type.name());
            }
            VectorFst<TropicalWeight> dag = FstFixtureFactory.shortestDistanceExample();
            assertEquals(ShortestDistance.shortestDistance(dag, withQueue(QueueType.FIFO)),
                    ShortestDistance.shortestDistance(dag, withQueue(QueueType.TOP_ORDER)));
        }

        @Test
        @DisplayName("Unreachable states hold zero")
        void testUnreachable() {
            VectorFst<TropicalWeight> fst = tropical("0 1 1 1 1\n2 1 1 1 1\n1 0");
            List<TropicalWeight> d = ShortestDistance.shortestDistance(fst);
            assertEquals(3, d.size());
            assertEquals(TropicalWeight.ZERO, d.get(2));
        }

        @Test
        @DisplayName("Automaton without start yields all-zero distances")
        void testNoStart() {
            VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
            fst.addStates(2);
            assertEquals(List.of(TropicalWeight.ZERO, TropicalWeight.ZERO), ShortestDistance.shortestDistance(fst));
            assertEquals(TropicalWeight.ZERO, ShortestDistance.totalWeight(fst));
        }

        @Test
        @DisplayName("Log semiring sums every path around a cycle")
        void testLogCycle() {
            float half = (float) -Math.log(0.5);
            VectorFst<LogWeight> fst = log("0 0 1 1 " + half + "\n0 1 2 2\n1 0");
            LogWeight total = ShortestDistance.totalWeight(fst);
            // sum over k of 0.5^k = 2
            assertEquals(-Math.log(2.0), total.value(), 5e-3);
        }
    }

    @Nested
    @DisplayName("2. Reverse Distances and Total Weight")
    class Backward {

        @Test
        @DisplayName("Reverse distances measure the cost to finish")
        void testReverse() {
            List<TropicalWeight> rd = ShortestDistance.reverseShortestDistance(FstFixtureFactory.shortestDistanceExample());
            assertEquals(List.of(tw(5), tw(3), tw(0), tw(4)), rd);
        }

        @Test
        @DisplayName("Total weight is the best complete path")
        void testTotalWeight() {
            assertEquals(tw(5), ShortestDistance.totalWeight(FstFixtureFactory.shortestDistanceExample()));
            assertEquals(tw(5), ShortestDistance.totalWeight(FstFixtureFactory.cyclicChain()));
        }

        @Test
        @DisplayName("Forward and reverse totals agree in the log semiring")
        void testLogTotals() {
            VectorFst<LogWeight> fst = log(String.join("\n",
                    "0 1 1 1 0.5",
                    "0 2 2 2 1.5",
                    "1 3 3 3 1",
                    "2 3 4 4 0.25",
                    "3 0.75"));
            LogWeight total = ShortestDistance.totalWeight(fst);
            LogWeight fromStart = ShortestDistance.reverseShortestDistance(fst).get(0);
            assertEquals(total.value(), fromStart.value(), 1e-4);
        }
    }

    @Nested
    @DisplayName("3. Convergence Guard")
    class Convergence {

        @Test
        @DisplayName("Exceeding the iteration ceiling is non-convergent")
        void testIterationLimit() {
            VectorFst<LogWeight> fst = log("0 0 1 1 0.01\n0 1 2 2\n1 0");
            ShortestDistanceConfig config = ShortestDistanceConfig.builder()
                    .queueType(QueueType.FIFO)
                    .maxIterations(3)
                    .build();
            FstException ex = assertThrows(FstException.class, () -> ShortestDistance.shortestDistance(fst, config));
            assertEquals(FstException.ErrorKind.NON_CONVERGENT, ex.kind());
            assertEquals(ShortestDistance.REASON_ITERATION_LIMIT, ex.reasonCode());
        }

        @Test
        @DisplayName("Defaults pick up system properties")
        void testDefaultsFromProperties() {
            String previous = System.getProperty(AlgorithmDefaults.PROP_MAX_ITERATIONS);
            try {
                System.setProperty(AlgorithmDefaults.PROP_MAX_ITERATIONS, "17");
                assertEquals(17, ShortestDistanceConfig.defaults().getMaxIterations());
                System.setProperty(AlgorithmDefaults.PROP_MAX_ITERATIONS, "not-a-number");
                assertEquals(AlgorithmDefaults.UNBOUNDED, ShortestDistanceConfig.defaults().getMaxIterations());
            } finally {
                if (previous == null) {
                    System.clearProperty(AlgorithmDefaults.PROP_MAX_ITERATIONS);
                } else {
                    System.setProperty(AlgorithmDefaults.PROP_MAX_ITERATIONS, previous);
                }
            }
            assertEquals(QueueType.AUTO, ShortestDistanceConfig.defaults().getQueueType());
        }
    }
}
