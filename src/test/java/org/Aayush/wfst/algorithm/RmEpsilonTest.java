package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.queue.QueueType;
import org.Aayush.wfst.semiring.LogWeight;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.Aayush.wfst.testutil.FstFixtureFactory.assertSameRelation;
import static org.Aayush.wfst.testutil.FstFixtureFactory.log;
import static org.Aayush.wfst.testutil.FstFixtureFactory.relation;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tropical;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tw;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Epsilon Removal")
class RmEpsilonTest {

    @Nested
    @DisplayName("1. Epsilon Removal")
    class Removal {

        @Test
        @DisplayName("Epsilon chains are folded into direct arcs and final weights")
        void testEpsilonAcceptor() {
            VectorFst<TropicalWeight> original = FstFixtureFactory.epsilonAcceptor();
            VectorFst<TropicalWeight> fst = VectorFst.copyOf(original);
            RmEpsilon.rmEpsilon(fst);
            assertTrue(fst.hasProperties(FstProperties.NO_EPSILONS));
            assertSameRelation(original, fst);
            assertEquals(tw(4.5f), fst.finalWeight(fst.start()));
        }

        @Test
        @DisplayName("Log weights of alternative epsilon paths are summed")
        void testLog() {
            VectorFst<LogWeight> original = log(String.join("\n",
                    "0 1 0 0 1",
                    "0 2 0 0 2",
                    "1 3 0 0 0.5",
                    "2 3 0 0 0.5",
                    "3 4 9 9 1",
                    "4 0"));
            VectorFst<LogWeight> fst = VectorFst.copyOf(original);
            RmEpsilon.rmEpsilon(fst);
            assertTrue(fst.hasProperties(FstProperties.NO_EPSILONS));
            assertSameRelation(original, fst);
        }

        @Test
        @DisplayName("Epsilon cycles are absorbed by the closure")
        void testEpsilonCycle() {
            VectorFst<TropicalWeight> fst = tropical(String.join("\n",
                    "0 1 0 0 1",
                    "1 0 0 0 1",
                    "1 2 3 3 1",
                    "2 0"));
            RmEpsilon.rmEpsilon(fst);
            assertTrue(fst.hasProperties(FstProperties.NO_EPSILONS));
            assertEquals(Map.of("3:3", 2.0f), relation(fst));
        }

        @Test
        @DisplayName("Result does not depend on the queue discipline")
        void testQueues() {
            VectorFst<TropicalWeight> original = FstFixtureFactory.epsilonAcceptor();
            for (QueueType type : new QueueType[]{QueueType.FIFO, QueueType.LIFO, QueueType.SHORTEST_FIRST}) {
                VectorFst<TropicalWeight> fst = VectorFst.copyOf(original);
                RmEpsilon.rmEpsilon(fst, RmEpsilonConfig.builder().queueType(type).build());
                assertSameRelation(original, fst);
            }
        }

        @Test
        @DisplayName("Without connect the unreachable epsilon targets stay")
        void testNoConnect() {
            VectorFst<TropicalWeight> fst = tropical("0 1 0 0 1\n1 2 4 4 1\n2 0");
            RmEpsilon.rmEpsilon(fst, RmEpsilonConfig.builder().connect(false).build());
            assertEquals(3, fst.numStates());
            RmEpsilon.rmEpsilon(fst);
            assertEquals(2, fst.numStates());
        }
    }

    @Nested
    @DisplayName("2. Final Epsilon Removal")
    class FinalEpsilons {

        @Test
        @DisplayName("Epsilon arc into a dead-end final becomes a final weight")
        void testFold() {
            VectorFst<TropicalWeight> fst = tropical("0 1 1 1 1\n1 2 0 0 2\n2 3");
            RmFinalEpsilon.rmFinalEpsilon(fst);
            assertEquals(2, fst.numStates());
            assertEquals(tw(5), fst.finalWeight(1));
            assertEquals(0, fst.numArcs(1));
        }

        @Test
        @DisplayName("Final states with further labeled arcs are kept")
        void testKeepsLiveFinals() {
            VectorFst<TropicalWeight> original = tropical("0 1 0 0 1\n1 2 3 3 1\n1 0\n2 0");
            VectorFst<TropicalWeight> fst = VectorFst.copyOf(original);
            RmFinalEpsilon.rmFinalEpsilon(fst);
            assertTrue(Isomorphic.isomorphic(original, fst));
        }

        @Test
        @DisplayName("Epsilon cycle among final states is rejected")
        void testCycle() {
            VectorFst<TropicalWeight> fst = tropical(String.join("\n",
                    "0 1 1 1 1",
                    "1 2 0 0 1",
                    "2 1 0 0 1",
                    "1 0",
                    "2 0"));
            FstException ex = assertThrows(FstException.class, () -> RmFinalEpsilon.rmFinalEpsilon(fst));
            assertEquals(FstException.ErrorKind.PRECONDITION_VIOLATED, ex.kind());
            assertEquals(RmFinalEpsilon.REASON_EPSILON_CYCLE, ex.reasonCode());
        }
    }
}
