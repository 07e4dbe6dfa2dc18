package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.GallicSemiring;
import org.Aayush.wfst.semiring.GallicType;
import org.Aayush.wfst.semiring.GallicWeight;
import org.Aayush.wfst.semiring.IntegerSemiring;
import org.Aayush.wfst.semiring.IntegerWeight;
import org.Aayush.wfst.semiring.LogWeight;
import org.Aayush.wfst.semiring.StringWeight;
import org.Aayush.wfst.semiring.TropicalSemiring;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.Aayush.wfst.testutil.FstFixtureFactory.assertSameRelation;
import static org.Aayush.wfst.testutil.FstFixtureFactory.log;
import static org.Aayush.wfst.testutil.FstFixtureFactory.relation;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tropical;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tw;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reweighting and Pushing")
class PushTest {

    /**
     * Every non-start state leaves with at least one zero-cost option after pushing to the start.
     */
    private static void assertStochastic(VectorFst<TropicalWeight> fst) {
        for (int s = 0; s < fst.numStates(); s++) {
            if (s == fst.start()) {
                continue;
            }
            float best = fst.finalWeight(s).value();
            for (Arc<TropicalWeight> arc : fst.arcs(s)) {
                best = Math.min(best, arc.weight().value());
            }
            assertEquals(0.0f, best, FstFixtureFactory.EPS, "state " + s);
        }
    }

    @Nested
    @DisplayName("1. Weight Pushing")
    class Weights {

        @Test
        @DisplayName("Pushing toward the start keeps path weights and front-loads costs")
        void testToInitial() {
            VectorFst<TropicalWeight> original = FstFixtureFactory.shortestDistanceExample();
            VectorFst<TropicalWeight> pushed = VectorFst.copyOf(original);
            Push.pushWeights(pushed, ReweightType.TO_INITIAL);
            assertSameRelation(original, pushed);
            assertStochastic(pushed);
            assertEquals(tw(5), pushed.arc(0, 0).weight());
        }

        @Test
        @DisplayName("Pushing toward the finals keeps path weights")
        void testToFinal() {
            VectorFst<TropicalWeight> original = FstFixtureFactory.shortestDistanceExample();
            VectorFst<TropicalWeight> pushed = Push.push(original, ReweightType.TO_FINAL, Push.PUSH_WEIGHTS);
            assertSameRelation(original, pushed);
            assertEquals(tw(0), pushed.arc(1, 0).weight(), "a->b lies on the shortest path to b");
        }

        @Test
        @DisplayName("Removing the total weight shifts every path by the best cost")
        void testRemoveTotal() {
            VectorFst<TropicalWeight> pushed = Push.push(FstFixtureFactory.shortestDistanceExample(),
                    ReweightType.TO_INITIAL, Push.PUSH_WEIGHTS | Push.REMOVE_TOTAL_WEIGHT);
            Map<String, Float> paths = relation(pushed);
            assertEquals(0.0f, paths.get("1 2:1 2"), FstFixtureFactory.EPS);
            assertEquals(5.0f, paths.get("3:3"), FstFixtureFactory.EPS);
            assertEquals(10.0f, paths.get("3 4:3 4"), FstFixtureFactory.EPS);
        }

        @Test
        @DisplayName("Log pushing preserves the summed relation")
        void testLog() {
            VectorFst<LogWeight> original = log(String.join("\n",
                    "0 1 1 1 0.5",
                    "0 1 2 2 1.5",
                    "1 2 3 3 1",
                    "1 3 4 4 0.25",
                    "2 0.75",
                    "3 2"));
            VectorFst<LogWeight> toInitial = Push.push(original, ReweightType.TO_INITIAL, Push.PUSH_WEIGHTS);
            VectorFst<LogWeight> toFinal = Push.push(original, ReweightType.TO_FINAL, Push.PUSH_WEIGHTS);
            assertSameRelation(original, toInitial);
            assertSameRelation(original, toFinal);
        }

        @Test
        @DisplayName("Start state on a cycle gets a fresh start state")
        void testInitialCyclic() {
            VectorFst<TropicalWeight> original = tropical("0 1 1 1 2\n1 0 2 2 3\n1 4");
            VectorFst<TropicalWeight> pushed = VectorFst.copyOf(original);
            Push.pushWeights(pushed, ReweightType.TO_INITIAL);
            assertEquals(3, pushed.numStates());
            assertEquals(2, pushed.start());
            assertEquals(Arc.of(0, 0, tw(6), 0), pushed.arc(2, 0));
            assertEquals(tw(6), ShortestDistance.totalWeight(pushed));
        }
    }

    @Nested
    @DisplayName("2. Label Pushing")
    class LabelPushing {

        @Test
        @DisplayName("Shared output suffix moves onto the start arcs")
        void testLabelsToInitial() {
            VectorFst<TropicalWeight> original = tropical(String.join("\n",
                    "0 1 1 0 1",
                    "0 3 3 0 1",
                    "1 2 2 5 1",
                    "3 2 4 5 1",
                    "2 0"));
            VectorFst<TropicalWeight> pushed = Push.push(original, ReweightType.TO_INITIAL, Push.PUSH_LABELS);
            assertSameRelation(original, pushed);
            for (Arc<TropicalWeight> arc : pushed.arcs(pushed.start())) {
                assertEquals(5, arc.olabel());
            }
        }

        @Test
        @DisplayName("Pushing labels and weights together keeps the relation")
        void testLabelsAndWeights() {
            VectorFst<TropicalWeight> original = FstFixtureFactory.functionalTransducer();
            VectorFst<TropicalWeight> pushed = Push.push(original, ReweightType.TO_FINAL,
                    Push.PUSH_LABELS | Push.PUSH_WEIGHTS);
            assertSameRelation(original, pushed);
        }
    }

    @Nested
    @DisplayName("3. Reweight and Factor Weight")
    class Reweighting {

        @Test
        @DisplayName("Reweighting with arbitrary potentials keeps the relation")
        void testReweight() {
            VectorFst<TropicalWeight> original = FstFixtureFactory.shortestDistanceExample();
            VectorFst<TropicalWeight> fst = VectorFst.copyOf(original);
            Reweight.reweight(fst, List.of(tw(1), tw(7), tw(2), tw(3)), ReweightType.TO_FINAL);
            assertSameRelation(original, fst);
        }

        @Test
        @DisplayName("Semirings without division are rejected")
        void testNotDivisible() {
            VectorFst<IntegerWeight> fst = new VectorFst<>(IntegerSemiring.INSTANCE);
            fst.addStates(1);
            fst.setStart(0);
            FstException ex = assertThrows(FstException.class,
                    () -> Reweight.reweight(fst, List.of(IntegerWeight.of(2)), ReweightType.TO_INITIAL));
            assertEquals(FstException.ErrorKind.PRECONDITION_VIOLATED, ex.kind());
            assertEquals(Reweight.REASON_NOT_DIVISIBLE, ex.reasonCode());
        }

        @Test
        @DisplayName("Multi-label Gallic strings are split into single-label arcs")
        void testFactorGallic() {
            GallicSemiring<TropicalWeight> gallic = new GallicSemiring<>(GallicType.LEFT, TropicalSemiring.INSTANCE);
            VectorFst<GallicWeight<TropicalWeight>> fst = new VectorFst<>(gallic);
            fst.addStates(2);
            fst.setStart(0);
            fst.addArc(0, 1, 1, GallicWeight.of(StringWeight.of(7, 8), tw(2)), 1);
            fst.setFinal(1, GallicWeight.of(StringWeight.of(9), tw(1)));

            VectorFst<GallicWeight<TropicalWeight>> factored = FactorWeight.factorWeight(
                    fst,
                    GallicAdapter.of(gallic).factorizer(),
                    FactorWeight.FACTOR_ARC_WEIGHTS | FactorWeight.FACTOR_FINAL_WEIGHTS,
                    FstFixtureFactory.EPS);
            for (int s = 0; s < factored.numStates(); s++) {
                for (Arc<GallicWeight<TropicalWeight>> arc : factored.arcs(s)) {
                    assertTrue(arc.weight().string().size() <= 1, arc.toString());
                }
            }
            Map<String, Float> paths = relation(WeightConvert.fromGallic(factored));
            assertEquals(Map.of("1:7 8 9", 3.0f), paths);
        }
    }
}
