package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.mapper.ArcSumMapper;
import org.Aayush.wfst.algorithm.mapper.ArcUniqueMapper;
import org.Aayush.wfst.algorithm.mapper.IdentityMapper;
import org.Aayush.wfst.algorithm.mapper.WeightFunctionConverter;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.GallicType;
import org.Aayush.wfst.semiring.LogSemiring;
import org.Aayush.wfst.semiring.LogWeight;
import org.Aayush.wfst.semiring.TropicalSemiring;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.wfst.testutil.FstFixtureFactory.assertSameRelation;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tropical;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tw;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Arc and State Mapping")
class ArcMapTest {

    /**
     * Moves every final weight onto an arc labeled 9:9.
     */
    private static ArcMapper<TropicalWeight> labelFinals(MapFinalAction action) {
        return new ArcMapper<>() {
            @Override
            public Arc<TropicalWeight> map(Arc<TropicalWeight> arc) {
                return arc;
            }

            @Override
            public FinalArc<TropicalWeight> mapFinal(FinalArc<TropicalWeight> finalArc) {
                return FinalArc.of(9, 9, finalArc.weight());
            }

            @Override
            public MapFinalAction finalAction() {
                return action;
            }
        };
    }

    @Nested
    @DisplayName("1. Final Actions")
    class FinalActions {

        @Test
        @DisplayName("Identity mapping leaves the automaton unchanged")
        void testIdentity() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.shortestDistanceExample();
            VectorFst<TropicalWeight> before = VectorFst.copyOf(fst);
            ArcMap.map(fst, new IdentityMapper<>());
            assertTrue(Isomorphic.isomorphic(before, fst));
        }

        @Test
        @DisplayName("Labels on a final arc are rejected without a super-final state")
        void testNoSuperfinal() {
            VectorFst<TropicalWeight> fst = tropical("0 1 1 1 1\n1 2");
            FstException ex = assertThrows(FstException.class,
                    () -> ArcMap.map(fst, labelFinals(MapFinalAction.NO_SUPERFINAL)));
            assertEquals(FstException.ErrorKind.PRECONDITION_VIOLATED, ex.kind());
            assertEquals(ArcMap.REASON_NON_EPSILON_FINAL, ex.reasonCode());
        }

        @Test
        @DisplayName("Labeled final arcs are routed to a shared super-final state when allowed")
        void testAllowSuperfinal() {
            VectorFst<TropicalWeight> fst = tropical("0 1 1 1 1\n0 2 2 2 1\n1 2\n2 3");
            ArcMap.map(fst, labelFinals(MapFinalAction.ALLOW_SUPERFINAL));
            assertEquals(4, fst.numStates());
            assertFalse(fst.isFinal(1));
            assertFalse(fst.isFinal(2));
            assertTrue(fst.isFinal(3));
            assertEquals(Arc.of(9, 9, tw(2), 3), fst.arc(1, 0));
            assertEquals(Arc.of(9, 9, tw(3), 3), fst.arc(2, 0));
            assertEquals(4.0f, FstFixtureFactory.relation(fst).get("2 9:2 9"), 1e-6);
            assertEquals(3.0f, FstFixtureFactory.relation(fst).get("1 9:1 9"), 1e-6);
        }

        @Test
        @DisplayName("A required super-final state is added even when no final carries labels")
        void testRequireSuperfinal() {
            VectorFst<TropicalWeight> fst = tropical("0 1 1 1 1\n1 2");
            ArcMap.map(fst, new ArcMapper<>() {
                @Override
                public Arc<TropicalWeight> map(Arc<TropicalWeight> arc) {
                    return arc;
                }

                @Override
                public FinalArc<TropicalWeight> mapFinal(FinalArc<TropicalWeight> finalArc) {
                    return finalArc;
                }

                @Override
                public MapFinalAction finalAction() {
                    return MapFinalAction.REQUIRE_SUPERFINAL;
                }
            });
            assertEquals(3, fst.numStates());
            assertFalse(fst.isFinal(1));
            assertEquals(TropicalWeight.ONE, fst.finalWeight(2));
            assertEquals(Arc.of(0, 0, tw(2), 2), fst.arc(1, 0));
        }

        @Test
        @DisplayName("Empty automaton is left alone")
        void testEmpty() {
            VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
            ArcMap.map(fst, labelFinals(MapFinalAction.REQUIRE_SUPERFINAL));
            assertEquals(0, fst.numStates());
        }
    }

    @Nested
    @DisplayName("2. State Mappers")
    class StateMappers {

        @Test
        @DisplayName("Arc sum merges parallel arcs and drops zero weights")
        void testArcSum() {
            VectorFst<TropicalWeight> fst = tropical(String.join("\n",
                    "0 1 2 2 3",
                    "0 1 1 1 4",
                    "0 1 2 2 1",
                    "0 1 3 3 inf",
                    "1 0"));
            StateMap.map(fst, new ArcSumMapper<>(TropicalSemiring.INSTANCE));
            assertEquals(List.of(Arc.of(1, 1, tw(4), 1), Arc.of(2, 2, tw(1), 1)), fst.arcs(0));
        }

        @Test
        @DisplayName("Arc unique removes exact duplicates only")
        void testArcUnique() {
            VectorFst<TropicalWeight> fst = tropical(String.join("\n",
                    "0 1 2 2 3",
                    "0 1 2 2 3",
                    "0 1 2 2 1",
                    "1 0"));
            StateMap.map(fst, new ArcUniqueMapper<>());
            assertEquals(List.of(Arc.of(2, 2, tw(3), 1), Arc.of(2, 2, tw(1), 1)), fst.arcs(0));
            assertEquals(TropicalWeight.ONE, fst.finalWeight(1));
        }
    }

    @Nested
    @DisplayName("3. Arc Sorting")
    class Sorting {

        @Test
        @DisplayName("Sorting is stable and idempotent")
        void testStableSort() {
            VectorFst<TropicalWeight> fst = tropical(String.join("\n",
                    "0 1 3 1 1",
                    "0 1 1 2 2",
                    "0 1 1 1 3",
                    "0 1 2 5 4",
                    "1 0"));
            ArcSort.sort(fst, ArcComparators.inputLabel());
            assertEquals(List.of(
                    Arc.of(1, 2, tw(2), 1),
                    Arc.of(1, 1, tw(3), 1),
                    Arc.of(2, 5, tw(4), 1),
                    Arc.of(3, 1, tw(1), 1)), fst.arcs(0));
            VectorFst<TropicalWeight> once = VectorFst.copyOf(fst);
            ArcSort.sort(fst, ArcComparators.inputLabel());
            assertEquals(once.arcs(0), fst.arcs(0));
            assertTrue(fst.hasProperties(FstProperties.I_LABEL_SORTED));
        }

        @Test
        @DisplayName("Output sort orders by output label")
        void testOutputSort() {
            VectorFst<TropicalWeight> fst = tropical("0 1 3 2 1\n0 1 1 4 2\n0 1 2 1 3\n1 0");
            ArcSort.sort(fst, ArcComparators.outputLabel());
            assertEquals(List.of(1, 2, 4), fst.arcs(0).stream().map(Arc::olabel).toList());
        }
    }

    @Nested
    @DisplayName("4. Weight Conversion")
    class Conversion {

        @Test
        @DisplayName("Tropical to log keeps the structure and values")
        void testTropicalToLog() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.shortestDistanceExample();
            VectorFst<LogWeight> converted = WeightConvert.convert(fst, LogSemiring.INSTANCE,
                    new WeightFunctionConverter<>(w -> LogWeight.of(w.value())));
            assertEquals(fst.numStates(), converted.numStates());
            assertEquals(LogWeight.of(4), converted.finalWeight(3));
            assertEquals(FstFixtureFactory.relation(fst), FstFixtureFactory.relation(converted));
        }

        @Test
        @DisplayName("Gallic round trip restores the transducer")
        void testGallicRoundTrip() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.functionalTransducer();
            VectorFst<TropicalWeight> back = WeightConvert.fromGallic(
                    WeightConvert.toGallic(fst, GallicType.LEFT));
            assertSameRelation(fst, back);
        }
    }
}
