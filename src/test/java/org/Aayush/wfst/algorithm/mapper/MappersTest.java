package org.Aayush.wfst.algorithm.mapper;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.ArcMap;
import org.Aayush.wfst.algorithm.FinalArc;
import org.Aayush.wfst.algorithm.ProjectType;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.TropicalSemiring;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.semiring.WeaklyDivisibleSemiring;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.Aayush.wfst.testutil.FstFixtureFactory.tw;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Arc Mappers")
class MappersTest {
    private static final TropicalSemiring TROPICAL = TropicalSemiring.INSTANCE;
    private static final Arc<TropicalWeight> ARC = Arc.of(3, 4, tw(2), 7);

    @Nested
    @DisplayName("1. Weight Mappers")
    class Weights {

        @Test
        @DisplayName("Plus and times combine with a constant")
        void testPlusTimes() {
            assertEquals(tw(1), new PlusMapper<>(TROPICAL, tw(1)).map(ARC).weight());
            assertEquals(tw(2), new PlusMapper<>(TROPICAL, tw(5)).map(ARC).weight());
            assertEquals(tw(7), new TimesMapper<>(TROPICAL, tw(5)).map(ARC).weight());
            assertEquals(tw(6), new TimesMapper<>(TROPICAL, tw(5)).mapFinal(FinalArc.of(tw(1))).weight());
        }

        @Test
        @DisplayName("Invert weight divides one by the weight")
        void testInvertWeight() {
            InvertWeightMapper<TropicalWeight> mapper = new InvertWeightMapper<>(TROPICAL);
            assertEquals(tw(-2), mapper.map(ARC).weight());
            assertEquals(tw(-0.5f), mapper.mapFinal(FinalArc.of(tw(0.5f))).weight());
            FstException ex = assertThrows(FstException.class,
                    () -> mapper.map(ARC.withWeight(TropicalWeight.ZERO)));
            assertEquals(WeaklyDivisibleSemiring.REASON_DIVIDE_BY_ZERO, ex.reasonCode());
        }

        @Test
        @DisplayName("Remove weight keeps zero and sets everything else to one")
        void testRmWeight() {
            RmWeightMapper<TropicalWeight> mapper = new RmWeightMapper<>(TROPICAL);
            assertEquals(TropicalWeight.ONE, mapper.map(ARC).weight());
            assertEquals(TropicalWeight.ZERO, mapper.mapFinal(FinalArc.of(TropicalWeight.ZERO)).weight());

            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            ArcMap.map(fst, mapper);
            assertTrue(fst.hasProperties(FstProperties.UNWEIGHTED));
        }

        @Test
        @DisplayName("Quantize snaps weights to the grid")
        void testQuantize() {
            QuantizeMapper<TropicalWeight> mapper = new QuantizeMapper<>(TROPICAL, 0.5f);
            assertEquals(tw(1.5f), mapper.map(ARC.withWeight(tw(1.4f))).weight());
            assertEquals(tw(1.0f), mapper.map(ARC.withWeight(tw(1.2f))).weight());
            assertEquals(TropicalWeight.ZERO, mapper.mapFinal(FinalArc.of(TropicalWeight.ZERO)).weight());
        }
    }

    @Nested
    @DisplayName("2. Label Mappers")
    class LabelMappers {

        @Test
        @DisplayName("Identity and invert")
        void testIdentityInvert() {
            assertSame(ARC, new IdentityMapper<TropicalWeight>().map(ARC));
            assertEquals(Arc.of(4, 3, tw(2), 7), new InvertMapper<TropicalWeight>().map(ARC));
        }

        @Test
        @DisplayName("Epsilon mappers clear one side")
        void testEpsilonMappers() {
            assertEquals(Arc.of(0, 4, tw(2), 7), new InputEpsilonMapper<TropicalWeight>().map(ARC));
            assertEquals(Arc.of(3, 0, tw(2), 7), new OutputEpsilonMapper<TropicalWeight>().map(ARC));
        }

        @Test
        @DisplayName("Projection copies the chosen side")
        void testProject() {
            assertEquals(Arc.of(3, 3, tw(2), 7), new ProjectMapper<TropicalWeight>(ProjectType.INPUT).map(ARC));
            assertEquals(Arc.of(4, 4, tw(2), 7), new ProjectMapper<TropicalWeight>(ProjectType.OUTPUT).map(ARC));
            long props = new ProjectMapper<TropicalWeight>(ProjectType.INPUT)
                    .properties(FstProperties.NOT_ACCEPTOR | FstProperties.ACYCLIC);
            assertEquals(FstProperties.ACCEPTOR | FstProperties.ACYCLIC, props);
        }

        @Test
        @DisplayName("Relabel leaves labels absent from the tables alone")
        void testRelabel() {
            Int2IntMap input = new Int2IntOpenHashMap();
            input.put(3, 30);
            RelabelMapper<TropicalWeight> mapper = new RelabelMapper<>(input, new Int2IntOpenHashMap());
            assertEquals(Arc.of(30, 4, tw(2), 7), mapper.map(ARC));
            Arc<TropicalWeight> untouched = Arc.of(5, 6, tw(1), 0);
            assertSame(untouched, mapper.map(untouched));
        }
    }
}
