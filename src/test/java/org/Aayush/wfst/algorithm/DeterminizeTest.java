package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.IntegerSemiring;
import org.Aayush.wfst.semiring.IntegerWeight;
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
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Determinization")
class DeterminizeTest {

    private static <W> void assertDeterministicOnNonEpsilonInput(VectorFst<W> fst) {
        for (int s = 0; s < fst.numStates(); s++) {
            IntSet seen = new IntOpenHashSet();
            for (Arc<W> arc : fst.arcs(s)) {
                if (arc.ilabel() != Labels.EPSILON) {
                    assertTrue(seen.add(arc.ilabel()), "state " + s + " repeats input " + arc.ilabel());
                }
            }
        }
    }

    @Nested
    @DisplayName("1. Acceptors")
    class Acceptors {

        @Test
        @DisplayName("Tropical acceptor keeps the best weight per string")
        void testTropicalAcceptor() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.nondeterministicAcceptor();
            VectorFst<TropicalWeight> det = Determinize.determinize(fst);
            assertTrue(det.hasProperties(FstProperties.I_DETERMINISTIC));
            assertEquals(3, det.numStates());
            assertSameRelation(fst, det);
            assertEquals(Map.of("1 2:1 2", 2.0f, "1 3:1 3", 3.0f), relation(det));
        }

        @Test
        @DisplayName("Log acceptor sums the weights of equal strings")
        void testLogAcceptor() {
            VectorFst<LogWeight> fst = log(String.join("\n",
                    "0 1 1 1 1",
                    "0 2 1 1 2",
                    "1 3 2 2 1",
                    "2 3 2 2 2",
                    "3 0"));
            VectorFst<LogWeight> det = Determinize.determinize(fst);
            assertTrue(det.hasProperties(FstProperties.I_DETERMINISTIC));
            assertSameRelation(fst, det);
            // -log(e^-2 + e^-4); residuals are not snapped to the delta grid
            assertEquals(1.873072f, relation(det).get("1 2:1 2"), 1e-5f);
        }

        @Test
        @DisplayName("Already deterministic input keeps its shape")
        void testDeterministicInput() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.shortestDistanceExample();
            VectorFst<TropicalWeight> det = Determinize.determinize(fst);
            assertEquals(fst.numStates(), det.numStates());
            assertTrue(Isomorphic.isomorphic(fst, det));
        }
    }

    @Nested
    @DisplayName("2. Transducers")
    class Transducers {

        @Test
        @DisplayName("Functional transducer delays output until it is known")
        void testFunctional() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.functionalTransducer();
            VectorFst<TropicalWeight> det = Determinize.determinize(fst);
            assertTrue(det.hasProperties(FstProperties.I_DETERMINISTIC));
            assertEquals(1, det.numArcs(det.start()));
            assertSameRelation(fst, det);
        }

        @Test
        @DisplayName("Non-functional input is a precondition failure by default")
        void testNonFunctional() {
            FstException ex = assertThrows(FstException.class,
                    () -> Determinize.determinize(FstFixtureFactory.nonFunctionalTransducer()));
            assertEquals(FstException.ErrorKind.PRECONDITION_VIOLATED, ex.kind());
            assertEquals(Determinize.REASON_NON_FUNCTIONAL, ex.reasonCode());
        }

        @Test
        @DisplayName("Non-functional mode keeps every output")
        void testNonFunctionalMode() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.nonFunctionalTransducer();
            VectorFst<TropicalWeight> det = Determinize.determinize(
                    fst, DeterminizeConfig.of(DeterminizeType.NONFUNCTIONAL));
            // residual outputs leave through parallel epsilon arcs towards the final states
            assertDeterministicOnNonEpsilonInput(det);
            assertSameRelation(fst, det);
        }

        @Test
        @DisplayName("Disambiguation keeps only the best output")
        void testDisambiguate() {
            VectorFst<TropicalWeight> det = Determinize.determinize(
                    FstFixtureFactory.nonFunctionalTransducer(), DeterminizeConfig.of(DeterminizeType.DISAMBIGUATE));
            assertTrue(det.hasProperties(FstProperties.I_DETERMINISTIC));
            assertEquals(Map.of("1:1", 1.0f), relation(det));
        }
    }

    @Nested
    @DisplayName("3. Preconditions")
    class Preconditions {

        @Test
        @DisplayName("Disambiguation needs a path semiring")
        void testDisambiguateLog() {
            VectorFst<LogWeight> fst = log("0 1 1 2 1\n1 0");
            FstException ex = assertThrows(FstException.class, () -> Determinize.determinize(
                    fst, DeterminizeConfig.of(DeterminizeType.DISAMBIGUATE)));
            assertEquals(Determinize.REASON_NOT_PATH_SEMIRING, ex.reasonCode());
        }

        @Test
        @DisplayName("Semirings without division are rejected")
        void testNotDivisible() {
            VectorFst<IntegerWeight> fst = new VectorFst<>(IntegerSemiring.INSTANCE);
            fst.addStates(1);
            fst.setStart(0);
            FstException ex = assertThrows(FstException.class, () -> Determinize.determinize(fst));
            assertEquals(Reweight.REASON_NOT_DIVISIBLE, ex.reasonCode());
        }
    }
}
