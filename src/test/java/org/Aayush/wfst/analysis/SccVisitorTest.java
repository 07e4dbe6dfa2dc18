package org.Aayush.wfst.analysis;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.TropicalSemiring;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.Aayush.wfst.testutil.FstFixtureFactory.tropical;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Analysis")
class SccVisitorTest {

    @Nested
    @DisplayName("1. Strongly Connected Components")
    class Components {

        @Test
        @DisplayName("Cycle {2,3,4} forms the only non-trivial component")
        void testKnownCycle() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            SccResult scc = SccVisitor.compute(fst);

            assertEquals(4, scc.count());
            int cycle = scc.component(2);
            assertEquals(cycle, scc.component(3));
            assertEquals(cycle, scc.component(4));
            assertEquals(3, scc.componentSize(cycle));
            assertTrue(scc.isCyclic(cycle));
            for (int s : new int[]{0, 1, 5}) {
                int c = scc.component(s);
                assertNotEquals(cycle, c, "state " + s + " is outside the cycle");
                assertEquals(1, scc.componentSize(c));
                assertFalse(scc.isCyclic(c));
            }
            assertFalse(scc.initialCyclic());
        }

        @Test
        @DisplayName("Component ids follow topological order of the component graph")
        void testComponentOrder() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            SccResult scc = SccVisitor.compute(fst);
            for (int s = 0; s < fst.numStates(); s++) {
                for (Arc<TropicalWeight> arc : fst.arcs(s)) {
                    assertTrue(scc.component(s) <= scc.component(arc.nextState()),
                            "arc " + s + "->" + arc.nextState() + " goes backwards in component order");
                }
            }
        }

        @Test
        @DisplayName("Self-loop makes a singleton component cyclic")
        void testSelfLoop() {
            VectorFst<TropicalWeight> fst = tropical("0 0 1 1\n0 1 2 2\n1 0");
            SccResult scc = SccVisitor.compute(fst);
            assertTrue(scc.isCyclic(scc.component(0)));
            assertTrue(scc.initialCyclic());
            assertFalse(scc.isCyclic(scc.component(1)));
        }

        @Test
        @DisplayName("Accessibility and coaccessibility are recorded per state")
        void testReachability() {
            VectorFst<TropicalWeight> fst = tropical(String.join("\n",
                    "0 1 1 1",
                    "0 2 2 2",
                    "3 1 1 1",
                    "1 0"));
            SccResult scc = SccVisitor.compute(fst);
            assertTrue(scc.isAccessible(0));
            assertTrue(scc.isAccessible(2));
            assertFalse(scc.isAccessible(3));
            assertTrue(scc.isCoaccessible(3));
            assertFalse(scc.isCoaccessible(2));
        }

        @Test
        @DisplayName("Filtered components only follow epsilon arcs")
        void testFiltered() {
            VectorFst<TropicalWeight> fst = tropical(String.join("\n",
                    "0 1 0 0",
                    "1 0 5 5",
                    "1 2 0 0",
                    "2 1 0 0",
                    "2 0"));
            SccResult all = SccVisitor.compute(fst);
            SccResult eps = SccVisitor.compute(fst, ArcFilters.epsilon());
            assertEquals(1, all.count());
            assertEquals(eps.component(1), eps.component(2));
            assertNotEquals(eps.component(0), eps.component(1));
        }
    }

    @Nested
    @DisplayName("2. Topological Order")
    class Topology {

        @Test
        @DisplayName("TopSort renumbers an acyclic automaton so every arc moves forward")
        void testTopSort() {
            VectorFst<TropicalWeight> fst = tropical(String.join("\n",
                    "2 0 1 1",
                    "2 1 2 2",
                    "1 0 3 3",
                    "0 0"));
            assertEquals(2, fst.start());
            assertTrue(TopSort.topSort(fst));
            assertEquals(0, fst.start());
            for (int s = 0; s < fst.numStates(); s++) {
                for (Arc<TropicalWeight> arc : fst.arcs(s)) {
                    assertTrue(arc.nextState() > s);
                }
            }
            assertTrue(fst.isFinal(2));
        }

        @Test
        @DisplayName("TopSort leaves a cyclic automaton untouched")
        void testCyclic() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            VectorFst<TropicalWeight> before = VectorFst.copyOf(fst);
            assertFalse(TopSort.topSort(fst));
            assertEquals(before.arcs(4), fst.arcs(4));
            assertThrows(FstException.class, () -> TopSort.requireTopOrder(fst));
        }

        @Test
        @DisplayName("StateSort rejects non-permutations")
        void testStateSortValidation() {
            VectorFst<TropicalWeight> fst = tropical("0 1 1 1\n1 0");
            FstException ex = assertThrows(FstException.class,
                    () -> StateSort.sort(fst, new int[]{0, 0}));
            assertEquals(StateSort.REASON_NOT_A_PERMUTATION, ex.reasonCode());
        }
    }

    @Nested
    @DisplayName("3. Traversal Infrastructure")
    class Traversal {

        @Test
        @DisplayName("Reverse adjacency lists every incoming arc")
        void testReverseAdjacency() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            ReverseAdjacency in = ReverseAdjacency.build(fst);
            assertEquals(2, in.incomingEnd(2) - in.incomingStart(2));
            boolean fromFour = false;
            for (int p = in.incomingStart(2); p < in.incomingEnd(2); p++) {
                int source = in.sourceAt(p);
                assertEquals(2, fst.arc(source, in.arcIndexAt(p)).nextState());
                fromFour |= source == 4;
            }
            assertTrue(fromFour);
            assertEquals(0, in.incomingEnd(0) - in.incomingStart(0));
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("DFS handles very deep chains without recursion")
        void testDeepChain() {
            int n = 200_000;
            VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
            fst.addStates(n);
            fst.setStart(0);
            for (int s = 0; s + 1 < n; s++) {
                fst.addArc(s, 1, 1, TropicalWeight.ONE, s + 1);
            }
            fst.setFinal(n - 1, TropicalWeight.ONE);
            SccResult scc = SccVisitor.compute(fst);
            assertEquals(n, scc.count());
            assertTrue(scc.allAccessible());
            assertTrue(scc.allCoaccessible());
        }

        @Test
        @DisplayName("A visitor can stop the traversal early")
        void testEarlyStop() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            int[] discovered = new int[1];
            DfsVisit.visit(fst, new DfsVisitor<>() {
                @Override
                public void initVisit(Fst<TropicalWeight> f) {
                }

                @Override
                public boolean initState(int state, int root) {
                    discovered[0]++;
                    return state < 2;
                }

                @Override
                public boolean treeArc(int state, Arc<TropicalWeight> arc) {
                    return true;
                }

                @Override
                public boolean backArc(int state, Arc<TropicalWeight> arc) {
                    return true;
                }

                @Override
                public boolean forwardOrCrossArc(int state, Arc<TropicalWeight> arc) {
                    return true;
                }

                @Override
                public void finishState(int state, int parent, Arc<TropicalWeight> parentArc) {
                }

                @Override
                public void finishVisit() {
                }
            });
            assertEquals(3, discovered[0]);
        }
    }
}
