package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.properties.FstProperties;
import org.Aayush.wfst.semiring.TropicalSemiring;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.Aayush.wfst.testutil.FstFixtureFactory.tropical;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tw;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Encoding label pairs and weights into single labels.
 */
@DisplayName("Encode and Decode")
class EncodeTest {

    @Test
    @DisplayName("Encoding labels turns a transducer into an acceptor")
    void testEncodeLabels() {
        VectorFst<TropicalWeight> original = FstFixtureFactory.functionalTransducer();
        VectorFst<TropicalWeight> fst = VectorFst.copyOf(original);
        EncodeTable<TropicalWeight> table = Encode.encode(fst, EncodeTable.ENCODE_LABELS);
        assertTrue(fst.hasProperties(FstProperties.ACCEPTOR));
        assertEquals(4, table.size());
        assertEquals(original.numStates(), fst.numStates());
        assertEquals(tw(1), fst.arc(0, 0).weight());

        Encode.decode(fst, table);
        assertTrue(Isomorphic.isomorphic(original, fst));
    }

    @Test
    @DisplayName("Encoding weights leaves an unweighted automaton with a super-final state")
    void testEncodeWeights() {
        VectorFst<TropicalWeight> original = FstFixtureFactory.shortestDistanceExample();
        VectorFst<TropicalWeight> fst = VectorFst.copyOf(original);
        EncodeTable<TropicalWeight> table = Encode.encode(fst, EncodeTable.ENCODE_LABELS | EncodeTable.ENCODE_WEIGHTS);
        assertTrue(fst.hasProperties(FstProperties.UNWEIGHTED | FstProperties.ACCEPTOR));
        assertEquals(original.numStates() + 1, fst.numStates());
        assertFalse(fst.isFinal(2));

        Encode.decode(fst, table);
        assertTrue(Isomorphic.isomorphic(original, fst));
    }

    @Test
    @DisplayName("Equal triples share one label, starting at one")
    void testTable() {
        EncodeTable<TropicalWeight> table = new EncodeTable<>(TropicalSemiring.INSTANCE, EncodeTable.ENCODE_LABELS);
        assertEquals(1, table.encode(3, 4, tw(1)));
        assertEquals(2, table.encode(3, 5, tw(1)));
        assertEquals(1, table.encode(3, 4, tw(7)), "weights are ignored without ENCODE_WEIGHTS");
        EncodeTable.Triple<TropicalWeight> triple = table.decode(2);
        assertEquals(3, triple.ilabel());
        assertEquals(5, triple.olabel());
        assertEquals(TropicalWeight.ONE, triple.weight());
    }

    @Test
    @DisplayName("Decoding a label never handed out is not found")
    void testUnknownLabel() {
        VectorFst<TropicalWeight> fst = tropical("0 1 1 2 1\n1 0");
        EncodeTable<TropicalWeight> table = Encode.encode(fst, EncodeTable.ENCODE_LABELS);
        fst.setArc(0, 0, Arc.of(99, 99, tw(1), 1));
        FstException ex = assertThrows(FstException.class, () -> Encode.decode(fst, table));
        assertEquals(FstException.ErrorKind.NOT_FOUND, ex.kind());
        assertEquals(EncodeTable.REASON_UNKNOWN_LABEL, ex.reasonCode());
    }

    @Test
    @DisplayName("A table must encode something")
    void testEmptyFlags() {
        FstException ex = assertThrows(FstException.class,
                () -> new EncodeTable<>(TropicalSemiring.INSTANCE, 0));
        assertEquals(EncodeTable.REASON_EMPTY_FLAGS, ex.reasonCode());
    }
}
