package org.Aayush.wfst.io;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.Isomorphic;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.LogWeight;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.symbols.SymbolTable;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.Aayush.wfst.testutil.FstFixtureFactory.lw;
import static org.Aayush.wfst.testutil.FstFixtureFactory.tw;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Text FST Codec")
class TextFstCodecTest {
    private static final TextFstCodec<TropicalWeight> NUMERIC = TextFstCodec.numeric(FloatWeightCodec.TROPICAL);

    private static FstException malformed(String text) {
        FstException ex = assertThrows(FstException.class, () -> NUMERIC.parse(text));
        assertEquals(FstException.ErrorKind.MALFORMED, ex.kind());
        return ex;
    }

    @Nested
    @DisplayName("1. Parsing and Formatting")
    class Format {

        @Test
        @DisplayName("First source state is the start state and one-weights are implicit")
        void testParse() {
            VectorFst<TropicalWeight> fst = NUMERIC.parse("2 0 1 1\n\n0 1 3 4 0.5\n1\n0 2.5\n");
            assertEquals(2, fst.start());
            assertEquals(3, fst.numStates());
            assertEquals(Arc.of(1, 1, TropicalWeight.ONE, 0), fst.arc(2, 0));
            assertEquals(Arc.of(3, 4, tw(0.5f), 1), fst.arc(0, 0));
            assertEquals(TropicalWeight.ONE, fst.finalWeight(1));
            assertEquals(tw(2.5f), fst.finalWeight(0));
        }

        @Test
        @DisplayName("Formatting writes the start state first")
        void testFormat() {
            VectorFst<TropicalWeight> fst = NUMERIC.parse("1 0 1 2 0.5\n0 1 3 3\n0\n1 2");
            assertEquals("1\t0\t1\t2\t0.5\n1\t2\n0\t1\t3\t3\n0\n", NUMERIC.format(fst));
        }

        @Test
        @DisplayName("Format and parse round trip")
        void testRoundTrip() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            assertTrue(Isomorphic.isomorphic(fst, NUMERIC.parse(NUMERIC.format(fst))));
        }

        @Test
        @DisplayName("Log weights parse with the log codec")
        void testLog() {
            VectorFst<LogWeight> fst = TextFstCodec.numeric(FloatWeightCodec.LOG).parse("0 1 1 1 0.75\n1 inf\n");
            assertEquals(lw(0.75f), fst.arc(0, 0).weight());
            assertFalse(fst.isFinal(1));
        }

        @Test
        @DisplayName("Empty text gives an empty automaton")
        void testEmpty() {
            VectorFst<TropicalWeight> fst = NUMERIC.parse("");
            assertEquals(0, fst.numStates());
            assertEquals(Fst.NO_STATE, fst.start());
            assertEquals("", NUMERIC.format(fst));
        }
    }

    @Nested
    @DisplayName("2. Symbol Tables")
    class Symbols {

        @Test
        @DisplayName("Symbolic transducer round trips through its tables")
        void testSymbols() {
            SymbolTable in = new SymbolTable();
            in.addSymbol("a");
            in.addSymbol("b");
            SymbolTable out = new SymbolTable();
            out.addSymbol("x");
            TextFstCodec<TropicalWeight> codec = new TextFstCodec<>(FloatWeightCodec.TROPICAL, in, out, false);

            VectorFst<TropicalWeight> fst = codec.parse("0 1 a x 1\n1 2 b <eps>\n2\n");
            assertEquals(Arc.of(1, 1, tw(1), 1), fst.arc(0, 0));
            assertEquals(Arc.of(2, 0, TropicalWeight.ONE, 2), fst.arc(1, 0));
            assertEquals("0\t1\ta\tx\t1\n1\t2\tb\t<eps>\n2\n", codec.format(fst));
        }

        @Test
        @DisplayName("Acceptor format uses one label column")
        void testAcceptor() {
            SymbolTable symbols = new SymbolTable();
            symbols.addSymbol("a");
            TextFstCodec<TropicalWeight> codec = new TextFstCodec<>(FloatWeightCodec.TROPICAL, symbols, symbols, true);
            VectorFst<TropicalWeight> fst = codec.parse("0 1 a 2\n1\n");
            assertEquals(Arc.of(1, 1, tw(2), 1), fst.arc(0, 0));
            assertEquals("0\t1\ta\t2\n1\n", codec.format(fst));
        }

        @Test
        @DisplayName("Unknown symbols are not found")
        void testUnknownSymbol() {
            TextFstCodec<TropicalWeight> codec = new TextFstCodec<>(
                    FloatWeightCodec.TROPICAL, new SymbolTable(), new SymbolTable(), false);
            FstException ex = assertThrows(FstException.class, () -> codec.parse("0 1 a b\n"));
            assertEquals(FstException.ErrorKind.NOT_FOUND, ex.kind());
            assertEquals(SymbolTable.REASON_UNKNOWN_SYMBOL, ex.reasonCode());
        }
    }

    @Nested
    @DisplayName("3. Malformed Input")
    class Malformed {

        @Test
        @DisplayName("Bad fields are reported with the line reason")
        void testBadLines() {
            assertEquals(TextFstCodec.REASON_MALFORMED_LINE, malformed("0 1 a 1").reasonCode());
            assertEquals(TextFstCodec.REASON_MALFORMED_LINE, malformed("0 1 1 1 1 1").reasonCode());
            assertEquals(TextFstCodec.REASON_MALFORMED_LINE, malformed("-1 0 1 1").reasonCode());
            assertEquals(TextFstCodec.REASON_MALFORMED_LINE, malformed("0 1 -2 1").reasonCode());
            assertEquals(TextFstCodec.REASON_MALFORMED_LINE, malformed("x").reasonCode());
            assertEquals(TextFstCodec.REASON_MALFORMED_LINE, malformed("0 1 1").reasonCode());
        }

        @Test
        @DisplayName("Unparsable weights")
        void testBadWeight() {
            assertEquals(FloatWeightCodec.REASON_BAD_WEIGHT, malformed("0 1 1 1 heavy").reasonCode());
            assertEquals(FloatWeightCodec.REASON_BAD_WEIGHT, malformed("0 NaN").reasonCode());
            assertEquals(FloatWeightCodec.REASON_BAD_WEIGHT, malformed("0 -inf").reasonCode());
        }
    }
}
