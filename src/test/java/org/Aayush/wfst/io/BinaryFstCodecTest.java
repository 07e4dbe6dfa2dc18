package org.Aayush.wfst.io;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.algorithm.Isomorphic;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.LogWeight;
import org.Aayush.wfst.semiring.TropicalSemiring;
import org.Aayush.wfst.semiring.TropicalWeight;
import org.Aayush.wfst.testutil.FstFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.Arrays;

import static org.Aayush.wfst.testutil.FstFixtureFactory.log;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Binary FST Codec")
class BinaryFstCodecTest {
    private static final BinaryFstCodec<TropicalWeight> TROPICAL = new BinaryFstCodec<>(FloatWeightCodec.TROPICAL);

    // magic, "vector", arc type and version precede the flags field
    private static int flagsOffset() {
        return 4 + 4 + BinaryFstCodec.FST_TYPE.length() + 4 + FloatWeightCodec.TROPICAL.arcType().length() + 4;
    }

    // flags, properties, start, state count and arc count
    private static int firstStateOffset() {
        return flagsOffset() + 4 + 8 * 4;
    }

    private static FstException malformed(byte[] bytes) {
        FstException ex = assertThrows(FstException.class, () -> TROPICAL.deserialize(ByteBuffer.wrap(bytes)));
        assertEquals(FstException.ErrorKind.MALFORMED, ex.kind());
        return ex;
    }

    @Nested
    @DisplayName("1. Round Trips")
    class RoundTrips {

        @Test
        @DisplayName("Tropical automaton survives serialization")
        void testTropical() {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.cyclicChain();
            VectorFst<TropicalWeight> back = TROPICAL.deserialize(ByteBuffer.wrap(TROPICAL.serialize(fst)));
            assertEquals(fst.numStates(), back.numStates());
            assertEquals(fst.start(), back.start());
            assertTrue(Isomorphic.isomorphic(fst, back));
        }

        @Test
        @DisplayName("Log automaton uses the log arc type")
        void testLog() {
            BinaryFstCodec<LogWeight> codec = new BinaryFstCodec<>(FloatWeightCodec.LOG);
            VectorFst<LogWeight> fst = log("0 1 1 2 0.25\n1 0.5");
            VectorFst<LogWeight> back = codec.deserialize(ByteBuffer.wrap(codec.serialize(fst)));
            assertTrue(Isomorphic.isomorphic(fst, back));

            FstException ex = assertThrows(FstException.class,
                    () -> TROPICAL.deserialize(ByteBuffer.wrap(codec.serialize(fst))));
            assertEquals(BinaryFstCodec.REASON_BAD_HEADER, ex.reasonCode());
        }

        @Test
        @DisplayName("Automaton without a start state keeps its states")
        void testNoStart() {
            VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
            fst.addStates(2);
            VectorFst<TropicalWeight> back = TROPICAL.deserialize(ByteBuffer.wrap(TROPICAL.serialize(fst)));
            assertEquals(2, back.numStates());
            assertEquals(Fst.NO_STATE, back.start());
        }

        @Test
        @DisplayName("Files round trip through the file system")
        void testFile(@TempDir Path dir) throws IOException {
            VectorFst<TropicalWeight> fst = FstFixtureFactory.shortestDistanceExample();
            Path file = dir.resolve("example.fst");
            TROPICAL.write(fst, file);
            assertTrue(Isomorphic.isomorphic(fst, TROPICAL.read(file)));
        }

        @Test
        @DisplayName("Header fields follow the vector layout in little-endian order")
        void testHeader() {
            byte[] bytes = TROPICAL.serialize(FstFixtureFactory.shortestDistanceExample());
            ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
            assertEquals(BinaryFstCodec.MAGIC, bb.getInt(0));
            assertEquals(BinaryFstCodec.VERSION, bb.getInt(flagsOffset() - 4));
            assertEquals(0, bb.getInt(flagsOffset()));
            assertEquals(0L, bb.getLong(flagsOffset() + 4 + 8));
            assertEquals(4L, bb.getLong(flagsOffset() + 4 + 16));
            assertEquals(4L, bb.getLong(flagsOffset() + 4 + 24));
        }
    }

    @Nested
    @DisplayName("2. Malformed Input")
    class Malformed {

        @Test
        @DisplayName("Wrong magic number")
        void testBadMagic() {
            byte[] bytes = TROPICAL.serialize(FstFixtureFactory.shortestDistanceExample());
            bytes[0] ^= 0x5A;
            assertEquals(BinaryFstCodec.REASON_BAD_MAGIC, malformed(bytes).reasonCode());
        }

        @Test
        @DisplayName("Non-zero flags are unsupported")
        void testFlags() {
            byte[] bytes = TROPICAL.serialize(FstFixtureFactory.shortestDistanceExample());
            bytes[flagsOffset()] = 1;
            assertEquals(BinaryFstCodec.REASON_UNSUPPORTED_FLAGS, malformed(bytes).reasonCode());
        }

        @Test
        @DisplayName("Truncated input")
        void testTruncated() {
            byte[] bytes = TROPICAL.serialize(FstFixtureFactory.shortestDistanceExample());
            assertEquals(BinaryFstCodec.REASON_TRUNCATED,
                    malformed(Arrays.copyOf(bytes, bytes.length - 3)).reasonCode());
            assertEquals(BinaryFstCodec.REASON_TRUNCATED, malformed(new byte[2]).reasonCode());
        }

        @Test
        @DisplayName("Arc target beyond the state count")
        void testTargetOutOfRange() {
            byte[] bytes = TROPICAL.serialize(FstFixtureFactory.shortestDistanceExample());
            // final weight, arc count, then ilabel, olabel and weight of the first arc
            int target = firstStateOffset() + 4 + 8 + 12;
            ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putInt(target, 99);
            assertEquals(BinaryFstCodec.REASON_STATE_OUT_OF_RANGE, malformed(bytes).reasonCode());
        }

        @Test
        @DisplayName("Negative label")
        void testNegativeLabel() {
            byte[] bytes = TROPICAL.serialize(FstFixtureFactory.shortestDistanceExample());
            int ilabel = firstStateOffset() + 4 + 8;
            ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putInt(ilabel, -7);
            assertEquals(BinaryFstCodec.REASON_BAD_LABEL, malformed(bytes).reasonCode());
        }

        @Test
        @DisplayName("Start state beyond the state count")
        void testStartOutOfRange() {
            byte[] bytes = TROPICAL.serialize(FstFixtureFactory.shortestDistanceExample());
            ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putLong(flagsOffset() + 4 + 8, 12L);
            assertEquals(BinaryFstCodec.REASON_STATE_OUT_OF_RANGE, malformed(bytes).reasonCode());
        }
    }
}
