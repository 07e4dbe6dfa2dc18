package org.Aayush.wfst.io;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.properties.FstProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Little-endian binary layout of a vector automaton.
 *
 * <p>Header: magic, fst type {@code "vector"}, arc type, version, flags, properties, start,
 * state count and arc count. Body, per state: final weight and arc count, then per arc input
 * label, output label, weight and destination. Strings are a 32-bit length followed by bytes.</p>
 */
public final class BinaryFstCodec<W> {
    private static final Logger LOGGER = LoggerFactory.getLogger(BinaryFstCodec.class);

    public static final int MAGIC = 2125659606;
    public static final String FST_TYPE = "vector";
    public static final int VERSION = 2;

    public static final String REASON_BAD_MAGIC = "BINARY_FST_BAD_MAGIC";
    public static final String REASON_BAD_HEADER = "BINARY_FST_BAD_HEADER";
    public static final String REASON_UNSUPPORTED_FLAGS = "BINARY_FST_UNSUPPORTED_FLAGS";
    public static final String REASON_STATE_OUT_OF_RANGE = "BINARY_FST_STATE_OUT_OF_RANGE";
    public static final String REASON_BAD_LABEL = "BINARY_FST_BAD_LABEL";
    public static final String REASON_TRUNCATED = "BINARY_FST_TRUNCATED";

    // bits the reference format sets on every stored vector automaton
    private static final long EXPANDED_MUTABLE = 0x3L;
    private static final int MAX_STRING = 1 << 16;

    private final WeightCodec<W> weights;

    public BinaryFstCodec(WeightCodec<W> weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public byte[] serialize(Fst<W> fst) {
        byte[] fstType = FST_TYPE.getBytes(StandardCharsets.US_ASCII);
        byte[] arcType = weights.arcType().getBytes(StandardCharsets.US_ASCII);
        long numArcs = 0L;
        for (int s = 0; s < fst.numStates(); s++) {
            numArcs += fst.numArcs(s);
        }
        long size = 4L + 4 + fstType.length + 4 + arcType.length + 4 + 4 + 8 + 8 + 8 + 8
                + (long) fst.numStates() * (weights.byteSize() + 8)
                + numArcs * (12 + weights.byteSize());
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("automaton too large for one buffer: " + size + " bytes");
        }
        ByteBuffer bb = ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
        bb.putInt(MAGIC);
        putString(bb, fstType);
        putString(bb, arcType);
        bb.putInt(VERSION);
        bb.putInt(0);
        bb.putLong(fst.properties(FstProperties.ALL) | EXPANDED_MUTABLE);
        bb.putLong(fst.start());
        bb.putLong(fst.numStates());
        bb.putLong(numArcs);
        for (int s = 0; s < fst.numStates(); s++) {
            weights.write(bb, fst.finalWeight(s));
            bb.putLong(fst.numArcs(s));
            for (Arc<W> arc : fst.arcs(s)) {
                bb.putInt(arc.ilabel());
                bb.putInt(arc.olabel());
                weights.write(bb, arc.weight());
                bb.putInt(arc.nextState());
            }
        }
        return bb.array();
    }

    /**
     * @throws FstException {@code MALFORMED} for a wrong magic number, type or version,
     * unsupported flags, truncated input, negative labels, or any state id out of range.
     */
    public VectorFst<W> deserialize(ByteBuffer buffer) {
        ByteBuffer bb = buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        try {
            return decode(bb);
        } catch (BufferUnderflowException ex) {
            throw FstException.malformed(REASON_TRUNCATED, "input ends before the automaton is complete");
        }
    }

    public void write(Fst<W> fst, Path path) throws IOException {
        Files.write(path, serialize(fst));
    }

    public VectorFst<W> read(Path path) throws IOException {
        VectorFst<W> fst = deserialize(ByteBuffer.wrap(Files.readAllBytes(path)));
        LOGGER.debug("read {} states from {}", fst.numStates(), path);
        return fst;
    }

    private VectorFst<W> decode(ByteBuffer bb) {
        int magic = bb.getInt();
        if (magic != MAGIC) {
            throw FstException.malformed(REASON_BAD_MAGIC, "bad magic number " + magic);
        }
        String fstType = getString(bb);
        String arcType = getString(bb);
        int version = bb.getInt();
        if (!FST_TYPE.equals(fstType) || !weights.arcType().equals(arcType) || version != VERSION) {
            throw FstException.malformed(
                    REASON_BAD_HEADER,
                    "expected " + FST_TYPE + "/" + weights.arcType() + " v" + VERSION
                            + ", got " + fstType + "/" + arcType + " v" + version
            );
        }
        int flags = bb.getInt();
        if (flags != 0) {
            throw FstException.malformed(REASON_UNSUPPORTED_FLAGS, "symbol tables and alignment are not supported, flags=" + flags);
        }
        bb.getLong();
        long start = bb.getLong();
        long numStates = bb.getLong();
        long numArcs = bb.getLong();
        if (numStates < 0 || numStates > Integer.MAX_VALUE || numArcs < -1) {
            throw FstException.malformed(REASON_BAD_HEADER, "bad counts: states=" + numStates + ", arcs=" + numArcs);
        }
        if (start < Fst.NO_STATE || start >= numStates) {
            throw FstException.malformed(REASON_STATE_OUT_OF_RANGE, "start state " + start + " out of range");
        }
        int n = (int) numStates;
        VectorFst<W> fst = new VectorFst<>(weights.semiring());
        fst.reserveStates(n);
        fst.addStates(n);
        for (int s = 0; s < n; s++) {
            W finalWeight = weights.read(bb);
            long arcs = bb.getLong();
            if (arcs < 0 || arcs > bb.remaining()) {
                throw FstException.malformed(REASON_BAD_HEADER, "bad arc count " + arcs + " at state " + s);
            }
            fst.reserveArcs(s, (int) arcs);
            for (long i = 0; i < arcs; i++) {
                int ilabel = bb.getInt();
                int olabel = bb.getInt();
                W w = weights.read(bb);
                int next = bb.getInt();
                if (ilabel < 0 || olabel < 0) {
                    throw FstException.malformed(REASON_BAD_LABEL, "negative label at state " + s);
                }
                if (next < 0 || next >= n) {
                    throw FstException.malformed(REASON_STATE_OUT_OF_RANGE, "arc target " + next + " out of range at state " + s);
                }
                fst.addArc(s, Arc.of(ilabel, olabel, w, next));
            }
            if (!weights.semiring().isZero(finalWeight)) {
                fst.setFinal(s, finalWeight);
            }
        }
        if (start != Fst.NO_STATE) {
            fst.setStart((int) start);
        }
        return fst;
    }

    private static void putString(ByteBuffer bb, byte[] bytes) {
        bb.putInt(bytes.length);
        bb.put(bytes);
    }

    private static String getString(ByteBuffer bb) {
        int length = bb.getInt();
        if (length < 0 || length > MAX_STRING || length > bb.remaining()) {
            throw FstException.malformed(REASON_BAD_HEADER, "bad string length " + length);
        }
        byte[] bytes = new byte[length];
        bb.get(bytes);
        return new String(bytes, StandardCharsets.US_ASCII);
    }
}
