package org.Aayush.wfst.io;

import it.unimi.dsi.fastutil.floats.Float2ObjectFunction;
import lombok.RequiredArgsConstructor;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.semiring.FloatWeight;
import org.Aayush.wfst.semiring.LogSemiring;
import org.Aayush.wfst.semiring.LogWeight;
import org.Aayush.wfst.semiring.Semiring;
import org.Aayush.wfst.semiring.TropicalSemiring;
import org.Aayush.wfst.semiring.TropicalWeight;

import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * Codec for single-precision weights; zero is written as {@code Infinity}.
 */
@RequiredArgsConstructor
public final class FloatWeightCodec<W extends FloatWeight> implements WeightCodec<W> {
    public static final String REASON_BAD_WEIGHT = "WEIGHT_CODEC_BAD_WEIGHT";

    public static final FloatWeightCodec<TropicalWeight> TROPICAL =
            new FloatWeightCodec<>(TropicalSemiring.INSTANCE, "standard", TropicalWeight::of);
    public static final FloatWeightCodec<LogWeight> LOG =
            new FloatWeightCodec<>(LogSemiring.INSTANCE, "log", LogWeight::of);

    private final Semiring<W> semiring;
    private final String arcType;
    private final Float2ObjectFunction<W> factory;

    @Override
    public Semiring<W> semiring() {
        return semiring;
    }

    @Override
    public String arcType() {
        return arcType;
    }

    @Override
    public int byteSize() {
        return Float.BYTES;
    }

    @Override
    public void write(ByteBuffer buffer, W weight) {
        buffer.putFloat(weight.value());
    }

    @Override
    public W read(ByteBuffer buffer) {
        return checked(buffer.getFloat(), "binary weight");
    }

    @Override
    public String format(W weight) {
        return FloatWeight.formatFloat(weight.value());
    }

    @Override
    public W parse(String text) {
        String t = text.trim().toLowerCase(Locale.ROOT);
        float value;
        if ("infinity".equals(t) || "inf".equals(t)) {
            value = Float.POSITIVE_INFINITY;
        } else if ("-infinity".equals(t) || "-inf".equals(t)) {
            value = Float.NEGATIVE_INFINITY;
        } else {
            try {
                value = Float.parseFloat(t);
            } catch (NumberFormatException ex) {
                throw FstException.malformed(REASON_BAD_WEIGHT, "unparsable weight: " + text);
            }
        }
        return checked(value, text);
    }

    private W checked(float value, String source) {
        W weight = factory.get(value);
        if (Float.isNaN(value) || !semiring.isMember(weight)) {
            throw FstException.malformed(REASON_BAD_WEIGHT, "not a " + semiring.name() + " weight: " + source);
        }
        return weight;
    }
}
