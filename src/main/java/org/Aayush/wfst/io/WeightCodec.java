package org.Aayush.wfst.io;

import org.Aayush.wfst.semiring.Semiring;

import java.nio.ByteBuffer;

/**
 * Binary and text form of one weight family.
 *
 * @param <W> weight type.
 */
public interface WeightCodec<W> {

    Semiring<W> semiring();

    /** Arc type name stored in binary headers. */
    String arcType();

    /** Bytes per weight in the binary form. */
    int byteSize();

    void write(ByteBuffer buffer, W weight);

    /**
     * @throws org.Aayush.wfst.FstException {@code MALFORMED} when the bytes do not encode a
     * member of the semiring.
     */
    W read(ByteBuffer buffer);

    String format(W weight);

    /**
     * @throws org.Aayush.wfst.FstException {@code MALFORMED} for unparsable text.
     */
    W parse(String text);
}
