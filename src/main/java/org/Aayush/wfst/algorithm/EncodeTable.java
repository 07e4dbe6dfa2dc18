package org.Aayush.wfst.algorithm;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Getter;
import lombok.Value;
import lombok.experimental.Accessors;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Labels;
import org.Aayush.wfst.semiring.Semiring;

import java.util.Objects;

/**
 * Reversible mapping between {@code (ilabel, olabel, weight)} triples and synthetic labels.
 *
 * <p>Labels are dense and start at {@code 1}; the parts not covered by the flags are stored as
 * epsilon and one. The table is filled by {@link Encode#encode} and must be handed to
 * {@link Encode#decode}.</p>
 *
 * @param <W> weight type.
 */
@Getter
@Accessors(fluent = true)
public final class EncodeTable<W> {
    public static final int ENCODE_LABELS = 0x1;
    public static final int ENCODE_WEIGHTS = 0x2;

    public static final String REASON_UNKNOWN_LABEL = "ENCODE_TABLE_UNKNOWN_LABEL";
    public static final String REASON_EMPTY_FLAGS = "ENCODE_TABLE_EMPTY_FLAGS";

    /**
     * One encoded triple.
     */
    @Value
    @Accessors(fluent = true)
    public static class Triple<W> {
        int ilabel;
        int olabel;
        W weight;
    }

    private final Semiring<W> semiring;
    private final int flags;
    @Getter(lombok.AccessLevel.NONE)
    private final ObjectArrayList<Triple<W>> triples = new ObjectArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Object2IntOpenHashMap<Triple<W>> labels = new Object2IntOpenHashMap<>();

    public EncodeTable(Semiring<W> semiring, int flags) {
        this.semiring = Objects.requireNonNull(semiring, "semiring");
        if ((flags & (ENCODE_LABELS | ENCODE_WEIGHTS)) == 0) {
            throw FstException.precondition(REASON_EMPTY_FLAGS, "encode flags must include labels or weights");
        }
        this.flags = flags;
        labels.defaultReturnValue(Labels.NO_LABEL);
    }

    public boolean encodesLabels() {
        return (flags & ENCODE_LABELS) != 0;
    }

    public boolean encodesWeights() {
        return (flags & ENCODE_WEIGHTS) != 0;
    }

    /**
     * Returns the label of a triple, assigning the next free label on first sight.
     */
    public int encode(int ilabel, int olabel, W weight) {
        Triple<W> triple = new Triple<>(
                ilabel,
                encodesLabels() ? olabel : Labels.EPSILON,
                encodesWeights() ? weight : semiring.one()
        );
        int label = labels.getInt(triple);
        if (label == Labels.NO_LABEL) {
            triples.add(triple);
            label = triples.size();
            labels.put(triple, label);
        }
        return label;
    }

    /**
     * @throws FstException {@code NOT_FOUND} for a label never handed out.
     */
    public Triple<W> decode(int label) {
        if (label < 1 || label > triples.size()) {
            throw FstException.notFound(REASON_UNKNOWN_LABEL, "label " + label + " is not in the encode table");
        }
        return triples.get(label - 1);
    }

    public int size() {
        return triples.size();
    }
}
