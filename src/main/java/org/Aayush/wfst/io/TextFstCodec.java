package org.Aayush.wfst.io;

import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.symbols.SymbolTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * AT&amp;T text format.
 *
 * <p>Arc lines are {@code src dst ilabel olabel [weight]} ({@code src dst label [weight]} for
 * acceptors); final lines are {@code state [weight]}. The first line's source is the start
 * state. Omitted weights are one; labels print as symbols when tables are given.</p>
 */
public final class TextFstCodec<W> {
    public static final String REASON_MALFORMED_LINE = "TEXT_FST_MALFORMED_LINE";

    private final WeightCodec<W> weights;
    private final SymbolTable inputSymbols;
    private final SymbolTable outputSymbols;
    private final boolean acceptor;

    /**
     * @param inputSymbols optional table for input labels; {@code null} for numeric labels.
     * @param outputSymbols optional table for output labels.
     * @param acceptor read and write a single label column.
     */
    public TextFstCodec(WeightCodec<W> weights, SymbolTable inputSymbols, SymbolTable outputSymbols, boolean acceptor) {
        this.weights = Objects.requireNonNull(weights, "weights");
        this.inputSymbols = inputSymbols;
        this.outputSymbols = outputSymbols;
        this.acceptor = acceptor;
    }

    public static <W> TextFstCodec<W> numeric(WeightCodec<W> weights) {
        return new TextFstCodec<>(weights, null, null, false);
    }

    public String format(Fst<W> fst) {
        StringWriter out = new StringWriter();
        try {
            write(fst, out);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return out.toString();
    }

    /**
     * Writes the start state first, then every other state in id order.
     */
    public void write(Fst<W> fst, Writer writer) throws IOException {
        int start = fst.start();
        if (start == Fst.NO_STATE) {
            writer.flush();
            return;
        }
        writeState(fst, start, writer);
        for (int s = 0; s < fst.numStates(); s++) {
            if (s != start) {
                writeState(fst, s, writer);
            }
        }
        writer.flush();
    }

    private void writeState(Fst<W> fst, int s, Writer writer) throws IOException {
        for (Arc<W> arc : fst.arcs(s)) {
            StringBuilder line = new StringBuilder();
            line.append(s).append('\t').append(arc.nextState()).append('\t')
                    .append(label(arc.ilabel(), inputSymbols));
            if (!acceptor) {
                line.append('\t').append(label(arc.olabel(), outputSymbols));
            }
            if (!weights.semiring().isOne(arc.weight())) {
                line.append('\t').append(weights.format(arc.weight()));
            }
            writer.write(line.append('\n').toString());
        }
        if (fst.isFinal(s)) {
            W w = fst.finalWeight(s);
            writer.write(weights.semiring().isOne(w) ? s + "\n" : s + "\t" + weights.format(w) + "\n");
        }
    }

    public VectorFst<W> parse(String text) {
        try {
            return read(new StringReader(text));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * @throws FstException {@code MALFORMED} for a line that does not fit the format, a negative
     * state or label, or an unparsable weight; {@code NOT_FOUND} for an unknown symbol.
     */
    public VectorFst<W> read(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        VectorFst<W> fst = new VectorFst<>(weights.semiring());
        int labelColumns = acceptor ? 1 : 2;
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] f = line.trim().split("\\s+");
            if (f.length <= 2) {
                int s = state(f[0], fst, lineNumber);
                fst.setFinal(s, f.length == 2 ? weights.parse(f[1]) : weights.semiring().one());
                continue;
            }
            if (f.length > 3 + labelColumns) {
                throw malformed(lineNumber, "too many fields");
            }
            if (f.length < 2 + labelColumns) {
                throw malformed(lineNumber, "missing label field");
            }
            int src = state(f[0], fst, lineNumber);
            int dst = state(f[1], fst, lineNumber);
            int ilabel = parseLabel(f[2], inputSymbols, lineNumber);
            int olabel = acceptor ? ilabel : parseLabel(f[3], outputSymbols, lineNumber);
            W w = f.length == 3 + labelColumns ? weights.parse(f[2 + labelColumns]) : weights.semiring().one();
            fst.addArc(src, Arc.of(ilabel, olabel, w, dst));
        }
        return fst;
    }

    private int state(String field, VectorFst<W> fst, int lineNumber) {
        int s;
        try {
            s = Integer.parseInt(field);
        } catch (NumberFormatException ex) {
            throw malformed(lineNumber, "bad state id " + field);
        }
        if (s < 0) {
            throw malformed(lineNumber, "negative state id " + s);
        }
        if (s >= fst.numStates()) {
            fst.addStates(s + 1 - fst.numStates());
        }
        if (fst.start() == Fst.NO_STATE) {
            fst.setStart(s);
        }
        return s;
    }

    private static int parseLabel(String field, SymbolTable symbols, int lineNumber) {
        if (symbols != null) {
            return symbols.label(field);
        }
        int label;
        try {
            label = Integer.parseInt(field);
        } catch (NumberFormatException ex) {
            throw malformed(lineNumber, "bad label " + field);
        }
        if (label < 0) {
            throw malformed(lineNumber, "negative label " + label);
        }
        return label;
    }

    private static String label(int label, SymbolTable symbols) {
        return symbols == null ? Integer.toString(label) : symbols.symbol(label);
    }

    private static FstException malformed(int lineNumber, String message) {
        return FstException.malformed(REASON_MALFORMED_LINE, "line " + lineNumber + ": " + message);
    }
}
