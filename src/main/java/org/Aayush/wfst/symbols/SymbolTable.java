package org.Aayush.wfst.symbols;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.FstException;
import org.Aayush.wfst.fst.Labels;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Objects;

/**
 * Bidirectional mapping between symbols and dense labels. Label {@code 0} is epsilon.
 *
 * <p>The text form holds one {@code symbol<TAB>label} pair per line.</p>
 */
public final class SymbolTable {
    public static final String DEFAULT_EPSILON = "<eps>";

    public static final String REASON_UNKNOWN_SYMBOL = "SYMBOL_TABLE_UNKNOWN_SYMBOL";
    public static final String REASON_UNKNOWN_LABEL = "SYMBOL_TABLE_UNKNOWN_LABEL";
    public static final String REASON_MALFORMED_LINE = "SYMBOL_TABLE_MALFORMED_LINE";
    public static final String REASON_NOT_DENSE = "SYMBOL_TABLE_NOT_DENSE";

    // symbol -> label, -1 when absent
    private final Object2IntOpenHashMap<String> forward = new Object2IntOpenHashMap<>();
    // label -> symbol
    private final ObjectArrayList<String> reverse = new ObjectArrayList<>();

    public SymbolTable() {
        this(DEFAULT_EPSILON);
    }

    public SymbolTable(String epsilonSymbol) {
        forward.defaultReturnValue(Labels.NO_LABEL);
        addSymbol(Objects.requireNonNull(epsilonSymbol, "epsilonSymbol"));
    }

    /**
     * Returns the label of {@code symbol}, assigning the next dense label on first sight.
     */
    public int addSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        int label = forward.getInt(symbol);
        if (label != Labels.NO_LABEL) {
            return label;
        }
        label = reverse.size();
        forward.put(symbol, label);
        reverse.add(symbol);
        return label;
    }

    /**
     * @throws FstException {@code NOT_FOUND} for an unknown symbol.
     */
    public int label(String symbol) {
        int label = forward.getInt(symbol);
        if (label == Labels.NO_LABEL) {
            throw FstException.notFound(REASON_UNKNOWN_SYMBOL, "symbol not found: " + symbol);
        }
        return label;
    }

    /**
     * @throws FstException {@code NOT_FOUND} for a label outside the table.
     */
    public String symbol(int label) {
        if (!containsLabel(label)) {
            throw FstException.notFound(REASON_UNKNOWN_LABEL, "label out of bounds: " + label);
        }
        return reverse.get(label);
    }

    public boolean containsSymbol(String symbol) {
        return forward.containsKey(symbol);
    }

    public boolean containsLabel(int label) {
        return label >= 0 && label < reverse.size();
    }

    public int size() {
        return reverse.size();
    }

    /**
     * Writes the table in label order.
     */
    public void writeText(Writer writer) throws IOException {
        for (int label = 0; label < reverse.size(); label++) {
            writer.write(reverse.get(label));
            writer.write('\t');
            writer.write(Integer.toString(label));
            writer.write('\n');
        }
        writer.flush();
    }

    /**
     * Reads a table whose labels form the dense range {@code 0..n-1}, in any line order.
     *
     * @throws FstException {@code MALFORMED} for unparsable lines, duplicates or gaps.
     */
    public static SymbolTable readText(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        ObjectArrayList<String> byLabel = new ObjectArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.trim().split("\\s+");
            if (fields.length != 2) {
                throw FstException.malformed(REASON_MALFORMED_LINE, "line " + lineNumber + ": expected 'symbol label'");
            }
            int label;
            try {
                label = Integer.parseInt(fields[1]);
            } catch (NumberFormatException ex) {
                throw FstException.malformed(REASON_MALFORMED_LINE, "line " + lineNumber + ": bad label " + fields[1]);
            }
            if (label < 0) {
                throw FstException.malformed(REASON_MALFORMED_LINE, "line " + lineNumber + ": negative label " + label);
            }
            while (byLabel.size() <= label) {
                byLabel.add(null);
            }
            if (byLabel.get(label) != null) {
                throw FstException.malformed(REASON_NOT_DENSE, "line " + lineNumber + ": duplicate label " + label);
            }
            byLabel.set(label, fields[0]);
        }
        if (byLabel.isEmpty()) {
            throw FstException.malformed(REASON_NOT_DENSE, "symbol table is empty; label 0 is required");
        }
        SymbolTable table = new SymbolTable(requireSymbol(byLabel, 0));
        for (int label = 1; label < byLabel.size(); label++) {
            String symbol = requireSymbol(byLabel, label);
            if (table.addSymbol(symbol) != label) {
                throw FstException.malformed(REASON_NOT_DENSE, "duplicate symbol " + symbol);
            }
        }
        return table;
    }

    private static String requireSymbol(ObjectArrayList<String> byLabel, int label) {
        String symbol = byLabel.get(label);
        if (symbol == null) {
            throw FstException.malformed(REASON_NOT_DENSE, "label " + label + " is missing");
        }
        return symbol;
    }
}
