// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.reader;

import java.util.ArrayList;
import java.util.List;
import sigil.symbol.Lexicon;
import sigil.symbol.Symbol;
import sigil.symbol.SymbolOrigin;
import sigil.symbol.SymbolPosition;
import sigil.symbol.SymbolSource;
import sigil.util.Trace;
import sigil.util.annotation.Nullable;

/**
 * Reads delimited text, such as a spreadsheet export, as a list of rows, each row a list of cell symbols.
 * <p>
 * Each cell is converted on its own:
 * <ul>
 * <li>an empty cell becomes an empty text;</li>
 * <li>a cell that doesn't start with {@code [} but contains whitespace or a structure character becomes a text,
 * verbatim;</li>
 * <li>any other cell is read as notation with {@link Reader#read(String, String)}.</li>
 * </ul>
 * The cell symbols carry origins within their own cell text only. The returned list has an origin covering the whole
 * input with zeroed positions.
 */
public final class CsvReader {
    private CsvReader() {
    }

    /**
     * Reads the given comma-separated text.
     *
     * @param text      The text to read.
     * @param hasHeader Whether the first record is a header, to be discarded.
     * @param sourceId  The identity of the text for diagnostics, or {@code null} if it has none.
     */
    public static Symbol.List read(final String text, final boolean hasHeader, final @Nullable String sourceId) {
        return read(text, CsvFormat.standard(hasHeader), sourceId);
    }

    /**
     * Reads the given delimited text in the given format.
     */
    public static Symbol.List read(final String text, final CsvFormat format, final @Nullable String sourceId) {
        final var source = new SymbolSource(sourceId, text);
        try (final var trace = new Trace(() -> "Reading delimited text from " + source.describe())) {
            trace.use();
            final var records = new CsvTokenizer(source, format).tokenize();
            final var firstRow = (format.hasHeader() && !records.isEmpty()) ? 1 : 0;
            final var rows = new ArrayList<Symbol>(records.size());
            for (int row = firstRow; row < records.size(); row += 1) {
                rows.add(readRow(records.get(row), row + 1));
            }
            final var origin = new SymbolOrigin(source, SymbolPosition.empty(), SymbolPosition.empty());
            return new Symbol.List(rows, origin);
        }
    }

    private static Symbol readRow(final List<String> cells, final int rowNumber) {
        final var symbols = new ArrayList<Symbol>(cells.size());
        for (int column = 0; column < cells.size(); column += 1) {
            final var columnNumber = column + 1;
            try (final var trace = new Trace(() -> "Reading cell at row " + rowNumber + ", column " + columnNumber)) {
                trace.use();
                symbols.add(readCell(cells.get(column)));
            }
        }
        return new Symbol.List(symbols);
    }

    private static Symbol readCell(final String cell) {
        if (cell.isEmpty()) {
            return new Symbol.Text("");
        }
        if (cell.charAt(0) != Lexicon.openListChar && containsNonAtomChar(cell)) {
            return new Symbol.Text(cell);
        }
        return Reader.read(cell, null);
    }

    private static boolean containsNonAtomChar(final String cell) {
        for (int i = 0; i < cell.length(); i += 1) {
            if (Lexicon.isNonAtomChar(cell.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
