// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.reader;

import java.util.ArrayList;
import java.util.List;
import sigil.symbol.SymbolOrigin;
import sigil.symbol.SymbolSource;
import sigil.util.condition.ConditionContext;

/**
 * Splits delimited text into records of raw field strings.
 * <p>
 * Records end at {@code \n}, {@code \r\n} or a lone {@code \r}, except inside quoted fields, which may span lines.
 * Blank lines are skipped. Characters following the closing quote of a field are kept as part of it.
 */
final class CsvTokenizer {
    CsvTokenizer(final SymbolSource source, final CsvFormat format) {
        this.source = source;
        this.format = format;
        cursor = new SourceCursor(source);
    }

    /**
     * Splits the whole text into records.
     * <p>
     * An unterminated quoted field is signaled as a fatal {@link ReadErrorCondition}.
     */
    List<List<String>> tokenize() {
        final var records = new ArrayList<List<String>>();
        while (!cursor.reachedEnd()) {
            if (atLineBreak()) {
                discardLineBreak();
            } else {
                records.add(readRecord());
            }
        }
        return records;
    }

    private List<String> readRecord() {
        final var fields = new ArrayList<String>();
        while (true) {
            fields.add(readField());
            if (cursor.peekIs(format.separator())) {
                cursor.discardPeek();
            } else {
                discardLineBreak();
                return fields;
            }
        }
    }

    private String readField() {
        final var builder = new StringBuilder();
        if (cursor.peekIs(format.quote())) {
            readQuoted(builder);
        }
        while (!cursor.reachedEnd() && !cursor.peekIs(format.separator()) && !atLineBreak()) {
            builder.append(cursor.peek());
            cursor.discardPeek();
        }
        return builder.toString();
    }

    private void readQuoted(final StringBuilder builder) {
        final var start = cursor.position();
        cursor.discardPeek();
        while (true) {
            if (cursor.reachedEnd()) {
                final var expected = "closing '" + format.quote() + "'";
                final var origin = new SymbolOrigin(source, start, cursor.position());
                throw ConditionContext.error(new ReadErrorCondition(
                    "Expected " + expected + " but found end of input",
                    ReadErrorCondition.Kind.STRUCTURAL,
                    List.of(expected),
                    origin
                ));
            }
            final var c = cursor.peek();
            cursor.discardPeek();
            if (c != format.quote()) {
                builder.append(c);
            } else if (cursor.peekIs(format.quote())) {
                builder.append(c);
                cursor.discardPeek();
            } else {
                return;
            }
        }
    }

    private boolean atLineBreak() {
        return cursor.peekIs('\n') || cursor.peekIs('\r');
    }

    private void discardLineBreak() {
        if (cursor.peekIs('\r')) {
            cursor.discardPeek();
        }
        if (cursor.peekIs('\n')) {
            cursor.discardPeek();
        }
    }

    private final SymbolSource source;
    private final CsvFormat format;
    private final SourceCursor cursor;
}
