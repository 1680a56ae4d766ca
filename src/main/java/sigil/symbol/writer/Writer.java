// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.writer;

import sigil.symbol.Lexicon;
import sigil.symbol.Symbol;
import sigil.symbol.Symbols;
import sigil.util.UnreachableCodeReachedError;

/**
 * The symbol writer: converts a {@link Symbol} into canonical notation text.
 * <p>
 * Origins are ignored. Reading the written text back yields a symbol equal to the original one, origins aside, for
 * every symbol the reader can produce. Index expansions are written back with the index operator:
 * {@code [Index 0 a]} is written as {@code a.[0]}, and {@code [Index b a]} as {@code a.b}. Expansions the operator
 * can't express faithfully, such as {@code [Index 0 5]}, are written as plain lists.
 */
public final class Writer {
    private Writer() {
    }

    /**
     * Writes the given symbol as notation text. Never fails.
     */
    public static String write(final Symbol symbol) {
        final var builder = new StringBuilder();
        write(builder, symbol);
        return builder.toString();
    }

    private static void write(final StringBuilder builder, final Symbol symbol) {
        if (symbol instanceof Symbol.Atom atom) {
            writeAtom(builder, atom.value());
        } else if (symbol instanceof Symbol.Number number) {
            builder.append(Lexicon.distill(number.value()));
        } else if (symbol instanceof Symbol.Text text) {
            writeExplicit(builder, Lexicon.distill(text.value()));
        } else if (symbol instanceof Symbol.Quote quote) {
            builder.append(Lexicon.quoteChar);
            write(builder, quote.value());
        } else if (symbol instanceof Symbol.List list) {
            writeList(builder, list.value());
        } else {
            throw new UnreachableCodeReachedError("Unknown symbol type " + symbol.getClass().getName());
        }
    }

    private static void writeAtom(final StringBuilder builder, final String value) {
        final var distilled = Lexicon.distill(value);
        if (distilled.isEmpty()) {
            writeExplicit(builder, distilled);
        } else if (!Lexicon.isExplicit(distilled) && Lexicon.shouldBeExplicit(distilled)) {
            writeExplicit(builder, distilled);
        } else if (Lexicon.isExplicit(distilled) && !Lexicon.shouldBeExplicit(distilled)) {
            builder.append(distilled, 1, distilled.length() - 1);
        } else {
            builder.append(distilled);
        }
    }

    private static void writeExplicit(final StringBuilder builder, final String value) {
        builder.append(Lexicon.openTextChar).append(value).append(Lexicon.closeTextChar);
    }

    private static void writeList(final StringBuilder builder, final java.util.List<Symbol> items) {
        if (items.size() == 3 && Symbols.isAtom(items.get(0), Lexicon.indexExpansion)
            && canUseIndexOperator(items.get(1), items.get(2))) {
            final var indexer = items.get(1);
            write(builder, items.get(2));
            builder.append(Lexicon.indexChar);
            if (indexer instanceof Symbol.Number) {
                // A bare number would be read back as part of a fractional number.
                builder.append(Lexicon.openListChar);
                write(builder, indexer);
                builder.append(Lexicon.closeListChar);
            } else {
                write(builder, indexer);
            }
            return;
        }
        builder.append(Lexicon.openListChar);
        var first = true;
        for (final var item : items) {
            if (!first) {
                builder.append(' ');
            }
            first = false;
            write(builder, item);
        }
        builder.append(Lexicon.closeListChar);
    }

    /**
     * Returns {@code true} iff {@code target.indexer} reads back as {@code [Index indexer target]}.
     * <p>
     * A number target would swallow the operator as its fractional point, and a quote target would swallow the whole
     * expansion. A one-element list holding a number is read back as the bare number. A quote or index expansion
     * indexer would absorb any index operator that follows it.
     */
    private static boolean canUseIndexOperator(final Symbol indexer, final Symbol target) {
        if (target instanceof Symbol.Number || target instanceof Symbol.Quote) {
            return false;
        }
        if (indexer instanceof Symbol.Quote || Symbols.isIndexExpansion(indexer)) {
            return false;
        }
        final var indexerItems = Symbols.asList(indexer);
        return indexerItems == null || indexerItems.size() != 1 || !(indexerItems.get(0) instanceof Symbol.Number);
    }
}
