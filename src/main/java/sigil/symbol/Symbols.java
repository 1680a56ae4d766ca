// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol;

import java.util.ArrayList;
import java.util.List;
import sigil.util.UnreachableCodeReachedError;
import sigil.util.annotation.Nullable;

/**
 * A utility class containing common operations on symbols.
 */
public final class Symbols {
    private Symbols() {
    }

    /**
     * Returns the text of the given symbol if it's an atom, or {@code null} otherwise.
     */
    public static @Nullable String asAtom(final Symbol symbol) {
        return (symbol instanceof Symbol.Atom atom) ? atom.value() : null;
    }

    /**
     * Returns the literal text of the given symbol if it's a number, or {@code null} otherwise.
     */
    public static @Nullable String asNumber(final Symbol symbol) {
        return (symbol instanceof Symbol.Number number) ? number.value() : null;
    }

    /**
     * Returns the text of the given symbol if it's an explicit text, or {@code null} otherwise.
     */
    public static @Nullable String asText(final Symbol symbol) {
        return (symbol instanceof Symbol.Text text) ? text.value() : null;
    }

    /**
     * Returns the quoted symbol if the given symbol is a quote, or {@code null} otherwise.
     */
    public static @Nullable Symbol asQuote(final Symbol symbol) {
        return (symbol instanceof Symbol.Quote quote) ? quote.value() : null;
    }

    /**
     * Returns the items of the given symbol if it's a list, or {@code null} otherwise.
     */
    public static @Nullable List<Symbol> asList(final Symbol symbol) {
        return (symbol instanceof Symbol.List list) ? list.value() : null;
    }

    /**
     * Returns {@code true} iff the given symbol is an atom with exactly the given text.
     */
    public static boolean isAtom(final Symbol symbol, final String value) {
        return symbol instanceof Symbol.Atom atom && atom.value().equals(value);
    }

    /**
     * Returns {@code true} iff the given symbol is an {@link Lexicon#indexExpansion} list, as produced by the index
     * operator: {@code [Index indexer target]}.
     */
    public static boolean isIndexExpansion(final Symbol symbol) {
        final var items = asList(symbol);
        return items != null && items.size() == 3 && isAtom(items.get(0), Lexicon.indexExpansion);
    }

    /**
     * Returns the given symbol with every origin in it removed, recursively.
     */
    public static Symbol stripOrigins(final Symbol symbol) {
        if (symbol instanceof Symbol.Quote quote) {
            return new Symbol.Quote(stripOrigins(quote.value()), null);
        } else if (symbol instanceof Symbol.List list) {
            final var items = new ArrayList<Symbol>(list.value().size());
            for (final var item : list.value()) {
                items.add(stripOrigins(item));
            }
            return new Symbol.List(items, null);
        } else {
            return symbol.withOrigin(null);
        }
    }

    /**
     * Returns {@code true} iff the two given symbols have the same shape and content, regardless of their origins.
     */
    public static boolean equalsIgnoringOrigins(final Symbol left, final Symbol right) {
        if (left instanceof Symbol.Atom l && right instanceof Symbol.Atom r) {
            return l.value().equals(r.value());
        } else if (left instanceof Symbol.Number l && right instanceof Symbol.Number r) {
            return l.value().equals(r.value());
        } else if (left instanceof Symbol.Text l && right instanceof Symbol.Text r) {
            return l.value().equals(r.value());
        } else if (left instanceof Symbol.Quote l && right instanceof Symbol.Quote r) {
            return equalsIgnoringOrigins(l.value(), r.value());
        } else if (left instanceof Symbol.List l && right instanceof Symbol.List r) {
            return equalsIgnoringOrigins(l.value(), r.value());
        } else {
            return false;
        }
    }

    private static boolean equalsIgnoringOrigins(final List<Symbol> left, final List<Symbol> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i += 1) {
            if (!equalsIgnoringOrigins(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a short user-readable name of the kind of the given symbol, for messages.
     */
    public static String kindName(final Symbol symbol) {
        if (symbol instanceof Symbol.Atom) {
            return "atom";
        } else if (symbol instanceof Symbol.Number) {
            return "number";
        } else if (symbol instanceof Symbol.Text) {
            return "text";
        } else if (symbol instanceof Symbol.Quote) {
            return "quote";
        } else if (symbol instanceof Symbol.List) {
            return "list";
        }
        throw new UnreachableCodeReachedError("Unknown symbol type " + symbol.getClass().getName());
    }
}
