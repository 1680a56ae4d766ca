// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import sigil.util.annotation.Nullable;

/**
 * The base type of symbols, the values of the sigil notation.
 * <p>
 * Symbols are guaranteed to be immutable, and a symbol tree never shares mutable structure. Equality is structural
 * and <em>includes</em> origins; use {@link Symbols#equalsIgnoringOrigins(Symbol, Symbol)} to compare content only.
 */
public sealed interface Symbol {
    /**
     * Retrieves the stretch of source text this symbol was read from, or {@code null} if it was synthesized.
     */
    @Nullable SymbolOrigin origin();

    /**
     * Returns a copy of this symbol with its origin replaced by the given one.
     */
    Symbol withOrigin(@Nullable SymbolOrigin origin);

    /**
     * A bare identifier-like token, such as {@code None}.
     */
    record Atom(String value, @Nullable SymbolOrigin origin) implements Symbol {
        public Atom(final String value) {
            this(value, null);
        }

        @Override
        public Atom withOrigin(final @Nullable SymbolOrigin origin) {
            return new Atom(value, origin);
        }
    }

    /**
     * A number literal, kept in its textual form including any type suffix, such as {@code 0.0f}.
     * <p>
     * Numbers are never parsed into a numeric type here: the exact text is what makes them round-trip.
     */
    record Number(String value, @Nullable SymbolOrigin origin) implements Symbol {
        public Number(final String value) {
            this(value, null);
        }

        @Override
        public Number withOrigin(final @Nullable SymbolOrigin origin) {
            return new Number(value, origin);
        }
    }

    /**
     * An explicitly quoted string, such as {@code "with spaces"}. The value is the text between the quotes.
     */
    record Text(String value, @Nullable SymbolOrigin origin) implements Symbol {
        public Text(final String value) {
            this(value, null);
        }

        @Override
        public Text withOrigin(final @Nullable SymbolOrigin origin) {
            return new Text(value, origin);
        }
    }

    /**
     * A quoted symbol, such as {@code `[Some 1]}.
     */
    record Quote(Symbol value, @Nullable SymbolOrigin origin) implements Symbol {
        public Quote(final Symbol value) {
            this(value, null);
        }

        @Override
        public Quote withOrigin(final @Nullable SymbolOrigin origin) {
            return new Quote(value, origin);
        }
    }

    /**
     * An ordered, possibly empty list of symbols, such as {@code [AnimationData 4 8]}.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The list is unmodifiable, SpotBugs can't tell")
    record List(java.util.List<Symbol> value, @Nullable SymbolOrigin origin) implements Symbol {
        public List {
            value = java.util.List.copyOf(value);
        }

        public List(final java.util.List<Symbol> value) {
            this(value, null);
        }

        /**
         * Creates a synthesized list of the given symbols.
         */
        public static List of(final Symbol... symbols) {
            return new List(java.util.List.of(symbols), null);
        }

        @Override
        public List withOrigin(final @Nullable SymbolOrigin origin) {
            return new List(value, origin);
        }
    }
}
