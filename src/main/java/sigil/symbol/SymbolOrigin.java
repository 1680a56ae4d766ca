// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol;

/**
 * The stretch of source text a symbol was read from.
 *
 * @param source The text the symbol was read from.
 * @param start  The position of the first character of the symbol.
 * @param stop   The position right after the last character of the symbol, trailing whitespace excluded.
 */
public record SymbolOrigin(SymbolSource source, SymbolPosition start, SymbolPosition stop) {
    public SymbolOrigin {
        assert start.index() <= stop.index() : "Origin stops before it starts";
    }

    /**
     * Returns the source text covered by this origin.
     */
    public String excerpt() {
        return source.text().substring(start.index(), stop.index());
    }
}
